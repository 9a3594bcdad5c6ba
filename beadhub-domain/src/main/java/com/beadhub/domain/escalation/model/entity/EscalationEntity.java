package com.beadhub.domain.escalation.model.entity;

import com.beadhub.types.enums.EscalationStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 升级请求（人工介入）实体。pending → responded | expired，终态不可变。
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class EscalationEntity {

    private String id;

    private String projectId;

    /**
     * 发起的工作区
     */
    private String workspaceId;

    private String alias;

    private String humanName;

    private String subject;

    private String situation;

    private List<String> options;

    private EscalationStatusEnum status;

    private String response;

    private String responseNote;

    private LocalDateTime createdAt;

    private LocalDateTime respondedAt;

    private LocalDateTime expiresAt;

    public boolean isTerminal() {
        return status == EscalationStatusEnum.RESPONDED || status == EscalationStatusEnum.EXPIRED;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return status == EscalationStatusEnum.PENDING && expiresAt != null && !expiresAt.isAfter(now);
    }

    public void respond(String response, String note) {
        if (status != EscalationStatusEnum.PENDING) {
            throw new IllegalStateException("Escalation is already " + (status == null ? "unknown" : status.getCode()));
        }
        this.status = EscalationStatusEnum.RESPONDED;
        this.response = response;
        this.responseNote = note;
        this.respondedAt = LocalDateTime.now();
    }

    public void expire() {
        if (status != EscalationStatusEnum.PENDING) {
            throw new IllegalStateException("Escalation is already " + (status == null ? "unknown" : status.getCode()));
        }
        this.status = EscalationStatusEnum.EXPIRED;
    }
}
