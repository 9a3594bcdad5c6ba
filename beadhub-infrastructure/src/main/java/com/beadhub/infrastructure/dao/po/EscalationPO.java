package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 升级请求 PO，对应 server.escalations。options 为 JSONB 数组原文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationPO {

    private String id;
    private String projectId;
    private String workspaceId;
    private String alias;
    private String humanName;
    private String subject;
    private String situation;
    private String options;
    private String status;
    private String response;
    private String responseNote;
    private LocalDateTime createdAt;
    private LocalDateTime respondedAt;
    private LocalDateTime expiresAt;
}
