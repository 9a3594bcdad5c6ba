package com.beadhub.domain.notification.model.entity;

import com.beadhub.types.enums.OutboxStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 发件箱条目实体。
 * <p>
 * 与触发它的业务事实在同一事务内写入；只在确认交付邮件原语后标记为已投递。
 * 重试中的条目保持 PENDING，通过 attempts 与 next_attempt_at 控制退避。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class OutboxEntryEntity {

    public static final String EVENT_BEAD_STATUS_CHANGE = "bead_status_change";
    public static final String EVENT_ESCALATION_RESPONSE = "escalation_response";

    private static final int MAX_ERROR_LENGTH = 500;

    private String id;

    private String projectId;

    private String eventType;

    private Map<String, Object> payload;

    private String recipientWorkspaceId;

    private String recipientAlias;

    private OutboxStatusEnum status;

    /**
     * 已尝试投递次数
     */
    private Integer attempts;

    /**
     * 下次允许投递的时间
     */
    private LocalDateTime nextAttemptAt;

    private String lastError;

    /**
     * 投递成功后邮件原语返回的消息 ID
     */
    private String messageId;

    private LocalDateTime createdAt;

    private LocalDateTime processedAt;

    public static OutboxEntryEntity pending(String projectId, String eventType, Map<String, Object> payload,
                                            String recipientWorkspaceId, String recipientAlias) {
        OutboxEntryEntity entry = new OutboxEntryEntity();
        entry.setProjectId(projectId);
        entry.setEventType(eventType);
        entry.setPayload(payload);
        entry.setRecipientWorkspaceId(recipientWorkspaceId);
        entry.setRecipientAlias(recipientAlias);
        entry.setStatus(OutboxStatusEnum.PENDING);
        entry.setAttempts(0);
        LocalDateTime now = LocalDateTime.now();
        entry.setNextAttemptAt(now);
        entry.setCreatedAt(now);
        return entry;
    }

    public int normalizedAttempts() {
        return attempts == null ? 0 : attempts;
    }

    public boolean isPending() {
        return status == OutboxStatusEnum.PENDING;
    }

    public void markDelivered(String messageId) {
        if (!isPending()) {
            throw new IllegalStateException("Only pending outbox entries can be delivered: " + status);
        }
        this.status = OutboxStatusEnum.DELIVERED;
        this.messageId = messageId;
        this.lastError = null;
        this.attempts = normalizedAttempts() + 1;
        this.processedAt = LocalDateTime.now();
    }

    /**
     * 记录一次投递失败。预算耗尽时标记为永久失败，否则按给定时间重新排期。
     */
    public void recordFailure(String error, int maxAttempts, LocalDateTime retryAt) {
        this.attempts = normalizedAttempts() + 1;
        this.lastError = truncate(error);
        if (this.attempts >= maxAttempts) {
            this.status = OutboxStatusEnum.FAILED;
            this.processedAt = LocalDateTime.now();
        } else {
            this.status = OutboxStatusEnum.PENDING;
            this.nextAttemptAt = retryAt;
        }
    }

    /**
     * 运维手动重新排队永久失败条目。
     */
    public void requeue() {
        if (status != OutboxStatusEnum.FAILED) {
            throw new IllegalStateException("Only failed outbox entries can be requeued: " + status);
        }
        this.status = OutboxStatusEnum.PENDING;
        this.attempts = 0;
        this.nextAttemptAt = LocalDateTime.now();
        this.processedAt = null;
    }

    private String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
