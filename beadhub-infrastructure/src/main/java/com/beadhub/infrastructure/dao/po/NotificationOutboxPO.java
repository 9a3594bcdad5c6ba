package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 通知发件箱 PO，对应 server.notification_outbox。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationOutboxPO {

    private String id;
    private String projectId;
    private String eventType;
    private String payload;
    private String recipientWorkspaceId;
    private String recipientAlias;
    private String status;
    private Integer attempts;
    private LocalDateTime nextAttemptAt;
    private String lastError;
    private String messageId;
    private LocalDateTime createdAt;
    private LocalDateTime processedAt;
}
