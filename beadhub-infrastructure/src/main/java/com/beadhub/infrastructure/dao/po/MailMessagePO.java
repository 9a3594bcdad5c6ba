package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 站内邮件 PO，对应 aweb.messages。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailMessagePO {

    private String id;
    private String projectId;
    private String fromAlias;
    private String toAgentId;
    private String toAlias;
    private String subject;
    private String body;
    private String priority;
    private String threadId;
    private LocalDateTime createdAt;
    private LocalDateTime readAt;
}
