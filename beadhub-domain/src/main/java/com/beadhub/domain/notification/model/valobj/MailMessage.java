package com.beadhub.domain.notification.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 交给邮件原语的消息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MailMessage {

    private String projectId;

    private String fromAlias;

    private String toAgentId;

    private String toAlias;

    private String subject;

    private String body;

    private String priority;

    /**
     * 同一条目的通知归入同一线程
     */
    private String threadId;
}
