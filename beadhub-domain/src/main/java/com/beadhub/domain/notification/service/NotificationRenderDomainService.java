package com.beadhub.domain.notification.service;

import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.domain.notification.model.valobj.MailMessage;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

/**
 * 通知渲染领域服务：把发件箱条目渲染为邮件消息。
 */
@Service
public class NotificationRenderDomainService {

    private final String senderAlias;

    public NotificationRenderDomainService(@Value("${beadhub.notifications.sender-alias:beadhub}") String senderAlias) {
        this.senderAlias = senderAlias;
    }

    public MailMessage render(OutboxEntryEntity entry) {
        Map<String, Object> payload = entry.getPayload() == null ? Map.of() : entry.getPayload();
        MailMessage.MailMessageBuilder builder = MailMessage.builder()
                .projectId(entry.getProjectId())
                .fromAlias(senderAlias)
                .toAgentId(entry.getRecipientWorkspaceId())
                .toAlias(entry.getRecipientAlias())
                .priority("normal");

        if (OutboxEntryEntity.EVENT_ESCALATION_RESPONSE.equals(entry.getEventType())) {
            String escalationId = text(payload, "escalation_id", "unknown");
            StringBuilder body = new StringBuilder();
            body.append("Your escalation **").append(text(payload, "subject", "")).append("** was answered.\n\n");
            body.append("Response: ").append(text(payload, "response", "")).append('\n');
            String note = text(payload, "note", "");
            if (!note.isEmpty()) {
                body.append("Note: ").append(note).append('\n');
            }
            return builder.subject("Escalation responded: " + text(payload, "subject", escalationId))
                    .body(body.toString())
                    .threadId(threadId("escalation:" + escalationId))
                    .build();
        }

        String beadId = text(payload, "bead_id", "unknown");
        StringBuilder body = new StringBuilder();
        body.append("**").append(beadId).append("** status changed from `")
                .append(text(payload, "old_status", "unknown")).append("` to `")
                .append(text(payload, "new_status", "unknown")).append("`\n\n");
        appendLine(body, "Title", text(payload, "title", ""));
        appendLine(body, "Repo", text(payload, "repo", ""));
        appendLine(body, "Branch", text(payload, "branch", ""));
        return builder.subject("Bead status changed: " + beadId)
                .body(body.toString())
                .threadId(threadId("bead:" + beadId))
                .build();
    }

    /**
     * 基于名称的确定性线程 ID。
     */
    public String threadId(String name) {
        return UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private void appendLine(StringBuilder body, String label, String value) {
        if (StringUtils.isNotEmpty(value)) {
            body.append(label).append(": ").append(value).append('\n');
        }
    }

    private String text(Map<String, Object> payload, String key, String fallback) {
        Object value = payload.get(key);
        return value == null ? fallback : String.valueOf(value);
    }
}
