package com.beadhub.infrastructure.gateway;

import com.beadhub.domain.notification.adapter.gateway.IMailGateway;
import com.beadhub.domain.notification.model.valobj.MailMessage;
import com.beadhub.infrastructure.dao.MailMessageDao;
import com.beadhub.infrastructure.dao.WorkspaceDao;
import com.beadhub.infrastructure.dao.po.MailMessagePO;
import com.beadhub.infrastructure.dao.po.WorkspacePO;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * aweb 邮件分区网关：把通知写入收件工作区的邮箱。
 */
@Component
public class MailGatewayImpl implements IMailGateway {

    private static final String DEFAULT_PRIORITY = "normal";

    private final MailMessageDao mailMessageDao;
    private final WorkspaceDao workspaceDao;

    public MailGatewayImpl(MailMessageDao mailMessageDao, WorkspaceDao workspaceDao) {
        this.mailMessageDao = mailMessageDao;
        this.workspaceDao = workspaceDao;
    }

    /**
     * @return 新邮件 ID
     * @throws IllegalStateException 收件工作区不存在或已删除
     */
    @Override
    public String deliver(MailMessage message) {
        WorkspacePO recipient = workspaceDao.selectById(message.getToAgentId());
        if (recipient == null || recipient.getDeletedAt() != null
                || !StringUtils.equals(recipient.getProjectId(), message.getProjectId())) {
            throw new IllegalStateException("Recipient workspace unavailable: " + message.getToAgentId());
        }
        MailMessagePO po = MailMessagePO.builder()
                .id(UUID.randomUUID().toString())
                .projectId(message.getProjectId())
                .fromAlias(message.getFromAlias())
                .toAgentId(message.getToAgentId())
                .toAlias(StringUtils.defaultIfBlank(message.getToAlias(), recipient.getAlias()))
                .subject(message.getSubject())
                .body(message.getBody())
                .priority(StringUtils.defaultIfBlank(message.getPriority(), DEFAULT_PRIORITY))
                .threadId(message.getThreadId())
                .createdAt(LocalDateTime.now())
                .build();
        mailMessageDao.insert(po);
        return po.getId();
    }
}
