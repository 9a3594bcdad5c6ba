package com.beadhub.trigger.application.command;

import com.beadhub.domain.notification.adapter.gateway.IMailGateway;
import com.beadhub.domain.notification.adapter.repository.IOutboxRepository;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.domain.notification.model.valobj.MailMessage;
import com.beadhub.domain.notification.service.NotificationRenderDomainService;
import com.beadhub.domain.notification.service.OutboxDomainService;
import com.beadhub.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 发件箱投递写用例。
 * <p>
 * 每个条目独立事务：SKIP LOCKED 锁定、写入邮件、标记 delivered 一起提交。
 * 失败时投递事务整体回滚，再由 {@link #recordFailure(String, String)} 在新事务中累计重试次数。
 * </p>
 */
@Slf4j
@Service
public class OutboxDeliveryCommandService {

    private final IOutboxRepository outboxRepository;
    private final IMailGateway mailGateway;
    private final NotificationRenderDomainService notificationRenderDomainService;
    private final OutboxDomainService outboxDomainService;

    public OutboxDeliveryCommandService(IOutboxRepository outboxRepository,
                                        IMailGateway mailGateway,
                                        NotificationRenderDomainService notificationRenderDomainService,
                                        OutboxDomainService outboxDomainService) {
        this.outboxRepository = outboxRepository;
        this.mailGateway = mailGateway;
        this.notificationRenderDomainService = notificationRenderDomainService;
        this.outboxDomainService = outboxDomainService;
    }

    public List<String> findDueIds(int limit) {
        return outboxRepository.findDueIds(LocalDateTime.now(), limit);
    }

    /**
     * @return true 表示本次完成投递；false 表示条目已被其他工作者锁定或已不再待投递
     */
    @Transactional(rollbackFor = Exception.class)
    public boolean deliverEntry(String entryId) {
        OutboxEntryEntity entry = outboxRepository.lockPending(entryId);
        if (entry == null) {
            return false;
        }
        if (entry.getNextAttemptAt() != null && entry.getNextAttemptAt().isAfter(LocalDateTime.now())) {
            return false;
        }
        MailMessage message = notificationRenderDomainService.render(entry);
        String messageId = mailGateway.deliver(message);
        entry.markDelivered(messageId);
        outboxRepository.updateResult(entry);
        log.debug("Outbox entry delivered. entryId={}, messageId={}, recipient={}",
                entryId, messageId, entry.getRecipientAlias());
        return true;
    }

    /**
     * @return 记录失败后的条目；条目已被其他工作者处理时返回 null
     */
    @Transactional(rollbackFor = Exception.class)
    public OutboxEntryEntity recordFailure(String entryId, String error) {
        OutboxEntryEntity entry = outboxRepository.lockPending(entryId);
        if (entry == null) {
            return null;
        }
        outboxDomainService.recordFailure(entry, error, LocalDateTime.now());
        outboxRepository.updateResult(entry);
        return entry;
    }

    @Transactional(rollbackFor = Exception.class)
    public OutboxEntryEntity requeue(String projectId, String entryId) {
        OutboxEntryEntity entry = outboxRepository.findById(projectId, entryId);
        if (entry == null) {
            throw AppException.notFound("Outbox entry not found: " + entryId);
        }
        try {
            entry.requeue();
        } catch (IllegalStateException ex) {
            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put("entry_id", entryId);
            detail.put("status", entry.getStatus() == null ? null : entry.getStatus().getCode());
            throw AppException.conflict(ex.getMessage(), detail);
        }
        outboxRepository.updateResult(entry);
        log.info("Outbox entry requeued. projectId={}, entryId={}", projectId, entryId);
        return entry;
    }

    @Transactional(rollbackFor = Exception.class)
    public int cleanupDelivered(LocalDateTime cutoff) {
        return outboxRepository.deleteDeliveredBefore(cutoff);
    }
}
