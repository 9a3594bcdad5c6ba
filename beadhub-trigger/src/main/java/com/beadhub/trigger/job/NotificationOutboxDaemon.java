package com.beadhub.trigger.job;

import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.trigger.application.command.OutboxDeliveryCommandService;
import com.beadhub.types.enums.OutboxStatusEnum;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 通知发件箱投递守护进程。
 * <p>
 * 每个条目在独立事务中锁定（SKIP LOCKED）并投递，多实例并行时互不重复；
 * 投递失败在另一个事务中记录，保证失败计数不随投递事务一起回滚。
 * </p>
 */
@Slf4j
@Component
public class NotificationOutboxDaemon {

    private final OutboxDeliveryCommandService outboxDeliveryCommandService;
    private final int batchSize;
    private final long retentionDays;
    private final Counter deliveredCounter;
    private final Counter skippedCounter;
    private final Counter retryCounter;
    private final Counter failedCounter;

    public NotificationOutboxDaemon(OutboxDeliveryCommandService outboxDeliveryCommandService,
                                    @Value("${beadhub.outbox.batch-size:50}") int batchSize,
                                    @Value("${beadhub.outbox.retention-days:7}") long retentionDays) {
        this.outboxDeliveryCommandService = outboxDeliveryCommandService;
        this.batchSize = batchSize > 0 ? batchSize : 50;
        this.retentionDays = retentionDays > 0 ? retentionDays : 7L;
        this.deliveredCounter = Counter.builder("beadhub.outbox.delivered.total").register(Metrics.globalRegistry);
        this.skippedCounter = Counter.builder("beadhub.outbox.skipped.total").register(Metrics.globalRegistry);
        this.retryCounter = Counter.builder("beadhub.outbox.retry.total").register(Metrics.globalRegistry);
        this.failedCounter = Counter.builder("beadhub.outbox.failed.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${beadhub.outbox.drain-interval-ms:5000}", scheduler = "daemonScheduler")
    public void drain() {
        List<String> dueIds = outboxDeliveryCommandService.findDueIds(batchSize);
        if (dueIds == null || dueIds.isEmpty()) {
            return;
        }
        int delivered = 0;
        int skipped = 0;
        int failed = 0;
        for (String entryId : dueIds) {
            switch (deliverOne(entryId)) {
                case DELIVERED -> delivered++;
                case SKIPPED -> skipped++;
                default -> failed++;
            }
        }
        if (delivered > 0 || failed > 0) {
            log.info("Outbox drain finished. candidates={}, delivered={}, skipped={}, failed={}",
                    dueIds.size(), delivered, skipped, failed);
        }
    }

    private DeliveryOutcome deliverOne(String entryId) {
        boolean delivered;
        try {
            delivered = outboxDeliveryCommandService.deliverEntry(entryId);
        } catch (Exception ex) {
            recordFailure(entryId, ex);
            return DeliveryOutcome.FAILED;
        }
        if (!delivered) {
            skippedCounter.increment();
            log.debug("Outbox entry skipped, locked or no longer due. entryId={}", entryId);
            return DeliveryOutcome.SKIPPED;
        }
        deliveredCounter.increment();
        return DeliveryOutcome.DELIVERED;
    }

    private void recordFailure(String entryId, Exception cause) {
        String error = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        OutboxEntryEntity entry;
        try {
            entry = outboxDeliveryCommandService.recordFailure(entryId, error);
        } catch (Exception ex) {
            log.error("Outbox failure bookkeeping failed. entryId={}, deliveryError={}, error={}",
                    entryId, error, ex.getMessage(), ex);
            return;
        }
        if (entry == null) {
            return;
        }
        if (entry.getStatus() == OutboxStatusEnum.FAILED) {
            failedCounter.increment();
            log.warn("Outbox entry permanently failed. entryId={}, attempts={}, recipient={}, error={}",
                    entryId, entry.getAttempts(), entry.getRecipientAlias(), error);
            return;
        }
        retryCounter.increment();
        log.warn("Outbox delivery failed. entryId={}, attempts={}, nextAttemptAt={}, error={}",
                entryId, entry.getAttempts(), entry.getNextAttemptAt(), error);
    }

    @Scheduled(fixedDelayString = "${beadhub.outbox.cleanup-interval-ms:3600000}", scheduler = "daemonScheduler")
    public void cleanup() {
        LocalDateTime cutoff = LocalDateTime.now().minusDays(retentionDays);
        int removed = outboxDeliveryCommandService.cleanupDelivered(cutoff);
        if (removed > 0) {
            log.info("Outbox cleanup removed delivered entries. removed={}, cutoff={}", removed, cutoff);
        }
    }

    private enum DeliveryOutcome {
        DELIVERED,
        SKIPPED,
        FAILED
    }
}
