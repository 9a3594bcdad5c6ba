package com.beadhub.trigger.job;

import com.beadhub.trigger.application.command.EscalationCommandService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 升级过期守护进程：把超过 expires_at 的待处理升级标记为 expired。
 */
@Slf4j
@Component
public class EscalationExpiryDaemon {

    private final EscalationCommandService escalationCommandService;
    private final int batchSize;
    private final Counter expiredCounter;

    public EscalationExpiryDaemon(EscalationCommandService escalationCommandService,
                                  @Value("${beadhub.escalation.expiry-batch-size:100}") int batchSize) {
        this.escalationCommandService = escalationCommandService;
        this.batchSize = batchSize > 0 ? batchSize : 100;
        this.expiredCounter = Counter.builder("beadhub.escalation.expired.total").register(Metrics.globalRegistry);
    }

    @Scheduled(fixedDelayString = "${beadhub.escalation.expiry-interval-ms:60000}", scheduler = "daemonScheduler")
    public void expireDue() {
        int expired;
        try {
            expired = escalationCommandService.expireDue(batchSize);
        } catch (Exception ex) {
            log.warn("Escalation expiry sweep failed. error={}", ex.getMessage());
            return;
        }
        if (expired > 0) {
            expiredCounter.increment(expired);
            log.info("Escalations expired. count={}", expired);
        }
    }
}
