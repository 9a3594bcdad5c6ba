package com.beadhub.domain.notification.service;

import com.beadhub.domain.bead.model.valobj.BeadStatusChange;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 发件箱领域服务：由业务事实生成发件箱条目，并给出失败后的退避排期。
 */
@Service
public class OutboxDomainService {

    private final int maxAttempts;
    private final long baseBackoffSeconds;
    private final long maxBackoffSeconds;

    public OutboxDomainService(@Value("${beadhub.outbox.max-attempts:3}") int maxAttempts,
                               @Value("${beadhub.outbox.base-backoff-seconds:30}") long baseBackoffSeconds,
                               @Value("${beadhub.outbox.max-backoff-seconds:1800}") long maxBackoffSeconds) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoffSeconds = Math.max(1L, baseBackoffSeconds);
        this.maxBackoffSeconds = Math.max(this.baseBackoffSeconds, maxBackoffSeconds);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 为状态变化生成通知条目：新条目不通知；每个匹配订阅一条；不通知变更发起者自己。
     */
    public List<OutboxEntryEntity> buildStatusChangeEntries(String projectId,
                                                            BeadStatusChange change,
                                                            List<SubscriptionEntity> subscriptions,
                                                            String actorWorkspaceId) {
        List<OutboxEntryEntity> entries = new ArrayList<>();
        if (change == null || change.isNewBead() || subscriptions == null) {
            return entries;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("bead_id", change.getBeadId());
        payload.put("repo", change.getRepo());
        payload.put("branch", change.getBranch());
        payload.put("old_status", change.getOldStatus());
        payload.put("new_status", change.getNewStatus());
        payload.put("title", change.getTitle());
        payload.put("changed_by_workspace_id", actorWorkspaceId);

        List<String> notified = new ArrayList<>();
        for (SubscriptionEntity subscription : subscriptions) {
            if (!subscription.matches(change.getRepo(), SubscriptionEntity.EVENT_STATUS_CHANGE)) {
                continue;
            }
            if (Objects.equals(subscription.getWorkspaceId(), actorWorkspaceId)
                    || notified.contains(subscription.getWorkspaceId())) {
                continue;
            }
            notified.add(subscription.getWorkspaceId());
            entries.add(OutboxEntryEntity.pending(projectId, OutboxEntryEntity.EVENT_BEAD_STATUS_CHANGE,
                    new LinkedHashMap<>(payload), subscription.getWorkspaceId(), subscription.getAlias()));
        }
        return entries;
    }

    /**
     * 升级请求被响应后通知发起的工作区。
     */
    public OutboxEntryEntity buildEscalationResponseEntry(String projectId, String escalationId, String subject,
                                                          String response, String note,
                                                          String recipientWorkspaceId, String recipientAlias) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("escalation_id", escalationId);
        payload.put("subject", subject);
        payload.put("response", response);
        payload.put("note", note);
        return OutboxEntryEntity.pending(projectId, OutboxEntryEntity.EVENT_ESCALATION_RESPONSE, payload,
                recipientWorkspaceId, recipientAlias);
    }

    /**
     * 指数退避：base * 2^(attempts-1)，上限 max。attempts 为失败后的累计次数。
     */
    public LocalDateTime nextAttemptAt(LocalDateTime now, int attempts) {
        int exponent = Math.max(0, Math.min(attempts - 1, 20));
        long delay = Math.min(maxBackoffSeconds, baseBackoffSeconds << exponent);
        return now.plusSeconds(delay);
    }

    public void recordFailure(OutboxEntryEntity entry, String error, LocalDateTime now) {
        entry.recordFailure(error, maxAttempts, nextAttemptAt(now, entry.normalizedAttempts() + 1));
    }
}
