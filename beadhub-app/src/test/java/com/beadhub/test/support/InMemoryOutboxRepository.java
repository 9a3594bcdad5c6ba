package com.beadhub.test.support;

import com.beadhub.domain.notification.adapter.repository.IOutboxRepository;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.types.enums.OutboxStatusEnum;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 内存发件箱仓储。
 */
public class InMemoryOutboxRepository implements IOutboxRepository {

    private final Map<String, OutboxEntryEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public OutboxEntryEntity save(OutboxEntryEntity entity) {
        if (entity.getId() == null) {
            entity.setId("outbox-" + nextId++);
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public List<String> findDueIds(LocalDateTime now, int limit) {
        List<String> result = new ArrayList<>();
        for (OutboxEntryEntity entry : store.values()) {
            if (result.size() >= limit) {
                break;
            }
            if (entry.isPending() && !entry.getNextAttemptAt().isAfter(now)) {
                result.add(entry.getId());
            }
        }
        return result;
    }

    @Override
    public OutboxEntryEntity lockPending(String entryId) {
        OutboxEntryEntity entry = store.get(entryId);
        return entry != null && entry.isPending() ? entry : null;
    }

    @Override
    public boolean updateResult(OutboxEntryEntity entity) {
        return store.containsKey(entity.getId());
    }

    @Override
    public OutboxEntryEntity findById(String projectId, String entryId) {
        OutboxEntryEntity entry = store.get(entryId);
        return entry != null && entry.getProjectId().equals(projectId) ? entry : null;
    }

    @Override
    public List<OutboxEntryEntity> findFailed(String projectId, int limit) {
        List<OutboxEntryEntity> result = new ArrayList<>();
        for (OutboxEntryEntity entry : store.values()) {
            if (entry.getProjectId().equals(projectId) && entry.getStatus() == OutboxStatusEnum.FAILED
                    && result.size() < limit) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public int deleteDeliveredBefore(LocalDateTime cutoff) {
        int before = store.size();
        store.values().removeIf(entry -> entry.getStatus() == OutboxStatusEnum.DELIVERED
                && entry.getProcessedAt() != null
                && entry.getProcessedAt().isBefore(cutoff));
        return before - store.size();
    }

    public List<OutboxEntryEntity> all() {
        return new ArrayList<>(store.values());
    }
}
