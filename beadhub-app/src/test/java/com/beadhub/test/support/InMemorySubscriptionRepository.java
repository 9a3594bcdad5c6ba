package com.beadhub.test.support;

import com.beadhub.domain.notification.adapter.repository.ISubscriptionRepository;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 内存订阅仓储。
 */
public class InMemorySubscriptionRepository implements ISubscriptionRepository {

    private final Map<String, SubscriptionEntity> store = new LinkedHashMap<>();
    private long nextId = 1;

    @Override
    public SubscriptionEntity save(SubscriptionEntity entity) {
        if (entity.getId() == null) {
            entity.setId("sub-" + nextId++);
        }
        store.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public SubscriptionEntity findById(String projectId, String subscriptionId) {
        SubscriptionEntity entity = store.get(subscriptionId);
        return entity != null && entity.getProjectId().equals(projectId) ? entity : null;
    }

    @Override
    public SubscriptionEntity findExisting(String projectId, String workspaceId, String beadId, String repo) {
        for (SubscriptionEntity entity : store.values()) {
            if (entity.getProjectId().equals(projectId)
                    && entity.getWorkspaceId().equals(workspaceId)
                    && entity.getBeadId().equals(beadId)
                    && Objects.equals(entity.getRepo(), repo)) {
                return entity;
            }
        }
        return null;
    }

    @Override
    public List<SubscriptionEntity> findByWorkspace(String projectId, String workspaceId) {
        List<SubscriptionEntity> result = new ArrayList<>();
        for (SubscriptionEntity entity : store.values()) {
            if (entity.getProjectId().equals(projectId) && entity.getWorkspaceId().equals(workspaceId)) {
                result.add(entity);
            }
        }
        return result;
    }

    @Override
    public List<SubscriptionEntity> findByBead(String projectId, String beadId) {
        List<SubscriptionEntity> result = new ArrayList<>();
        for (SubscriptionEntity entity : store.values()) {
            if (entity.getProjectId().equals(projectId) && entity.getBeadId().equals(beadId)) {
                result.add(entity);
            }
        }
        return result;
    }

    @Override
    public boolean deleteById(String projectId, String subscriptionId) {
        return findById(projectId, subscriptionId) != null && store.remove(subscriptionId) != null;
    }

    @Override
    public int deleteByWorkspace(String workspaceId) {
        int before = store.size();
        store.values().removeIf(entity -> entity.getWorkspaceId().equals(workspaceId));
        return before - store.size();
    }
}
