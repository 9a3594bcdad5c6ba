package com.beadhub.infrastructure.repository.notification;

import com.beadhub.domain.notification.adapter.repository.ISubscriptionRepository;
import com.beadhub.domain.notification.model.entity.SubscriptionEntity;
import com.beadhub.infrastructure.dao.SubscriptionDao;
import com.beadhub.infrastructure.dao.po.SubscriptionPO;
import com.beadhub.infrastructure.util.JsonCodec;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 订阅仓储实现。
 */
@Repository
public class SubscriptionRepositoryImpl implements ISubscriptionRepository {

    private final SubscriptionDao subscriptionDao;
    private final JsonCodec jsonCodec;

    public SubscriptionRepositoryImpl(SubscriptionDao subscriptionDao, JsonCodec jsonCodec) {
        this.subscriptionDao = subscriptionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public SubscriptionEntity save(SubscriptionEntity entity) {
        SubscriptionPO po = SubscriptionPO.builder()
                .id(entity.getId() == null ? UUID.randomUUID().toString() : entity.getId())
                .projectId(entity.getProjectId())
                .workspaceId(entity.getWorkspaceId())
                .alias(entity.getAlias())
                .beadId(entity.getBeadId())
                .repo(entity.getRepo())
                .eventTypes(jsonCodec.writeValue(entity.getEventTypes()))
                .createdAt(entity.getCreatedAt() == null ? LocalDateTime.now() : entity.getCreatedAt())
                .build();
        subscriptionDao.insert(po);
        return toEntity(po);
    }

    @Override
    public SubscriptionEntity findById(String projectId, String subscriptionId) {
        return toEntity(subscriptionDao.selectById(projectId, subscriptionId));
    }

    @Override
    public SubscriptionEntity findExisting(String projectId, String workspaceId, String beadId, String repo) {
        return toEntity(subscriptionDao.selectExisting(projectId, workspaceId, beadId, repo));
    }

    @Override
    public List<SubscriptionEntity> findByWorkspace(String projectId, String workspaceId) {
        return toEntities(subscriptionDao.selectByWorkspace(projectId, workspaceId));
    }

    @Override
    public List<SubscriptionEntity> findByBead(String projectId, String beadId) {
        return toEntities(subscriptionDao.selectByBead(projectId, beadId));
    }

    @Override
    public boolean deleteById(String projectId, String subscriptionId) {
        return subscriptionDao.deleteById(projectId, subscriptionId) > 0;
    }

    @Override
    public int deleteByWorkspace(String workspaceId) {
        return subscriptionDao.deleteByWorkspace(workspaceId);
    }

    private List<SubscriptionEntity> toEntities(List<SubscriptionPO> rows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private SubscriptionEntity toEntity(SubscriptionPO po) {
        if (po == null) {
            return null;
        }
        SubscriptionEntity entity = new SubscriptionEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setWorkspaceId(po.getWorkspaceId());
        entity.setAlias(po.getAlias());
        entity.setBeadId(po.getBeadId());
        entity.setRepo(po.getRepo());
        entity.setEventTypes(jsonCodec.readStringList(po.getEventTypes()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
