package com.beadhub.domain.notification.adapter.repository;

import com.beadhub.domain.notification.model.entity.SubscriptionEntity;

import java.util.List;

/**
 * 订阅仓储接口
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface ISubscriptionRepository {

    SubscriptionEntity save(SubscriptionEntity entity);

    SubscriptionEntity findById(String projectId, String subscriptionId);

    /**
     * 同一工作区对同一 (bead_id, repo) 的订阅
     */
    SubscriptionEntity findExisting(String projectId, String workspaceId, String beadId, String repo);

    List<SubscriptionEntity> findByWorkspace(String projectId, String workspaceId);

    /**
     * 条目的所有订阅（含不限仓库的订阅），事件类型与仓库匹配由调用方过滤
     */
    List<SubscriptionEntity> findByBead(String projectId, String beadId);

    boolean deleteById(String projectId, String subscriptionId);

    int deleteByWorkspace(String workspaceId);
}
