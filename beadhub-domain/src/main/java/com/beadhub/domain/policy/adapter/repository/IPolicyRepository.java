package com.beadhub.domain.policy.adapter.repository;

import com.beadhub.domain.policy.model.entity.PolicyEntity;

import java.util.List;

/**
 * 策略版本仓储接口（只追加）
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IPolicyRepository {

    /**
     * 插入新版本
     */
    PolicyEntity insert(PolicyEntity entity);

    /**
     * 项目内查询指定版本；跨项目返回 null
     */
    PolicyEntity findById(String projectId, String policyId);

    /**
     * 项目内当前最大版本号；无版本时返回 0。调用方必须已持有项目行锁。
     */
    int findMaxVersion(String projectId);

    /**
     * 历史版本，按版本号倒序
     */
    List<PolicyEntity> findHistory(String projectId, int limit);
}
