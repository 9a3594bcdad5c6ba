package com.beadhub.domain.project.adapter.repository;

import com.beadhub.domain.project.model.entity.ProjectEntity;

/**
 * 项目仓储接口
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IProjectRepository {

    /**
     * 保存项目
     */
    ProjectEntity save(ProjectEntity entity);

    /**
     * 根据 ID 查询
     */
    ProjectEntity findById(String projectId);

    /**
     * 根据租户范围与 slug 查询（tenantId 为空表示全局范围）
     */
    ProjectEntity findBySlug(String tenantId, String slug);

    /**
     * 以排他行锁读取项目（策略版本分配的串行化点）
     */
    ProjectEntity lockById(String projectId);

    /**
     * 切换激活的策略版本
     */
    boolean updateActivePolicy(String projectId, String policyId);
}
