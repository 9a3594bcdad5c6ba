package com.beadhub.domain.project.adapter.repository;

import com.beadhub.domain.project.model.entity.WorkspaceEntity;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 工作区仓储接口
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IWorkspaceRepository {

    /**
     * 保存工作区
     */
    WorkspaceEntity save(WorkspaceEntity entity);

    /**
     * 根据 ID 查询（包含已软删除的工作区）
     */
    WorkspaceEntity findById(String workspaceId);

    /**
     * 查询项目内指定别名的未删除工作区
     */
    WorkspaceEntity findActiveByAlias(String projectId, String alias);

    /**
     * 项目内所有未删除工作区的别名
     */
    Set<String> findActiveAliases(String projectId);

    /**
     * 过滤出给定 ID 中仍存活（未删除）的工作区 ID
     */
    Set<String> findLiveIds(Collection<String> workspaceIds);

    /**
     * 分页查询未删除工作区，按 (created_at, workspace_id) 排序
     */
    List<WorkspaceEntity> findActivePage(String projectId, String repoId,
                                         LocalDateTime afterCreatedAt, String afterId, int limit);

    /**
     * 软删除
     */
    boolean softDelete(String workspaceId);

    /**
     * 仓库下仍存活的工作区 ID
     */
    List<String> findLiveIdsByRepo(String repoId);

    /**
     * 软删除仓库下全部存活工作区
     *
     * @return 受影响行数
     */
    int softDeleteByRepo(String repoId);

    /**
     * 刷新最近活跃时间
     */
    void touchLastSeen(String workspaceId, LocalDateTime lastSeenAt);
}
