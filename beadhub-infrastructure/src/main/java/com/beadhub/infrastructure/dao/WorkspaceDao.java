package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.WorkspacePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 工作区 DAO。
 */
@Mapper
public interface WorkspaceDao {

    /**
     * 按 workspace_id 插入或更新可变字段。
     */
    int upsert(WorkspacePO po);

    WorkspacePO selectById(@Param("workspaceId") String workspaceId);

    WorkspacePO selectActiveByAlias(@Param("projectId") String projectId, @Param("alias") String alias);

    List<String> selectActiveAliases(@Param("projectId") String projectId);

    List<String> selectLiveIds(@Param("workspaceIds") Collection<String> workspaceIds);

    /**
     * 按 (created_at, workspace_id) 升序的游标分页。
     */
    List<WorkspacePO> selectActivePage(@Param("projectId") String projectId,
                                       @Param("repoId") String repoId,
                                       @Param("afterCreatedAt") LocalDateTime afterCreatedAt,
                                       @Param("afterId") String afterId,
                                       @Param("limit") int limit);

    int softDelete(@Param("workspaceId") String workspaceId, @Param("deletedAt") LocalDateTime deletedAt);

    List<String> selectLiveIdsByRepo(@Param("repoId") String repoId);

    int softDeleteByRepo(@Param("repoId") String repoId, @Param("deletedAt") LocalDateTime deletedAt);

    int updateLastSeen(@Param("workspaceId") String workspaceId, @Param("lastSeenAt") LocalDateTime lastSeenAt);
}
