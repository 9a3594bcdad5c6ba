package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.RepoPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 仓库 DAO。
 */
@Mapper
public interface RepoDao {

    /**
     * 插入仓库；同项目同规范化地址已存在时恢复软删除状态。
     */
    int upsert(RepoPO po);

    RepoPO selectById(@Param("id") String id);

    RepoPO selectByCanonicalOrigin(@Param("projectId") String projectId,
                                   @Param("canonicalOrigin") String canonicalOrigin);

    RepoPO selectByIdForUpdate(@Param("id") String id);

    /**
     * 按 (created_at, id) 升序的游标分页，workspace_count 为存活工作区数。
     */
    List<RepoPO> selectActivePage(@Param("projectId") String projectId,
                                  @Param("afterCreatedAt") LocalDateTime afterCreatedAt,
                                  @Param("afterId") String afterId,
                                  @Param("limit") int limit);

    int softDelete(@Param("id") String id, @Param("deletedAt") LocalDateTime deletedAt);
}
