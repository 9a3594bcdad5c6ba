package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.BeadClaimPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务认领 DAO。
 */
@Mapper
public interface BeadClaimDao {

    /**
     * 获取 (project, bead) 维度的事务级咨询锁，事务结束自动释放。
     */
    Integer lockBead(@Param("projectId") String projectId, @Param("beadId") String beadId);

    List<BeadClaimPO> selectByBead(@Param("projectId") String projectId, @Param("beadId") String beadId);

    /**
     * 插入认领，同工作区重复认领时忽略。
     */
    int insert(BeadClaimPO po);

    int deleteByWorkspaceAndBead(@Param("projectId") String projectId,
                                 @Param("workspaceId") String workspaceId,
                                 @Param("beadId") String beadId);

    int deleteById(@Param("id") String id);

    int deleteByBead(@Param("projectId") String projectId, @Param("beadId") String beadId);

    int deleteByWorkspace(@Param("workspaceId") String workspaceId);

    List<BeadClaimPO> selectPage(@Param("projectId") String projectId,
                                 @Param("workspaceId") String workspaceId,
                                 @Param("afterClaimedAt") LocalDateTime afterClaimedAt,
                                 @Param("afterId") String afterId,
                                 @Param("limit") int limit);
}
