package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.EscalationPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 升级请求 DAO。
 */
@Mapper
public interface EscalationDao {

    int insert(EscalationPO po);

    EscalationPO selectById(@Param("projectId") String projectId, @Param("id") String id);

    EscalationPO selectByIdForUpdate(@Param("projectId") String projectId, @Param("id") String id);

    /**
     * 仅当当前状态仍为 pending 时写入终态。
     */
    int updateFromPending(EscalationPO po);

    /**
     * 按 (created_at, id) 降序的游标分页。
     */
    List<EscalationPO> selectPage(@Param("projectId") String projectId,
                                  @Param("status") String status,
                                  @Param("workspaceId") String workspaceId,
                                  @Param("beforeCreatedAt") LocalDateTime beforeCreatedAt,
                                  @Param("beforeId") String beforeId,
                                  @Param("limit") int limit);

    int countPending(@Param("projectId") String projectId);

    List<EscalationPO> selectDuePendingForUpdate(@Param("now") LocalDateTime now, @Param("limit") int limit);
}
