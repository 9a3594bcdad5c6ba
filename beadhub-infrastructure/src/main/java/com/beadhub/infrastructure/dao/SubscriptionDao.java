package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.SubscriptionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 订阅 DAO。
 */
@Mapper
public interface SubscriptionDao {

    int insert(SubscriptionPO po);

    SubscriptionPO selectById(@Param("projectId") String projectId, @Param("id") String id);

    SubscriptionPO selectExisting(@Param("projectId") String projectId,
                                  @Param("workspaceId") String workspaceId,
                                  @Param("beadId") String beadId,
                                  @Param("repo") String repo);

    List<SubscriptionPO> selectByWorkspace(@Param("projectId") String projectId,
                                           @Param("workspaceId") String workspaceId);

    List<SubscriptionPO> selectByBead(@Param("projectId") String projectId, @Param("beadId") String beadId);

    int deleteById(@Param("projectId") String projectId, @Param("id") String id);

    int deleteByWorkspace(@Param("workspaceId") String workspaceId);
}
