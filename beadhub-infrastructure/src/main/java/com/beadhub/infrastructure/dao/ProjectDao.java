package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.ProjectPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 项目 DAO。
 */
@Mapper
public interface ProjectDao {

    /**
     * 插入项目，(tenant, slug) 已存在时忽略。
     */
    int insertIfAbsent(ProjectPO po);

    ProjectPO selectById(@Param("id") String id);

    ProjectPO selectBySlug(@Param("tenantId") String tenantId, @Param("slug") String slug);

    /**
     * 行级锁定项目，用于串行化策略版本分配。
     */
    ProjectPO selectByIdForUpdate(@Param("id") String id);

    int updateActivePolicy(@Param("id") String id, @Param("activePolicyId") String activePolicyId);
}
