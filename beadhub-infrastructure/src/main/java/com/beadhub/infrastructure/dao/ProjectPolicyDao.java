package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.ProjectPolicyPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 项目策略版本 DAO。
 */
@Mapper
public interface ProjectPolicyDao {

    int insert(ProjectPolicyPO po);

    ProjectPolicyPO selectById(@Param("projectId") String projectId, @Param("policyId") String policyId);

    /**
     * 当前最大版本号，无版本时为 0。
     */
    int selectMaxVersion(@Param("projectId") String projectId);

    List<ProjectPolicyPO> selectHistory(@Param("projectId") String projectId, @Param("limit") int limit);
}
