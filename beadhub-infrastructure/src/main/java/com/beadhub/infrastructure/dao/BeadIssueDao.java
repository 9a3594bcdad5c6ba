package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.BeadIssuePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 工作项镜像 DAO。
 */
@Mapper
public interface BeadIssueDao {

    BeadIssuePO selectForUpdate(@Param("projectId") String projectId,
                                @Param("repo") String repo,
                                @Param("branch") String branch,
                                @Param("beadId") String beadId);

    /**
     * 按 (project, repo, branch, bead_id) 插入或覆盖。
     */
    int upsert(BeadIssuePO po);

    int deleteByBeadIds(@Param("projectId") String projectId,
                        @Param("repo") String repo,
                        @Param("branch") String branch,
                        @Param("beadIds") List<String> beadIds);

    List<BeadIssuePO> selectByBeadId(@Param("projectId") String projectId, @Param("beadId") String beadId);

    List<BeadIssuePO> selectByStatus(@Param("projectId") String projectId,
                                     @Param("repo") String repo,
                                     @Param("branch") String branch,
                                     @Param("status") String status,
                                     @Param("limit") int limit);
}
