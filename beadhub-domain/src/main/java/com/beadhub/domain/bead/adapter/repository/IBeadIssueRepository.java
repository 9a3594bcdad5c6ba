package com.beadhub.domain.bead.adapter.repository;

import com.beadhub.domain.bead.model.entity.BeadIssueEntity;

import java.util.List;

/**
 * 工作条目镜像仓储接口
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IBeadIssueRepository {

    /**
     * 以行锁读取已存储的条目；不存在时返回 null
     */
    BeadIssueEntity findForUpdate(String projectId, String repo, String branch, String beadId);

    /**
     * 按 (project_id, repo, branch, bead_id) 插入或更新
     */
    void upsert(BeadIssueEntity entity);

    /**
     * 显式删除
     *
     * @return 删除行数
     */
    int deleteByBeadIds(String projectId, String repo, String branch, List<String> beadIds);

    /**
     * 项目内跨仓库 / 分支查询同一 bead_id 的条目
     */
    List<BeadIssueEntity> findByBeadId(String projectId, String beadId);

    /**
     * 按状态查询条目，repo / branch 为空时不过滤；按 (priority, created_at, bead_id) 排序，priority 为空的排在最后
     */
    List<BeadIssueEntity> findByStatus(String projectId, String repo, String branch, String status, int limit);
}
