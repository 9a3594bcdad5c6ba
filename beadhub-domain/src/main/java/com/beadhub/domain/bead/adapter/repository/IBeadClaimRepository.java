package com.beadhub.domain.bead.adapter.repository;

import com.beadhub.domain.bead.model.entity.BeadClaimEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 认领仓储接口
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IBeadClaimRepository {

    /**
     * 在当前事务内获取 (project_id, bead_id) 粒度的排他锁，事务结束自动释放。
     * 同一调用内必须按 bead_id 排序加锁。
     */
    void lockBead(String projectId, String beadId);

    /**
     * 查询条目上的所有认领
     */
    List<BeadClaimEntity> findByBead(String projectId, String beadId);

    BeadClaimEntity save(BeadClaimEntity entity);

    boolean deleteByWorkspaceAndBead(String projectId, String workspaceId, String beadId);

    int deleteById(String claimId);

    int deleteByBead(String projectId, String beadId);

    int deleteByWorkspace(String workspaceId);

    /**
     * 分页查询项目内的认领，按 (claimed_at, id) 排序；workspaceId 为空时不过滤
     */
    List<BeadClaimEntity> findPage(String projectId, String workspaceId,
                                   LocalDateTime afterClaimedAt, String afterId, int limit);
}
