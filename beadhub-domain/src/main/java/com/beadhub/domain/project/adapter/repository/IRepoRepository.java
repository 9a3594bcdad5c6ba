package com.beadhub.domain.project.adapter.repository;

import com.beadhub.domain.project.model.entity.RepoEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 仓库仓储接口
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IRepoRepository {

    /**
     * 按 (project_id, canonical_origin) 幂等确保仓库存在；已软删除的仓库会被恢复。
     */
    RepoEntity ensure(RepoEntity entity);

    RepoEntity findById(String repoId);

    RepoEntity findByCanonicalOrigin(String projectId, String canonicalOrigin);

    /**
     * 以排他行锁读取仓库，删除级联期间阻止并发的 init 挂入新工作区
     */
    RepoEntity lockById(String repoId);

    /**
     * 分页查询未删除仓库，按 (created_at, id) 排序，附带存活工作区数量
     */
    List<RepoEntity> findActivePage(String projectId, LocalDateTime afterCreatedAt, String afterId, int limit);

    boolean softDelete(String repoId);
}
