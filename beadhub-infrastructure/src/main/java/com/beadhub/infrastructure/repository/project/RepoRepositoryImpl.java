package com.beadhub.infrastructure.repository.project;

import com.beadhub.domain.project.adapter.repository.IRepoRepository;
import com.beadhub.domain.project.model.entity.RepoEntity;
import com.beadhub.infrastructure.dao.RepoDao;
import com.beadhub.infrastructure.dao.po.RepoPO;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * 仓库仓储实现。
 */
@Repository
public class RepoRepositoryImpl implements IRepoRepository {

    private final RepoDao repoDao;

    public RepoRepositoryImpl(RepoDao repoDao) {
        this.repoDao = repoDao;
    }

    @Override
    public RepoEntity ensure(RepoEntity entity) {
        RepoPO po = RepoPO.builder()
                .id(entity.getId() == null ? UUID.randomUUID().toString() : entity.getId())
                .projectId(entity.getProjectId())
                .originUrl(entity.getOriginUrl())
                .canonicalOrigin(entity.getCanonicalOrigin())
                .name(entity.getName())
                .createdAt(entity.getCreatedAt() == null ? LocalDateTime.now() : entity.getCreatedAt())
                .build();
        repoDao.upsert(po);
        return toEntity(repoDao.selectByCanonicalOrigin(po.getProjectId(), po.getCanonicalOrigin()));
    }

    @Override
    public RepoEntity findById(String repoId) {
        return toEntity(repoDao.selectById(repoId));
    }

    @Override
    public RepoEntity findByCanonicalOrigin(String projectId, String canonicalOrigin) {
        return toEntity(repoDao.selectByCanonicalOrigin(projectId, canonicalOrigin));
    }

    @Override
    public RepoEntity lockById(String repoId) {
        return toEntity(repoDao.selectByIdForUpdate(repoId));
    }

    @Override
    public List<RepoEntity> findActivePage(String projectId, LocalDateTime afterCreatedAt, String afterId, int limit) {
        List<RepoPO> rows = repoDao.selectActivePage(projectId, afterCreatedAt, afterId, limit);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).toList();
    }

    @Override
    public boolean softDelete(String repoId) {
        return repoDao.softDelete(repoId, LocalDateTime.now()) > 0;
    }

    private RepoEntity toEntity(RepoPO po) {
        if (po == null) {
            return null;
        }
        RepoEntity entity = new RepoEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setOriginUrl(po.getOriginUrl());
        entity.setCanonicalOrigin(po.getCanonicalOrigin());
        entity.setName(po.getName());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setDeletedAt(po.getDeletedAt());
        entity.setWorkspaceCount(po.getWorkspaceCount());
        return entity;
    }
}
