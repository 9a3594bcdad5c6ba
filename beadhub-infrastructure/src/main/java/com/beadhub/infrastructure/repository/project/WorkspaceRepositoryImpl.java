package com.beadhub.infrastructure.repository.project;

import com.beadhub.domain.project.adapter.repository.IWorkspaceRepository;
import com.beadhub.domain.project.model.entity.WorkspaceEntity;
import com.beadhub.infrastructure.dao.WorkspaceDao;
import com.beadhub.infrastructure.dao.po.WorkspacePO;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 工作区仓储实现。
 */
@Repository
public class WorkspaceRepositoryImpl implements IWorkspaceRepository {

    private final WorkspaceDao workspaceDao;

    public WorkspaceRepositoryImpl(WorkspaceDao workspaceDao) {
        this.workspaceDao = workspaceDao;
    }

    @Override
    public WorkspaceEntity save(WorkspaceEntity entity) {
        LocalDateTime now = LocalDateTime.now();
        WorkspacePO po = toPO(entity);
        if (po.getCreatedAt() == null) {
            po.setCreatedAt(now);
        }
        po.setUpdatedAt(now);
        workspaceDao.upsert(po);
        return toEntity(workspaceDao.selectById(po.getWorkspaceId()));
    }

    @Override
    public WorkspaceEntity findById(String workspaceId) {
        return toEntity(workspaceDao.selectById(workspaceId));
    }

    @Override
    public WorkspaceEntity findActiveByAlias(String projectId, String alias) {
        return toEntity(workspaceDao.selectActiveByAlias(projectId, alias));
    }

    @Override
    public Set<String> findActiveAliases(String projectId) {
        List<String> aliases = workspaceDao.selectActiveAliases(projectId);
        return aliases == null ? Collections.emptySet() : new HashSet<>(aliases);
    }

    @Override
    public Set<String> findLiveIds(Collection<String> workspaceIds) {
        if (workspaceIds == null || workspaceIds.isEmpty()) {
            return Collections.emptySet();
        }
        return new HashSet<>(workspaceDao.selectLiveIds(workspaceIds));
    }

    @Override
    public List<WorkspaceEntity> findActivePage(String projectId, String repoId,
                                                LocalDateTime afterCreatedAt, String afterId, int limit) {
        List<WorkspacePO> rows = workspaceDao.selectActivePage(projectId, repoId, afterCreatedAt, afterId, limit);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public boolean softDelete(String workspaceId) {
        return workspaceDao.softDelete(workspaceId, LocalDateTime.now()) > 0;
    }

    @Override
    public List<String> findLiveIdsByRepo(String repoId) {
        List<String> ids = workspaceDao.selectLiveIdsByRepo(repoId);
        return ids == null ? Collections.emptyList() : ids;
    }

    @Override
    public int softDeleteByRepo(String repoId) {
        return workspaceDao.softDeleteByRepo(repoId, LocalDateTime.now());
    }

    @Override
    public void touchLastSeen(String workspaceId, LocalDateTime lastSeenAt) {
        workspaceDao.updateLastSeen(workspaceId, lastSeenAt);
    }

    private WorkspaceEntity toEntity(WorkspacePO po) {
        if (po == null) {
            return null;
        }
        WorkspaceEntity entity = new WorkspaceEntity();
        entity.setWorkspaceId(po.getWorkspaceId());
        entity.setProjectId(po.getProjectId());
        entity.setRepoId(po.getRepoId());
        entity.setAlias(po.getAlias());
        entity.setHumanName(po.getHumanName());
        entity.setRole(po.getRole());
        entity.setHostname(po.getHostname());
        entity.setWorkspacePath(po.getWorkspacePath());
        entity.setLastSeenAt(po.getLastSeenAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setDeletedAt(po.getDeletedAt());
        return entity;
    }

    private WorkspacePO toPO(WorkspaceEntity entity) {
        return WorkspacePO.builder()
                .workspaceId(entity.getWorkspaceId())
                .projectId(entity.getProjectId())
                .repoId(entity.getRepoId())
                .alias(entity.getAlias())
                .humanName(entity.getHumanName())
                .role(entity.getRole())
                .hostname(entity.getHostname())
                .workspacePath(entity.getWorkspacePath())
                .lastSeenAt(entity.getLastSeenAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .deletedAt(entity.getDeletedAt())
                .build();
    }
}
