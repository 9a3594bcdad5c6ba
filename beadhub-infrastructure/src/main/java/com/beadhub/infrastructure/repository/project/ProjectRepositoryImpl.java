package com.beadhub.infrastructure.repository.project;

import com.beadhub.domain.project.adapter.repository.IProjectRepository;
import com.beadhub.domain.project.model.entity.ProjectEntity;
import com.beadhub.infrastructure.dao.ProjectDao;
import com.beadhub.infrastructure.dao.po.ProjectPO;
import com.beadhub.types.enums.ProjectVisibilityEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 项目仓储实现。
 */
@Slf4j
@Repository
public class ProjectRepositoryImpl implements IProjectRepository {

    private final ProjectDao projectDao;

    public ProjectRepositoryImpl(ProjectDao projectDao) {
        this.projectDao = projectDao;
    }

    /**
     * 幂等创建：(tenant, slug) 已存在时返回已有项目。
     */
    @Override
    public ProjectEntity save(ProjectEntity entity) {
        ProjectPO po = toPO(entity);
        if (po.getId() == null) {
            po.setId(UUID.randomUUID().toString());
        }
        LocalDateTime now = LocalDateTime.now();
        if (po.getCreatedAt() == null) {
            po.setCreatedAt(now);
        }
        po.setUpdatedAt(now);
        int inserted = projectDao.insertIfAbsent(po);
        if (inserted == 0) {
            log.debug("Project already exists, tenantId={}, slug={}", po.getTenantId(), po.getSlug());
        }
        return toEntity(projectDao.selectBySlug(po.getTenantId(), po.getSlug()));
    }

    @Override
    public ProjectEntity findById(String projectId) {
        return toEntity(projectDao.selectById(projectId));
    }

    @Override
    public ProjectEntity findBySlug(String tenantId, String slug) {
        return toEntity(projectDao.selectBySlug(tenantId, slug));
    }

    @Override
    public ProjectEntity lockById(String projectId) {
        return toEntity(projectDao.selectByIdForUpdate(projectId));
    }

    @Override
    public boolean updateActivePolicy(String projectId, String policyId) {
        return projectDao.updateActivePolicy(projectId, policyId) > 0;
    }

    private ProjectEntity toEntity(ProjectPO po) {
        if (po == null) {
            return null;
        }
        ProjectEntity entity = new ProjectEntity();
        entity.setId(po.getId());
        entity.setTenantId(po.getTenantId());
        entity.setSlug(po.getSlug());
        entity.setName(po.getName());
        entity.setVisibility(ProjectVisibilityEnum.fromCode(po.getVisibility()));
        entity.setActivePolicyId(po.getActivePolicyId());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private ProjectPO toPO(ProjectEntity entity) {
        ProjectVisibilityEnum visibility = entity.getVisibility() == null
                ? ProjectVisibilityEnum.PRIVATE : entity.getVisibility();
        return ProjectPO.builder()
                .id(entity.getId())
                .tenantId(entity.getTenantId())
                .slug(entity.getSlug())
                .name(entity.getName())
                .visibility(visibility.getCode())
                .activePolicyId(entity.getActivePolicyId())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
