package com.beadhub.infrastructure.repository.bead;

import com.beadhub.domain.bead.adapter.repository.IBeadClaimRepository;
import com.beadhub.domain.bead.model.entity.BeadClaimEntity;
import com.beadhub.infrastructure.dao.BeadClaimDao;
import com.beadhub.infrastructure.dao.po.BeadClaimPO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 任务认领仓储实现。
 */
@Slf4j
@Repository
public class BeadClaimRepositoryImpl implements IBeadClaimRepository {

    private final BeadClaimDao beadClaimDao;

    public BeadClaimRepositoryImpl(BeadClaimDao beadClaimDao) {
        this.beadClaimDao = beadClaimDao;
    }

    /**
     * 必须在事务内调用，锁随事务提交或回滚释放。
     */
    @Override
    public void lockBead(String projectId, String beadId) {
        beadClaimDao.lockBead(projectId, beadId);
    }

    @Override
    public List<BeadClaimEntity> findByBead(String projectId, String beadId) {
        return toEntities(beadClaimDao.selectByBead(projectId, beadId));
    }

    @Override
    public BeadClaimEntity save(BeadClaimEntity entity) {
        BeadClaimPO po = toPO(entity);
        if (po.getId() == null) {
            po.setId(UUID.randomUUID().toString());
        }
        if (po.getClaimedAt() == null) {
            po.setClaimedAt(LocalDateTime.now());
        }
        if (beadClaimDao.insert(po) == 0) {
            log.debug("Claim already held, projectId={}, beadId={}, workspaceId={}",
                    po.getProjectId(), po.getBeadId(), po.getWorkspaceId());
        }
        return toEntity(po);
    }

    @Override
    public boolean deleteByWorkspaceAndBead(String projectId, String workspaceId, String beadId) {
        return beadClaimDao.deleteByWorkspaceAndBead(projectId, workspaceId, beadId) > 0;
    }

    @Override
    public int deleteById(String claimId) {
        return beadClaimDao.deleteById(claimId);
    }

    @Override
    public int deleteByBead(String projectId, String beadId) {
        return beadClaimDao.deleteByBead(projectId, beadId);
    }

    @Override
    public int deleteByWorkspace(String workspaceId) {
        return beadClaimDao.deleteByWorkspace(workspaceId);
    }

    @Override
    public List<BeadClaimEntity> findPage(String projectId, String workspaceId,
                                          LocalDateTime afterClaimedAt, String afterId, int limit) {
        return toEntities(beadClaimDao.selectPage(projectId, workspaceId, afterClaimedAt, afterId, limit));
    }

    private List<BeadClaimEntity> toEntities(List<BeadClaimPO> rows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private BeadClaimEntity toEntity(BeadClaimPO po) {
        if (po == null) {
            return null;
        }
        BeadClaimEntity entity = new BeadClaimEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setWorkspaceId(po.getWorkspaceId());
        entity.setAlias(po.getAlias());
        entity.setHumanName(po.getHumanName());
        entity.setBeadId(po.getBeadId());
        entity.setApexBeadId(po.getApexBeadId());
        entity.setCoordinated(Boolean.TRUE.equals(po.getCoordinated()));
        entity.setClaimedAt(po.getClaimedAt());
        return entity;
    }

    private BeadClaimPO toPO(BeadClaimEntity entity) {
        return BeadClaimPO.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .workspaceId(entity.getWorkspaceId())
                .alias(entity.getAlias())
                .humanName(entity.getHumanName())
                .beadId(entity.getBeadId())
                .apexBeadId(entity.getApexBeadId())
                .coordinated(entity.isCoordinated())
                .claimedAt(entity.getClaimedAt())
                .build();
    }
}
