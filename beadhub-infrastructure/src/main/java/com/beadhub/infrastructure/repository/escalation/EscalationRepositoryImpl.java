package com.beadhub.infrastructure.repository.escalation;

import com.beadhub.domain.escalation.adapter.repository.IEscalationRepository;
import com.beadhub.domain.escalation.model.entity.EscalationEntity;
import com.beadhub.infrastructure.dao.EscalationDao;
import com.beadhub.infrastructure.dao.po.EscalationPO;
import com.beadhub.infrastructure.util.JsonCodec;
import com.beadhub.types.enums.EscalationStatusEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 升级请求仓储实现。
 */
@Repository
public class EscalationRepositoryImpl implements IEscalationRepository {

    private final EscalationDao escalationDao;
    private final JsonCodec jsonCodec;

    public EscalationRepositoryImpl(EscalationDao escalationDao, JsonCodec jsonCodec) {
        this.escalationDao = escalationDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public EscalationEntity save(EscalationEntity entity) {
        if (entity.getId() == null) {
            entity.setId(UUID.randomUUID().toString());
        }
        if (entity.getCreatedAt() == null) {
            entity.setCreatedAt(LocalDateTime.now());
        }
        escalationDao.insert(toPO(entity));
        return entity;
    }

    @Override
    public EscalationEntity findById(String projectId, String escalationId) {
        return toEntity(escalationDao.selectById(projectId, escalationId));
    }

    @Override
    public EscalationEntity lockById(String projectId, String escalationId) {
        return toEntity(escalationDao.selectByIdForUpdate(projectId, escalationId));
    }

    @Override
    public boolean updateFromPending(EscalationEntity entity) {
        return escalationDao.updateFromPending(toPO(entity)) > 0;
    }

    @Override
    public List<EscalationEntity> findPage(String projectId, EscalationStatusEnum status, String workspaceId,
                                           LocalDateTime beforeCreatedAt, String beforeId, int limit) {
        String statusCode = status == null ? null : status.getCode();
        return toEntities(escalationDao.selectPage(projectId, statusCode, workspaceId, beforeCreatedAt, beforeId, limit));
    }

    @Override
    public int countPending(String projectId) {
        return escalationDao.countPending(projectId);
    }

    @Override
    public List<EscalationEntity> lockDuePending(LocalDateTime now, int limit) {
        return toEntities(escalationDao.selectDuePendingForUpdate(now, limit));
    }

    private List<EscalationEntity> toEntities(List<EscalationPO> rows) {
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private EscalationEntity toEntity(EscalationPO po) {
        if (po == null) {
            return null;
        }
        EscalationEntity entity = new EscalationEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setWorkspaceId(po.getWorkspaceId());
        entity.setAlias(po.getAlias());
        entity.setHumanName(po.getHumanName());
        entity.setSubject(po.getSubject());
        entity.setSituation(po.getSituation());
        List<String> options = jsonCodec.readStringList(po.getOptions());
        entity.setOptions(options == null ? new ArrayList<>() : options);
        entity.setStatus(EscalationStatusEnum.fromCode(po.getStatus()));
        entity.setResponse(po.getResponse());
        entity.setResponseNote(po.getResponseNote());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setRespondedAt(po.getRespondedAt());
        entity.setExpiresAt(po.getExpiresAt());
        return entity;
    }

    private EscalationPO toPO(EscalationEntity entity) {
        EscalationStatusEnum status = entity.getStatus() == null ? EscalationStatusEnum.PENDING : entity.getStatus();
        return EscalationPO.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .workspaceId(entity.getWorkspaceId())
                .alias(entity.getAlias())
                .humanName(entity.getHumanName())
                .subject(entity.getSubject())
                .situation(entity.getSituation())
                .options(jsonCodec.writeValue(entity.getOptions() == null ? new ArrayList<>() : entity.getOptions()))
                .status(status.getCode())
                .response(entity.getResponse())
                .responseNote(entity.getResponseNote())
                .createdAt(entity.getCreatedAt())
                .respondedAt(entity.getRespondedAt())
                .expiresAt(entity.getExpiresAt())
                .build();
    }
}
