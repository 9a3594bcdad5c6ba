package com.beadhub.infrastructure.repository.notification;

import com.beadhub.domain.notification.adapter.repository.IOutboxRepository;
import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;
import com.beadhub.infrastructure.dao.NotificationOutboxDao;
import com.beadhub.infrastructure.dao.po.NotificationOutboxPO;
import com.beadhub.infrastructure.util.JsonCodec;
import com.beadhub.types.enums.OutboxStatusEnum;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 通知发件箱仓储实现。
 */
@Repository
public class OutboxRepositoryImpl implements IOutboxRepository {

    private final NotificationOutboxDao notificationOutboxDao;
    private final JsonCodec jsonCodec;

    public OutboxRepositoryImpl(NotificationOutboxDao notificationOutboxDao, JsonCodec jsonCodec) {
        this.notificationOutboxDao = notificationOutboxDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public OutboxEntryEntity save(OutboxEntryEntity entity) {
        if (entity.getId() == null) {
            entity.setId(UUID.randomUUID().toString());
        }
        notificationOutboxDao.insert(toPO(entity));
        return entity;
    }

    @Override
    public List<String> findDueIds(LocalDateTime now, int limit) {
        List<String> ids = notificationOutboxDao.selectDueIds(now, limit);
        return ids == null ? Collections.emptyList() : ids;
    }

    @Override
    public OutboxEntryEntity lockPending(String entryId) {
        return toEntity(notificationOutboxDao.selectPendingForUpdate(entryId));
    }

    @Override
    public boolean updateResult(OutboxEntryEntity entity) {
        return notificationOutboxDao.updateResult(toPO(entity)) > 0;
    }

    @Override
    public OutboxEntryEntity findById(String projectId, String entryId) {
        return toEntity(notificationOutboxDao.selectById(projectId, entryId));
    }

    @Override
    public List<OutboxEntryEntity> findFailed(String projectId, int limit) {
        List<NotificationOutboxPO> rows = notificationOutboxDao.selectFailed(projectId, limit);
        if (rows == null || rows.isEmpty()) {
            return Collections.emptyList();
        }
        return rows.stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public int deleteDeliveredBefore(LocalDateTime cutoff) {
        return notificationOutboxDao.deleteDeliveredBefore(cutoff);
    }

    private OutboxEntryEntity toEntity(NotificationOutboxPO po) {
        if (po == null) {
            return null;
        }
        OutboxEntryEntity entity = new OutboxEntryEntity();
        entity.setId(po.getId());
        entity.setProjectId(po.getProjectId());
        entity.setEventType(po.getEventType());
        entity.setPayload(jsonCodec.readMap(po.getPayload()));
        entity.setRecipientWorkspaceId(po.getRecipientWorkspaceId());
        entity.setRecipientAlias(po.getRecipientAlias());
        entity.setStatus(OutboxStatusEnum.fromCode(po.getStatus()));
        entity.setAttempts(po.getAttempts());
        entity.setNextAttemptAt(po.getNextAttemptAt());
        entity.setLastError(po.getLastError());
        entity.setMessageId(po.getMessageId());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setProcessedAt(po.getProcessedAt());
        return entity;
    }

    private NotificationOutboxPO toPO(OutboxEntryEntity entity) {
        OutboxStatusEnum status = entity.getStatus() == null ? OutboxStatusEnum.PENDING : entity.getStatus();
        return NotificationOutboxPO.builder()
                .id(entity.getId())
                .projectId(entity.getProjectId())
                .eventType(entity.getEventType())
                .payload(jsonCodec.writeValue(entity.getPayload()))
                .recipientWorkspaceId(entity.getRecipientWorkspaceId())
                .recipientAlias(entity.getRecipientAlias())
                .status(status.getCode())
                .attempts(entity.normalizedAttempts())
                .nextAttemptAt(entity.getNextAttemptAt() == null ? LocalDateTime.now() : entity.getNextAttemptAt())
                .lastError(entity.getLastError())
                .messageId(entity.getMessageId())
                .createdAt(entity.getCreatedAt() == null ? LocalDateTime.now() : entity.getCreatedAt())
                .processedAt(entity.getProcessedAt())
                .build();
    }
}
