package com.beadhub.domain.notification.adapter.repository;

import com.beadhub.domain.notification.model.entity.OutboxEntryEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 发件箱仓储接口
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IOutboxRepository {

    /**
     * 追加条目（与触发事件同一事务）
     */
    OutboxEntryEntity save(OutboxEntryEntity entity);

    /**
     * 到期待投递条目的 ID，按创建时间排序。只是候选，不加锁。
     */
    List<String> findDueIds(LocalDateTime now, int limit);

    /**
     * 在当前事务内锁定一个仍处于待投递状态的条目（FOR UPDATE SKIP LOCKED）；
     * 已被其他投递者锁定或已不再待投递时返回 null。
     */
    OutboxEntryEntity lockPending(String entryId);

    /**
     * 持久化投递结果（状态、次数、错误、下次时间、消息 ID）
     */
    boolean updateResult(OutboxEntryEntity entity);

    OutboxEntryEntity findById(String projectId, String entryId);

    List<OutboxEntryEntity> findFailed(String projectId, int limit);

    /**
     * 删除早于截止时间的已投递条目
     */
    int deleteDeliveredBefore(LocalDateTime cutoff);
}
