package com.beadhub.domain.escalation.adapter.repository;

import com.beadhub.domain.escalation.model.entity.EscalationEntity;
import com.beadhub.types.enums.EscalationStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 升级请求仓储接口
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IEscalationRepository {

    EscalationEntity save(EscalationEntity entity);

    /**
     * 项目内查询；跨项目返回 null
     */
    EscalationEntity findById(String projectId, String escalationId);

    /**
     * 以行锁读取
     */
    EscalationEntity lockById(String projectId, String escalationId);

    /**
     * 仅当当前状态为 pending 时写入终态
     *
     * @return 是否更新成功
     */
    boolean updateFromPending(EscalationEntity entity);

    /**
     * 分页查询，按 (created_at, id) 倒序
     */
    List<EscalationEntity> findPage(String projectId, EscalationStatusEnum status, String workspaceId,
                                    LocalDateTime beforeCreatedAt, String beforeId, int limit);

    int countPending(String projectId);

    /**
     * 锁定到期的 pending 升级请求（FOR UPDATE SKIP LOCKED）
     */
    List<EscalationEntity> lockDuePending(LocalDateTime now, int limit);
}
