package com.beadhub.infrastructure.dao;

import com.beadhub.infrastructure.dao.po.NotificationOutboxPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 通知发件箱 DAO。
 */
@Mapper
public interface NotificationOutboxDao {

    int insert(NotificationOutboxPO po);

    /**
     * 到期待投递条目 ID，按 next_attempt_at、created_at 升序。
     */
    List<String> selectDueIds(@Param("now") LocalDateTime now, @Param("limit") int limit);

    /**
     * 锁定单条待投递条目；已被其他投递者锁定或状态已变更时返回 null。
     */
    NotificationOutboxPO selectPendingForUpdate(@Param("id") String id);

    int updateResult(NotificationOutboxPO po);

    NotificationOutboxPO selectById(@Param("projectId") String projectId, @Param("id") String id);

    List<NotificationOutboxPO> selectFailed(@Param("projectId") String projectId, @Param("limit") int limit);

    int deleteDeliveredBefore(@Param("cutoff") LocalDateTime cutoff);
}
