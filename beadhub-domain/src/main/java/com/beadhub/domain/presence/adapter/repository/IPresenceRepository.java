package com.beadhub.domain.presence.adapter.repository;

import com.beadhub.domain.presence.model.valobj.PresenceFilter;
import com.beadhub.domain.presence.model.valobj.PresenceRecord;

import java.util.Collection;
import java.util.List;

/**
 * 在线状态仓储接口（缓存实现，全部为尽力而为）
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IPresenceRepository {

    /**
     * 写入主记录并刷新二级索引，主记录 TTL 为 ttlSeconds，索引 TTL 更长
     */
    void heartbeat(PresenceRecord record, int ttlSeconds);

    /**
     * 单个工作区的在线记录；已过期返回 null
     */
    PresenceRecord find(String workspaceId);

    /**
     * 按条件查询；主记录已过期的索引成员被过滤并惰性清理
     */
    List<PresenceRecord> lookup(PresenceFilter filter);

    /**
     * 删除给定工作区的主记录；索引中的残留成员在查询时清理
     *
     * @return 实际删除的记录数
     */
    int clear(Collection<String> workspaceIds);
}
