package com.beadhub.domain.notification.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 订阅实体。
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class SubscriptionEntity {

    /**
     * 当前支持的事件类型
     */
    public static final String EVENT_STATUS_CHANGE = "status_change";

    private String id;

    private String projectId;

    private String workspaceId;

    private String alias;

    private String beadId;

    /**
     * 仓库 canonical origin；为空时匹配项目内所有仓库
     */
    private String repo;

    private List<String> eventTypes;

    private LocalDateTime createdAt;

    public boolean matches(String repo, String eventType) {
        boolean repoMatches = this.repo == null || this.repo.equals(repo);
        return repoMatches && eventTypes != null && eventTypes.contains(eventType);
    }
}
