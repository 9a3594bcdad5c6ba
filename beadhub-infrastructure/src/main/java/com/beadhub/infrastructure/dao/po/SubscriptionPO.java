package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 订阅 PO，对应 server.subscriptions。eventTypes 为 JSONB 数组原文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionPO {

    private String id;
    private String projectId;
    private String workspaceId;
    private String alias;
    private String beadId;
    private String repo;
    private String eventTypes;
    private LocalDateTime createdAt;
}
