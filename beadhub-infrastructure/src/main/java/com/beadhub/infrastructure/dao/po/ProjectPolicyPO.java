package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 项目策略版本 PO，对应 server.project_policies。bundleJson 为 JSONB 原文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectPolicyPO {

    private String policyId;
    private String projectId;
    private Integer version;
    private String bundleJson;
    private String createdByWorkspaceId;
    private LocalDateTime createdAt;
}
