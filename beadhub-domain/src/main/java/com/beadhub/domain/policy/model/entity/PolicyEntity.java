package com.beadhub.domain.policy.model.entity;

import com.beadhub.domain.policy.model.valobj.PolicyBundle;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 策略版本实体，(project_id, version) 唯一，创建后不可变。
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class PolicyEntity {

    private String policyId;

    private String projectId;

    /**
     * 项目内单调递增的版本号
     */
    private Integer version;

    private PolicyBundle bundle;

    private String createdByWorkspaceId;

    private LocalDateTime createdAt;
}
