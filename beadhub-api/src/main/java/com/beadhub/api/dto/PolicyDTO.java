package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 策略版本视图 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyDTO {

    private String policyId;
    private String projectId;
    private Integer version;
    private Boolean isActive;
    private PolicyBundleDTO bundle;
    private String selectedRole;
    private String createdByWorkspaceId;
    private String createdAt;
}
