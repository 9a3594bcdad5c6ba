package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 策略历史条目。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyHistoryItemDTO {

    private String policyId;
    private Integer version;
    private Boolean isActive;
    private String createdByWorkspaceId;
    private String createdAt;
}
