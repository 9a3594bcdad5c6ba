package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 认领视图 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClaimDTO {

    private String beadId;
    private String apexBeadId;
    private String workspaceId;
    private String alias;
    private String humanName;
    private Boolean coordinated;
    private String claimedAt;
}
