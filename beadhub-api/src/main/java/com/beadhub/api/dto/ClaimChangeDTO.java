package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 同步结果中的单条认领变更。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ClaimChangeDTO {

    private String beadId;

    /**
     * 调用方同步后是否持有该认领
     */
    private Boolean claimed;

    /**
     * claimed / retained / coordinated / rejected / released
     */
    private String action;

    /**
     * 被拒绝时的当前持有者别名
     */
    private String heldBy;

    private String heldByWorkspaceId;
    private String heldByHumanName;
    private String claimedAt;
}
