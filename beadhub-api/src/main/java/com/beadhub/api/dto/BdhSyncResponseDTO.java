package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * bdh 同步响应 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BdhSyncResponseDTO {

    private Boolean synced;
    private String syncMode;
    private String repo;
    private String branch;
    private Integer issuesSynced;
    private Integer issuesAdded;
    private Integer issuesUpdated;
    private Integer issuesDeleted;

    /**
     * 因 updated_at 落后于已存储值而跳过的条目
     */
    private List<String> conflicts;

    private Integer conflictsCount;
    private List<ClaimChangeDTO> claims;
    private Integer notificationsQueued;
    private String syncedAt;
}
