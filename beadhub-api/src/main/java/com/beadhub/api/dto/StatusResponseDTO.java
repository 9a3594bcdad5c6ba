package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 项目状态快照 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StatusResponseDTO {

    private String projectId;
    private String projectSlug;
    private String visibility;
    private String workspaceId;
    private String repoId;
    private List<WorkspaceDTO> workspaces;
    private List<ClaimDTO> claims;
    private Integer onlineCount;
    private Integer pendingEscalations;
    private Integer activePolicyVersion;
    private String activePolicyId;
    private String timestamp;
}
