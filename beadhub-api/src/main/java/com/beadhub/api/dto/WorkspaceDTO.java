package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 工作区视图 DTO，附带在线状态。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class WorkspaceDTO {

    private String workspaceId;
    private String projectId;
    private String repoId;
    private String alias;
    private String humanName;
    private String role;
    private String hostname;
    private String workspacePath;

    /**
     * 在线状态来自缓存，可能短暂滞后
     */
    private Boolean online;

    private String branch;
    private String lastSeen;
    private String createdAt;
}
