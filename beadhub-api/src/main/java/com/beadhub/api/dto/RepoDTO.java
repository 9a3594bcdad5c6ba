package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 仓库 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RepoDTO {

    private String id;
    private String projectId;
    private String canonicalOrigin;
    private String name;
    private String createdAt;
    private Integer workspaceCount;
}
