package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 工作条目镜像 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BeadIssueDTO {

    private String beadId;
    private String repo;
    private String branch;
    private String title;
    private String description;
    private String status;
    private Integer priority;
    private String issueType;
    private String assignee;
    private List<String> labels;
    private List<BeadRefDTO> blockedBy;
    private BeadRefDTO parentId;
    private String createdAt;
    private String updatedAt;
    private String syncedAt;
}
