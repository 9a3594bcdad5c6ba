package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工作项镜像 PO，对应 beads.beads_issues。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BeadIssuePO {

    private String id;
    private String projectId;
    private String beadId;
    private String repo;
    private String branch;
    private String title;
    private String description;
    private String status;
    private Integer priority;
    private String issueType;
    private String assignee;
    private String createdBy;
    /** JSONB 字符串数组 */
    private String labels;
    /** JSONB，元素为 {repo, branch, bead_id} */
    private String blockedBy;
    /** JSONB，单个 {repo, branch, bead_id} 或 null */
    private String parentId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime syncedAt;
}
