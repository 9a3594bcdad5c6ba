package com.beadhub.domain.bead.model.entity;

import com.beadhub.domain.bead.model.valobj.BeadRef;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 工作条目镜像实体，唯一键 (project_id, repo, branch, bead_id)。
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class BeadIssueEntity {

    private String id;

    private String projectId;

    private String beadId;

    /**
     * 仓库 canonical origin
     */
    private String repo;

    private String branch;

    private String title;

    private String description;

    private String status;

    private Integer priority;

    private String issueType;

    private String assignee;

    private String createdBy;

    private List<String> labels;

    /**
     * 阻塞当前条目的引用
     */
    private List<BeadRef> blockedBy;

    private BeadRef parentId;

    /**
     * 客户端声明的创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 客户端声明的更新时间，用于陈旧更新检测
     */
    private LocalDateTime updatedAt;

    private LocalDateTime syncedAt;

    /**
     * 入站更新是否陈旧：两边都有 updated_at 且入站更早。
     */
    public boolean isStaleComparedTo(BeadIssueEntity stored) {
        if (stored == null || stored.getUpdatedAt() == null || this.updatedAt == null) {
            return false;
        }
        return this.updatedAt.isBefore(stored.getUpdatedAt());
    }
}
