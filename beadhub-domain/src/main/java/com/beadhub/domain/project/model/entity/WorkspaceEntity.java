package com.beadhub.domain.project.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 工作区领域实体：一个 Agent 的工作上下文。
 * <p>
 * 与项目、仓库的关联在创建后不可变；只做软删除。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class WorkspaceEntity {

    /**
     * 工作区 ID（同时作为 Agent 身份 actor_id）
     */
    private String workspaceId;

    private String projectId;

    private String repoId;

    /**
     * 别名，在项目内未删除的工作区中唯一
     */
    private String alias;

    private String humanName;

    private String role;

    private String hostname;

    private String workspacePath;

    private LocalDateTime lastSeenAt;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean belongsTo(String projectId) {
        return this.projectId != null && this.projectId.equals(projectId);
    }

    public void softDelete() {
        if (isDeleted()) {
            return;
        }
        LocalDateTime now = LocalDateTime.now();
        this.deletedAt = now;
        this.updatedAt = now;
    }
}
