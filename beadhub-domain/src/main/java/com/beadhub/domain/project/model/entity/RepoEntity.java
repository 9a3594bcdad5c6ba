package com.beadhub.domain.project.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 仓库领域实体。仓库与项目的关联在创建后不可变。
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class RepoEntity {

    private String id;

    private String projectId;

    /**
     * 原始 origin URL
     */
    private String originUrl;

    /**
     * 规范化后的 origin（host/path）
     */
    private String canonicalOrigin;

    /**
     * 仓库名（canonical origin 的最后一段）
     */
    private String name;

    private LocalDateTime createdAt;

    private LocalDateTime deletedAt;

    /**
     * 存活工作区数量，仅列表查询时填充
     */
    private Integer workspaceCount;

    public boolean belongsTo(String otherProjectId) {
        return projectId != null && projectId.equals(otherProjectId);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
