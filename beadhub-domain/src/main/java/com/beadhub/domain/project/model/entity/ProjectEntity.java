package com.beadhub.domain.project.model.entity;

import com.beadhub.types.enums.ProjectVisibilityEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 项目领域实体（租户边界）。
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class ProjectEntity {

    /**
     * 项目 ID
     */
    private String id;

    /**
     * 租户 ID（可空，为空表示全局租户范围）
     */
    private String tenantId;

    /**
     * slug，租户范围内唯一
     */
    private String slug;

    private String name;

    private ProjectVisibilityEnum visibility;

    /**
     * 当前激活的策略版本 ID
     */
    private String activePolicyId;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public boolean isPublic() {
        return visibility == ProjectVisibilityEnum.PUBLIC;
    }
}
