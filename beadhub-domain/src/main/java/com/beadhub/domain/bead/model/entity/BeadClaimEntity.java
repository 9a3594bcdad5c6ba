package com.beadhub.domain.bead.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 认领实体：工作区与条目的绑定。
 *
 * @author beadhub
 * @since 2026-01-12
 */
@Data
public class BeadClaimEntity {

    private String id;

    private String projectId;

    private String workspaceId;

    /**
     * 认领时的工作区别名快照
     */
    private String alias;

    private String humanName;

    private String beadId;

    /**
     * 条目所在层级的根条目
     */
    private String apexBeadId;

    /**
     * 是否为协同认领
     */
    private boolean coordinated;

    private LocalDateTime claimedAt;

    public boolean isHeldBy(String workspaceId) {
        return this.workspaceId != null && this.workspaceId.equals(workspaceId);
    }
}
