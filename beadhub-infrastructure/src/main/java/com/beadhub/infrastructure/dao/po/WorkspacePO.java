package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 工作区 PO，对应 server.workspaces。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkspacePO {

    private String workspaceId;
    private String projectId;
    private String repoId;
    private String alias;
    private String humanName;
    private String role;
    private String hostname;
    private String workspacePath;
    private LocalDateTime lastSeenAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime deletedAt;
}
