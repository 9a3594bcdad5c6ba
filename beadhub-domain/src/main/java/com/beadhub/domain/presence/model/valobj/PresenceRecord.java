package com.beadhub.domain.presence.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 工作区在线记录。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresenceRecord {

    private String workspaceId;

    private String projectId;

    private String repoId;

    private String branch;

    private String alias;

    private String humanName;

    private String role;

    private String currentBead;

    private String commandLine;

    /**
     * 最近心跳时间（ISO-8601）
     */
    private String lastSeen;
}
