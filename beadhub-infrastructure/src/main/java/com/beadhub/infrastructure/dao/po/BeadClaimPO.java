package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 任务认领 PO，对应 server.bead_claims。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BeadClaimPO {

    private String id;
    private String projectId;
    private String workspaceId;
    private String alias;
    private String humanName;
    private String beadId;
    private String apexBeadId;
    private Boolean coordinated;
    private LocalDateTime claimedAt;
}
