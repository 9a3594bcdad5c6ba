package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 项目 PO，对应 server.projects。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectPO {

    private String id;
    private String tenantId;
    private String slug;
    private String name;
    private String visibility;
    private String activePolicyId;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
