package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 仓库 PO，对应 server.repos。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepoPO {

    private String id;
    private String projectId;
    private String originUrl;
    private String canonicalOrigin;
    private String name;
    private LocalDateTime createdAt;
    private LocalDateTime deletedAt;
    private Integer workspaceCount;
}
