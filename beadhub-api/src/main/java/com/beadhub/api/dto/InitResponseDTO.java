package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 初始化（Bootstrap）响应 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InitResponseDTO {

    private String status;

    /**
     * 新签发的 API Key，仅本次响应可见
     */
    private String apiKey;

    private String projectId;
    private String projectSlug;
    private String repoId;
    private String canonicalOrigin;
    private String workspaceId;
    private String alias;
    private String humanName;
    private String role;

    /**
     * 当前激活的策略版本 ID
     */
    private String policyId;

    /**
     * 项目或仓库是否为本次新建
     */
    private Boolean created;

    private Boolean workspaceCreated;
}
