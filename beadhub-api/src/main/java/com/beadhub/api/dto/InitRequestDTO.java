package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 初始化（Bootstrap）请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class InitRequestDTO {

    /**
     * 项目 slug，同一租户范围内唯一
     */
    private String projectSlug;

    /**
     * 项目显示名，缺省取 slug
     */
    private String projectName;

    /**
     * 仓库 origin URL，服务端规范化为 host/path
     */
    private String repoOrigin;

    /**
     * 工作区别名，缺省时自动建议
     */
    private String alias;

    /**
     * 人类负责人名称
     */
    private String humanName;

    /**
     * 角色，规范化为小写
     */
    private String role;

    private String hostname;
    private String workspacePath;

    /**
     * 项目可见性 private/public，仅新建项目时生效
     */
    private String visibility;

}
