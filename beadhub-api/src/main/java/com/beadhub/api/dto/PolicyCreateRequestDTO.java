package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 创建策略版本请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyCreateRequestDTO {

    private PolicyBundleDTO bundle;

    /**
     * 调用方最后观察到的激活版本 ID，为空时跳过乐观并发校验
     */
    private String basePolicyId;

    /**
     * 是否立即激活，默认 true
     */
    private Boolean activate;

    private String workspaceId;
}
