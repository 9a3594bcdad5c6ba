package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 订阅请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubscriptionCreateRequestDTO {

    private String workspaceId;
    private String beadId;

    /**
     * 为空时匹配项目内所有仓库
     */
    private String repo;

    private List<String> eventTypes;
}
