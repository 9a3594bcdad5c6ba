package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 创建升级请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EscalationCreateRequestDTO {

    private String workspaceId;
    private String subject;
    private String situation;
    private List<String> options;
    private Long expiresInSeconds;
}
