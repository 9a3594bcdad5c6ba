package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 仓库注册请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RepoEnsureRequestDTO {

    /**
     * 可选；给出时必须是调用方所属项目
     */
    private String projectId;

    private String originUrl;
}
