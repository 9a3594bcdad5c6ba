package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 仓库注册响应 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RepoEnsureResponseDTO {

    private String repoId;
    private String canonicalOrigin;
    private String name;

    /**
     * 新建或从软删除中恢复时为 true
     */
    private Boolean created;
}
