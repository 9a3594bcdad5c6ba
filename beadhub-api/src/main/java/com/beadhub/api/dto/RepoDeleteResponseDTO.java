package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * 仓库删除响应 DTO，计数均为本次级联实际影响的数量。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RepoDeleteResponseDTO {

    private String id;
    private Integer workspacesDeleted;
    private Integer claimsDeleted;
    private Integer presenceCleared;
}
