package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

/**
 * bdh 命令预检请求 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BdhCommandRequestDTO {

    private String workspaceId;
    private String repoId;
    private String alias;
    private String humanName;
    private String role;
    private String commandLine;
}
