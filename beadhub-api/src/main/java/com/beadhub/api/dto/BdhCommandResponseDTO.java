package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * bdh 命令预检响应 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BdhCommandResponseDTO {

    private Boolean approved;
    private String reason;
    private Map<String, List<ClaimDTO>> context;
}
