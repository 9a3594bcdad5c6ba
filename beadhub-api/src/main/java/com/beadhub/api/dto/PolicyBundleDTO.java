package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 策略包 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PolicyBundleDTO {

    private List<InvariantDTO> invariants;
    private Map<String, RolePlaybookDTO> roles;

    /**
     * 适配器配置，结构不做约束，原样保存
     */
    private Map<String, Object> adapters;

}
