package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 升级视图 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class EscalationDTO {

    private String escalationId;
    private String projectId;
    private String workspaceId;
    private String alias;
    private String humanName;
    private String subject;
    private String situation;
    private List<String> options;
    private String status;
    private String response;
    private String responseNote;
    private String createdAt;
    private String respondedAt;
    private String expiresAt;
}
