package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.List;

/**
 * 订阅视图 DTO。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SubscriptionDTO {

    private String subscriptionId;
    private String workspaceId;
    private String alias;
    private String beadId;
    private String repo;
    private List<String> eventTypes;
    private String createdAt;
}
