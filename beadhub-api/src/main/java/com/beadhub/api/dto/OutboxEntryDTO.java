package com.beadhub.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Data;

import java.util.Map;

/**
 * 发件箱条目视图 DTO（运维查看永久失败条目）。
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OutboxEntryDTO {

    private String entryId;
    private String eventType;
    private String recipientWorkspaceId;
    private String recipientAlias;
    private String status;
    private Integer attempts;
    private String lastError;
    private String nextAttemptAt;
    private Map<String, Object> payload;
    private String createdAt;
    private String processedAt;
}
