package com.beadhub.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * API Key PO，对应 aweb.api_keys，只保存哈希与前缀。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyPO {

    private String id;
    private String projectId;
    private String agentId;
    private String keyHash;
    private String keyPrefix;
    private String label;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;
    private LocalDateTime revokedAt;
}
