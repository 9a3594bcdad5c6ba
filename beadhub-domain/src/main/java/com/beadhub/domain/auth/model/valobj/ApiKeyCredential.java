package com.beadhub.domain.auth.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 身份分区中的 API Key 凭据（不含明文）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiKeyCredential {

    private String apiKeyId;

    private String projectId;

    /**
     * 绑定的 Agent（工作区）ID
     */
    private String agentId;

    private String keyPrefix;

    private LocalDateTime expiresAt;

    private LocalDateTime revokedAt;

    public boolean isUsable(LocalDateTime now) {
        if (revokedAt != null) {
            return false;
        }
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
