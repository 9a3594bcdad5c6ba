package com.beadhub.domain.auth.model.valobj;

import lombok.Builder;
import lombok.Data;

/**
 * 参与身份解析的请求头集合。
 */
@Data
@Builder
public class AuthRequest {

    private String authorization;

    /**
     * X-BH-Auth 签名头
     */
    private String proxySignature;

    /**
     * X-Project-ID
     */
    private String projectId;

    /**
     * X-User-ID
     */
    private String userId;

    /**
     * X-API-Key
     */
    private String apiKey;

    /**
     * X-Aweb-Actor-ID
     */
    private String actorId;

    public boolean hasProxyHeaders() {
        return proxySignature != null && !proxySignature.isBlank();
    }
}
