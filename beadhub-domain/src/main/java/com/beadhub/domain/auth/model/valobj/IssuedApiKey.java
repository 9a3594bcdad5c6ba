package com.beadhub.domain.auth.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 新签发的 API Key，明文只在签发响应中出现一次。
 */
@Data
@AllArgsConstructor
public class IssuedApiKey {

    private String apiKeyId;

    private String plainKey;
}
