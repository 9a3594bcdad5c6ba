package com.beadhub.domain.auth.adapter.gateway;

import com.beadhub.domain.auth.model.valobj.ApiKeyCredential;
import com.beadhub.domain.auth.model.valobj.IssuedApiKey;

/**
 * 身份分区访问器。
 * <p>
 * 协调引擎不直接写入身份分区，凭据的查询与签发都经由此接口。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
public interface IIdentityGateway {

    /**
     * 根据明文 Key 查询凭据；不存在时返回 null。
     */
    ApiKeyCredential findByPlainKey(String plainKey);

    /**
     * 根据 Key ID 查询凭据；不存在时返回 null。
     */
    ApiKeyCredential findById(String apiKeyId);

    /**
     * 为工作区签发新的 API Key。
     */
    IssuedApiKey issueApiKey(String projectId, String workspaceId, String alias);
}
