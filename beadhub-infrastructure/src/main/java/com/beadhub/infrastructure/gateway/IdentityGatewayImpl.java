package com.beadhub.infrastructure.gateway;

import com.beadhub.domain.auth.adapter.gateway.IIdentityGateway;
import com.beadhub.domain.auth.model.valobj.ApiKeyCredential;
import com.beadhub.domain.auth.model.valobj.IssuedApiKey;
import com.beadhub.infrastructure.dao.ApiKeyDao;
import com.beadhub.infrastructure.dao.po.ApiKeyPO;
import com.beadhub.types.common.Constants;
import com.google.common.cache.Cache;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * aweb 身份分区网关：API Key 的签发与校验。
 * <p>
 * 明文 key 只在签发时返回一次，库中仅保存 SHA-256 摘要与展示前缀。
 * 校验结果按摘要短期缓存，吊销在缓存过期后生效。
 * </p>
 */
@Slf4j
@Component
public class IdentityGatewayImpl implements IIdentityGateway {

    private static final int KEY_RANDOM_BYTES = 32;
    private static final int KEY_PREFIX_LENGTH = 12;

    private final ApiKeyDao apiKeyDao;
    private final Cache<String, ApiKeyCredential> apiKeyCache;
    private final SecureRandom secureRandom = new SecureRandom();

    public IdentityGatewayImpl(ApiKeyDao apiKeyDao,
                               @Qualifier("apiKeyCache") Cache<String, ApiKeyCredential> apiKeyCache) {
        this.apiKeyDao = apiKeyDao;
        this.apiKeyCache = apiKeyCache;
    }

    @Override
    public ApiKeyCredential findByPlainKey(String plainKey) {
        if (StringUtils.isBlank(plainKey) || !plainKey.startsWith(Constants.API_KEY_PREFIX)) {
            return null;
        }
        String keyHash = hash(plainKey);
        ApiKeyCredential cached = apiKeyCache.getIfPresent(keyHash);
        if (cached != null) {
            return cached;
        }
        ApiKeyCredential credential = toCredential(apiKeyDao.selectByHash(keyHash));
        if (credential != null) {
            apiKeyCache.put(keyHash, credential);
        }
        return credential;
    }

    @Override
    public ApiKeyCredential findById(String apiKeyId) {
        return toCredential(apiKeyDao.selectById(apiKeyId));
    }

    @Override
    public IssuedApiKey issueApiKey(String projectId, String workspaceId, String alias) {
        byte[] random = new byte[KEY_RANDOM_BYTES];
        secureRandom.nextBytes(random);
        String plainKey = Constants.API_KEY_PREFIX + BaseEncoding.base16().lowerCase().encode(random);
        ApiKeyPO po = ApiKeyPO.builder()
                .id(UUID.randomUUID().toString())
                .projectId(projectId)
                .agentId(workspaceId)
                .keyHash(hash(plainKey))
                .keyPrefix(plainKey.substring(0, KEY_PREFIX_LENGTH))
                .label(alias)
                .createdAt(LocalDateTime.now())
                .build();
        apiKeyDao.insert(po);
        log.info("API key issued. projectId={}, workspaceId={}, keyPrefix={}", projectId, workspaceId, po.getKeyPrefix());
        return new IssuedApiKey(po.getId(), plainKey);
    }

    private String hash(String plainKey) {
        return Hashing.sha256().hashString(plainKey, StandardCharsets.UTF_8).toString();
    }

    private ApiKeyCredential toCredential(ApiKeyPO po) {
        if (po == null) {
            return null;
        }
        return ApiKeyCredential.builder()
                .apiKeyId(po.getId())
                .projectId(po.getProjectId())
                .agentId(po.getAgentId())
                .keyPrefix(po.getKeyPrefix())
                .expiresAt(po.getExpiresAt())
                .revokedAt(po.getRevokedAt())
                .build();
    }
}
