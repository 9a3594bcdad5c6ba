package com.beadhub.config;

import com.beadhub.domain.auth.model.valobj.ApiKeyCredential;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 缓存配置类。
 */
@Configuration
public class GuavaConfig {

    /**
     * API Key 凭据缓存，键为 key 的 SHA-256 摘要。
     * 过期时间较短，吊销后最多延迟一个周期生效。
     */
    @Bean(name = "apiKeyCache")
    public Cache<String, ApiKeyCredential> apiKeyCache(
            @Value("${beadhub.auth.api-key-cache.expire-seconds:30}") long expireSeconds,
            @Value("${beadhub.auth.api-key-cache.maximum-size:10000}") long maximumSize) {
        return CacheBuilder.newBuilder()
                .expireAfterWrite(Math.max(expireSeconds, 1L), TimeUnit.SECONDS)
                .maximumSize(Math.max(maximumSize, 1L))
                .build();
    }

}
