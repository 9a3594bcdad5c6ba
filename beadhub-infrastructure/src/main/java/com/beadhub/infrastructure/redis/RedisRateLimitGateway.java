package com.beadhub.infrastructure.redis;

import com.beadhub.domain.auth.adapter.gateway.IRateLimitGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;

/**
 * 固定窗口限流，计数与过期在同一脚本内原子完成。Redis 不可用时放行。
 */
@Slf4j
@Component
public class RedisRateLimitGateway implements IRateLimitGateway {

    private static final RedisScript<Long> INCR_WITH_EXPIRE = new DefaultRedisScript<>(
            "local current = redis.call('INCR', KEYS[1]) "
                    + "if current == 1 then redis.call('EXPIRE', KEYS[1], ARGV[1]) end "
                    + "return current",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisRateLimitGateway(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean tryAcquire(String bucket, int limit, int windowSeconds) {
        try {
            Long current = redisTemplate.execute(INCR_WITH_EXPIRE,
                    Collections.singletonList(RedisKeys.rateLimit(bucket)), String.valueOf(windowSeconds));
            return current == null || current <= limit;
        } catch (RuntimeException ex) {
            log.warn("Rate limiter unavailable, allowing request. bucket={}, error={}", bucket, ex.getMessage());
            return true;
        }
    }
}
