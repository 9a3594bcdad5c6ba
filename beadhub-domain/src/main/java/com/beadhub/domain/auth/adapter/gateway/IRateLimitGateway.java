package com.beadhub.domain.auth.adapter.gateway;

/**
 * 固定窗口限流访问器。
 */
public interface IRateLimitGateway {

    /**
     * 记录一次请求并判断是否仍在限额内。
     *
     * @param bucket 限流桶标识
     * @param limit 窗口内允许的请求数
     * @param windowSeconds 窗口长度（秒）
     * @return true 表示允许
     */
    boolean tryAcquire(String bucket, int limit, int windowSeconds);
}
