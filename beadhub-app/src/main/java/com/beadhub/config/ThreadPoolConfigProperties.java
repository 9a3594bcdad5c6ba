package com.beadhub.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 事件监听线程池配置，前缀 beadhub.thread-pool。
 */
@Data
@ConfigurationProperties(prefix = "beadhub.thread-pool", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    /** 核心线程数 */
    private Integer corePoolSize = 4;

    /** 最大线程数 */
    private Integer maxPoolSize = 16;

    /** 空闲线程最大存活时间（秒） */
    private Long keepAliveTime = 60L;

    /** 阻塞队列最大容量 */
    private Integer blockQueueSize = 1000;

    /**
     * 拒绝策略：AbortPolicy、DiscardPolicy、DiscardOldestPolicy、CallerRunsPolicy。
     * 事件投递是尽力而为的，默认丢弃最老的任务。
     */
    private String policy = "DiscardOldestPolicy";

    private String threadNamePrefix = "event-listener-";
}
