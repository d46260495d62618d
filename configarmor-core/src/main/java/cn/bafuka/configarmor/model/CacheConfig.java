package cn.bafuka.configarmor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 单飞缓存配置
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheConfig {

    /**
     * 默认 TTL，超过后条目视为过期，下次访问触发回源
     */
    @Builder.Default
    private Duration ttl = Duration.ofMinutes(5);

    /**
     * 最大条目数（仅用于保护内存）
     */
    @Builder.Default
    private long maximumSize = 10000;

    /**
     * 过期条目作为降级兜底值保留的时长
     */
    @Builder.Default
    private Duration staleRetention = Duration.ofHours(24);
}
