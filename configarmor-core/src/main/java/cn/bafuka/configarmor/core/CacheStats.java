package cn.bafuka.configarmor.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 缓存统计信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStats {

    private long hitCount;
    private long missCount;

    /**
     * 搭便车等待已有回源的次数
     */
    private long coalescedCount;

    private long loadSuccessCount;
    private long loadFailureCount;

    /**
     * 回源失败后返回过期值的次数
     */
    private long staleFallbackCount;

    private long size;

    /**
     * 计算命中率
     *
     * @return 命中率（0.0 ~ 1.0）
     */
    public double hitRate() {
        long requestCount = hitCount + missCount;
        return requestCount == 0 ? 1.0 : (double) hitCount / requestCount;
    }
}
