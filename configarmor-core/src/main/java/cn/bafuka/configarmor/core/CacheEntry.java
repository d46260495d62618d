package cn.bafuka.configarmor.core;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 缓存条目
 * 值本身不可变，刷新或更新时整条替换
 *
 * @param <V> 缓存值类型
 */
@Getter
@ToString
@AllArgsConstructor
public final class CacheEntry<V> {

    /**
     * 缓存值
     */
    private final V value;

    /**
     * 写入时刻（Ticker 纳秒）
     */
    private final long insertedAtNanos;

    /**
     * 写入序号，单调递增
     * 回源完成时用它判断期间是否发生过更新写入
     */
    private final long sequence;

    /**
     * 判断条目在给定 TTL 下是否仍新鲜
     *
     * @param nowNanos 当前时刻
     * @param ttlNanos TTL（纳秒），0 表示不复用
     * @return 是否新鲜
     */
    public boolean isFresh(long nowNanos, long ttlNanos) {
        return nowNanos - insertedAtNanos < ttlNanos;
    }

    /**
     * 条目年龄（纳秒）
     */
    public long ageNanos(long nowNanos) {
        return nowNanos - insertedAtNanos;
    }
}
