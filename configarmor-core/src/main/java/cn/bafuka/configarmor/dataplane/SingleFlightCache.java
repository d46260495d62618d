package cn.bafuka.configarmor.dataplane;

import cn.bafuka.configarmor.core.CacheStats;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * 单飞缓存接口
 * 同一个键在同一时刻至多只有一次回源，所有并发调用方共享其结果；
 * 回源失败时若存在过期值，则以过期值降级返回
 *
 * @param <K> 缓存键类型
 * @param <V> 缓存值类型
 */
public interface SingleFlightCache<K, V> {

    /**
     * 同步获取，使用默认 TTL
     * 领头的调用方在当前线程执行回源
     *
     * @param key    缓存键
     * @param loader 回源函数
     * @return 缓存值
     */
    V get(K key, Function<? super K, ? extends V> loader);

    /**
     * 同步获取
     *
     * @param key    缓存键
     * @param loader 回源函数
     * @param ttl    本次访问使用的 TTL
     * @return 缓存值
     */
    V get(K key, Function<? super K, ? extends V> loader, Duration ttl);

    /**
     * 异步获取，使用默认 TTL
     * 回源在缓存的执行器上运行。取消返回的 Future 只会让当前调用方放弃等待，
     * 不影响正在进行的回源和其他等待者
     *
     * @param key    缓存键
     * @param loader 回源函数
     * @return 缓存值的 Future
     */
    CompletableFuture<V> getAsync(K key, Function<? super K, ? extends V> loader);

    /**
     * 异步获取
     *
     * @param key    缓存键
     * @param loader 回源函数
     * @param ttl    本次访问使用的 TTL
     * @return 缓存值的 Future
     */
    CompletableFuture<V> getAsync(K key, Function<? super K, ? extends V> loader, Duration ttl);

    /**
     * 读取当前缓存值，不论是否过期，也不触发回源
     *
     * @param key 缓存键
     * @return 缓存值，不存在返回 null
     */
    V getIfPresent(K key);

    /**
     * 直接写入（写穿透后更新缓存）
     * 写入时刻之前开始的回源不会覆盖该值
     *
     * @param key   缓存键
     * @param value 缓存值
     */
    void put(K key, V value);

    /**
     * 删除指定键，不影响正在进行的回源
     *
     * @param key 缓存键
     */
    void invalidate(K key);

    /**
     * 清空所有条目，正在进行的回源完成后照常写入
     */
    void invalidateAll();

    /**
     * 当前正在回源的键数量
     */
    int pendingCount();

    /**
     * 获取缓存统计信息
     *
     * @return 统计快照
     */
    CacheStats getStats();
}
