package cn.bafuka.configarmor.dataplane.impl;

import cn.bafuka.configarmor.core.CacheEntry;
import cn.bafuka.configarmor.core.CacheStats;
import cn.bafuka.configarmor.dataplane.SingleFlightCache;
import cn.bafuka.configarmor.model.CacheConfig;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Function;

/**
 * 单飞缓存实现
 * 条目存放在 Caffeine 中，新鲜度由条目自身的写入时刻判断，
 * 这样过期条目仍然保留，可在回源失败时作为降级值返回
 *
 * @param <K> 缓存键类型
 * @param <V> 缓存值类型
 */
@Slf4j
public class CaffeineSingleFlightCache<K, V> implements SingleFlightCache<K, V> {

    /**
     * 同步获取时，领头调用方直接在当前线程回源
     */
    private static final Executor CALLER_RUNS = Runnable::run;

    /**
     * 缓存名称（用于日志）
     */
    private final String name;

    /**
     * 条目存储
     */
    private final Cache<K, CacheEntry<V>> store;

    /**
     * 进行中的回源登记表，每个键至多一项
     */
    private final Map<K, CompletableFuture<V>> pending = new ConcurrentHashMap<>();

    /**
     * 时间源
     */
    private final Ticker ticker;

    /**
     * 异步回源执行器
     */
    private final Executor executor;

    /**
     * 默认 TTL
     */
    private final Duration defaultTtl;

    /**
     * 条目写入序号
     */
    private final AtomicLong sequence = new AtomicLong();

    private final LongAdder hitCount = new LongAdder();
    private final LongAdder missCount = new LongAdder();
    private final LongAdder coalescedCount = new LongAdder();
    private final LongAdder loadSuccessCount = new LongAdder();
    private final LongAdder loadFailureCount = new LongAdder();
    private final LongAdder staleFallbackCount = new LongAdder();

    public CaffeineSingleFlightCache(String name, CacheConfig config, Executor executor) {
        this(name, config, executor, Ticker.systemTicker());
    }

    public CaffeineSingleFlightCache(String name, CacheConfig config, Executor executor, Ticker ticker) {
        this.name = name;
        this.executor = executor;
        this.ticker = ticker;
        this.defaultTtl = requireValidTtl(config.getTtl());
        this.store = buildStore(config, ticker);
    }

    /**
     * 根据配置构建 Caffeine 存储
     * 物理过期时间 = TTL + 过期值保留时长
     *
     * @param config 缓存配置
     * @param ticker 时间源
     * @return Caffeine Cache 实例
     */
    private Cache<K, CacheEntry<V>> buildStore(CacheConfig config, Ticker ticker) {
        long retentionNanos = config.getTtl().plus(config.getStaleRetention()).toNanos();

        log.info("构建单飞缓存: name={}, maximumSize={}, ttl={}, staleRetention={}",
                name, config.getMaximumSize(), config.getTtl(), config.getStaleRetention());

        return Caffeine.newBuilder()
                .maximumSize(config.getMaximumSize())
                .expireAfterWrite(retentionNanos, TimeUnit.NANOSECONDS)
                .ticker(ticker)
                .build();
    }

    @Override
    public V get(K key, Function<? super K, ? extends V> loader) {
        return get(key, loader, defaultTtl);
    }

    @Override
    public V get(K key, Function<? super K, ? extends V> loader, Duration ttl) {
        return join(lookup(key, loader, ttl, CALLER_RUNS));
    }

    @Override
    public CompletableFuture<V> getAsync(K key, Function<? super K, ? extends V> loader) {
        return getAsync(key, loader, defaultTtl);
    }

    @Override
    public CompletableFuture<V> getAsync(K key, Function<? super K, ? extends V> loader, Duration ttl) {
        return lookup(key, loader, ttl, executor);
    }

    /**
     * 查找流程：新鲜命中 -> 加入已有回源 -> 登记并发起新回源
     * 登记表只做 putIfAbsent/remove，回源本身从不在任何锁内执行
     */
    private CompletableFuture<V> lookup(K key, Function<? super K, ? extends V> loader,
                                        Duration ttl, Executor fetchExecutor) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(loader, "loader");
        long ttlNanos = requireValidTtl(ttl).toNanos();

        CacheEntry<V> entry = store.getIfPresent(key);
        if (entry != null && entry.isFresh(ticker.read(), ttlNanos)) {
            hitCount.increment();
            log.debug("单飞缓存命中: cache={}, key={}", name, key);
            return CompletableFuture.completedFuture(entry.getValue());
        }
        missCount.increment();

        CompletableFuture<V> flight = new CompletableFuture<>();
        CompletableFuture<V> existing = pending.putIfAbsent(key, flight);
        if (existing != null) {
            coalescedCount.increment();
            log.debug("合并到进行中的回源: cache={}, key={}", name, key);
            return detach(existing);
        }

        // 复查：上一次回源可能恰好在首次检查与登记之间完成
        CacheEntry<V> recheck = store.getIfPresent(key);
        if (recheck != null && recheck.isFresh(ticker.read(), ttlNanos)) {
            pending.remove(key, flight);
            flight.complete(recheck.getValue());
            return detach(flight);
        }

        long startSequence = sequence.get();
        try {
            fetchExecutor.execute(() -> runFetch(key, loader, flight, startSequence));
        } catch (RejectedExecutionException e) {
            log.error("回源任务被拒绝: cache={}, key={}", name, key, e);
            pending.remove(key, flight);
            flight.completeExceptionally(e);
        }
        return detach(flight);
    }

    /**
     * 执行回源并把结果分发给所有等待者
     */
    private void runFetch(K key, Function<? super K, ? extends V> loader,
                          CompletableFuture<V> flight, long startSequence) {
        V value;
        try {
            log.debug("开始回源: cache={}, key={}", name, key);
            value = loader.apply(key);
        } catch (Exception e) {
            loadFailureCount.increment();
            pending.remove(key, flight);
            fallback(key, flight, e);
            return;
        } catch (Error e) {
            loadFailureCount.increment();
            pending.remove(key, flight);
            flight.completeExceptionally(e);
            throw e;
        }

        loadSuccessCount.increment();
        if (value != null) {
            storeFetched(key, value, startSequence);
        }
        pending.remove(key, flight);
        flight.complete(value);
    }

    /**
     * 回源失败：有旧值则降级返回旧值，否则把异常交给所有等待者
     */
    private void fallback(K key, CompletableFuture<V> flight, Exception failure) {
        CacheEntry<V> stale = store.getIfPresent(key);
        if (stale != null) {
            staleFallbackCount.increment();
            log.warn("回源失败，降级返回过期值: cache={}, key={}, ageMs={}, error={}",
                    name, key, TimeUnit.NANOSECONDS.toMillis(stale.ageNanos(ticker.read())),
                    failure.toString());
            flight.complete(stale.getValue());
        } else {
            log.warn("回源失败且无可用旧值: cache={}, key={}, error={}", name, key, failure.toString());
            flight.completeExceptionally(failure);
        }
    }

    /**
     * 写入回源结果；回源开始后若有 put 写入过更新的值，则保留该值
     */
    private void storeFetched(K key, V value, long startSequence) {
        store.asMap().compute(key, (k, current) -> {
            if (current != null && current.getSequence() > startSequence) {
                log.debug("回源期间发生过写入，保留较新的值: cache={}, key={}", name, key);
                return current;
            }
            return newEntry(value);
        });
    }

    @Override
    public V getIfPresent(K key) {
        if (key == null) {
            return null;
        }
        CacheEntry<V> entry = store.getIfPresent(key);
        return entry != null ? entry.getValue() : null;
    }

    @Override
    public void put(K key, V value) {
        if (key == null || value == null) {
            return;
        }
        store.put(key, newEntry(value));
        log.debug("单飞缓存写入: cache={}, key={}", name, key);
    }

    @Override
    public void invalidate(K key) {
        if (key == null) {
            return;
        }
        store.invalidate(key);
        log.debug("单飞缓存失效: cache={}, key={}", name, key);
    }

    @Override
    public void invalidateAll() {
        store.invalidateAll();
        log.info("单飞缓存全部失效: cache={}", name);
    }

    @Override
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.builder()
                .hitCount(hitCount.sum())
                .missCount(missCount.sum())
                .coalescedCount(coalescedCount.sum())
                .loadSuccessCount(loadSuccessCount.sum())
                .loadFailureCount(loadFailureCount.sum())
                .staleFallbackCount(staleFallbackCount.sum())
                .size(store.estimatedSize())
                .build();
    }

    public String getName() {
        return name;
    }

    private CacheEntry<V> newEntry(V value) {
        return new CacheEntry<>(value, ticker.read(), sequence.incrementAndGet());
    }

    /**
     * 为调用方派生独立的 Future，取消它不会影响共享的回源
     */
    private CompletableFuture<V> detach(CompletableFuture<V> shared) {
        return shared.thenApply(Function.identity());
    }

    private V join(CompletableFuture<V> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private static Duration requireValidTtl(Duration ttl) {
        if (ttl == null || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL 不能为空或为负数: " + ttl);
        }
        return ttl;
    }
}
