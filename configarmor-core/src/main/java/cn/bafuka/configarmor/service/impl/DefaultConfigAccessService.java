package cn.bafuka.configarmor.service.impl;

import cn.bafuka.configarmor.consistency.ChangeEvent;
import cn.bafuka.configarmor.consistency.ChangeListener;
import cn.bafuka.configarmor.consistency.ChangeNotificationBus;
import cn.bafuka.configarmor.core.CacheStats;
import cn.bafuka.configarmor.dataplane.SingleFlightCache;
import cn.bafuka.configarmor.exception.RepositoryException;
import cn.bafuka.configarmor.repository.ConfigRepository;
import cn.bafuka.configarmor.repository.FetchResult;
import cn.bafuka.configarmor.service.ConfigAccessService;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * 配置访问服务默认实现
 *
 * <p>读路径：单飞缓存 -> 仓储查询 -> 不存在则创建默认记录后再查一次。
 * 回源失败且没有旧值时返回内存默认值，该值不写入缓存，下次访问会重新尝试持久化。
 *
 * <p>写路径：仓储更新 -> 缓存覆盖 -> 发布变更事件。
 * 自己发布的事件会被忽略，避免刚写入的条目被立即失效。
 *
 * @param <ID> 配置主键类型
 * @param <R>  配置记录类型
 */
@Slf4j
public class DefaultConfigAccessService<ID, R> implements ConfigAccessService<ID, R>, ChangeListener {

    private final String resource;

    private final SingleFlightCache<ID, R> cache;

    private final ConfigRepository<ID, R> repository;

    private final ChangeNotificationBus bus;

    /**
     * 从记录中取出主键
     */
    private final Function<? super R, ? extends ID> idExtractor;

    /**
     * 构造内存默认值
     */
    private final Function<? super ID, ? extends R> defaultFactory;

    /**
     * 写入执行器
     */
    private final Executor executor;

    /**
     * 本实例的发布方标识
     */
    private final String sourceId = UUID.randomUUID().toString();

    public DefaultConfigAccessService(String resource,
                                      SingleFlightCache<ID, R> cache,
                                      ConfigRepository<ID, R> repository,
                                      ChangeNotificationBus bus,
                                      Function<? super R, ? extends ID> idExtractor,
                                      Function<? super ID, ? extends R> defaultFactory,
                                      Executor executor) {
        this.resource = resource;
        this.cache = cache;
        this.repository = repository;
        this.bus = bus;
        this.idExtractor = idExtractor;
        this.defaultFactory = defaultFactory;
        this.executor = executor;
    }

    /**
     * 订阅变更总线
     */
    public void initialize() {
        bus.subscribe(this);
        log.info("配置访问服务已启动: resource={}, sourceId={}", resource, sourceId);
    }

    /**
     * 取消订阅
     */
    public void shutdown() {
        bus.unsubscribe(this);
        log.info("配置访问服务已停止: resource={}", resource);
    }

    @Override
    public CompletableFuture<R> getConfig(ID id) {
        Objects.requireNonNull(id, "id");
        return cache.getAsync(id, this::loadOrCreate)
                .exceptionally(e -> degrade(id, e));
    }

    /**
     * 回源：查询，不存在则创建默认记录并重新查询一次
     */
    private R loadOrCreate(ID id) {
        FetchResult<R> result = repository.fetchByKey(id);
        if (result.isFound()) {
            return result.getRecord();
        }

        log.info("配置不存在，创建默认配置: resource={}, id={}", resource, id);
        repository.create(id);

        FetchResult<R> created = repository.fetchByKey(id);
        if (!created.isFound()) {
            throw new RepositoryException("创建默认配置后仍未查询到记录", null, id);
        }
        return created.getRecord();
    }

    /**
     * 读失败且无旧值：返回内存默认值（不缓存）
     */
    private R degrade(ID id, Throwable e) {
        Throwable cause = unwrap(e);
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        log.warn("读取配置失败，使用内存默认值: resource={}, id={}, error={}", resource, id, cause.toString());
        return defaultFactory.apply(id);
    }

    @Override
    public CompletableFuture<Void> updateConfig(R record) {
        Objects.requireNonNull(record, "record");
        ID id = idExtractor.apply(record);

        return CompletableFuture.runAsync(() -> {
            try {
                repository.update(record);
            } catch (RuntimeException e) {
                log.error("写入配置失败，缓存保持原值: resource={}, id={}", resource, id, e);
                throw e;
            }

            cache.put(id, record);
            log.info("配置已写入: resource={}, id={}", resource, id);
            publishQuietly(id);
        }, executor);
    }

    /**
     * 发布变更事件，失败只记录日志，不影响已成功的写入
     */
    private void publishQuietly(ID id) {
        try {
            bus.publish(ChangeEvent.of(resource, id, sourceId));
        } catch (Exception e) {
            log.error("发布配置变更事件失败: resource={}, id={}", resource, id, e);
        }
    }

    @Override
    public void invalidateCache(ID id) {
        if (id == null) {
            cache.invalidateAll();
            return;
        }
        cache.invalidate(id);
    }

    @Override
    public void onExternalInvalidation(ID id) {
        log.debug("收到外部失效通知: resource={}, id={}", resource, id);
        invalidateCache(id);
    }

    @Override
    @SuppressWarnings("unchecked")
    public void onChange(ChangeEvent event) {
        if (!resource.equals(event.getResource()) || sourceId.equals(event.getSourceId())) {
            return;
        }
        onExternalInvalidation((ID) event.getKey());
    }

    @Override
    public String getResource() {
        return resource;
    }

    @Override
    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public String getSourceId() {
        return sourceId;
    }

    private static Throwable unwrap(Throwable e) {
        if (e instanceof CompletionException && e.getCause() != null) {
            return e.getCause();
        }
        return e;
    }
}
