package cn.bafuka.configarmor.service;

import cn.bafuka.configarmor.core.CacheStats;

import java.util.concurrent.CompletableFuture;

/**
 * 配置访问服务
 * 组合单飞缓存与仓储：读走缓存，写先落库再更新缓存
 *
 * @param <ID> 配置主键类型
 * @param <R>  配置记录类型
 */
public interface ConfigAccessService<ID, R> {

    /**
     * 获取配置
     * 后端故障时返回过期值或内存默认值，返回的 Future 不会因后端故障而异常完成
     *
     * @param id 配置主键
     * @return 配置
     */
    CompletableFuture<R> getConfig(ID id);

    /**
     * 写入配置
     * 落库成功后用新值覆盖缓存并发布变更事件；落库失败时缓存保持原值，失败经 Future 返回
     *
     * @param record 配置记录
     * @return 写入完成的 Future
     */
    CompletableFuture<Void> updateConfig(R record);

    /**
     * 失效本地缓存
     *
     * @param id 配置主键，为 null 时失效全部
     */
    void invalidateCache(ID id);

    /**
     * 处理外部失效通知
     *
     * @param id 配置主键
     */
    void onExternalInvalidation(ID id);

    /**
     * 资源名称
     */
    String getResource();

    /**
     * 缓存统计
     */
    CacheStats getCacheStats();
}
