package cn.bafuka.configarmor.connection;

import java.sql.Connection;

/**
 * 连接管理器接口
 * 负责获取、校验和释放连接，并在其中施加重试退避与熔断策略
 */
public interface ConnectionManager {

    /**
     * 获取可用连接
     *
     * @return 连接
     * @throws cn.bafuka.configarmor.exception.CircuitOpenException              熔断中
     * @throws cn.bafuka.configarmor.exception.RetriesExhaustedException         重试耗尽
     * @throws cn.bafuka.configarmor.exception.ConnectionConfigurationException  连接参数缺失
     */
    Connection open();

    /**
     * 轻量存活探测，用于发现已悄然失效的连接
     *
     * @param handle 连接
     * @return 是否可用
     */
    boolean validate(Connection handle);

    /**
     * 释放连接，从不抛出异常
     *
     * @param handle 连接
     */
    void dispose(Connection handle);

    /**
     * 报告一次在连接上完成的操作，清零熔断失败计数
     */
    void reportSuccess();

    /**
     * 报告一次在已获取连接上发生的连接故障（如查询中途断开），计入熔断失败
     */
    void reportConnectivityFailure();

    /**
     * 获取共享的熔断器
     */
    CircuitBreaker getCircuitBreaker();
}
