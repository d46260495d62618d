package cn.bafuka.configarmor.connection.impl;

import cn.bafuka.configarmor.connection.CircuitBreaker;
import cn.bafuka.configarmor.connection.ConnectionFactory;
import cn.bafuka.configarmor.connection.ConnectionManager;
import cn.bafuka.configarmor.connection.RetryPolicy;
import cn.bafuka.configarmor.connection.Sleeper;
import cn.bafuka.configarmor.exception.ConnectionConfigurationException;
import cn.bafuka.configarmor.exception.RetriesExhaustedException;
import cn.bafuka.configarmor.exception.TransientConnectivityException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * JDBC 连接管理器
 * 熔断器关闭时按重试策略多次尝试；冷却后的探测只尝试一次。
 * 一次完整的重试周期失败只向熔断器计一次失败。
 * 正常建连成功不清零失败计数，由调用方在整个操作完成后通过 reportSuccess 清零，
 * 这样“能建连但查询总是断开”的后端同样会被熔断
 */
@Slf4j
public class JdbcConnectionManager implements ConnectionManager {

    private final String connectionString;

    private final ConnectionFactory connectionFactory;

    private final RetryPolicy retryPolicy;

    /**
     * 共享熔断器
     */
    private final CircuitBreaker circuitBreaker;

    private final Sleeper sleeper;

    /**
     * isValid 探测超时（秒）
     */
    private final int validationTimeoutSeconds;

    public JdbcConnectionManager(String connectionString,
                                 ConnectionFactory connectionFactory,
                                 RetryPolicy retryPolicy,
                                 CircuitBreaker circuitBreaker) {
        this(connectionString, connectionFactory, retryPolicy, circuitBreaker, Sleeper.SYSTEM, 2);
    }

    public JdbcConnectionManager(String connectionString,
                                 ConnectionFactory connectionFactory,
                                 RetryPolicy retryPolicy,
                                 CircuitBreaker circuitBreaker,
                                 Sleeper sleeper,
                                 int validationTimeoutSeconds) {
        this.connectionString = requireConnectionString(connectionString);
        this.connectionFactory = connectionFactory;
        this.retryPolicy = retryPolicy;
        this.circuitBreaker = circuitBreaker;
        this.sleeper = sleeper;
        this.validationTimeoutSeconds = validationTimeoutSeconds;

        log.info("连接管理器初始化: circuitBreaker={}, retryPolicy={}", circuitBreaker.getName(), retryPolicy);
    }

    /**
     * 校验连接串，缺失属于致命配置错误
     */
    static String requireConnectionString(String connectionString) {
        if (connectionString == null || connectionString.trim().isEmpty()) {
            throw new ConnectionConfigurationException("缺少数据库连接串");
        }
        if (!connectionString.startsWith("jdbc:")) {
            throw new ConnectionConfigurationException("数据库连接串必须以 jdbc: 开头");
        }
        return connectionString;
    }

    @Override
    public Connection open() {
        CircuitBreaker.Permission permission = circuitBreaker.tryAcquire();
        int maxAttempts = permission == CircuitBreaker.Permission.PROBE ? 1 : retryPolicy.getMaxAttempts();

        Exception lastFailure = null;
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                if (attempt > 1) {
                    backoff(attempt - 2);
                }

                try {
                    Connection connection = connectionFactory.connect(connectionString);
                    if (permission == CircuitBreaker.Permission.PROBE) {
                        circuitBreaker.recordSuccess();
                    }
                    if (attempt > 1) {
                        log.info("重试后连接成功: attempt={}/{}", attempt, maxAttempts);
                    }
                    return connection;
                } catch (SQLException e) {
                    lastFailure = e;
                    log.warn("连接数据库失败: attempt={}/{}, sqlState={}, error={}",
                            attempt, maxAttempts, e.getSQLState(), e.getMessage());
                } catch (RuntimeException e) {
                    lastFailure = e;
                    log.warn("连接数据库失败: attempt={}/{}, error={}", attempt, maxAttempts, e.toString());
                }
            }
        } catch (Error e) {
            // 驱动加载失败等致命错误也必须结算本次许可，否则探测标记无法释放
            log.error("连接数据库时发生严重错误: permission={}", permission, e);
            circuitBreaker.recordFailure();
            throw e;
        }

        circuitBreaker.recordFailure();
        throw new RetriesExhaustedException(maxAttempts, lastFailure);
    }

    @Override
    public void reportSuccess() {
        circuitBreaker.recordSuccess();
    }

    @Override
    public void reportConnectivityFailure() {
        log.warn("操作过程中连接中断，计入熔断失败: circuitBreaker={}", circuitBreaker.getName());
        circuitBreaker.recordFailure();
    }

    /**
     * 退避等待；被中断时放弃本次获取，不计入熔断失败。
     * 探测只尝试一次，不会走到这里
     */
    private void backoff(int retryIndex) {
        long delayMs = retryPolicy.nextDelayMillis(retryIndex);
        log.debug("连接重试退避: retry={}, delayMs={}", retryIndex + 1, delayMs);
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientConnectivityException("连接重试等待被中断", e, null);
        }
    }

    @Override
    public boolean validate(Connection handle) {
        if (handle == null) {
            return false;
        }
        try {
            return !handle.isClosed() && handle.isValid(validationTimeoutSeconds);
        } catch (SQLException e) {
            log.debug("连接存活探测失败: error={}", e.getMessage());
            return false;
        }
    }

    @Override
    public void dispose(Connection handle) {
        if (handle == null) {
            return;
        }
        try {
            handle.close();
        } catch (Exception e) {
            log.warn("释放连接失败: error={}", e.toString());
        }
    }

    @Override
    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }
}
