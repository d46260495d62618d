package cn.bafuka.configarmor.repository.impl;

import cn.bafuka.configarmor.connection.ConnectionManager;
import cn.bafuka.configarmor.exception.ConfigAccessException;
import cn.bafuka.configarmor.exception.RepositoryException;
import cn.bafuka.configarmor.exception.TransientConnectivityException;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * JDBC 仓储基类
 * 每次操作独立获取连接：先做存活探测，失效则换一个，结束后总是释放
 */
@Slf4j
public abstract class AbstractJdbcRepository {

    protected final ConnectionManager connectionManager;

    protected AbstractJdbcRepository(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    /**
     * 在一个独立连接上执行操作
     *
     * @param operation 操作描述（用于日志与异常信息）
     * @param key       相关的键
     * @param callback  具体的 SQL 操作
     * @return 操作结果
     */
    protected <T> T execute(String operation, Object key, SqlCallback<T> callback) {
        Connection connection = acquire();
        try {
            T result = callback.doInConnection(connection);
            connectionManager.reportSuccess();
            return result;
        } catch (SQLException e) {
            log.error("{}失败: key={}, sqlState={}", operation, key, e.getSQLState(), e);
            ConfigAccessException failure = translate(operation, key, e);
            if (failure.isRetryable()) {
                // 查询途中的连接故障与建连失败同样计入熔断
                connectionManager.reportConnectivityFailure();
            } else {
                // 数据库错误说明连接本身可用
                connectionManager.reportSuccess();
            }
            throw failure;
        } finally {
            connectionManager.dispose(connection);
        }
    }

    private Connection acquire() {
        Connection connection = connectionManager.open();
        if (connectionManager.validate(connection)) {
            return connection;
        }

        log.warn("连接存活探测未通过，重新获取连接");
        connectionManager.dispose(connection);
        return connectionManager.open();
    }

    /**
     * 将 SQLException 转换为本层异常
     */
    protected ConfigAccessException translate(String operation, Object key, SQLException e) {
        if (isConnectivityFailure(e)) {
            return new TransientConnectivityException(operation + "失败：连接异常", e, key);
        }
        return new RepositoryException(operation + "失败：" + e.getMessage(), e, key);
    }

    /**
     * SQLState 08 类（连接异常）以及瞬时/可恢复异常视为连接故障
     */
    static boolean isConnectivityFailure(SQLException e) {
        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    /**
     * 读取可为空的整型列
     */
    protected static Integer getNullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * 读取字符串列，为空时返回默认值
     */
    protected static String getString(ResultSet rs, String column, String defaultValue) throws SQLException {
        String value = rs.getString(column);
        return value != null ? value : defaultValue;
    }

    /**
     * SQL 回调
     */
    @FunctionalInterface
    protected interface SqlCallback<T> {

        T doInConnection(Connection connection) throws SQLException;
    }
}
