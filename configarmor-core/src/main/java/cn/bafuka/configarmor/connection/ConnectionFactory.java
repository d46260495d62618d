package cn.bafuka.configarmor.connection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * 底层连接工厂
 * 每次调用产生一个新的物理连接（或从下层连接池借出一个）
 */
@FunctionalInterface
public interface ConnectionFactory {

    /**
     * 建立连接
     *
     * @param connectionString 连接串
     * @return 连接
     * @throws SQLException 建立失败
     */
    Connection connect(String connectionString) throws SQLException;

    /**
     * 基于 DriverManager 的默认实现
     */
    static ConnectionFactory driverManager() {
        return DriverManager::getConnection;
    }
}
