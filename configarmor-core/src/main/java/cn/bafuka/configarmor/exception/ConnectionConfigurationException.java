package cn.bafuka.configarmor.exception;

/**
 * 连接参数缺失或非法
 * 属于启动期的致命错误，不做重试
 */
public class ConnectionConfigurationException extends ConfigAccessException {

    public ConnectionConfigurationException(String message) {
        super(message, null, FailureReason.CONFIGURATION);
    }
}
