package cn.bafuka.configarmor.exception;

/**
 * 瞬时连接故障（网络中断、超时等）
 * 会按退避策略重试，并计入熔断器
 */
public class TransientConnectivityException extends ConfigAccessException {

    public TransientConnectivityException(String message, Throwable cause, Object key) {
        super(message, cause, key, FailureReason.TRANSIENT_CONNECTIVITY);
    }

    protected TransientConnectivityException(String message, Throwable cause, Object key, FailureReason reason) {
        super(message, cause, key, reason);
    }
}
