package cn.bafuka.configarmor.exception;

/**
 * 连接重试次数耗尽
 */
public class RetriesExhaustedException extends TransientConnectivityException {

    /**
     * 实际尝试次数
     */
    private final int attempts;

    public RetriesExhaustedException(int attempts, Throwable lastFailure) {
        super("连接失败，已尝试 " + attempts + " 次", lastFailure, null, FailureReason.RETRIES_EXHAUSTED);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
