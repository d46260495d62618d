package cn.bafuka.configarmor.exception;

/**
 * 熔断器处于打开状态，请求被快速拒绝
 */
public class CircuitOpenException extends ConfigAccessException {

    /**
     * 剩余冷却时间（毫秒）
     */
    private final long remainingCoolDownMs;

    public CircuitOpenException(long remainingCoolDownMs) {
        super("熔断器已打开，剩余冷却时间 " + remainingCoolDownMs + "ms", null, FailureReason.CIRCUIT_OPEN);
        this.remainingCoolDownMs = remainingCoolDownMs;
    }

    public long getRemainingCoolDownMs() {
        return remainingCoolDownMs;
    }
}
