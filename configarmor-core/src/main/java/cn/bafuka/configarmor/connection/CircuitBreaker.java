package cn.bafuka.configarmor.connection;

import cn.bafuka.configarmor.exception.CircuitOpenException;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 熔断器
 * 一个后端存储对应一个实例，由所有连接管理器共享（显式注入，不使用静态单例）。
 * 所有状态读写都在同一把锁内完成，锁内只做计数和时间比较，从不包含 I/O
 */
@Slf4j
public class CircuitBreaker {

    /**
     * 放行许可类型
     */
    public enum Permission {
        /**
         * 正常放行，可以按重试策略多次尝试
         */
        NORMAL,

        /**
         * 冷却后的探测，只允许尝试一次
         */
        PROBE
    }

    private final String name;

    private final int failureThreshold;

    private final long coolDownNanos;

    private final Ticker ticker;

    private final Object lock = new Object();

    private int consecutiveFailures;

    /**
     * 熔断截止时刻，仅在 tripped 为 true 时有意义
     */
    private long trippedUntilNanos;

    private boolean tripped;

    /**
     * 半开状态下是否已有探测在进行
     */
    private boolean probeInFlight;

    private long tripCount;

    public CircuitBreaker(String name, int failureThreshold, Duration coolDown) {
        this(name, failureThreshold, coolDown, Ticker.systemTicker());
    }

    public CircuitBreaker(String name, int failureThreshold, Duration coolDown, Ticker ticker) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold 必须大于 0: " + failureThreshold);
        }
        if (coolDown == null || coolDown.isNegative()) {
            throw new IllegalArgumentException("coolDown 不能为空或为负数: " + coolDown);
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.coolDownNanos = coolDown.toNanos();
        this.ticker = ticker;
    }

    /**
     * 申请一次连接尝试
     * 冷却期内直接拒绝；冷却结束后的第一次申请重置熔断并作为探测放行
     *
     * @return 放行类型
     * @throws CircuitOpenException 熔断中
     */
    public Permission tryAcquire() {
        synchronized (lock) {
            if (probeInFlight) {
                throw new CircuitOpenException(0);
            }
            if (!tripped) {
                return Permission.NORMAL;
            }

            long now = ticker.read();
            if (now < trippedUntilNanos) {
                throw new CircuitOpenException(TimeUnit.NANOSECONDS.toMillis(trippedUntilNanos - now));
            }

            // 冷却结束：重置计数，放行一次探测
            tripped = false;
            trippedUntilNanos = 0;
            consecutiveFailures = 0;
            probeInFlight = true;
            log.warn("熔断器冷却结束，已重置并放行探测: name={}", name);
            return Permission.PROBE;
        }
    }

    /**
     * 记录一次成功
     */
    public void recordSuccess() {
        synchronized (lock) {
            if (probeInFlight) {
                probeInFlight = false;
                log.info("熔断器探测成功，恢复正常: name={}", name);
            }
            consecutiveFailures = 0;
        }
    }

    /**
     * 记录一次失败（一次完整的重试周期只记一次）
     * 探测失败会立即重新熔断
     */
    public void recordFailure() {
        synchronized (lock) {
            if (probeInFlight) {
                probeInFlight = false;
                consecutiveFailures = failureThreshold;
                trip();
                return;
            }
            if (tripped) {
                return;
            }
            consecutiveFailures++;
            if (consecutiveFailures >= failureThreshold) {
                trip();
            } else {
                log.debug("熔断器记录失败: name={}, consecutiveFailures={}/{}",
                        name, consecutiveFailures, failureThreshold);
            }
        }
    }

    private void trip() {
        tripped = true;
        trippedUntilNanos = ticker.read() + coolDownNanos;
        tripCount++;
        log.error("熔断器打开: name={}, consecutiveFailures={}, coolDownMs={}",
                name, consecutiveFailures, TimeUnit.NANOSECONDS.toMillis(coolDownNanos));
    }

    public CircuitState getState() {
        synchronized (lock) {
            if (probeInFlight) {
                return CircuitState.HALF_OPEN;
            }
            if (!tripped) {
                return CircuitState.CLOSED;
            }
            return ticker.read() < trippedUntilNanos ? CircuitState.OPEN : CircuitState.HALF_OPEN;
        }
    }

    public int getConsecutiveFailures() {
        synchronized (lock) {
            return consecutiveFailures;
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        synchronized (lock) {
            long remaining = tripped ? Math.max(0, trippedUntilNanos - ticker.read()) : 0;
            return CircuitBreakerSnapshot.builder()
                    .name(name)
                    .state(getState())
                    .consecutiveFailures(consecutiveFailures)
                    .failureThreshold(getFailureThreshold())
                    .remainingCoolDownMs(TimeUnit.NANOSECONDS.toMillis(remaining))
                    .tripCount(tripCount)
                    .build();
        }
    }

    public String getName() {
        return name;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }
}
