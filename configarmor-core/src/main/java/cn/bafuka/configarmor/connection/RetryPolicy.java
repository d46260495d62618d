package cn.bafuka.configarmor.connection;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 连接重试策略：有限次数 + 指数退避 + 随机抖动
 * 第 n 次重试（n 从 0 开始）前等待 initialDelay * backoffFactor^n + [0, maxJitter]
 */
@Getter
@ToString
public class RetryPolicy {

    /**
     * 最大尝试次数（含首次）
     */
    private final int maxAttempts;

    private final Duration initialDelay;

    private final double backoffFactor;

    private final Duration maxJitter;

    public RetryPolicy(int maxAttempts, Duration initialDelay, double backoffFactor, Duration maxJitter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必须大于 0: " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay 不能为空或为负数: " + initialDelay);
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor 不能小于 1: " + backoffFactor);
        }
        if (maxJitter == null || maxJitter.isNegative()) {
            throw new IllegalArgumentException("maxJitter 不能为空或为负数: " + maxJitter);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.backoffFactor = backoffFactor;
        this.maxJitter = maxJitter;
    }

    /**
     * 默认策略：3 次尝试，1s 起步，翻倍，抖动 0~500ms
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofMillis(500));
    }

    /**
     * 不重试（只尝试一次）
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * 第 retryIndex 次重试前的基础退避，不含抖动。
     * 结果上限为 Long.MAX_VALUE - maxJitter，叠加抖动后不会溢出
     *
     * @param retryIndex 重试序号，从 0 开始
     * @return 毫秒
     */
    public long baseDelayMillis(int retryIndex) {
        long ceiling = Long.MAX_VALUE - maxJitter.toMillis();
        double base = initialDelay.toMillis() * Math.pow(backoffFactor, retryIndex);
        if (base >= ceiling) {
            return ceiling;
        }
        return (long) base;
    }

    /**
     * 第 retryIndex 次重试前的实际等待
     *
     * @param retryIndex   重试序号，从 0 开始
     * @param jitterMillis 抖动，超出 [0, maxJitter] 的部分会被截断
     * @return 毫秒
     */
    public long delayMillis(int retryIndex, long jitterMillis) {
        long jitter = Math.max(0, Math.min(jitterMillis, maxJitter.toMillis()));
        return baseDelayMillis(retryIndex) + jitter;
    }

    /**
     * 带随机抖动的等待时长
     */
    public long nextDelayMillis(int retryIndex) {
        long bound = maxJitter.toMillis();
        long jitter = bound == 0 ? 0 : ThreadLocalRandom.current().nextLong(bound + 1);
        return delayMillis(retryIndex, jitter);
    }
}
