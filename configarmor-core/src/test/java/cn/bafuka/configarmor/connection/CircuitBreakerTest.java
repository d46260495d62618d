package cn.bafuka.configarmor.connection;

import cn.bafuka.configarmor.exception.CircuitOpenException;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

/**
 * CircuitBreaker 单元测试
 */
public class CircuitBreakerTest {

    private final AtomicLong nanos = new AtomicLong();

    private CircuitBreaker breaker;

    @Before
    public void setUp() {
        breaker = new CircuitBreaker("test-db", 5, Duration.ofMinutes(2), nanos::get);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
    }

    private void failTimes(int times) {
        for (int i = 0; i < times; i++) {
            breaker.tryAcquire();
            breaker.recordFailure();
        }
    }

    /**
     * 测试初始状态为关闭
     */
    @Test
    public void testInitiallyClosed() {
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(CircuitBreaker.Permission.NORMAL, breaker.tryAcquire());
    }

    /**
     * 测试未达到阈值时保持关闭
     */
    @Test
    public void testBelowThresholdStaysClosed() {
        failTimes(4);

        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(4, breaker.getConsecutiveFailures());
        assertEquals(CircuitBreaker.Permission.NORMAL, breaker.tryAcquire());
    }

    /**
     * 测试成功会清零失败计数
     */
    @Test
    public void testSuccessResetsCounter() {
        failTimes(4);
        breaker.recordSuccess();
        failTimes(4);

        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    /**
     * 测试连续失败达到阈值后熔断
     */
    @Test
    public void testTripsAtThreshold() {
        failTimes(5);

        assertEquals(CircuitState.OPEN, breaker.getState());
        try {
            breaker.tryAcquire();
            fail("熔断中应该拒绝");
        } catch (CircuitOpenException e) {
            assertEquals(TimeUnit.MINUTES.toMillis(2), e.getRemainingCoolDownMs());
        }
        assertEquals(1, breaker.snapshot().getTripCount());
    }

    /**
     * 测试冷却结束后放行一次探测，探测成功恢复关闭
     */
    @Test
    public void testProbeSuccessCloses() {
        failTimes(5);
        advance(Duration.ofMinutes(2));

        assertEquals(CircuitBreaker.Permission.PROBE, breaker.tryAcquire());
        assertEquals(CircuitState.HALF_OPEN, breaker.getState());
        assertEquals(0, breaker.getConsecutiveFailures());

        // 探测进行中，其他调用被拒绝
        try {
            breaker.tryAcquire();
            fail("探测进行中应该拒绝");
        } catch (CircuitOpenException expected) {
            // 预期
        }

        breaker.recordSuccess();
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(CircuitBreaker.Permission.NORMAL, breaker.tryAcquire());
    }

    /**
     * 测试探测失败立即重新熔断
     */
    @Test
    public void testProbeFailureRetrips() {
        failTimes(5);
        advance(Duration.ofMinutes(2));

        assertEquals(CircuitBreaker.Permission.PROBE, breaker.tryAcquire());
        breaker.recordFailure();

        assertEquals(CircuitState.OPEN, breaker.getState());
        assertEquals(2, breaker.snapshot().getTripCount());

        advance(Duration.ofMinutes(1));
        try {
            breaker.tryAcquire();
            fail("重新熔断后应该拒绝");
        } catch (CircuitOpenException e) {
            assertEquals(TimeUnit.MINUTES.toMillis(1), e.getRemainingCoolDownMs());
        }
    }

    /**
     * 测试冷却期未到时仍然拒绝
     */
    @Test(expected = CircuitOpenException.class)
    public void testRejectsBeforeCoolDownEnds() {
        failTimes(5);
        advance(Duration.ofSeconds(119));
        breaker.tryAcquire();
    }

    /**
     * 测试快照内容
     */
    @Test
    public void testSnapshot() {
        failTimes(5);
        advance(Duration.ofSeconds(30));

        CircuitBreakerSnapshot snapshot = breaker.snapshot();
        assertEquals("test-db", snapshot.getName());
        assertEquals(CircuitState.OPEN, snapshot.getState());
        assertEquals(5, snapshot.getConsecutiveFailures());
        assertEquals(5, snapshot.getFailureThreshold());
        assertEquals(TimeUnit.SECONDS.toMillis(90), snapshot.getRemainingCoolDownMs());
    }

    /**
     * 测试非法参数
     */
    @Test(expected = IllegalArgumentException.class)
    public void testInvalidThreshold() {
        new CircuitBreaker("bad", 0, Duration.ofMinutes(2));
    }
}
