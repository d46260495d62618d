package cn.bafuka.configarmor.connection.impl;

import cn.bafuka.configarmor.connection.CircuitBreaker;
import cn.bafuka.configarmor.connection.CircuitState;
import cn.bafuka.configarmor.connection.ConnectionFactory;
import cn.bafuka.configarmor.connection.RetryPolicy;
import cn.bafuka.configarmor.exception.CircuitOpenException;
import cn.bafuka.configarmor.exception.ConnectionConfigurationException;
import cn.bafuka.configarmor.exception.RetriesExhaustedException;
import cn.bafuka.configarmor.exception.TransientConnectivityException;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;
import static org.mockito.Mockito.*;

/**
 * JdbcConnectionManager 单元测试
 */
public class JdbcConnectionManagerTest {

    private static final String URL = "jdbc:postgresql://localhost:5432/omega";

    @Mock
    private Connection connection;

    private final AtomicLong nanos = new AtomicLong();

    private final AtomicInteger connectCalls = new AtomicInteger();

    private final AtomicBoolean databaseUp = new AtomicBoolean(false);

    private final List<Long> sleeps = new ArrayList<>();

    private CircuitBreaker breaker;

    private ConnectionFactory factory;

    @Before
    public void setUp() {
        MockitoAnnotations.initMocks(this);
        breaker = new CircuitBreaker("test-db", 5, Duration.ofMinutes(2), nanos::get);
        factory = url -> {
            connectCalls.incrementAndGet();
            if (!databaseUp.get()) {
                throw new SQLException("connection refused", "08001");
            }
            return connection;
        };
    }

    private JdbcConnectionManager manager(RetryPolicy policy) {
        return new JdbcConnectionManager(URL, factory, policy, breaker, sleeps::add, 2);
    }

    /**
     * 测试连接成功
     */
    @Test
    public void testOpenSuccess() {
        databaseUp.set(true);

        assertSame(connection, manager(RetryPolicy.defaults()).open());
        assertEquals(1, connectCalls.get());
        assertTrue(sleeps.isEmpty());
    }

    /**
     * 测试重试：3 次尝试，退避 1s/2s 加抖动，只计一次熔断失败
     */
    @Test
    public void testRetriesWithBackoff() {
        JdbcConnectionManager manager = manager(RetryPolicy.defaults());

        try {
            manager.open();
            fail("应该抛出 RetriesExhaustedException");
        } catch (RetriesExhaustedException e) {
            assertEquals(3, e.getAttempts());
            assertTrue(e.getCause() instanceof SQLException);
        }

        assertEquals(3, connectCalls.get());
        assertEquals(2, sleeps.size());
        assertTrue(sleeps.get(0) >= 1000 && sleeps.get(0) <= 1500);
        assertTrue(sleeps.get(1) >= 2000 && sleeps.get(1) <= 2500);
        assertEquals(1, breaker.getConsecutiveFailures());
    }

    /**
     * 测试重试中途恢复
     */
    @Test
    public void testRecoversDuringRetry() throws Exception {
        ConnectionFactory flaky = url -> {
            if (connectCalls.incrementAndGet() < 2) {
                throw new SQLException("timeout", "08006");
            }
            return connection;
        };
        JdbcConnectionManager manager =
                new JdbcConnectionManager(URL, flaky, RetryPolicy.defaults(), breaker, sleeps::add, 2);

        assertSame(connection, manager.open());
        assertEquals(2, connectCalls.get());
        assertEquals(0, breaker.getConsecutiveFailures());
    }

    /**
     * 测试连续 5 次失败后熔断，第 6 次不再连接数据库
     */
    @Test
    public void testCircuitTripsAfterFiveFailures() {
        JdbcConnectionManager manager = manager(RetryPolicy.noRetry());

        for (int i = 0; i < 5; i++) {
            try {
                manager.open();
                fail("应该失败");
            } catch (RetriesExhaustedException expected) {
                // 预期
            }
        }
        assertEquals(5, connectCalls.get());
        assertEquals(CircuitState.OPEN, breaker.getState());

        try {
            manager.open();
            fail("熔断中应该快速失败");
        } catch (CircuitOpenException expected) {
            // 预期
        }
        assertEquals(5, connectCalls.get());
    }

    /**
     * 测试冷却结束后恢复
     */
    @Test
    public void testResetAfterCoolDown() {
        JdbcConnectionManager manager = manager(RetryPolicy.noRetry());
        tripBreaker(manager);

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        databaseUp.set(true);

        assertSame(connection, manager.open());
        assertEquals(CircuitState.CLOSED, breaker.getState());
        assertEquals(0, breaker.getConsecutiveFailures());
    }

    /**
     * 测试冷却后的探测只尝试一次，失败后立即重新熔断
     */
    @Test
    public void testProbeAttemptsOnce() {
        JdbcConnectionManager manager = manager(RetryPolicy.defaults());
        for (int i = 0; i < 5; i++) {
            try {
                manager.open();
            } catch (RetriesExhaustedException expected) {
                // 预期
            }
        }
        assertEquals(15, connectCalls.get());

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        try {
            manager.open();
            fail("探测应该失败");
        } catch (RetriesExhaustedException e) {
            assertEquals(1, e.getAttempts());
        }
        assertEquals(16, connectCalls.get());
        assertEquals(CircuitState.OPEN, breaker.getState());
    }

    /**
     * 测试探测时驱动抛出 Error：错误原样抛出，熔断器重新打开而不是卡在半开
     */
    @Test
    public void testDriverErrorAfterCoolDownReleasesHalfOpen() {
        AtomicBoolean driverBroken = new AtomicBoolean(false);
        ConnectionFactory fragile = url -> {
            connectCalls.incrementAndGet();
            if (driverBroken.get()) {
                throw new NoClassDefFoundError("org/postgresql/Driver");
            }
            if (!databaseUp.get()) {
                throw new SQLException("connection refused", "08001");
            }
            return connection;
        };
        JdbcConnectionManager manager =
                new JdbcConnectionManager(URL, fragile, RetryPolicy.noRetry(), breaker, sleeps::add, 2);
        tripBreaker(manager);

        nanos.addAndGet(Duration.ofMinutes(3).toNanos());
        driverBroken.set(true);
        try {
            manager.open();
            fail("应该抛出 NoClassDefFoundError");
        } catch (NoClassDefFoundError expected) {
            // 预期
        }
        assertEquals(6, connectCalls.get());
        assertEquals(CircuitState.OPEN, breaker.getState());

        nanos.addAndGet(Duration.ofMinutes(2).toNanos());
        driverBroken.set(false);
        databaseUp.set(true);

        assertSame(connection, manager.open());
        assertEquals(7, connectCalls.get());
        assertEquals(CircuitState.CLOSED, breaker.getState());
    }

    /**
     * 测试已获取连接上的连接故障计入熔断
     */
    @Test
    public void testReportConnectivityFailureCountsTowardBreaker() {
        databaseUp.set(true);
        JdbcConnectionManager manager = manager(RetryPolicy.noRetry());

        for (int i = 0; i < 5; i++) {
            manager.open();
            manager.reportConnectivityFailure();
        }
        assertEquals(CircuitState.OPEN, breaker.getState());

        try {
            manager.open();
            fail("熔断中应该快速失败");
        } catch (CircuitOpenException expected) {
            // 预期
        }
        assertEquals(5, connectCalls.get());
    }

    /**
     * 测试建连成功本身不清零失败计数，操作完成后才清零
     */
    @Test
    public void testReportSuccessResetsFailures() {
        JdbcConnectionManager manager = manager(RetryPolicy.noRetry());
        try {
            manager.open();
            fail("应该失败");
        } catch (RetriesExhaustedException expected) {
            // 预期
        }
        assertEquals(1, breaker.getConsecutiveFailures());

        databaseUp.set(true);
        manager.open();
        assertEquals(1, breaker.getConsecutiveFailures());

        manager.reportSuccess();
        assertEquals(0, breaker.getConsecutiveFailures());
    }

    /**
     * 测试多个连接管理器共享同一个熔断器
     */
    @Test
    public void testSharedBreaker() {
        JdbcConnectionManager first = manager(RetryPolicy.noRetry());
        AtomicInteger secondCalls = new AtomicInteger();
        JdbcConnectionManager second = new JdbcConnectionManager(URL, url -> {
            secondCalls.incrementAndGet();
            return connection;
        }, RetryPolicy.noRetry(), breaker, sleeps::add, 2);

        tripBreaker(first);

        try {
            second.open();
            fail("共享熔断器打开时应该拒绝");
        } catch (CircuitOpenException expected) {
            // 预期
        }
        assertEquals(0, secondCalls.get());
    }

    /**
     * 测试退避被中断：放弃获取并保留中断标记，不计熔断失败
     */
    @Test
    public void testInterruptedBackoff() {
        JdbcConnectionManager manager = new JdbcConnectionManager(URL, factory, RetryPolicy.defaults(), breaker,
                millis -> {
                    throw new InterruptedException();
                }, 2);

        try {
            manager.open();
            fail("应该抛出 TransientConnectivityException");
        } catch (RetriesExhaustedException e) {
            fail("中断不应该被当作重试耗尽");
        } catch (TransientConnectivityException e) {
            assertTrue(Thread.interrupted());
        }
        assertEquals(1, connectCalls.get());
        assertEquals(0, breaker.getConsecutiveFailures());
    }

    /**
     * 测试缺失或非法的连接串
     */
    @Test
    public void testMissingConnectionString() {
        for (String bad : new String[]{null, "", "  ", "postgres://localhost"}) {
            try {
                new JdbcConnectionManager(bad, factory, RetryPolicy.defaults(), breaker);
                fail("应该拒绝连接串: " + bad);
            } catch (ConnectionConfigurationException expected) {
                // 预期
            }
        }
        assertEquals(0, connectCalls.get());
    }

    /**
     * 测试存活探测
     */
    @Test
    public void testValidate() throws Exception {
        JdbcConnectionManager manager = manager(RetryPolicy.defaults());
        when(connection.isClosed()).thenReturn(false);
        when(connection.isValid(2)).thenReturn(true);

        assertTrue(manager.validate(connection));
        assertFalse(manager.validate(null));

        when(connection.isValid(2)).thenThrow(new SQLException("broken pipe", "08006"));
        assertFalse(manager.validate(connection));
    }

    /**
     * 测试释放连接从不抛出异常
     */
    @Test
    public void testDisposeNeverThrows() throws Exception {
        JdbcConnectionManager manager = manager(RetryPolicy.defaults());
        doThrow(new SQLException("already closed")).when(connection).close();

        manager.dispose(connection);
        manager.dispose(null);

        verify(connection).close();
    }

    private void tripBreaker(JdbcConnectionManager manager) {
        for (int i = 0; i < 5; i++) {
            try {
                manager.open();
            } catch (RetriesExhaustedException expected) {
                // 预期
            }
        }
        assertEquals(CircuitState.OPEN, breaker.getState());
    }
}
