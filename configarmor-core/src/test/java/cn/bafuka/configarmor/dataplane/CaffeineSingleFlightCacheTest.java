package cn.bafuka.configarmor.dataplane;

import cn.bafuka.configarmor.core.CacheStats;
import cn.bafuka.configarmor.dataplane.impl.CaffeineSingleFlightCache;
import cn.bafuka.configarmor.model.CacheConfig;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.*;

/**
 * CaffeineSingleFlightCache 单元测试
 */
public class CaffeineSingleFlightCacheTest {

    private final AtomicLong nanos = new AtomicLong(TimeUnit.SECONDS.toNanos(1));

    private ExecutorService executor;

    private CaffeineSingleFlightCache<String, String> cache;

    @Before
    public void setUp() {
        executor = Executors.newFixedThreadPool(4);
        CacheConfig config = CacheConfig.builder()
                .ttl(Duration.ofMillis(100))
                .build();
        cache = new CaffeineSingleFlightCache<>("test", config, executor, nanos::get);
    }

    @After
    public void tearDown() {
        executor.shutdownNow();
    }

    private void advance(long millis) {
        nanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    /**
     * 测试并发异步获取只回源一次，所有调用方拿到同一个结果
     */
    @Test
    public void testAsyncCoalescing() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger loads = new AtomicInteger();

        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(cache.getAsync("k", key -> {
                loads.incrementAndGet();
                await(release);
                return "v";
            }));
        }
        assertEquals(1, cache.pendingCount());
        assertEquals(19, cache.getStats().getCoalescedCount());

        release.countDown();
        for (CompletableFuture<String> future : futures) {
            assertEquals("v", future.get(5, TimeUnit.SECONDS));
        }
        assertEquals(1, loads.get());
        assertEquals(0, cache.pendingCount());
    }

    /**
     * 测试多线程同步获取只回源一次
     */
    @Test
    public void testConcurrentSyncCoalescing() throws Exception {
        int callers = 10;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger loads = new AtomicInteger();

        try {
            List<Future<String>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> cache.get("k", key -> {
                    loads.incrementAndGet();
                    await(release);
                    return "v";
                })));
            }

            // 等所有调用方都挂到同一次回源上再放行
            long deadline = System.currentTimeMillis() + 5000;
            while (cache.getStats().getCoalescedCount() < callers - 1 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
            release.countDown();

            for (Future<String> result : results) {
                assertEquals("v", result.get(5, TimeUnit.SECONDS));
            }
            assertEquals(1, loads.get());
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * 测试 TTL：新鲜期内命中，过期后重新回源
     */
    @Test
    public void testTtlExpiry() {
        AtomicInteger loads = new AtomicInteger();

        assertEquals("v1", cache.get("k", key -> "v" + loads.incrementAndGet()));

        advance(50);
        assertEquals("v1", cache.get("k", key -> "v" + loads.incrementAndGet()));
        assertEquals(1, loads.get());

        advance(100);
        assertEquals("v2", cache.get("k", key -> "v" + loads.incrementAndGet()));
        assertEquals(2, loads.get());
    }

    /**
     * 测试回源失败时返回过期值
     */
    @Test
    public void testStaleFallback() {
        cache.get("k", key -> "old");
        advance(200);

        String value = cache.get("k", key -> {
            throw new IllegalStateException("db down");
        });

        assertEquals("old", value);
        assertEquals(1, cache.getStats().getStaleFallbackCount());
        assertEquals(1, cache.getStats().getLoadFailureCount());
    }

    /**
     * 测试没有旧值时失败直接抛出，且不影响下一次回源
     */
    @Test
    public void testFailureDoesNotPoisonNextFetch() {
        try {
            cache.get("k", key -> {
                throw new IllegalStateException("db down");
            });
            fail("应该抛出异常");
        } catch (IllegalStateException e) {
            assertEquals("db down", e.getMessage());
        }

        assertEquals(0, cache.pendingCount());
        assertEquals("v", cache.get("k", key -> "v"));
    }

    /**
     * 测试一次失败分发给所有等待者
     */
    @Test
    public void testFailureFansOutToAllWaiters() {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> first = cache.getAsync("k", key -> {
            await(release);
            throw new IllegalStateException("db down");
        });
        CompletableFuture<String> second = cache.getAsync("k", key -> "unused");

        release.countDown();
        assertFailedWith(first, IllegalStateException.class);
        assertFailedWith(second, IllegalStateException.class);
    }

    /**
     * 测试 TTL 为 0 时不复用已完成的结果
     */
    @Test
    public void testZeroTtlDisablesReuse() {
        AtomicInteger loads = new AtomicInteger();

        cache.get("k", key -> "v" + loads.incrementAndGet(), Duration.ZERO);
        cache.get("k", key -> "v" + loads.incrementAndGet(), Duration.ZERO);

        assertEquals(2, loads.get());
    }

    /**
     * 测试负数 TTL 被拒绝
     */
    @Test(expected = IllegalArgumentException.class)
    public void testNegativeTtlRejected() {
        cache.get("k", key -> "v", Duration.ofMillis(-1));
    }

    /**
     * 测试 invalidate 后重新回源
     */
    @Test
    public void testInvalidate() {
        AtomicInteger loads = new AtomicInteger();
        cache.get("k", key -> "v" + loads.incrementAndGet());

        cache.invalidate("k");

        assertNull(cache.getIfPresent("k"));
        assertEquals("v2", cache.get("k", key -> "v" + loads.incrementAndGet()));
    }

    /**
     * 测试 invalidateAll 不影响进行中的回源写入
     */
    @Test
    public void testInvalidateAllDuringFlight() throws Exception {
        cache.put("other", "x");
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> future = cache.getAsync("k", key -> {
            await(release);
            return "v";
        });

        cache.invalidateAll();
        assertNull(cache.getIfPresent("other"));

        release.countDown();
        assertEquals("v", future.get(5, TimeUnit.SECONDS));
        assertEquals("v", cache.getIfPresent("k"));
    }

    /**
     * 测试回源期间 put 的新值不会被回源结果覆盖
     */
    @Test
    public void testPutDuringFlightWins() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<String> future = cache.getAsync("k", key -> {
            await(release);
            return "fetched";
        });

        cache.put("k", "written");
        release.countDown();

        assertEquals("fetched", future.get(5, TimeUnit.SECONDS));
        assertEquals("written", cache.getIfPresent("k"));
        assertEquals("written", cache.get("k", key -> "unused"));
    }

    /**
     * 测试取消某个调用方的 Future 不影响其他等待者
     */
    @Test
    public void testCancelDetachesOnlyOneWaiter() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger loads = new AtomicInteger();
        CompletableFuture<String> first = cache.getAsync("k", key -> {
            loads.incrementAndGet();
            await(release);
            return "v";
        });
        CompletableFuture<String> second = cache.getAsync("k", key -> "unused");

        assertTrue(first.cancel(true));
        release.countDown();

        assertEquals("v", second.get(5, TimeUnit.SECONDS));
        assertEquals(1, loads.get());
        assertEquals("v", cache.getIfPresent("k"));
    }

    /**
     * 测试统计信息
     */
    @Test
    public void testStats() {
        cache.get("k", key -> "v");
        cache.get("k", key -> "v");

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.getHitCount());
        assertEquals(1, stats.getMissCount());
        assertEquals(1, stats.getLoadSuccessCount());
        assertEquals(0.5, stats.hitRate(), 0.0001);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("等待超时");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    private static void assertFailedWith(CompletableFuture<?> future, Class<? extends Throwable> type) {
        try {
            future.join();
            fail("应该异常完成");
        } catch (CompletionException e) {
            assertTrue(type.isInstance(e.getCause()));
        }
    }
}
