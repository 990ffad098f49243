package org.lexcrawl.fetch;

import org.junit.jupiter.api.Test;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.util.ManualTicker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProxyRateLimiterTest {
    private static final long SECOND = 1_000_000_000L;

    @Test
    void requestsThroughOneProxyAreSpacedByTheRate() {
        var ticker = new ManualTicker();
        var limiter = new ProxyRateLimiter(2.0, ticker);
        var proxy = proxy(1);
        assertEquals(0, limiter.reserve(proxy, Duration.ZERO));
        assertEquals(SECOND / 2, limiter.reserve(proxy, Duration.ZERO));
        assertEquals(SECOND, limiter.reserve(proxy, Duration.ZERO));
        assertEquals(0, limiter.reserve(proxy(2), Duration.ZERO), "other proxies have their own budget");
    }

    @Test
    void sourceDelayWidensTheSpacing() {
        var ticker = new ManualTicker();
        var limiter = new ProxyRateLimiter(10.0, ticker);
        var proxy = proxy(1);
        limiter.reserve(proxy, Duration.ofSeconds(3));
        assertEquals(3 * SECOND, limiter.reserve(proxy, Duration.ofSeconds(3)));
    }

    @Test
    void idleTimeDoesNotAccumulateBurstCredit() {
        var ticker = new ManualTicker();
        var limiter = new ProxyRateLimiter(1.0, ticker);
        var proxy = proxy(1);
        limiter.reserve(proxy, Duration.ZERO);
        ticker.advance(60 * SECOND);
        assertEquals(0, limiter.reserve(proxy, Duration.ZERO));
        assertEquals(SECOND, limiter.reserve(proxy, Duration.ZERO));
    }

    @Test
    void noWindowEverExceedsTheRate() {
        var random = new Random(42);
        var ticker = new ManualTicker();
        double rate = 4.0;
        long interval = (long) (SECOND / rate);
        var limiter = new ProxyRateLimiter(rate, ticker);
        Map<Long, List<Long>> starts = new HashMap<>();
        for (int i = 0; i < 5000; i++) {
            var proxy = proxy(random.nextInt(3) + 1);
            long wait = limiter.reserve(proxy, Duration.ZERO);
            starts.computeIfAbsent(proxy.id(), id -> new ArrayList<>()).add(ticker.nanoTime() + wait);
            ticker.advance(random.nextInt((int) interval));
        }
        for (var proxyStarts : starts.values()) {
            for (int i = 1; i < proxyStarts.size(); i++) {
                assertTrue(proxyStarts.get(i) - proxyStarts.get(i - 1) >= interval,
                        "requests " + (i - 1) + " and " + i + " too close");
            }
        }
    }

    @Test
    void concurrentReservationsGetDistinctSlots() throws Exception {
        var ticker = new ManualTicker();
        var limiter = new ProxyRateLimiter(1.0, ticker);
        var proxy = proxy(7);
        var waits = new ConcurrentLinkedQueue<Long>();
        var executor = Executors.newFixedThreadPool(8);
        var start = new CountDownLatch(1);
        try {
            for (int i = 0; i < 200; i++) {
                executor.execute(() -> {
                    try {
                        start.await();
                        waits.add(limiter.reserve(proxy, Duration.ZERO));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        var sorted = waits.stream().sorted().toList();
        assertEquals(200, sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            assertEquals(i * SECOND, sorted.get(i));
        }
    }

    @Test
    void acquireSleepsOnTheTicker() throws InterruptedException {
        var ticker = new ManualTicker();
        var limiter = new ProxyRateLimiter(0.5, ticker);
        var proxy = proxy(1);
        limiter.acquire(proxy, Duration.ZERO);
        limiter.acquire(proxy, Duration.ZERO);
        assertEquals(2 * SECOND, ticker.nanoTime());
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class, () -> new ProxyRateLimiter(0, new ManualTicker()));
    }

    static ProxyEndpoint proxy(long id) {
        return new ProxyEndpoint(id, "static", null, "10.0.0." + id, 3128, null, null, ProxyEndpoint.State.ACTIVE,
                Instant.EPOCH, null, null);
    }
}
