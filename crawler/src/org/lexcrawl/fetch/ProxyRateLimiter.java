package org.lexcrawl.fetch;

import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.util.Ticker;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One token bucket per proxy. Sources rate-limit by client IP, so each proxy has its own budget; there is no
 * global limit.
 */
public class ProxyRateLimiter {
    private final Map<Long, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Ticker ticker;
    private final long minIntervalNanos;

    /**
     * @param perProxyRate maximum requests per second through any single proxy
     */
    public ProxyRateLimiter(double perProxyRate, Ticker ticker) {
        if (perProxyRate <= 0) throw new IllegalArgumentException("perProxyRate must be positive");
        this.ticker = ticker;
        this.minIntervalNanos = (long) (1_000_000_000L / perProxyRate);
    }

    /**
     * Blocks until the proxy may be used again. A source's own request delay widens the spacing if it is longer.
     */
    public void acquire(ProxyEndpoint proxy, Duration sourceDelay) throws InterruptedException {
        bucket(proxy).acquire(interval(sourceDelay));
    }

    /**
     * Reserves a slot without waiting.
     *
     * @return nanoseconds until the slot starts
     */
    public long reserve(ProxyEndpoint proxy, Duration sourceDelay) {
        return bucket(proxy).reserve(interval(sourceDelay));
    }

    long interval(Duration sourceDelay) {
        return Math.max(minIntervalNanos, sourceDelay.toNanos());
    }

    private TokenBucket bucket(ProxyEndpoint proxy) {
        return buckets.computeIfAbsent(proxy.id(), id -> new TokenBucket(ticker));
    }
}
