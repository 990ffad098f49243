package org.lexcrawl.fetch;

import org.lexcrawl.util.Ticker;

/**
 * Single-token bucket: grants at most one request per interval, in the order reservations are made.
 */
public class TokenBucket {
    private final Ticker ticker;
    private long nextFreeAt;
    private boolean used;

    public TokenBucket(Ticker ticker) {
        this.ticker = ticker;
    }

    /**
     * Reserves the next slot and spaces the one after it {@code intervalNanos} later.
     *
     * @return nanoseconds to wait before the reserved slot starts
     */
    public synchronized long reserve(long intervalNanos) {
        long now = ticker.nanoTime();
        long start = used && nextFreeAt - now > 0 ? nextFreeAt : now;
        nextFreeAt = start + intervalNanos;
        used = true;
        return start - now;
    }

    public void acquire(long intervalNanos) throws InterruptedException {
        ticker.sleep(reserve(intervalNanos));
    }
}
