package org.lexcrawl.util;

/**
 * Simulated time: sleeping advances the clock instantly.
 */
public class ManualTicker implements Ticker {
    private long now;

    @Override
    public synchronized long nanoTime() {
        return now;
    }

    @Override
    public synchronized void sleep(long nanos) {
        if (nanos > 0) now += nanos;
    }

    public synchronized void advance(long nanos) {
        now += nanos;
    }
}
