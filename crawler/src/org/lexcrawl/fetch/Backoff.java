package org.lexcrawl.fetch;

import java.time.Duration;
import java.util.Random;

/**
 * Capped exponential backoff with equal jitter: half the delay is fixed, the other half random.
 */
public class Backoff {
    private final Duration base;
    private final Duration max;
    private final Random random;

    public Backoff(Duration base, Duration max, Random random) {
        this.base = base;
        this.max = max;
        this.random = random;
    }

    /**
     * @param attempt the number of attempts made so far, starting at 1
     */
    public Duration delay(int attempt) {
        long exp = base.toMillis() << Math.min(Math.max(attempt - 1, 0), 30);
        long capped = Math.min(exp, max.toMillis());
        long half = capped / 2;
        long jitter;
        synchronized (random) {
            jitter = half == 0 ? 0 : (long) (random.nextDouble() * (capped - half));
        }
        return Duration.ofMillis(half + jitter);
    }
}
