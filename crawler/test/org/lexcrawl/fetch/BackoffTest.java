package org.lexcrawl.fetch;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertTrue;

class BackoffTest {
    @Test
    void delayGrowsExponentiallyUpToTheCap() {
        var backoff = new Backoff(Duration.ofSeconds(2), Duration.ofMinutes(1), new Random(1));
        for (int round = 0; round < 50; round++) {
            assertBetween(backoff.delay(1), 1000, 2000);
            assertBetween(backoff.delay(2), 2000, 4000);
            assertBetween(backoff.delay(3), 4000, 8000);
            assertBetween(backoff.delay(10), 30_000, 60_000);
            assertBetween(backoff.delay(500), 30_000, 60_000);
        }
    }

    @Test
    void zeroBaseMeansNoDelay() {
        var backoff = new Backoff(Duration.ZERO, Duration.ofMinutes(1), new Random(1));
        assertTrue(backoff.delay(3).isZero());
    }

    private static void assertBetween(Duration delay, long minMillis, long maxMillis) {
        long millis = delay.toMillis();
        assertTrue(millis >= minMillis && millis <= maxMillis, millis + " not in [" + minMillis + ", " + maxMillis + "]");
    }
}
