package org.lexcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.lexcrawl.util.DurationDeserializer;

import java.time.Duration;

/**
 * @param probeUrl    echo service that reports the caller's address, as JSON {@code {"origin": ...}} or plain text
 * @param timeout     per-probe timeout
 * @param concurrency probes in flight at once
 * @param interval    how often the working set is refreshed during a scrape
 */
public record HealthConfig(
        String probeUrl,
        @JsonDeserialize(using = DurationDeserializer.class) Duration timeout,
        int concurrency,
        @JsonDeserialize(using = DurationDeserializer.class) Duration interval) {
}
