package org.lexcrawl.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of one probe round, written as JSON by {@code proxies probe --report}.
 */
public record HealthReport(Instant timestamp, Summary summary, Map<String, ProviderSummary> byProvider,
                           List<ProbeResult> results) {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public record Summary(int total, int working, int failed, int perfect, double avgResponseTimeSec) {
    }

    public record ProviderSummary(int total, int working) {
    }

    public void write(Path file) throws IOException {
        MAPPER.writeValue(file.toFile(), this);
    }

    public static HealthReport of(Instant timestamp, List<ProbeResult> results) {
        int working = 0;
        int perfect = 0;
        long totalMs = 0;
        var byProvider = new TreeMap<String, int[]>();
        for (var result : results) {
            var counts = byProvider.computeIfAbsent(result.provider(), p -> new int[2]);
            counts[0]++;
            if (result.success()) {
                working++;
                counts[1]++;
                totalMs += result.responseTimeMs();
                if (result.status() == ProbeStatus.PERFECT) perfect++;
            }
        }
        double avgSec = working == 0 ? 0 : totalMs / (double) working / 1000.0;
        var providers = new TreeMap<String, ProviderSummary>();
        byProvider.forEach((provider, counts) -> providers.put(provider, new ProviderSummary(counts[0], counts[1])));
        return new HealthReport(timestamp, new Summary(results.size(), working, results.size() - working, perfect,
                Math.round(avgSec * 1000) / 1000.0), providers, results);
    }
}
