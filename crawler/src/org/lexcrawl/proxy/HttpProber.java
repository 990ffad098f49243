package org.lexcrawl.proxy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Probes a proxy by fetching an address echo service through it.
 */
public class HttpProber implements Prober {
    private final ProxyClients clients;
    private final URI probeUrl;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock;

    public HttpProber(ProxyClients clients, URI probeUrl, Clock clock) {
        this.clients = clients;
        this.probeUrl = probeUrl;
        this.clock = clock;
    }

    @Override
    public ProbeResult probe(ProxyEndpoint endpoint, Duration timeout) {
        Instant testedAt = clock.instant();
        long start = System.nanoTime();
        try {
            var request = HttpRequest.newBuilder(probeUrl).timeout(timeout).GET().build();
            var response = clients.get(endpoint).send(request, HttpResponse.BodyHandlers.ofString());
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            if (response.statusCode() != 200) {
                return ProbeResult.failed(endpoint, elapsedMs, "HTTP " + response.statusCode(), testedAt);
            }
            String observed = parseOrigin(response.body());
            var status = observed != null && observed.equals(endpoint.address()) ? ProbeStatus.PERFECT
                    : ProbeStatus.WORKING;
            return new ProbeResult(endpoint.id(), endpoint.provider(), endpoint.address(), true, status, elapsedMs,
                    observed, null, testedAt);
        } catch (IOException | IllegalStateException | IllegalArgumentException e) {
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return ProbeResult.failed(endpoint, elapsedMs, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    testedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeResult.failed(endpoint, 0, "interrupted", testedAt);
        }
    }

    /**
     * Reads the caller address from {@code {"origin": "1.2.3.4"}} or a plain-text body. Chained proxies report
     * a comma separated list, of which the first entry is the client.
     */
    @Nullable String parseOrigin(String body) {
        String text = body.trim();
        if (text.startsWith("{")) {
            try {
                JsonNode origin = mapper.readTree(text).get("origin");
                if (origin == null || !origin.isTextual()) return null;
                text = origin.asText();
            } catch (JsonProcessingException e) {
                return null;
            }
        }
        int comma = text.indexOf(',');
        if (comma >= 0) text = text.substring(0, comma);
        text = text.trim();
        return text.isEmpty() ? null : text;
    }
}
