package org.lexcrawl.fetch;

import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.normalize.RawContent;
import org.lexcrawl.proxy.ProxyClients;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * Plain HTTP GET through the proxy.
 */
public class DirectFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(DirectFetcher.class);
    private final ProxyClients clients;
    private final Duration timeout;
    private final String userAgent;
    private final Clock clock;

    public DirectFetcher(ProxyClients clients, Duration timeout, String userAgent, Clock clock) {
        this.clients = clients;
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.clock = clock;
    }

    @Override
    public FetchOutcome fetch(Url url, ProxyEndpoint proxy, SourceConfig source) throws InterruptedException {
        long start = System.nanoTime();
        HttpResponse<byte[]> response;
        try {
            var request = HttpRequest.newBuilder(url.toURI())
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/pdf;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();
            response = clients.get(proxy).send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            return FetchOutcome.Failed.transientError("Timed out after " + timeout.toSeconds() + "s");
        } catch (IOException e) {
            return FetchOutcome.Failed.transientError(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return FetchOutcome.Failed.permanent("Invalid URL: " + e.getMessage());
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        byte[] body = response.body();
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        String text = contentType != null && contentType.contains("pdf") ? ""
                : new String(body, StandardCharsets.UTF_8);
        var failure = ResponseRules.check(response.statusCode(), text, source.blockSignatures());
        if (failure != null) {
            log.atDebug().addKeyValue("url", url).addKeyValue("proxy", proxy).addKeyValue("status",
                    response.statusCode()).log(failure.error());
            return failure;
        }
        return new FetchOutcome.Fetched(new RawContent(url, contentType, body, response.statusCode(),
                Strategy.DIRECT, clock.instant()), elapsedMs);
    }
}
