package org.lexcrawl.fetch;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lexcrawl.ErrorKind;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.proxy.ProxyClients;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.util.Url;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DirectFetcherTest {
    private HttpServer server;
    private DirectFetcher fetcher;
    private final SourceConfig source = new SourceConfig("BD", "http://localhost/", "generic-html", null, null,
            null, null, List.of("Access Denied"));

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        respond("/act-11.html", 200, "text/html; charset=utf-8", "<title>The Penal Code, 1860</title>");
        respond("/gone", 404, "text/plain", "not found");
        respond("/busy", 503, "text/plain", "try later");
        respond("/blocked", 200, "text/html", "<h1>Access Denied</h1>");
        server.start();
        fetcher = new DirectFetcher(new ProxyClients(name -> null, Duration.ofSeconds(5)), Duration.ofSeconds(5),
                "lexcrawl-test", Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void fetchesDirectly() throws InterruptedException {
        var outcome = fetcher.fetch(url("/act-11.html"), ProxyEndpoint.DIRECT, source);
        var fetched = assertInstanceOf(FetchOutcome.Fetched.class, outcome);
        assertEquals(200, fetched.content().status());
        assertEquals(Strategy.DIRECT, fetched.content().strategy());
        assertTrue(fetched.content().text().contains("Penal Code"));
    }

    @Test
    void classifiesFailures() throws InterruptedException {
        assertEquals(ErrorKind.PERMANENT, failure("/gone").kind());
        assertEquals(ErrorKind.TRANSIENT, failure("/busy").kind());
        assertEquals(ErrorKind.PERMANENT, failure("/blocked").kind());
    }

    @Test
    void connectionRefusedIsTransient() throws Exception {
        int port;
        try (var socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        var outcome = fetcher.fetch(new Url("http://127.0.0.1:" + port + "/x"), ProxyEndpoint.DIRECT, source);
        assertEquals(ErrorKind.TRANSIENT, assertInstanceOf(FetchOutcome.Failed.class, outcome).kind());
    }

    private FetchOutcome.Failed failure(String path) throws InterruptedException {
        return assertInstanceOf(FetchOutcome.Failed.class, fetcher.fetch(url(path), ProxyEndpoint.DIRECT, source));
    }

    private Url url(String path) {
        return new Url("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }

    private void respond(String path, int status, String contentType, String body) {
        server.createContext(path, exchange -> {
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", contentType);
            exchange.sendResponseHeaders(status, bytes.length);
            try (var out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
    }
}
