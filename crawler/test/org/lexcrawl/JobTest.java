package org.lexcrawl;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.lexcrawl.config.CrawlerConfig;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.fetch.FetchOutcome;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.normalize.RawContent;
import org.lexcrawl.proxy.ProbeResult;
import org.lexcrawl.util.ManualTicker;
import org.lexcrawl.util.Url;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class JobTest {
    private static final String PENAL_CODE = """
            <html><head><title>The Penal Code, 1860</title></head>
            <body><nav>Home | Acts | Search</nav>
            <h1>The Penal Code, 1860</h1>
            <p>(Act No. XLV of 1860)</p>
            <p>Whereas it is expedient to provide a general Penal Code for Bangladesh.</p>
            <a href="/files/penal-code.pdf">Download PDF</a>
            </body></html>""";
    private static final String NAVIGATION = """
            <html><head><title>Related Links</title></head>
            <body><ul><li><a href="/">Home</a></li></ul></body></html>""";

    private final Database database;
    @TempDir
    Path jobDir;
    private HttpServer server;
    private String baseUrl;
    private final AtomicInteger renderedFetches = new AtomicInteger();

    JobTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() throws IOException {
        InMemoryDatabaseTestExtension.clear(database);
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        serve("/doc/42", 200, "text/html; charset=utf-8", PENAL_CODE.getBytes(StandardCharsets.UTF_8));
        serve("/doc/43", 404, "text/html", "Not Found".getBytes(StandardCharsets.UTF_8));
        serve("/doc/44", 200, "text/html", NAVIGATION.getBytes(StandardCharsets.UTF_8));
        serve("/files/penal-code.pdf", 200, "application/pdf", "%PDF-1.4 test".getBytes(StandardCharsets.US_ASCII));
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void scrapeAndRescrape() throws Exception {
        var config = config(true);

        RunReport first;
        try (var job = job(config)) {
            first = job.run("BD", null, false);
            assertEquals(Job.State.FINISHED, job.state());
        }
        assertEquals(1, first.done());
        assertEquals(1, first.newDocuments());
        assertEquals(1, first.failed(), "HTTP 404 fails permanently");
        assertEquals(1, first.escalated(), "the navigation page is retried rendered");
        assertEquals(1, first.parked(), "and parked once rendering doesn't help either");
        assertEquals(1, first.pdfsDownloaded());
        assertEquals(4, first.processed());
        assertTrue(first.confirmed());
        assertEquals(1, renderedFetches.get());

        var document = database.documents().findBySourceUrl(baseUrl + "/doc/42");
        assertEquals("BD-ACT-1860-0001", document.globalId());
        assertEquals("BD_ACT_1860_0001_Penal_Code_CRM", document.filename());
        assertEquals("CRM", document.subjectCode());
        assertTrue(document.pdfDownloaded());
        Path pdf = jobDir.resolve("pdfs/BD/ACT/1851-1900/BD_ACT_1860_0001_Penal_Code_CRM.pdf");
        assertTrue(Files.exists(pdf), pdf + " missing");

        var parked = database.frontier().findByUrl(new Url(baseUrl + "/doc/44"));
        assertTrue(parked.isParked());
        assertEquals(Strategy.RENDERED, parked.strategy());
        assertNotNull(parked.rawContentRef());

        RunReport second;
        try (var job = job(config)) {
            second = job.run("BD", null, false);
        }
        assertEquals(0, second.newDocuments(), "rescraping must not create duplicate documents");
        assertEquals(0, second.processed());
        assertEquals(1, second.totalDone());
        assertEquals(1, second.totalFailed());
        assertEquals(1, second.totalParked());
        assertEquals(1, database.documents().count("BD"));
    }

    @Test
    void leaseLimitStopsTheRun() throws Exception {
        RunReport report;
        try (var job = job(config(true))) {
            report = job.run("BD", 1, false);
        }
        assertEquals(1, report.processed());
        assertEquals(1, report.totalDone(), "entries are leased oldest first");
        assertEquals(2, report.pending());
    }

    @Test
    void resumeSkipsSeeds() throws Exception {
        RunReport report;
        try (var job = job(config(true))) {
            report = job.run("BD", null, true);
        }
        assertEquals(0, report.processed());
        assertEquals(0, database.frontier().countActive(null));
    }

    @Test
    void setupErrors() throws Exception {
        try (var job = job(config(true))) {
            assertThrows(SetupException.class, () -> job.run("IN", null, false));
        }
        try (var job = job(config(false))) {
            var e = assertThrows(SetupException.class, () -> job.run("BD", null, false));
            assertTrue(e.getMessage().contains("No healthy proxies"));
        }
        var unknownAdapter = config(true).withSources(Map.of("test", new SourceConfig("BD", baseUrl, "nope", null,
                null, List.of(baseUrl + "/doc/42"), null, null)));
        try (var job = job(unknownAdapter)) {
            assertThrows(SetupException.class, () -> job.run("BD", null, false));
        }
    }

    @Test
    void cancellingMidRunLeavesNothingLeased() throws Exception {
        var fetching = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var result = new AtomicReference<RunReport>();
        try (var job = job(config(true))) {
            job.useFetcher(Strategy.DIRECT, (url, proxy, source) -> {
                fetching.countDown();
                release.await();
                return FetchOutcome.Failed.transientError("connection reset");
            });
            var runner = new Thread(() -> {
                try {
                    result.set(job.run("BD", null, false));
                } catch (Exception e) {
                    throw new RuntimeException(e);
                }
            });
            runner.start();
            assertTrue(fetching.await(10, TimeUnit.SECONDS));
            job.cancel();
            release.countDown();
            assertTrue(job.awaitFinished(Duration.ofSeconds(10)));
            runner.join(10_000);
        }
        var report = result.get();
        assertNotNull(report);
        assertTrue(report.cancelled());
        assertEquals(0, report.leased());
        assertEquals(0, report.totalDone());
        for (String path : List.of("/doc/42", "/doc/43", "/doc/44")) {
            var entry = database.frontier().findByUrl(new Url(baseUrl + path));
            assertEquals(FrontierEntry.State.PENDING, entry.state(), path);
            assertEquals(0, entry.attempts(), path + " must not lose an attempt to cancellation");
        }
    }

    @Test
    void failedPdfBookkeepingDoesNotKillTheWorker() throws Exception {
        database.useHandle(handle -> handle.execute("""
                CREATE TRIGGER reject_pdf_flag BEFORE UPDATE OF pdf_downloaded ON documents
                BEGIN SELECT RAISE(ABORT, 'disk I/O error'); END"""));
        RunReport report;
        try (var job = job(config(true))) {
            report = job.run("BD", null, false);
        } finally {
            database.useHandle(handle -> handle.execute("DROP TRIGGER reject_pdf_flag"));
        }
        assertEquals(4, report.processed(), "the worker keeps going after the failed write");
        assertEquals(1, report.done());
        assertEquals(1, report.unconfirmed());
        assertFalse(report.confirmed());
        assertEquals(0, report.requeued(), "a DONE entry is never requeued");
        var entry = database.frontier().findByUrl(new Url(baseUrl + "/doc/42"));
        assertEquals(FrontierEntry.State.DONE, entry.state());
        assertFalse(database.documents().findBySourceUrl(baseUrl + "/doc/42").pdfDownloaded());
    }

    private Job job(CrawlerConfig config) throws IOException {
        var job = new Job(jobDir, config, database, Clock.systemUTC(), new ManualTicker(), name -> null,
                (endpoint, timeout) -> ProbeResult.failed(endpoint, 0, "no proxies in tests", Instant.now()));
        job.useFetcher(Strategy.RENDERED, (url, proxy, source) -> {
            renderedFetches.incrementAndGet();
            return new FetchOutcome.Fetched(new RawContent(url, "text/html",
                    NAVIGATION.getBytes(StandardCharsets.UTF_8), 200, Strategy.RENDERED, Instant.now()), 1);
        });
        return job;
    }

    private CrawlerConfig config(boolean allowDirect) {
        var defaults = CrawlerConfig.defaults();
        var source = new SourceConfig("BD", baseUrl, "generic-html", "ACT", null,
                List.of(baseUrl + "/doc/42", baseUrl + "/doc/43", baseUrl + "/doc/44"), null, null);
        return defaults.withSources(Map.of("test", source))
                .withCrawl(defaults.crawl()
                        .withAllowDirect(allowDirect)
                        .withConcurrency(2)
                        .withIdleDelay(Duration.ofMillis(10))
                        .withBackoff(Duration.ZERO, Duration.ZERO));
    }

    private void serve(String path, int status, String contentType, byte[] body) {
        server.createContext(path, exchange -> {
            exchange.getResponseHeaders().add("Content-Type", contentType);
            exchange.sendResponseHeaders(status, body.length);
            try (var out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
    }
}
