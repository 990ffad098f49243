package org.lexcrawl;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.lexcrawl.config.CrawlerConfig;
import org.lexcrawl.util.MutableClock;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LexCrawlTest {
    @TempDir
    Path jobDir;
    private ByteArrayOutputStream buffer;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        String[] withJobDir = new String[args.length + 2];
        withJobDir[0] = "-j";
        withJobDir[1] = jobDir.toString();
        System.arraycopy(args, 0, withJobDir, 2, args.length);
        var cli = new LexCrawl(new PrintStream(buffer, true, StandardCharsets.UTF_8), name -> null,
                new MutableClock(Instant.parse("2024-03-01T00:00:00Z")));
        return cli.run(withJobDir);
    }

    private String output() {
        String text = buffer.toString(StandardCharsets.UTF_8);
        buffer.reset();
        return text;
    }

    @Test
    void usageErrors() {
        assertEquals(LexCrawl.EXIT_USAGE, run());
        assertEquals(LexCrawl.EXIT_USAGE, run("frobnicate"));
        assertEquals(LexCrawl.EXIT_USAGE, run("scrape"));
        assertEquals(LexCrawl.EXIT_USAGE, run("scrape", "--country", "BD", "--limit", "many"));
        assertEquals(LexCrawl.EXIT_USAGE, run("stats", "--verbose"));
        assertEquals(LexCrawl.EXIT_OK, run("--help"));
        assertTrue(output().startsWith("Usage: lexcrawl"));
    }

    @Test
    void missingConfigFileIsASetupError() {
        assertEquals(LexCrawl.EXIT_SETUP, run("--config", jobDir.resolve("nope.yaml").toString(), "stats"));
        assertEquals(LexCrawl.EXIT_SETUP, run("enqueue", "--source", "unknown", "https://example.gov/1"));
    }

    @Test
    void enqueueAndStats() throws IOException {
        Files.writeString(jobDir.resolve(CrawlerConfig.CONFIG_FILENAME), """
                sources:
                  bdlaws:
                    countryCode: BD
                    baseUrl: "http://bdlaws.minlaw.gov.bd/"
                    adapter: bdlaws
                """);
        assertEquals(LexCrawl.EXIT_OK, run("stats"));
        assertTrue(output().contains("Documents: 0 (added today: 0)"));

        assertEquals(LexCrawl.EXIT_OK, run("enqueue", "--source", "bdlaws",
                "http://bdlaws.minlaw.gov.bd/act-11.html", "http://bdlaws.minlaw.gov.bd/act-12.html"));
        assertEquals("Enqueued 2 new URLs (0 already known)", output().trim());
        assertEquals(LexCrawl.EXIT_OK, run("enqueue", "--source", "bdlaws", "http://bdlaws.minlaw.gov.bd/act-11.html"));
        assertEquals("Enqueued 0 new URLs (1 already known)", output().trim());

        assertEquals(LexCrawl.EXIT_OK, run("stats", "--country", "bd"));
        assertTrue(output().contains("Frontier: 2 pending, 0 leased, 0 done, 0 failed, 0 parked"));
        assertEquals(LexCrawl.EXIT_OK, run("stats", "--country", "IN"));
        assertTrue(output().contains("Frontier: 0 pending"));

        assertEquals(LexCrawl.EXIT_OK, run("requeue-failed"));
        assertEquals("Requeued 0 failed entries", output().trim());
        assertEquals(LexCrawl.EXIT_OK, run("search", "penal"));
        assertEquals("0 results", output().trim());
    }

    @Test
    void reissuedGlobalIdExitsWithThree() throws IOException {
        var server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        byte[] page = """
                <html><head><title>The Penal Code, 1860</title></head>
                <body><h1>The Penal Code, 1860</h1>
                <p>Whereas it is expedient to provide a general Penal Code for Bangladesh.</p></body></html>"""
                .getBytes(StandardCharsets.UTF_8);
        server.createContext("/act/45", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
            exchange.sendResponseHeaders(200, page.length);
            try (var body = exchange.getResponseBody()) {
                body.write(page);
            }
        });
        server.start();
        try {
            String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
            Files.writeString(jobDir.resolve(CrawlerConfig.CONFIG_FILENAME), """
                    sources:
                      test:
                        countryCode: BD
                        baseUrl: "%s/"
                        adapter: generic-html
                        defaultCategory: ACT
                        seeds: ["%s/act/45"]
                    crawl:
                      allowDirect: true
                      concurrency: 1
                      idleDelay: 10ms
                    """.formatted(baseUrl, baseUrl));
            // a document holding the next id of a sequence whose counter was lost
            try (var db = Database.open(jobDir.resolve(LexCrawl.DB_FILENAME))) {
                db.useHandle(handle -> handle.execute("""
                        INSERT INTO documents (global_id, uuid, country_code, doc_category, doc_year, yearly_sequence,
                                               title_full, subject_code, source_url, source_id, filename,
                                               folder_path, created_at, updated_at)
                        VALUES ('BD-ACT-1860-0001', '0190f5a2-0000-7000-8000-000000000001', 'BD', 'ACT', 1860, 1,
                                'Older Copy', 'GEN', 'http://elsewhere.example/act/45', 'legacy',
                                'BD_ACT_1860_0001_Older_Copy_GEN', 'BD/ACT/1851-1900', 0, 0)"""));
            }

            assertEquals(LexCrawl.EXIT_UNCONFIRMED, run("scrape", "--country", "BD"));
            try (var db = Database.open(jobDir.resolve(LexCrawl.DB_FILENAME))) {
                assertEquals(1, db.documents().count("BD"), "the clashing document must not be written");
            }
        } finally {
            server.stop(0);
        }
    }

    @Test
    void proxyInventoryLifecycle() throws IOException {
        Path inventory = jobDir.resolve("proxies.json");
        Files.writeString(inventory, """
                {"proxies": [{"ip": "198.51.100.7", "region": "sgp", "proxy_url": "http://198.51.100.7:8080"}]}""");

        assertEquals(LexCrawl.EXIT_OK, run("proxies", "import", inventory.toString()));
        assertTrue(output().startsWith("Imported 1 proxies"));
        assertEquals(LexCrawl.EXIT_OK, run("proxies", "import", inventory.toString()));
        output();

        assertEquals(LexCrawl.EXIT_OK, run("proxies", "list"));
        String list = output();
        assertEquals(1, list.lines().count(), "re-importing must not duplicate: " + list);
        assertTrue(list.contains("PROVISIONING"), list);
        assertTrue(list.contains("198.51.100.7:8080"), list);

        assertEquals(LexCrawl.EXIT_SETUP, run("proxies", "provision", "static", "sgp", "2"));
        assertEquals(LexCrawl.EXIT_OK, run("proxies", "terminate", "1"));
        assertEquals("Terminated proxy 1", output().trim());
        assertEquals(LexCrawl.EXIT_OK, run("proxies", "list"));
        assertTrue(output().contains("TERMINATED"));
    }
}
