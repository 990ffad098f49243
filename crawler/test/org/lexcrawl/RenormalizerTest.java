package org.lexcrawl;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.lexcrawl.config.CrawlerConfig;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.identity.DocCategory;
import org.lexcrawl.identity.IdentityService;
import org.lexcrawl.normalize.AdapterRegistry;
import org.lexcrawl.normalize.ExtractionException;
import org.lexcrawl.normalize.ParsedFields;
import org.lexcrawl.normalize.RawContent;
import org.lexcrawl.normalize.SourceAdapter;
import org.lexcrawl.util.MutableClock;
import org.lexcrawl.util.Url;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class RenormalizerTest {
    private static final String URL = "http://bdlaws.example/act-11.html";
    private final Database database;
    private final FixableAdapter adapter = new FixableAdapter();
    private MutableClock clock;
    private Frontier frontier;
    private RawStore rawStore;
    private Renormalizer renormalizer;

    @TempDir
    Path jobDir;

    RenormalizerTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() throws IOException {
        InMemoryDatabaseTestExtension.clear(database);
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        frontier = new Frontier(database, new IdentityService(database, clock), clock, 5);
        rawStore = new RawStore(jobDir, "test", 1, clock);
        var source = new SourceConfig("BD", "http://bdlaws.example/", adapter.id(), "ACT", null, null, null, null);
        var config = CrawlerConfig.defaults().withSources(Map.of("bdlaws", source));
        var adapters = new AdapterRegistry();
        adapters.register(adapter);
        renormalizer = new Renormalizer(database, frontier, rawStore, adapters, config, clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        rawStore.close();
    }

    @Test
    void parkedEntryIsRecoveredOnceTheAdapterIsFixed() throws IOException {
        frontier.enqueue("bdlaws", "BD", List.of(URL));
        var entry = frontier.leaseNext("w", Duration.ofMinutes(5), null);
        String ref = rawStore.save(new RawContent(entry.url(), "text/html",
                "<h1>The Penal Code, 1860</h1>".getBytes(StandardCharsets.UTF_8), 200, Strategy.RENDERED,
                clock.instant()));
        frontier.park(entry, "No title found", ref, Duration.ofDays(1));

        var stillBroken = renormalizer.run("BD");
        assertEquals(new Renormalizer.Result(0, 1, 0, 0, 0), stillBroken);
        assertEquals(1, frontier.totals("BD").parked());

        adapter.fixed = true;
        var result = renormalizer.run("BD");
        assertEquals(1, result.recovered());
        assertEquals(1, result.unchanged(), "the recovered document is then compared with itself");
        var document = database.documents().findBySourceUrl(URL);
        assertEquals("BD-ACT-1860-0001", document.globalId());
        assertEquals(ref, document.rawContentRef());
        assertEquals(FrontierEntry.State.DONE, database.frontier().findById(entry.id()).state());

        assertEquals(new Renormalizer.Result(0, 0, 0, 1, 0), renormalizer.run(null));
    }

    @Test
    void refreshedDocumentsKeepTheirIdentity() throws IOException {
        frontier.enqueue("bdlaws", "BD", List.of(URL));
        var entry = frontier.leaseNext("w", Duration.ofMinutes(5), null);
        String ref = rawStore.save(new RawContent(entry.url(), "text/html",
                "<h1>The Penal Code, 1860</h1>".getBytes(StandardCharsets.UTF_8), 200, Strategy.DIRECT,
                clock.instant()));
        adapter.fixed = true;
        var fields = adapter.fields();
        frontier.complete(entry, Worker.draft(entry, new SourceConfig("BD", null, null, null, null, null, null, null),
                fields.withTitle("Penal Code"), ref, null));
        var before = database.documents().findBySourceUrl(URL);

        var result = renormalizer.run("BD");
        assertEquals(1, result.updated());
        var after = database.documents().findBySourceUrl(URL);
        assertEquals("The Penal Code, 1860", after.titleFull());
        assertEquals(before.globalId(), after.globalId());
        assertEquals(before.filename(), after.filename());
        assertEquals(before.uuid(), after.uuid());
    }

    @Test
    void unreadableRawContentIsSkipped() {
        frontier.enqueue("bdlaws", "BD", List.of(URL));
        var entry = frontier.leaseNext("w", Duration.ofMinutes(5), null);
        frontier.park(entry, "No title found", "missing.warc.gz@0", Duration.ofDays(1));
        adapter.fixed = true;

        var result = renormalizer.run(null);
        assertEquals(1, result.skipped());
        assertEquals(1, frontier.totals(null).parked());
    }

    private static class FixableAdapter implements SourceAdapter {
        volatile boolean fixed;

        @Override
        public String id() {
            return "fixable";
        }

        @Override
        public ParsedFields extract(RawContent raw, SourceConfig source) throws ExtractionException {
            if (!fixed) throw new ExtractionException("No title found");
            return fields();
        }

        ParsedFields fields() {
            return new ParsedFields("The Penal Code, 1860", 1860, DocCategory.ACT, "whoever commits theft", null,
                    null, "Penal Code", Map.of("actNumber", "XLV"));
        }
    }
}
