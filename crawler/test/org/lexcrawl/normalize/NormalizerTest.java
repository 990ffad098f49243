package org.lexcrawl.normalize;

import org.junit.jupiter.api.Test;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.identity.DocCategory;
import org.lexcrawl.util.MutableClock;
import org.lexcrawl.util.Url;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NormalizerTest {
    private final Normalizer normalizer = new Normalizer(new MutableClock(Instant.parse("2024-06-01T00:00:00Z")));
    private final SourceConfig source = new SourceConfig("BD", "http://bdlaws.minlaw.gov.bd/", "test", "ACT",
            null, null, List.of("Bangladesh Code"), null);
    private final RawContent raw = new RawContent(new Url("http://bdlaws.minlaw.gov.bd/act-11.html"), "text/html",
            "<html></html>".getBytes(StandardCharsets.UTF_8), 200, Strategy.DIRECT, Instant.EPOCH);

    @Test
    void acceptsAPlausibleDocument() {
        var fields = parsed(fields("  The Penal\n Code,   1860 ", 1860, null));
        assertEquals("The Penal Code, 1860", fields.title());
        assertEquals(1860, fields.year());
        assertEquals(DocCategory.ACT, fields.category(), "falls back to the source's default category");
    }

    @Test
    void rejectsNavigationTitles() {
        assertEquals("Sentinel title: 'Related Links'", rejected(fields("Related Links", null, null)));
        assertEquals("Sentinel title: 'Related Links'", rejected(fields("related  links:", null, null)));
        assertEquals("Sentinel title: 'Bangladesh Code'", rejected(fields("BANGLADESH CODE", null, null)));
        assertEquals("Empty title", rejected(fields("   ", null, null)));
        assertEquals("Empty title", rejected(fields(null, 2001, DocCategory.ACT)));
        assertTrue(rejected(fields("Act", null, null)).startsWith("Title too short"));
    }

    @Test
    void discardsImplausibleYears() {
        assertNull(parsed(fields("Some Ancient Charter", 1650, null)).year());
        assertNull(parsed(fields("Some Future Act", 2026, null)).year());
        assertEquals(2025, parsed(fields("Some Act for Next Year", 2025, null)).year());
    }

    @Test
    void unknownCategoryWithoutDefaultIsMisc() {
        var noDefault = new SourceConfig("BD", "http://x/", "test", "bogus", null, null, null, null);
        var outcome = normalizer.normalize(adapter(fields("A Document of Some Kind", null, null)), raw, noDefault);
        assertEquals(DocCategory.MISC, assertInstanceOf(NormalizeOutcome.Parsed.class, outcome).fields().category());
        assertEquals(DocCategory.ORDINANCE, parsed(fields("Some Ordinance", null, DocCategory.ORDINANCE)).category());
    }

    @Test
    void adapterFailuresAreRejections() {
        var failing = new SourceAdapter() {
            @Override
            public String id() {
                return "failing";
            }

            @Override
            public ParsedFields extract(RawContent raw, SourceConfig source) throws ExtractionException {
                throw new ExtractionException("no title element");
            }
        };
        var throwing = new SourceAdapter() {
            @Override
            public String id() {
                return "throwing";
            }

            @Override
            public ParsedFields extract(RawContent raw, SourceConfig source) {
                throw new NullPointerException("oops");
            }
        };
        var outcome = normalizer.normalize(failing, raw, source);
        assertEquals("failing: no title element", assertInstanceOf(NormalizeOutcome.Rejected.class, outcome).reason());
        outcome = normalizer.normalize(throwing, raw, source);
        assertTrue(assertInstanceOf(NormalizeOutcome.Rejected.class, outcome).reason().startsWith("throwing threw"));
    }

    private ParsedFields parsed(ParsedFields fields) {
        var outcome = normalizer.normalize(adapter(fields), raw, source);
        return assertInstanceOf(NormalizeOutcome.Parsed.class, outcome).fields();
    }

    private String rejected(ParsedFields fields) {
        var outcome = normalizer.normalize(adapter(fields), raw, source);
        return assertInstanceOf(NormalizeOutcome.Rejected.class, outcome).reason();
    }

    private static ParsedFields fields(String title, Integer year, DocCategory category) {
        return new ParsedFields(title, year, category, null, null, null, null, Map.of());
    }

    private static SourceAdapter adapter(ParsedFields fields) {
        return new SourceAdapter() {
            @Override
            public String id() {
                return "test";
            }

            @Override
            public ParsedFields extract(RawContent raw, SourceConfig source) {
                return fields;
            }
        };
    }
}
