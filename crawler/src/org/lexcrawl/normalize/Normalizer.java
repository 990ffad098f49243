package org.lexcrawl.normalize;

import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.identity.DocCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * Runs a source adapter and vets its output. Source HTML is inconsistent enough that adapters regularly pick up a
 * navigation label as the title; such results are rejected rather than stored.
 */
public class Normalizer {
    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);
    static final List<String> DEFAULT_SENTINELS = List.of(
            "Related Links", "Home", "Menu", "Main Menu", "Navigation", "Search", "Search Results", "Login",
            "Contact Us", "About Us", "Index", "Untitled", "Page Not Found", "404 Not Found", "Error",
            "Skip to main content", "Access Denied", "Just a moment...");
    static final int MIN_YEAR = 1700;
    static final int MIN_TITLE_LENGTH = 4;
    private final Clock clock;

    public Normalizer(Clock clock) {
        this.clock = clock;
    }

    public NormalizeOutcome normalize(SourceAdapter adapter, RawContent raw, SourceConfig source) {
        ParsedFields fields;
        try {
            fields = adapter.extract(raw, source);
        } catch (ExtractionException e) {
            return new NormalizeOutcome.Rejected(adapter.id() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Adapter {} failed on {}", adapter.id(), raw.url(), e);
            return new NormalizeOutcome.Rejected(adapter.id() + " threw " + e);
        }
        if (fields == null || fields.title() == null || fields.title().isBlank()) {
            return new NormalizeOutcome.Rejected("Empty title");
        }
        String title = TextHeuristics.collapseWhitespace(fields.title());
        if (title.length() < MIN_TITLE_LENGTH) {
            return new NormalizeOutcome.Rejected("Title too short: '" + title + "'");
        }
        String sentinel = matchSentinel(title, source);
        if (sentinel != null) {
            return new NormalizeOutcome.Rejected("Sentinel title: '" + sentinel + "'");
        }
        fields = fields.withTitle(title);

        Integer year = fields.year();
        int maxYear = clock.instant().atZone(ZoneOffset.UTC).getYear() + 1;
        if (year != null && (year < MIN_YEAR || year > maxYear)) {
            log.atDebug().addKeyValue("url", raw.url()).addKeyValue("year", year).log("Discarding implausible year");
            fields = fields.withYear(null);
        }
        if (fields.category() == null) {
            fields = fields.withCategory(DocCategory.parseOrDefault(source.defaultCategory(), DocCategory.MISC));
        }
        return new NormalizeOutcome.Parsed(fields);
    }

    static String matchSentinel(String title, SourceConfig source) {
        String normalized = comparable(title);
        for (String sentinel : source.sentinelTitles()) {
            if (comparable(sentinel).equals(normalized)) return sentinel;
        }
        for (String sentinel : DEFAULT_SENTINELS) {
            if (comparable(sentinel).equals(normalized)) return sentinel;
        }
        return null;
    }

    private static String comparable(String title) {
        return title.toLowerCase(Locale.ROOT).replaceAll("[\\p{Punct}\\s]+", " ").trim();
    }
}
