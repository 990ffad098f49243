package org.lexcrawl;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.config.CrawlerConfig;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.identity.Document;
import org.lexcrawl.identity.DocumentNamer;
import org.lexcrawl.normalize.AdapterRegistry;
import org.lexcrawl.normalize.NormalizeOutcome;
import org.lexcrawl.normalize.Normalizer;
import org.lexcrawl.normalize.ParsedFields;
import org.lexcrawl.normalize.RawContent;
import org.lexcrawl.normalize.SourceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Applies the current adapters to archived raw content, without refetching anything.
 * <p>
 * Parked entries whose content now normalizes are completed as if freshly fetched. Existing documents get their
 * descriptive fields refreshed; their global id and filename never change, since other tooling keys on them.
 */
public class Renormalizer {
    private static final Logger log = LoggerFactory.getLogger(Renormalizer.class);
    static final String OWNER = "renormalizer";
    private final Database db;
    private final Frontier frontier;
    private final RawStore rawStore;
    private final AdapterRegistry adapters;
    private final Normalizer normalizer;
    private final CrawlerConfig config;
    private final DocumentNamer namer = new DocumentNamer();
    private final Clock clock;

    public Renormalizer(Database db, Frontier frontier, RawStore rawStore, AdapterRegistry adapters,
                        CrawlerConfig config, Clock clock) {
        this.db = db;
        this.frontier = frontier;
        this.rawStore = rawStore;
        this.adapters = adapters;
        this.normalizer = new Normalizer(clock);
        this.config = config;
        this.clock = clock;
    }

    public record Result(int recovered, int stillParked, int updated, int unchanged, int skipped) {
    }

    public Result run(@Nullable String country) {
        int recovered = 0, stillParked = 0, updated = 0, unchanged = 0, skipped = 0;

        for (FrontierEntry parked : db.frontier().listParked(country)) {
            SourceConfig source = config.sources().get(parked.sourceId());
            SourceAdapter adapter = source == null ? null : adapters.get(source.adapter());
            if (adapter == null) {
                skipped++;
                continue;
            }
            var entry = db.frontier().leaseById(parked.id(), OWNER,
                    clock.instant().plus(config.crawl().leaseTtl()));
            if (entry == null) continue; // leased by a running scrape
            RawContent raw = load(entry.rawContentRef());
            if (raw == null) {
                frontier.park(entry, "Raw content unreadable", entry.rawContentRef(), Duration.ZERO);
                skipped++;
                continue;
            }
            var outcome = normalizer.normalize(adapter, raw, source);
            if (outcome instanceof NormalizeOutcome.Parsed parsed) {
                var assignment = frontier.complete(entry, Worker.draft(entry, source, parsed.fields(),
                        entry.rawContentRef(), entry.lastProxyId()));
                log.atInfo().addKeyValue("entry", entry.id()).addKeyValue("globalId", assignment.globalId())
                        .log("Recovered parked entry");
                recovered++;
            } else {
                frontier.park(entry, ((NormalizeOutcome.Rejected) outcome).reason(), entry.rawContentRef(),
                        config.crawl().parseRetryDelay());
                stillParked++;
            }
        }

        for (Document document : db.documents().list(country)) {
            SourceConfig source = config.sources().get(document.sourceId());
            SourceAdapter adapter = source == null ? null : adapters.get(source.adapter());
            RawContent raw = adapter == null ? null : load(document.rawContentRef());
            if (raw == null) {
                skipped++;
                continue;
            }
            var outcome = normalizer.normalize(adapter, raw, source);
            if (!(outcome instanceof NormalizeOutcome.Parsed parsed)) {
                log.atWarn().addKeyValue("globalId", document.globalId())
                        .log("Stored document no longer normalizes: {}", ((NormalizeOutcome.Rejected) outcome).reason());
                skipped++;
                continue;
            }
            if (refresh(document, parsed.fields())) {
                updated++;
            } else {
                unchanged++;
            }
        }
        var result = new Result(recovered, stillParked, updated, unchanged, skipped);
        log.info("Renormalization finished: {}", result);
        return result;
    }

    private boolean refresh(Document document, ParsedFields fields) {
        String titleShort = fields.titleShort() != null ? fields.titleShort() : namer.shortTitle(fields.title());
        String extra = Worker.extraJson(fields);
        if (!Objects.equals(fields.year(), document.docYear())) {
            log.atWarn().addKeyValue("globalId", document.globalId()).addKeyValue("storedYear", document.docYear())
                    .addKeyValue("parsedYear", fields.year())
                    .log("Parsed year differs from the one in the global id; keeping the id");
        }
        if (fields.title().equals(document.titleFull()) && titleShort.equals(document.titleShort())
            && Objects.equals(extra, document.parsedFields())
            && (fields.pdfUrl() == null || fields.pdfUrl().equals(document.pdfUrl()))) {
            return false;
        }
        db.documents().updateParsed(document.id(), fields.title(), titleShort, extra, fields.pdfUrl(),
                clock.instant());
        return true;
    }

    private @Nullable RawContent load(@Nullable String ref) {
        if (ref == null) return null;
        try {
            return rawStore.load(ref);
        } catch (IOException | IllegalArgumentException e) {
            log.atWarn().addKeyValue("ref", ref).log("Can't read raw content: {}", e.toString());
            return null;
        }
    }
}
