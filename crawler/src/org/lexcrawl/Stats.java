package org.lexcrawl;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.identity.Document;
import org.lexcrawl.identity.DocumentDAO;

import java.io.PrintStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Read-only reports over the store.
 */
public class Stats {
    private final Database db;
    private final Clock clock;

    public Stats(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    public record Summary(long documents, long addedToday, DocumentDAO.PdfCount pdfs, FrontierTotals frontier) {
    }

    public Summary summary(@Nullable String country) {
        var startOfDay = LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay().toInstant(ZoneOffset.UTC);
        return new Summary(db.documents().count(country), db.documents().countCreatedSince(country, startOfDay),
                db.documents().pdfCount(country), FrontierTotals.of(db.frontier().countByState(country)));
    }

    public void print(@Nullable String country, boolean detailed, PrintStream out) {
        var summary = summary(country);
        out.printf("Documents: %d (added today: %d)%n", summary.documents(), summary.addedToday());
        var pdfs = summary.pdfs();
        out.printf("PDFs: %d of %d downloaded%s%n", pdfs.downloaded(), pdfs.withPdf(),
                pdfs.withPdf() == 0 ? "" : String.format(" (%.1f%%)", 100.0 * pdfs.downloaded() / pdfs.withPdf()));
        var frontier = summary.frontier();
        out.printf("Frontier: %d pending, %d leased, %d done, %d failed, %d parked%n",
                frontier.pending(), frontier.leased(), frontier.done(), frontier.failed(), frontier.parked());
        if (!detailed) return;

        out.println();
        out.println("By category:");
        for (var count : db.documents().countByCategory(country)) {
            out.printf("  %-14s %8d%n", count.docCategory(), count.count());
        }
        out.println("By year:");
        for (var count : db.documents().countByYear(country)) {
            out.printf("  %-14s %8d%n", count.docYear() == null ? "undated" : count.docYear(), count.count());
        }
        List<FrontierEntry> failed = db.frontier().listFailed(country, 20);
        if (!failed.isEmpty()) {
            out.println("Failed entries (first 20):");
            for (var entry : failed) {
                out.printf("  %s [%s x%d] %s%n", entry.url(), entry.errorKind(), entry.attempts(), entry.lastError());
            }
        }
    }

    public List<Document> search(String query, @Nullable String country, int limit) {
        return db.documents().search("%" + escapeLike(query.trim()) + "%", country, limit);
    }

    public void printSearch(String query, @Nullable String country, int limit, PrintStream out) {
        var results = search(query, country, limit);
        for (var document : results) {
            out.printf("%-22s %s%n", document.globalId(), document.titleFull());
            out.printf("%-22s %s%n", "", document.relativePath());
        }
        out.printf("%d result%s%n", results.size(), results.size() == 1 ? "" : "s");
    }

    static String escapeLike(String text) {
        return text.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }
}
