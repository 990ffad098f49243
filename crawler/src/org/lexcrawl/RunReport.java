package org.lexcrawl;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts for one run of the worker pool, plus the frontier totals when it ended.
 *
 * @param newDocuments documents created by this run, as opposed to entries that resolved to an existing document
 * @param unconfirmed  outcomes whose database write failed, so the entry's state is not known to be recorded
 */
public record RunReport(long processed, long done, long newDocuments, long failed, long retried, long requeued,
                        long escalated, long parked, long unconfirmed, long pdfsDownloaded, long pending,
                        long leased, long totalDone, long totalFailed, long totalParked, boolean cancelled) {

    public boolean confirmed() {
        return unconfirmed == 0;
    }

    public void print(PrintStream out) {
        out.printf("Processed %d: done %d (%d new), failed %d, retrying %d, requeued %d, escalated %d, parked %d%n",
                processed, done, newDocuments, failed, retried, requeued, escalated, parked);
        out.printf("PDFs downloaded: %d%n", pdfsDownloaded);
        out.printf("Frontier: %d done, %d failed, %d pending, %d leased, %d parked for adapter fix%n",
                totalDone, totalFailed, pending, leased, totalParked);
        if (cancelled) out.println("Run was cancelled.");
        if (!confirmed()) {
            out.printf("WARNING: %d writes could not be confirmed; the run is incomplete.%n", unconfirmed);
        }
    }

    /**
     * Live counters updated by the workers.
     */
    static class Counters {
        final AtomicLong processed = new AtomicLong();
        final AtomicLong done = new AtomicLong();
        final AtomicLong newDocuments = new AtomicLong();
        final AtomicLong failed = new AtomicLong();
        final AtomicLong retried = new AtomicLong();
        final AtomicLong requeued = new AtomicLong();
        final AtomicLong escalated = new AtomicLong();
        final AtomicLong parked = new AtomicLong();
        final AtomicLong unconfirmed = new AtomicLong();
        final AtomicLong pdfsDownloaded = new AtomicLong();

        RunReport toReport(FrontierTotals totals, boolean cancelled) {
            return new RunReport(processed.get(), done.get(), newDocuments.get(), failed.get(), retried.get(),
                    requeued.get(), escalated.get(), parked.get(), unconfirmed.get(), pdfsDownloaded.get(),
                    totals.pending(), totals.leased(), totals.done(), totals.failed(), totals.parked(), cancelled);
        }
    }
}
