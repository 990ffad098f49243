package org.lexcrawl;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.identity.Assignment;
import org.lexcrawl.identity.DocumentDraft;
import org.lexcrawl.identity.IdentityService;
import org.lexcrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Locale;

/**
 * Durable queue of URLs with expiring leases.
 * <p>
 * A worker that crashes never releases its lease. The entry becomes leasable again once the lease expires, which
 * is what makes a killed run safe to resume.
 */
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);
    private final Database db;
    private final IdentityService identity;
    private final Clock clock;
    private final int maxAttempts;

    public Frontier(Database db, IdentityService identity, Clock clock, int maxAttempts) {
        this.db = db;
        this.identity = identity;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Adds URLs as pending entries. URLs already in the frontier, in any state, are left alone.
     *
     * @return the number of URLs that were new
     */
    public int enqueue(String sourceId, String countryCode, Collection<String> urls) {
        Instant now = clock.instant();
        String country = countryCode.toUpperCase(Locale.ROOT);
        return db.inTransaction(txn -> {
            int added = 0;
            for (String value : urls) {
                var url = new Url(value.trim()).withoutFragment();
                if (!url.isHttp() || !url.isValid()) {
                    log.warn("Not enqueueing invalid URL {}", value);
                    continue;
                }
                added += txn.frontier().add(url, country, sourceId, now);
            }
            return added;
        });
    }

    /**
     * Leases the next due entry, optionally restricted to one country.
     *
     * @return the leased entry, or null if nothing is due
     */
    public @Nullable FrontierEntry leaseNext(String workerId, Duration leaseTtl, @Nullable String country) {
        Instant now = clock.instant();
        return db.frontier().leaseNext(workerId, country, now, now.plus(leaseTtl));
    }

    /**
     * Records the document and marks the entry done in one transaction. Fails, leaving nothing written, if the
     * entry's lease has meanwhile passed to another worker.
     */
    public Assignment complete(FrontierEntry entry, DocumentDraft draft) {
        Assignment assignment = db.inTransaction(txn -> {
            Assignment result = identity.assignOrLookup(txn, draft);
            txn.frontier().complete(entry.id(), entry.leaseOwner(), draft.rawContentRef(), draft.proxyId());
            return result;
        });
        identity.remember(assignment);
        return assignment;
    }

    /**
     * Consumes an attempt. The entry fails for good on a permanent error or once the attempt ceiling is reached,
     * otherwise it becomes due again after {@code backoff}.
     *
     * @return the entry's new state
     */
    public FrontierEntry.State fail(FrontierEntry entry, ErrorKind kind, String error, @Nullable Long proxyId,
                                    Duration backoff) {
        int attempts = entry.attempts() + 1;
        boolean terminal = kind == ErrorKind.PERMANENT || attempts >= maxAttempts;
        var state = terminal ? FrontierEntry.State.FAILED : FrontierEntry.State.PENDING;
        Instant nextAttemptAt = terminal ? null : clock.instant().plus(backoff);
        db.frontier().fail(entry.id(), entry.leaseOwner(), state, error, kind, nextAttemptAt, proxyId);
        return state;
    }

    /**
     * Gives the entry back without consuming an attempt.
     */
    public void requeue(FrontierEntry entry) {
        db.frontier().requeue(entry.id(), entry.leaseOwner());
    }

    /**
     * Retries the entry with a heavier strategy after its content could not be extracted. No attempt is consumed.
     */
    public void escalate(FrontierEntry entry, Strategy strategy, String reason, @Nullable String rawContentRef) {
        db.frontier().escalate(entry.id(), entry.leaseOwner(), strategy, reason, rawContentRef);
    }

    /**
     * Parks an entry whose content was fetched but not extractable until the adapter is fixed. No attempt is
     * consumed and the raw content is kept for {@link Renormalizer}.
     */
    public void park(FrontierEntry entry, String reason, @Nullable String rawContentRef, Duration delay) {
        db.frontier().park(entry.id(), entry.leaseOwner(), reason, rawContentRef, clock.instant().plus(delay));
    }

    public int requeueFailed(@Nullable String country) {
        return db.frontier().requeueFailed(country);
    }

    /**
     * Number of entries that still need work, not counting parked ones.
     */
    public long countActive(@Nullable String country) {
        return db.frontier().countActive(country);
    }

    public FrontierTotals totals(@Nullable String country) {
        return FrontierTotals.of(db.frontier().countByState(country));
    }

    public void recordClassification(FrontierEntry entry, String classification) {
        db.frontier().setClassification(entry.id(), classification);
    }
}
