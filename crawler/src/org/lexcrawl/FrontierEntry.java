package org.lexcrawl;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.util.Url;

import java.time.Instant;

/**
 * A URL awaiting fetch.
 *
 * @param attempts       fetch attempts consumed so far, never decreases
 * @param strategy       fetch strategy forced by an earlier escalation, overriding the classifier
 * @param classification how the URL was last classified
 * @param rawContentRef  archived content of the last fetch
 */
public record FrontierEntry(
        long id,
        Url url,
        String countryCode,
        String sourceId,
        State state,
        int attempts,
        @Nullable String lastError,
        @Nullable ErrorKind errorKind,
        @Nullable Strategy strategy,
        @Nullable String classification,
        @Nullable String leaseOwner,
        @Nullable Instant leaseExpiry,
        @Nullable Instant nextAttemptAt,
        @Nullable String rawContentRef,
        @Nullable Long lastProxyId,
        Instant timeAdded) {

    public enum State {
        PENDING, LEASED, DONE, FAILED
    }

    public boolean isParked() {
        return state == State.PENDING && errorKind == ErrorKind.PARSE;
    }
}
