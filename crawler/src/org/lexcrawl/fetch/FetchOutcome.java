package org.lexcrawl.fetch;

import org.lexcrawl.ErrorKind;
import org.lexcrawl.normalize.RawContent;

/**
 * Result of one fetch. Failures carry the kind that decides whether the worker retries.
 */
public sealed interface FetchOutcome permits FetchOutcome.Fetched, FetchOutcome.Failed {

    record Fetched(RawContent content, long elapsedMs) implements FetchOutcome {
    }

    record Failed(ErrorKind kind, String error) implements FetchOutcome {
        public static Failed transientError(String error) {
            return new Failed(ErrorKind.TRANSIENT, error);
        }

        public static Failed permanent(String error) {
            return new Failed(ErrorKind.PERMANENT, error);
        }
    }
}
