package org.lexcrawl;

/**
 * What the worker pool does about a failed fetch or extraction.
 */
public enum ErrorKind {
    /** Timeouts, resets, 5xx and 429. Retried with backoff through a different proxy. */
    TRANSIENT,
    /** 404, 410, other 4xx and block pages. The entry fails without further retries. */
    PERMANENT,
    /** The page was fetched but extraction produced nothing usable. Parked until the adapter is fixed. */
    PARSE
}
