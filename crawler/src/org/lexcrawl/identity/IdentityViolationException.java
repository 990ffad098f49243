package org.lexcrawl.identity;

/**
 * A global id was about to be issued twice. Allocation is atomic, so this means the store is corrupt or another
 * writer bypassed the sequence counters, and the run must stop.
 */
public class IdentityViolationException extends RuntimeException {
    public IdentityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
