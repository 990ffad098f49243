package org.lexcrawl.proxy;

/**
 * A cloud provider call failed. For teardown this means the instance may still exist and be billed.
 */
public class FleetException extends Exception {
    public FleetException(String message) {
        super(message);
    }

    public FleetException(String message, Throwable cause) {
        super(message, cause);
    }
}
