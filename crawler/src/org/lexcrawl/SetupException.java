package org.lexcrawl;

/**
 * The configuration or environment doesn't allow a run to start.
 */
public class SetupException extends Exception {
    public SetupException(String message) {
        super(message);
    }

    public SetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
