package org.lexcrawl.normalize;

/**
 * An adapter could not find the fields it needs in a page.
 */
public class ExtractionException extends Exception {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
