package org.lexcrawl.fetch;

/**
 * How a URL is fetched.
 */
public enum Strategy {
    /** Plain HTTP request, no script execution. */
    DIRECT,
    /** Headless browser render, several times the cost of a direct fetch. */
    RENDERED
}
