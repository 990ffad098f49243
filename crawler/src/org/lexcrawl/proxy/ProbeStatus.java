package org.lexcrawl.proxy;

public enum ProbeStatus {
    /** The echo service saw the proxy's own address. */
    PERFECT,
    /** The request succeeded but came out from some other address, e.g. a chained or transparent proxy. */
    WORKING,
    FAILED
}
