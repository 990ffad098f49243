package org.lexcrawl.proxy;

import java.time.Duration;

@FunctionalInterface
public interface Prober {
    /**
     * Sends one request through the endpoint. Failures are reported in the result, not thrown.
     */
    ProbeResult probe(ProxyEndpoint endpoint, Duration timeout);
}
