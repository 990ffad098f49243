package org.lexcrawl.proxy;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * @param observedExternalAddress the address the echo service saw the request come from
 */
public record ProbeResult(
        long endpointId,
        String provider,
        @Nullable String address,
        boolean success,
        ProbeStatus status,
        long responseTimeMs,
        @Nullable String observedExternalAddress,
        @Nullable String error,
        @JsonIgnore Instant testedAt) {

    public static ProbeResult failed(ProxyEndpoint endpoint, long responseTimeMs, String error, Instant testedAt) {
        return new ProbeResult(endpoint.id(), endpoint.provider(), endpoint.address(), false, ProbeStatus.FAILED,
                responseTimeMs, null, error, testedAt);
    }
}
