package org.lexcrawl.proxy;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * An egress proxy, typically a small cloud VM running an HTTP proxy.
 *
 * @param externalId     the provider's id for the instance, null for imported static proxies
 * @param address        public IPv4 address, null until the provider has assigned one
 * @param credentialsRef name of the environment variable holding {@code user:password}, if the proxy needs auth
 */
public record ProxyEndpoint(
        long id,
        String provider,
        @Nullable String externalId,
        @Nullable String address,
        int port,
        @Nullable String region,
        @Nullable String credentialsRef,
        State state,
        Instant createdAt,
        @Nullable Instant lastTestedAt,
        @Nullable Long lastResponseTimeMs) {

    public static final long DIRECT_ID = 0;

    /**
     * Pseudo-endpoint for fetching without a proxy.
     */
    public static final ProxyEndpoint DIRECT = new ProxyEndpoint(DIRECT_ID, "direct", null, null, 0, null, null,
            State.ACTIVE, Instant.EPOCH, null, null);

    public enum State {
        PROVISIONING, ACTIVE, UNHEALTHY, TERMINATED
    }

    public boolean isDirect() {
        return id == DIRECT_ID;
    }

    public String proxyUrl() {
        return "http://" + address + ":" + port;
    }

    @Override
    public String toString() {
        return isDirect() ? "direct" : provider + "/" + id + "(" + address + ":" + port + ")";
    }
}
