package org.lexcrawl.proxy;

import org.jetbrains.annotations.Nullable;

/**
 * Null fields match anything.
 */
public record ProxyFilter(@Nullable ProxyEndpoint.State state, @Nullable String provider, @Nullable String region) {
    public static final ProxyFilter ALL = new ProxyFilter(null, null, null);

    public static ProxyFilter state(ProxyEndpoint.State state) {
        return new ProxyFilter(state, null, null);
    }

    public static ProxyFilter provider(String provider) {
        return new ProxyFilter(null, provider, null);
    }
}
