package org.lexcrawl.proxy;

import org.jetbrains.annotations.Nullable;

/**
 * An instance as reported by a fleet provider.
 *
 * @param address public address, null while the instance is still being created
 */
public record ProvisionedProxy(String provider, String externalId, @Nullable String name, @Nullable String address,
                               int port, @Nullable String region) {
}
