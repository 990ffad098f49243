package org.lexcrawl.config;

import org.jetbrains.annotations.Nullable;

/**
 * Settings of one cloud provider the proxy fleet runs on. The API token is never part of the config, only the name
 * of the environment variable that holds it.
 *
 * @param type      provider implementation: {@code digitalocean} or {@code static}
 * @param apiUrl    base URL of the provider API
 * @param tokenEnv  environment variable holding the API token
 * @param size      instance size slug
 * @param image     instance image slug
 * @param proxyPort port the proxy software listens on
 * @param tag       tag applied to (and used to find) fleet instances
 * @param userData  cloud-init script that installs the proxy software
 */
public record ProviderConfig(
        String type,
        @Nullable String apiUrl,
        @Nullable String tokenEnv,
        @Nullable String size,
        @Nullable String image,
        int proxyPort,
        @Nullable String tag,
        @Nullable String userData) {
}
