package org.lexcrawl.proxy;

import org.lexcrawl.config.FleetConfig;

import java.net.http.HttpClient;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

public final class FleetProviders {
    private FleetProviders() {
    }

    /**
     * Instantiates the configured providers by name.
     */
    public static Map<String, FleetProvider> create(FleetConfig config, HttpClient httpClient,
                                                    Function<String, String> env) {
        var providers = new LinkedHashMap<String, FleetProvider>();
        config.providers().forEach((name, providerConfig) -> {
            String type = providerConfig.type() == null ? "static" : providerConfig.type();
            switch (type) {
                case "digitalocean" -> providers.put(name, new DigitalOceanFleet(name, providerConfig, httpClient, env));
                case "static" -> providers.put(name, new StaticFleet(name));
                default -> throw new IllegalArgumentException("Unknown fleet provider type '" + type + "' for " + name);
            }
        });
        return providers;
    }
}
