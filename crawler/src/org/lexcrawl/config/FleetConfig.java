package org.lexcrawl.config;

import java.util.Map;

public record FleetConfig(Map<String, ProviderConfig> providers) {
    public FleetConfig {
        providers = providers == null ? Map.of() : Map.copyOf(providers);
    }
}
