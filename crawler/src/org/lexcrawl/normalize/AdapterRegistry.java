package org.lexcrawl.normalize;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * Adapters by id: the built-in ones plus any found with {@link ServiceLoader}.
 */
public class AdapterRegistry {
    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);
    private final Map<String, SourceAdapter> adapters = new TreeMap<>();

    public AdapterRegistry() {
        register(new GenericHtmlAdapter());
        register(new BdLawsAdapter());
    }

    public static AdapterRegistry withServiceLoader() {
        var registry = new AdapterRegistry();
        for (SourceAdapter adapter : ServiceLoader.load(SourceAdapter.class)) {
            log.debug("Loaded adapter {} ({})", adapter.id(), adapter.getClass().getName());
            registry.register(adapter);
        }
        return registry;
    }

    public void register(SourceAdapter adapter) {
        adapters.put(adapter.id(), adapter);
    }

    public @Nullable SourceAdapter get(String id) {
        return adapters.get(id);
    }

    public Collection<String> ids() {
        return adapters.keySet();
    }
}
