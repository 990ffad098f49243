package org.lexcrawl.normalize;

import org.lexcrawl.config.SourceConfig;

/**
 * Site-specific field extraction. Implementations must be stateless and thread-safe. Additional adapters can be
 * registered through {@link java.util.ServiceLoader}.
 */
public interface SourceAdapter {
    /**
     * Identifier referenced by {@code sources.*.adapter} in the configuration.
     */
    String id();

    ParsedFields extract(RawContent raw, SourceConfig source) throws ExtractionException;
}
