package org.lexcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.jetbrains.annotations.Nullable;
import org.lexcrawl.util.DurationDeserializer;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * One national legal document source.
 *
 * @param countryCode     ISO 3166 alpha-2 code, also the first part of every global id from this source
 * @param baseUrl         site root
 * @param adapter         id of the extraction adapter, see {@link org.lexcrawl.normalize.AdapterRegistry}
 * @param defaultCategory document category used when the adapter can't tell (e.g. {@code ACT} or {@code CAS})
 * @param requestDelay    minimum spacing between two requests through the same proxy
 * @param seeds           URLs enqueued when a scrape of this source starts
 * @param sentinelTitles  titles that mean the adapter picked up navigation instead of the document
 * @param blockSignatures body fragments that identify a block or captcha page
 */
public record SourceConfig(
        String countryCode,
        String baseUrl,
        String adapter,
        @Nullable String defaultCategory,
        @JsonDeserialize(using = DurationDeserializer.class) @Nullable Duration requestDelay,
        @Nullable List<String> seeds,
        @Nullable List<String> sentinelTitles,
        @Nullable List<String> blockSignatures) {

    public SourceConfig {
        if (countryCode != null) countryCode = countryCode.toUpperCase(Locale.ROOT);
        if (adapter == null) adapter = "generic-html";
        if (requestDelay == null) requestDelay = Duration.ZERO;
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
        sentinelTitles = sentinelTitles == null ? List.of() : List.copyOf(sentinelTitles);
        blockSignatures = blockSignatures == null ? List.of() : List.copyOf(blockSignatures);
    }
}
