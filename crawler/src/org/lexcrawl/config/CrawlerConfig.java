package org.lexcrawl.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Top-level configuration. Loaded from the bundled {@code defaults.yaml} deep-merged with the job's own file.
 */
public record CrawlerConfig(
        Map<String, SourceConfig> sources,
        CrawlSettings crawl,
        HealthConfig health,
        StorageConfig storage,
        FleetConfig fleet,
        ClassifierConfig classifier) {

    public static final String CONFIG_FILENAME = "lexcrawl.yaml";

    public CrawlerConfig {
        sources = sources == null ? Map.of() : Map.copyOf(sources);
        if (fleet == null) fleet = new FleetConfig(null);
        if (classifier == null) classifier = new ClassifierConfig(null);
        if (storage == null) storage = new StorageConfig(null, null);
    }

    public static ObjectMapper yamlMapper() {
        return YAMLMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .findAndAddModules()
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .build();
    }

    /**
     * Loads the defaults merged with {@code configFile}, or with {@code lexcrawl.yaml} in the job directory if no
     * file is given and one exists there.
     */
    public static CrawlerConfig load(Path jobDir, @Nullable Path configFile) throws IOException {
        var mapper = yamlMapper();
        JsonNode tree = defaultsTree(mapper);
        if (configFile == null && jobDir != null && Files.exists(jobDir.resolve(CONFIG_FILENAME))) {
            configFile = jobDir.resolve(CONFIG_FILENAME);
        }
        if (configFile != null) {
            tree = deepMerge(tree, mapper.readTree(configFile.toFile()));
        }
        return mapper.treeToValue(tree, CrawlerConfig.class);
    }

    /**
     * The bundled defaults on their own, with no sources configured.
     */
    public static CrawlerConfig defaults() {
        var mapper = yamlMapper();
        try {
            return mapper.treeToValue(defaultsTree(mapper), CrawlerConfig.class);
        } catch (IOException e) {
            throw new IllegalStateException("Bundled defaults.yaml is invalid", e);
        }
    }

    private static JsonNode defaultsTree(ObjectMapper mapper) throws IOException {
        try (InputStream stream = Objects.requireNonNull(CrawlerConfig.class.getResourceAsStream("defaults.yaml"),
                "missing defaults.yaml")) {
            return mapper.readTree(stream);
        }
    }

    static JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (override == null || override.isMissingNode() || override.isNull()) return base;
        if (!base.isObject() || !override.isObject()) {
            // for simple values or arrays, always take override
            return override;
        }
        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            String key = entry.getKey();
            JsonNode baseValue = merged.get(key);
            merged.set(key, baseValue != null ? deepMerge(baseValue, entry.getValue()) : entry.getValue());
        });
        return merged;
    }

    /**
     * Finds the sources for a country code, or every source for {@code all}.
     */
    public Map<String, SourceConfig> sourcesFor(String country) {
        if (country == null || country.equalsIgnoreCase("all")) return sources;
        String code = country.toUpperCase(Locale.ROOT);
        var matching = new java.util.LinkedHashMap<String, SourceConfig>();
        sources.forEach((id, source) -> {
            if (code.equals(source.countryCode())) matching.put(id, source);
        });
        return matching;
    }

    public CrawlerConfig withCrawl(CrawlSettings crawl) {
        return new CrawlerConfig(sources, crawl, health, storage, fleet, classifier);
    }

    public CrawlerConfig withSources(Map<String, SourceConfig> sources) {
        return new CrawlerConfig(sources, crawl, health, storage, fleet, classifier);
    }

    public CrawlerConfig withHealth(HealthConfig health) {
        return new CrawlerConfig(sources, crawl, health, storage, fleet, classifier);
    }
}
