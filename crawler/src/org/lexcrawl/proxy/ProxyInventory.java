package org.lexcrawl.proxy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jetbrains.annotations.Nullable;
import org.lexcrawl.util.Url;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Proxy inventory file exchanged with fleet tooling.
 * <p>
 * Written as {@code {"generatedAt", "totalProxies", "counts": {provider: n},
 * "providers": {provider: [{provider, ip, region, proxyUrl}]}}}. Reading also accepts the older flat form
 * {@code {"proxies": [{provider, ip, region, proxy_url}]}}.
 */
public class ProxyInventory {
    static final int DEFAULT_PORT = 3128;
    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public record Entry(String provider, String ip, @Nullable String region, String proxyUrl,
                        @Nullable String name) {
        public int port() {
            try {
                int port = new Url(proxyUrl).toURI().getPort();
                return port == -1 ? DEFAULT_PORT : port;
            } catch (IllegalArgumentException e) {
                return DEFAULT_PORT;
            }
        }
    }

    public List<Entry> read(Path file) throws IOException {
        JsonNode root = mapper.readTree(file.toFile());
        var entries = new ArrayList<Entry>();
        if (root.has("proxies") && root.get("proxies").isArray()) {
            for (JsonNode node : root.get("proxies")) {
                entries.add(entry(node, null));
            }
        }
        JsonNode providers = root.get("providers");
        if (providers != null && providers.isObject()) {
            providers.fields().forEachRemaining(field -> {
                if (!field.getValue().isArray()) return; // older files keep per-provider counts here
                for (JsonNode node : field.getValue()) {
                    entries.add(entry(node, field.getKey()));
                }
            });
        }
        return entries;
    }

    private Entry entry(JsonNode node, @Nullable String defaultProvider) {
        String ip = text(node, "ip");
        if (ip == null) throw new IllegalArgumentException("Inventory record without ip: " + node);
        String provider = text(node, "provider");
        if (provider == null) provider = defaultProvider != null ? defaultProvider : "static";
        String proxyUrl = text(node, "proxyUrl");
        if (proxyUrl == null) proxyUrl = text(node, "proxy_url");
        if (proxyUrl == null) proxyUrl = "http://" + ip + ":" + DEFAULT_PORT;
        return new Entry(provider, ip, text(node, "region"), proxyUrl, text(node, "name"));
    }

    private static @Nullable String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public void write(Path file, List<ProxyEndpoint> endpoints, Instant generatedAt) throws IOException {
        var byProvider = new TreeMap<String, List<ProxyEndpoint>>();
        for (var endpoint : endpoints) {
            if (endpoint.address() == null || endpoint.state() == ProxyEndpoint.State.TERMINATED) continue;
            byProvider.computeIfAbsent(endpoint.provider(), p -> new ArrayList<>()).add(endpoint);
        }
        ObjectNode root = mapper.createObjectNode();
        root.put("generatedAt", generatedAt.toString());
        root.put("totalProxies", byProvider.values().stream().mapToInt(List::size).sum());
        ObjectNode counts = root.putObject("counts");
        ObjectNode providers = root.putObject("providers");
        for (Map.Entry<String, List<ProxyEndpoint>> group : byProvider.entrySet()) {
            counts.put(group.getKey(), group.getValue().size());
            ArrayNode array = providers.putArray(group.getKey());
            for (var endpoint : group.getValue()) {
                array.addPOJO(new Entry(endpoint.provider(), endpoint.address(), endpoint.region(),
                        endpoint.proxyUrl(), null));
            }
        }
        mapper.writeValue(file.toFile(), root);
    }
}
