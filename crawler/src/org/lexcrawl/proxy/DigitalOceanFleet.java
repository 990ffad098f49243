package org.lexcrawl.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.lexcrawl.config.ProviderConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Proxy fleet on DigitalOcean droplets, found by tag.
 */
public class DigitalOceanFleet implements FleetProvider {
    private static final Logger log = LoggerFactory.getLogger(DigitalOceanFleet.class);
    private final String name;
    private final ProviderConfig config;
    private final HttpClient httpClient;
    private final Function<String, String> env;
    private final ObjectMapper mapper = new ObjectMapper();

    public DigitalOceanFleet(String name, ProviderConfig config, HttpClient httpClient, Function<String, String> env) {
        this.name = name;
        this.config = config;
        this.httpClient = httpClient;
        this.env = env;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ProvisionedProxy> provision(String region, int count) throws FleetException {
        ObjectNode body = mapper.createObjectNode();
        var names = body.putArray("names");
        for (int i = 0; i < count; i++) {
            names.add(tag() + "-" + region + "-" + Long.toString(System.nanoTime(), 36) + "-" + i);
        }
        body.put("region", region);
        body.put("size", config.size());
        body.put("image", config.image());
        body.putArray("tags").add(tag());
        if (config.userData() != null) body.put("user_data", config.userData());

        JsonNode response = send(request("/droplets")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .header("Content-Type", "application/json")
                .build(), 202);
        var created = new ArrayList<ProvisionedProxy>();
        for (JsonNode droplet : response.path("droplets")) {
            created.add(toProxy(droplet));
        }
        log.atInfo().addKeyValue("provider", name).addKeyValue("region", region).addKeyValue("count", created.size())
                .log("Provisioned droplets");
        return created;
    }

    @Override
    public List<ProvisionedProxy> list() throws FleetException {
        var proxies = new ArrayList<ProvisionedProxy>();
        String next = "/droplets?per_page=200&tag_name=" + tag();
        while (next != null) {
            JsonNode page = send(request(next).GET().build(), 200);
            for (JsonNode droplet : page.path("droplets")) {
                proxies.add(toProxy(droplet));
            }
            String nextUrl = page.path("links").path("pages").path("next").asText(null);
            next = nextUrl == null ? null : StringUtils.removeStart(nextUrl, apiUrl());
        }
        return proxies;
    }

    @Override
    public void terminate(ProxyEndpoint endpoint) throws FleetException {
        if (endpoint.externalId() == null) {
            throw new FleetException("Proxy " + endpoint.id() + " has no droplet id");
        }
        var request = request("/droplets/" + endpoint.externalId()).DELETE().build();
        HttpResponse<String> response = execute(request);
        if (response.statusCode() == 404) {
            log.info("Droplet {} was already deleted", endpoint.externalId());
            return;
        }
        check(request, response, 204);
    }

    private ProvisionedProxy toProxy(JsonNode droplet) {
        String address = null;
        for (JsonNode network : droplet.path("networks").path("v4")) {
            if ("public".equals(network.path("type").asText())) {
                address = network.path("ip_address").asText(null);
                break;
            }
        }
        return new ProvisionedProxy(name, droplet.path("id").asText(), droplet.path("name").asText(null), address,
                config.proxyPort(), droplet.path("region").path("slug").asText(null));
    }

    private HttpRequest.Builder request(String path) throws FleetException {
        return HttpRequest.newBuilder(URI.create(apiUrl() + path))
                .timeout(Duration.ofSeconds(60))
                .header("Authorization", "Bearer " + token())
                .header("Accept", "application/json");
    }

    private String apiUrl() {
        return StringUtils.removeEnd(config.apiUrl(), "/");
    }

    private String tag() {
        return config.tag() == null ? "lexcrawl-proxy" : config.tag();
    }

    private String token() throws FleetException {
        String tokenEnv = config.tokenEnv() == null ? "DIGITALOCEAN_TOKEN" : config.tokenEnv();
        String token = env.apply(tokenEnv);
        if (token == null || token.isBlank()) {
            throw new FleetException("Environment variable " + tokenEnv + " must hold the " + name + " API token");
        }
        return token;
    }

    private JsonNode send(HttpRequest request, int expectedStatus) throws FleetException {
        var response = execute(request);
        check(request, response, expectedStatus);
        try {
            return mapper.readTree(response.body());
        } catch (IOException e) {
            throw new FleetException("Unparseable response from " + request.uri(), e);
        }
    }

    private HttpResponse<String> execute(HttpRequest request) throws FleetException {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new FleetException(request.method() + " " + request.uri() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FleetException("Interrupted during " + request.method() + " " + request.uri(), e);
        }
    }

    private static void check(HttpRequest request, HttpResponse<String> response, int expectedStatus)
            throws FleetException {
        if (response.statusCode() != expectedStatus) {
            throw new FleetException(request.method() + " " + request.uri() + " returned HTTP "
                                     + response.statusCode() + ": " + StringUtils.abbreviate(response.body(), 300));
        }
    }
}
