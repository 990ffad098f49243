package org.lexcrawl.proxy;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Durable record of the proxy fleet. Only the health monitor changes an endpoint's health and only fleet teardown
 * terminates it.
 */
public class ProxyRegistry {
    private static final Logger log = LoggerFactory.getLogger(ProxyRegistry.class);
    private final Database db;
    private final Map<String, FleetProvider> providers;
    private final Clock clock;

    public ProxyRegistry(Database db, Map<String, FleetProvider> providers, Clock clock) {
        this.db = db;
        this.providers = providers;
        this.clock = clock;
    }

    /**
     * Records an endpoint, or returns the id of the live endpoint already recorded for the same instance or address.
     */
    public long register(String provider, @Nullable String externalId, @Nullable String address, int port,
                         @Nullable String region, @Nullable String credentialsRef, ProxyEndpoint.State state) {
        return db.inTransaction(txn -> {
            ProxyEndpoint existing = null;
            if (externalId != null) existing = txn.proxies().findByExternalId(provider, externalId);
            if (existing == null && address != null) existing = txn.proxies().findLiveByAddress(address, port);
            if (existing != null) {
                txn.proxies().updateDetails(existing.id(), externalId, address, region, credentialsRef);
                return existing.id();
            }
            long id = txn.proxies().insert(provider, externalId, address, port, region, credentialsRef, state,
                    clock.instant());
            log.atInfo().addKeyValue("id", id).addKeyValue("provider", provider).addKeyValue("address", address)
                    .log("Registered proxy");
            return id;
        });
    }

    public List<ProxyEndpoint> list(ProxyFilter filter) {
        return db.proxies().list(filter);
    }

    public @Nullable ProxyEndpoint get(long id) {
        return db.proxies().findById(id);
    }

    /**
     * Endpoints worth probing: every one with an address that hasn't been terminated.
     */
    public List<ProxyEndpoint> probeCandidates() {
        var candidates = new ArrayList<ProxyEndpoint>();
        for (var endpoint : db.proxies().list(ProxyFilter.ALL)) {
            if (endpoint.state() != ProxyEndpoint.State.TERMINATED && endpoint.address() != null) {
                candidates.add(endpoint);
            }
        }
        return candidates;
    }

    public void markUnhealthy(long id) {
        if (db.proxies().updateState(id, ProxyEndpoint.State.UNHEALTHY) > 0) {
            log.atWarn().addKeyValue("id", id).log("Proxy marked unhealthy");
        }
    }

    /**
     * Stores the outcome of a probe with one update and logs when the endpoint changes state.
     *
     * @return true if the endpoint moved to a different state
     */
    public boolean recordProbe(ProbeResult result) {
        ProxyEndpoint before = db.proxies().findById(result.endpointId());
        if (before == null || before.state() == ProxyEndpoint.State.TERMINATED) return false;
        var state = result.success() ? ProxyEndpoint.State.ACTIVE : ProxyEndpoint.State.UNHEALTHY;
        if (db.proxies().recordProbe(result.endpointId(), state, result.testedAt(),
                result.success() ? result.responseTimeMs() : null) == 0 || before.state() == state) {
            return false;
        }
        if (state == ProxyEndpoint.State.UNHEALTHY) {
            log.atWarn().addKeyValue("id", result.endpointId()).log("Proxy marked unhealthy: {}", result.error());
        } else {
            log.atInfo().addKeyValue("id", result.endpointId()).log("Proxy active");
        }
        return true;
    }

    /**
     * Deletes the instance at the provider, then marks the endpoint terminated. Terminating an endpoint twice is a
     * no-op. If the provider call fails the endpoint keeps its state so the teardown can be retried.
     */
    public void terminate(long id) throws FleetException {
        ProxyEndpoint endpoint = db.proxies().findById(id);
        if (endpoint == null) throw new IllegalArgumentException("No such proxy: " + id);
        if (endpoint.state() == ProxyEndpoint.State.TERMINATED) return;
        FleetProvider provider = providers.get(endpoint.provider());
        if (provider == null) throw new FleetException("No fleet provider configured for " + endpoint.provider());
        provider.terminate(endpoint);
        db.proxies().markTerminated(id);
        log.atInfo().addKeyValue("id", id).addKeyValue("provider", endpoint.provider()).log("Proxy terminated");
    }

    /**
     * Creates instances at a provider and registers them as provisioning. They become active once a probe through
     * them succeeds.
     */
    public List<Long> provision(String providerName, String region, int count) throws FleetException {
        FleetProvider provider = provider(providerName);
        var ids = new ArrayList<Long>();
        for (var proxy : provider.provision(region, count)) {
            ids.add(register(proxy.provider(), proxy.externalId(), proxy.address(), proxy.port(), proxy.region(),
                    null, ProxyEndpoint.State.PROVISIONING));
        }
        return ids;
    }

    /**
     * Brings the registry in line with the provider: registers unknown instances, fills in addresses, and marks
     * endpoints whose instance no longer exists as terminated.
     *
     * @return number of instances the provider reported
     */
    public int sync(String providerName) throws FleetException {
        FleetProvider provider = provider(providerName);
        var live = provider.list();
        var liveIds = new HashSet<String>();
        for (var proxy : live) {
            liveIds.add(proxy.externalId());
            register(proxy.provider(), proxy.externalId(), proxy.address(), proxy.port(), proxy.region(), null,
                    ProxyEndpoint.State.PROVISIONING);
        }
        for (var endpoint : db.proxies().list(ProxyFilter.provider(providerName))) {
            if (endpoint.externalId() != null && endpoint.state() != ProxyEndpoint.State.TERMINATED
                && !liveIds.contains(endpoint.externalId())) {
                log.atWarn().addKeyValue("id", endpoint.id()).addKeyValue("externalId", endpoint.externalId())
                        .log("Instance gone at provider, marking proxy terminated");
                db.proxies().markTerminated(endpoint.id());
            }
        }
        return live.size();
    }

    private FleetProvider provider(String name) throws FleetException {
        FleetProvider provider = providers.get(name);
        if (provider == null) throw new FleetException("No fleet provider configured named " + name);
        return provider;
    }
}
