package org.lexcrawl.proxy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lexcrawl.Database;
import org.lexcrawl.InMemoryDatabaseTestExtension;
import org.lexcrawl.util.MutableClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(InMemoryDatabaseTestExtension.class)
class ProxyRegistryTest {
    private final Database database;
    private final FakeFleet fleet = new FakeFleet();
    private ProxyRegistry registry;

    ProxyRegistryTest(Database database) {
        this.database = database;
    }

    @BeforeEach
    void setUp() {
        InMemoryDatabaseTestExtension.clear(database);
        registry = new ProxyRegistry(database, Map.of("fake", fleet), new MutableClock(Instant.EPOCH));
    }

    @Test
    void registeringTheSameProxyTwiceKeepsOneRecord() {
        long first = registry.register("static", null, "198.51.100.1", 3128, "sgp1", null,
                ProxyEndpoint.State.PROVISIONING);
        long second = registry.register("static", null, "198.51.100.1", 3128, null, "PROXY_AUTH",
                ProxyEndpoint.State.PROVISIONING);
        assertEquals(first, second);
        var endpoint = registry.get(first);
        assertEquals("sgp1", endpoint.region());
        assertEquals("PROXY_AUTH", endpoint.credentialsRef());
        assertNotEquals(first, registry.register("static", null, "198.51.100.1", 8080, null, null,
                ProxyEndpoint.State.PROVISIONING));
    }

    @Test
    void addressIsFilledInOnceTheProviderAssignsOne() {
        long id = registry.register("fake", "i-1", null, 3128, "fra1", null, ProxyEndpoint.State.PROVISIONING);
        assertEquals(id, registry.register("fake", "i-1", "198.51.100.7", 3128, null, null,
                ProxyEndpoint.State.PROVISIONING));
        assertEquals("198.51.100.7", registry.get(id).address());
    }

    @Test
    void failedTeardownKeepsTheProxyForRetry() throws FleetException {
        long id = registry.register("fake", "i-1", "198.51.100.1", 3128, null, null, ProxyEndpoint.State.ACTIVE);
        fleet.failTerminate = true;
        assertThrows(FleetException.class, () -> registry.terminate(id));
        assertEquals(ProxyEndpoint.State.ACTIVE, registry.get(id).state());

        fleet.failTerminate = false;
        registry.terminate(id);
        assertEquals(ProxyEndpoint.State.TERMINATED, registry.get(id).state());
        registry.terminate(id);
        assertEquals(List.of("i-1", "i-1"), fleet.terminated, "a terminated proxy is not deleted again");
    }

    @Test
    void probesNeverReviveTerminatedProxies() throws FleetException {
        long id = registry.register("fake", "i-1", "198.51.100.1", 3128, null, null, ProxyEndpoint.State.ACTIVE);
        registry.terminate(id);
        registry.recordProbe(new ProbeResult(id, "fake", "198.51.100.1", true, ProbeStatus.PERFECT, 10, null, null,
                Instant.EPOCH));
        assertEquals(ProxyEndpoint.State.TERMINATED, registry.get(id).state());
    }

    @Test
    void repeatedFailedProbesTransitionOnce() {
        long id = registry.register("fake", "i-1", "198.51.100.1", 3128, null, null, ProxyEndpoint.State.ACTIVE);
        var endpoint = registry.get(id);
        assertTrue(registry.recordProbe(ProbeResult.failed(endpoint, 0, "connect timed out",
                Instant.parse("2024-03-01T00:00:00Z"))));
        assertFalse(registry.recordProbe(ProbeResult.failed(endpoint, 0, "connect timed out",
                Instant.parse("2024-03-01T00:10:00Z"))));
        var unhealthy = registry.get(id);
        assertEquals(ProxyEndpoint.State.UNHEALTHY, unhealthy.state());
        assertEquals(Instant.parse("2024-03-01T00:10:00Z"), unhealthy.lastTestedAt());

        assertTrue(registry.recordProbe(new ProbeResult(id, "fake", "198.51.100.1", true, ProbeStatus.WORKING, 250,
                null, null, Instant.parse("2024-03-01T00:20:00Z"))));
        assertEquals(ProxyEndpoint.State.ACTIVE, registry.get(id).state());
        assertEquals(250L, registry.get(id).lastResponseTimeMs());
    }

    @Test
    void markUnhealthyLeavesTerminatedProxiesAlone() throws FleetException {
        long id = registry.register("fake", "i-1", "198.51.100.1", 3128, null, null, ProxyEndpoint.State.ACTIVE);
        registry.markUnhealthy(id);
        assertEquals(ProxyEndpoint.State.UNHEALTHY, registry.get(id).state());
        registry.terminate(id);
        registry.markUnhealthy(id);
        assertEquals(ProxyEndpoint.State.TERMINATED, registry.get(id).state());
    }

    @Test
    void provisionRegistersProvisioningEndpoints() throws FleetException {
        var ids = registry.provision("fake", "fra1", 2);
        assertEquals(2, ids.size());
        for (long id : ids) {
            assertEquals(ProxyEndpoint.State.PROVISIONING, registry.get(id).state());
        }
        assertThrows(FleetException.class, () -> registry.provision("nope", "fra1", 1));
    }

    @Test
    void syncRegistersNewAndTerminatesVanishedInstances() throws FleetException {
        long vanished = registry.register("fake", "i-old", "198.51.100.1", 3128, null, null,
                ProxyEndpoint.State.ACTIVE);
        fleet.live.add(new ProvisionedProxy("fake", "i-new", "lexcrawl-proxy-1", "198.51.100.2", 3128, "fra1"));
        assertEquals(1, registry.sync("fake"));
        assertEquals(ProxyEndpoint.State.TERMINATED, registry.get(vanished).state());
        var live = registry.list(new ProxyFilter(ProxyEndpoint.State.PROVISIONING, "fake", "fra1"));
        assertEquals(1, live.size());
        assertEquals("198.51.100.2", live.get(0).address());
    }

    static class FakeFleet implements FleetProvider {
        final List<ProvisionedProxy> live = new ArrayList<>();
        final List<String> terminated = new ArrayList<>();
        boolean failTerminate;

        @Override
        public String name() {
            return "fake";
        }

        @Override
        public List<ProvisionedProxy> provision(String region, int count) {
            var created = new ArrayList<ProvisionedProxy>();
            for (int i = 0; i < count; i++) {
                var proxy = new ProvisionedProxy("fake", "i-" + region + "-" + (live.size() + 1), null, null, 3128,
                        region);
                live.add(proxy);
                created.add(proxy);
            }
            return created;
        }

        @Override
        public List<ProvisionedProxy> list() {
            return List.copyOf(live);
        }

        @Override
        public void terminate(ProxyEndpoint endpoint) throws FleetException {
            terminated.add(endpoint.externalId());
            if (failTerminate) throw new FleetException("API unavailable");
        }
    }
}
