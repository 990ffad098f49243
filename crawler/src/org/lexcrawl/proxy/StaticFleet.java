package org.lexcrawl.proxy;

import java.util.List;

/**
 * Proxies run by someone else and imported from an inventory file. There is nothing to create or delete.
 */
public class StaticFleet implements FleetProvider {
    private final String name;

    public StaticFleet(String name) {
        this.name = name;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ProvisionedProxy> provision(String region, int count) throws FleetException {
        throw new FleetException("Provider " + name + " is static; add proxies with 'proxies import' instead");
    }

    @Override
    public List<ProvisionedProxy> list() {
        return List.of();
    }

    @Override
    public void terminate(ProxyEndpoint endpoint) {
    }
}
