package org.lexcrawl.proxy;

import java.util.List;

/**
 * Cloud provider API for creating, listing and deleting proxy instances.
 */
public interface FleetProvider {
    String name();

    /**
     * Creates {@code count} proxy instances. They usually have no address yet when this returns.
     */
    List<ProvisionedProxy> provision(String region, int count) throws FleetException;

    /**
     * Lists every proxy instance of this fleet that still exists.
     */
    List<ProvisionedProxy> list() throws FleetException;

    /**
     * Deletes the instance behind an endpoint. Deleting an instance that no longer exists succeeds.
     */
    void terminate(ProxyEndpoint endpoint) throws FleetException;
}
