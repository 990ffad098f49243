package org.lexcrawl.fetch;

import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.util.Url;

public interface Fetcher {
    /**
     * Fetches a URL through a proxy. Network and HTTP errors are returned as {@link FetchOutcome.Failed}.
     *
     * @throws InterruptedException if the run is cancelled mid-fetch
     */
    FetchOutcome fetch(Url url, ProxyEndpoint proxy, SourceConfig source) throws InterruptedException;
}
