package org.lexcrawl.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.lexcrawl.util.DurationDeserializer;

import java.time.Duration;

/**
 * How the worker pool behaves.
 *
 * @param concurrency     number of fetch workers
 * @param perProxyRate    maximum requests per second through any one proxy
 * @param leaseTtl        how long a worker owns a leased frontier entry
 * @param maxAttempts     fetch attempts before an entry is marked failed
 * @param backoffBase     retry delay after the first failure, doubled for each further attempt
 * @param backoffMax      upper bound of the retry delay
 * @param fetchTimeout    timeout of a direct fetch
 * @param renderTimeout   timeout of a rendered fetch
 * @param parseRetryDelay how long an entry whose extraction failed stays parked
 * @param idleDelay       how long an idle worker sleeps before polling the frontier again
 * @param allowDirect     fetch without a proxy when no healthy proxy is available
 * @param userAgent       User-Agent header sent to sources
 * @param downloadPdfs    download linked PDFs of new documents
 */
public record CrawlSettings(
        int concurrency,
        double perProxyRate,
        @JsonDeserialize(using = DurationDeserializer.class) Duration leaseTtl,
        int maxAttempts,
        @JsonDeserialize(using = DurationDeserializer.class) Duration backoffBase,
        @JsonDeserialize(using = DurationDeserializer.class) Duration backoffMax,
        @JsonDeserialize(using = DurationDeserializer.class) Duration fetchTimeout,
        @JsonDeserialize(using = DurationDeserializer.class) Duration renderTimeout,
        @JsonDeserialize(using = DurationDeserializer.class) Duration parseRetryDelay,
        @JsonDeserialize(using = DurationDeserializer.class) Duration idleDelay,
        boolean allowDirect,
        String userAgent,
        boolean downloadPdfs) {

    public CrawlSettings withConcurrency(int concurrency) {
        return new CrawlSettings(concurrency, perProxyRate, leaseTtl, maxAttempts, backoffBase, backoffMax,
                fetchTimeout, renderTimeout, parseRetryDelay, idleDelay, allowDirect, userAgent, downloadPdfs);
    }

    public CrawlSettings withAllowDirect(boolean allowDirect) {
        return new CrawlSettings(concurrency, perProxyRate, leaseTtl, maxAttempts, backoffBase, backoffMax,
                fetchTimeout, renderTimeout, parseRetryDelay, idleDelay, allowDirect, userAgent, downloadPdfs);
    }

    public CrawlSettings withMaxAttempts(int maxAttempts) {
        return new CrawlSettings(concurrency, perProxyRate, leaseTtl, maxAttempts, backoffBase, backoffMax,
                fetchTimeout, renderTimeout, parseRetryDelay, idleDelay, allowDirect, userAgent, downloadPdfs);
    }

    public CrawlSettings withBackoff(Duration backoffBase, Duration backoffMax) {
        return new CrawlSettings(concurrency, perProxyRate, leaseTtl, maxAttempts, backoffBase, backoffMax,
                fetchTimeout, renderTimeout, parseRetryDelay, idleDelay, allowDirect, userAgent, downloadPdfs);
    }

    public CrawlSettings withIdleDelay(Duration idleDelay) {
        return new CrawlSettings(concurrency, perProxyRate, leaseTtl, maxAttempts, backoffBase, backoffMax,
                fetchTimeout, renderTimeout, parseRetryDelay, idleDelay, allowDirect, userAgent, downloadPdfs);
    }
}
