package org.lexcrawl;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.config.CrawlerConfig;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.fetch.Backoff;
import org.lexcrawl.fetch.DirectFetcher;
import org.lexcrawl.fetch.Fetcher;
import org.lexcrawl.fetch.ProxyBalancer;
import org.lexcrawl.fetch.ProxyRateLimiter;
import org.lexcrawl.fetch.RenderedFetcher;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.fetch.UrlClassifier;
import org.lexcrawl.identity.IdentityService;
import org.lexcrawl.identity.IdentityViolationException;
import org.lexcrawl.normalize.AdapterRegistry;
import org.lexcrawl.normalize.Normalizer;
import org.lexcrawl.normalize.SourceAdapter;
import org.lexcrawl.proxy.FleetProviders;
import org.lexcrawl.proxy.HealthMonitor;
import org.lexcrawl.proxy.HttpProber;
import org.lexcrawl.proxy.Prober;
import org.lexcrawl.proxy.ProxyClients;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.proxy.ProxyRegistry;
import org.lexcrawl.util.BoundedPool;
import org.lexcrawl.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * One scrape: the worker pool and everything it shares.
 */
public class Job implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Job.class);
    private final CrawlerConfig config;
    private final Database db;
    private final Clock clock;
    private final Frontier frontier;
    private final RawStore rawStore;
    private final ProxyRegistry registry;
    private final HealthMonitor healthMonitor;
    private final ProxyBalancer balancer;
    private final ProxyRateLimiter rateLimiter;
    private final UrlClassifier classifier;
    private final Map<Strategy, Fetcher> fetchers = new EnumMap<>(Strategy.class);
    private final AdapterRegistry adapters;
    private final Normalizer normalizer;
    private final Backoff backoff;
    private final @Nullable PdfDownloader pdfDownloader;
    private final RunReport.Counters counters = new RunReport.Counters();
    private final Lock startStopLock = new ReentrantLock();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile State state = State.STOPPED;
    private volatile @Nullable String country;
    private @Nullable AtomicInteger leasesRemaining;

    public enum State {
        STOPPED, RUNNING, STOPPING, FINISHED
    }

    public Job(Path jobDir, CrawlerConfig config, Database db, Clock clock, Ticker ticker,
               Function<String, String> env) throws IOException {
        this(jobDir, config, db, clock, ticker, env, null);
    }

    /**
     * @param prober probes proxies, or null to probe over HTTP through each proxy
     */
    Job(Path jobDir, CrawlerConfig config, Database db, Clock clock, Ticker ticker,
        Function<String, String> env, @Nullable Prober prober) throws IOException {
        var crawl = config.crawl();
        this.config = config;
        this.db = db;
        this.clock = clock;
        var identity = new IdentityService(db, clock);
        this.frontier = new Frontier(db, identity, clock, crawl.maxAttempts());
        this.rawStore = new RawStore(jobDir, config.storage().prefix(), Math.max(1, Math.min(crawl.concurrency(), 8)),
                clock);
        var clients = new ProxyClients(env, crawl.fetchTimeout());
        this.registry = new ProxyRegistry(db, FleetProviders.create(config.fleet(), HttpClient.newHttpClient(), env),
                clock);
        if (prober == null) prober = new HttpProber(clients, URI.create(config.health().probeUrl()), clock);
        this.healthMonitor = new HealthMonitor(registry, prober, config.health().concurrency(),
                config.health().timeout(), clock);
        this.balancer = new ProxyBalancer(healthMonitor::workingSet);
        this.rateLimiter = new ProxyRateLimiter(crawl.perProxyRate(), ticker);
        this.classifier = new UrlClassifier(config.classifier());
        var direct = new DirectFetcher(clients, crawl.fetchTimeout(), crawl.userAgent(), clock);
        fetchers.put(Strategy.DIRECT, direct);
        fetchers.put(Strategy.RENDERED, new RenderedFetcher(RenderedFetcher.probeForExecutable(),
                crawl.renderTimeout(), crawl.userAgent(), clock));
        this.adapters = AdapterRegistry.withServiceLoader();
        this.normalizer = new Normalizer(clock);
        this.backoff = new Backoff(crawl.backoffBase(), crawl.backoffMax(), new Random());
        String pdfDir = config.storage().pdfDir() == null ? "pdfs" : config.storage().pdfDir();
        this.pdfDownloader = crawl.downloadPdfs() ? new PdfDownloader(direct, db, jobDir.resolve(pdfDir), clock)
                : null;
    }

    /**
     * Runs the worker pool until the frontier for {@code country} is drained, {@code limit} entries have been
     * leased, or {@link #cancel()} is called.
     *
     * @param country country code, or {@code all}
     * @param resume  skip enqueueing the configured seeds and only work on what is already in the frontier
     * @throws SetupException             if no usable source or proxy is configured
     * @throws IdentityViolationException if a global id was allocated twice; the run is aborted
     */
    public RunReport run(String country, @Nullable Integer limit, boolean resume)
            throws SetupException, InterruptedException {
        BoundedPool pool;
        var futures = new ArrayList<Future<?>>();
        startStopLock.lock();
        try {
            if (state != State.STOPPED) throw new IllegalStateException("Job already " + state);
            var sources = config.sourcesFor(country);
            if (sources.isEmpty()) throw new SetupException("No sources configured for country " + country);
            for (var entry : sources.entrySet()) {
                if (adapters.get(entry.getValue().adapter()) == null) {
                    throw new SetupException("Source " + entry.getKey() + " uses unknown adapter "
                                             + entry.getValue().adapter() + " (known: " + adapters.ids() + ")");
                }
            }
            this.country = country.equalsIgnoreCase("all") ? null : country.toUpperCase(Locale.ROOT);
            this.leasesRemaining = limit == null ? null : new AtomicInteger(limit);

            var workingSet = healthMonitor.refresh();
            if (workingSet.isEmpty() && !config.crawl().allowDirect()) {
                throw new SetupException("No healthy proxies; import or provision some, or set crawl.allowDirect");
            }
            healthMonitor.start(config.health().interval());

            if (!resume) {
                sources.forEach((id, source) -> {
                    int added = frontier.enqueue(id, source.countryCode(), source.seeds());
                    log.atInfo().addKeyValue("source", id).addKeyValue("added", added).log("Enqueued seeds");
                });
            }

            int concurrency = config.crawl().concurrency();
            pool = new BoundedPool("worker", concurrency);
            for (int i = 0; i < concurrency; i++) {
                futures.add(pool.submit(new Worker("worker-" + i, this)));
            }
            state = State.RUNNING;
            log.atInfo().addKeyValue("country", country).addKeyValue("workers", concurrency)
                    .addKeyValue("proxies", workingSet.size()).log("Run started");
        } finally {
            startStopLock.unlock();
        }

        try {
            for (var future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    if (e.getCause() instanceof IdentityViolationException violation) {
                        log.error("Identity invariant violated, aborting run", violation);
                        cancel();
                        throw violation;
                    }
                    log.error("Worker died", e.getCause());
                }
            }
        } finally {
            pool.close();
            pool.awaitTermination(30, TimeUnit.SECONDS);
            healthMonitor.close();
            state = State.FINISHED;
            finished.countDown();
        }
        var report = counters.toReport(frontier.totals(this.country), isCancelled());
        log.atInfo().addKeyValue("done", report.done()).addKeyValue("failed", report.failed())
                .addKeyValue("pending", report.pending()).addKeyValue("unconfirmed", report.unconfirmed())
                .log("Run finished");
        return report;
    }

    /**
     * Stops workers from leasing new entries. In-flight fetches finish or time out on their own.
     */
    public void cancel() {
        if (state == State.RUNNING) state = State.STOPPING;
        cancelled.countDown();
    }

    /**
     * Waits for a cancelled run to wind down.
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        cancel();
        healthMonitor.close();
        try {
            rawStore.close();
        } catch (IOException e) {
            log.error("Failed to close raw store", e);
        }
    }

    boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Sleeps, returning early if the job is cancelled.
     */
    void sleep(Duration duration) throws InterruptedException {
        cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    boolean tryReserveLease() {
        return leasesRemaining == null || leasesRemaining.getAndDecrement() > 0;
    }

    void releaseLeaseReservation() {
        if (leasesRemaining != null) leasesRemaining.incrementAndGet();
    }

    /**
     * Picks a proxy from the working set, avoiding the one that last failed the entry. Falls back to fetching
     * without a proxy when that is allowed.
     */
    @Nullable ProxyEndpoint selectProxy(@Nullable Long avoid) {
        var proxy = balancer.select(avoid);
        if (proxy == null && config.crawl().allowDirect()) return ProxyEndpoint.DIRECT;
        return proxy;
    }

    SourceAdapter adapter(SourceConfig source) {
        var adapter = adapters.get(source.adapter());
        if (adapter == null) throw new IllegalStateException("Unknown adapter " + source.adapter());
        return adapter;
    }

    Fetcher fetcher(Strategy strategy) {
        return fetchers.get(strategy);
    }

    void useFetcher(Strategy strategy, Fetcher fetcher) {
        fetchers.put(strategy, fetcher);
    }

    public State state() {
        return state;
    }

    public CrawlerConfig config() {
        return config;
    }

    public Frontier frontier() {
        return frontier;
    }

    public ProxyRegistry registry() {
        return registry;
    }

    Database db() {
        return db;
    }

    @Nullable String country() {
        return country;
    }

    RunReport.Counters counters() {
        return counters;
    }

    RawStore rawStore() {
        return rawStore;
    }

    ProxyRateLimiter rateLimiter() {
        return rateLimiter;
    }

    UrlClassifier classifier() {
        return classifier;
    }

    Normalizer normalizer() {
        return normalizer;
    }

    Backoff backoff() {
        return backoff;
    }

    @Nullable PdfDownloader pdfDownloader() {
        return pdfDownloader;
    }
}
