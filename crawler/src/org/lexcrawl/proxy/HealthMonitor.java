package org.lexcrawl.proxy;

import org.lexcrawl.util.BoundedPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Probes the fleet and publishes the ranked working set. Workers read the current snapshot without locking; a
 * refresh builds a new snapshot and swaps it in.
 */
public class HealthMonitor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);
    private final ProxyRegistry registry;
    private final Prober prober;
    private final BoundedPool pool;
    private final Duration timeout;
    private final Clock clock;
    private final AtomicReference<WorkingSet> current = new AtomicReference<>(WorkingSet.EMPTY);
    private final AtomicReference<List<ProbeResult>> lastResults = new AtomicReference<>(List.of());
    private ScheduledExecutorService scheduler;

    public HealthMonitor(ProxyRegistry registry, Prober prober, int concurrency, Duration timeout, Clock clock) {
        this.registry = registry;
        this.prober = prober;
        this.pool = new BoundedPool("probe", concurrency);
        this.timeout = timeout;
        this.clock = clock;
    }

    /**
     * Probes every endpoint concurrently, at most {@code concurrency} at a time.
     *
     * @return results in the order of {@code endpoints}
     */
    public List<ProbeResult> probeAll(List<ProxyEndpoint> endpoints, Duration timeout) throws InterruptedException {
        var tasks = new ArrayList<Callable<ProbeResult>>(endpoints.size());
        for (var endpoint : endpoints) {
            tasks.add(() -> {
                try {
                    return prober.probe(endpoint, timeout);
                } catch (RuntimeException e) {
                    log.warn("Probe of {} threw", endpoint, e);
                    return ProbeResult.failed(endpoint, 0, e.toString(), clock.instant());
                }
            });
        }
        return pool.invokeAll(tasks);
    }

    /**
     * Probes all candidates, records the results in the registry and publishes a new working set.
     */
    public WorkingSet refresh() throws InterruptedException {
        var endpoints = registry.probeCandidates();
        var results = probeAll(endpoints, timeout);
        var members = new ArrayList<WorkingSet.Member>();
        for (int i = 0; i < results.size(); i++) {
            var result = results.get(i);
            registry.recordProbe(result);
            if (result.success()) {
                members.add(new WorkingSet.Member(endpoints.get(i), result.status(), result.responseTimeMs()));
            }
        }
        var workingSet = new WorkingSet(members, clock.instant());
        current.set(workingSet);
        lastResults.set(List.copyOf(results));
        log.atInfo().addKeyValue("probed", results.size()).addKeyValue("healthy", members.size())
                .log("Working set refreshed");
        return workingSet;
    }

    public WorkingSet workingSet() {
        return current.get();
    }

    public List<ProbeResult> lastResults() {
        return lastResults.get();
    }

    /**
     * Refreshes the working set every {@code interval} in the background.
     */
    public synchronized void start(Duration interval) {
        if (scheduler != null) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "health-monitor");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(() -> {
            try {
                refresh();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Working set refresh failed", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        pool.close();
    }
}
