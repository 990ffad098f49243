package org.lexcrawl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.jdbi.v3.core.JdbiException;
import org.jetbrains.annotations.Nullable;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.fetch.Classification;
import org.lexcrawl.fetch.FetchOutcome;
import org.lexcrawl.fetch.Fetcher;
import org.lexcrawl.fetch.Strategy;
import org.lexcrawl.identity.Assignment;
import org.lexcrawl.identity.DocumentDraft;
import org.lexcrawl.normalize.NormalizeOutcome;
import org.lexcrawl.normalize.ParsedFields;
import org.lexcrawl.normalize.RawContent;
import org.lexcrawl.normalize.SourceAdapter;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.util.MustUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Leases frontier entries one at a time and carries each through fetch, archive, normalization and commit until
 * the frontier is drained or the job is cancelled.
 */
public class Worker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Worker.class);
    private static final ObjectMapper JSON = JsonMapper.builder().build();
    final String id;
    private final Job job;

    public Worker(String id, Job job) {
        this.id = id;
        this.job = job;
    }

    @Override
    public void run() {
        try {
            loop();
        } catch (InterruptedException e) {
            log.debug("Worker {} interrupted", id);
        }
    }

    void loop() throws InterruptedException {
        var frontier = job.frontier();
        var settings = job.config().crawl();
        while (!job.isCancelled()) {
            if (!job.tryReserveLease()) {
                log.info("Worker {} stopping: lease limit reached", id);
                return;
            }
            FrontierEntry entry = frontier.leaseNext(id, settings.leaseTtl(), job.country());
            if (entry == null) {
                job.releaseLeaseReservation();
                if (frontier.countActive(job.country()) == 0) {
                    log.info("Worker {} stopping: frontier drained", id);
                    return;
                }
                job.sleep(settings.idleDelay());
                continue;
            }
            try {
                process(entry);
            } catch (MustUpdate.NoRowsUpdatedException e) {
                log.atWarn().addKeyValue("entry", entry.id()).log("Lease lost to another worker: {}", e.getMessage());
            } catch (JdbiException e) {
                unconfirmed(entry, e);
            }
        }
    }

    void process(FrontierEntry entry) throws InterruptedException {
        var counters = job.counters();
        counters.processed.incrementAndGet();
        SourceConfig source = job.config().sources().get(entry.sourceId());
        if (source == null) {
            fail(entry, ErrorKind.PERMANENT, "No source configured with id " + entry.sourceId(), null);
            return;
        }

        ProxyEndpoint proxy = job.selectProxy(entry.lastProxyId());
        if (proxy == null) {
            log.atWarn().addKeyValue("entry", entry.id()).log("No healthy proxy, requeueing");
            job.frontier().requeue(entry);
            counters.requeued.incrementAndGet();
            job.sleep(job.config().crawl().idleDelay());
            return;
        }

        Classification classification = entry.strategy() != null
                ? new Classification(entry.strategy(), 1.0, "Escalated after parse failure")
                : job.classifier().classify(entry.url());
        job.frontier().recordClassification(entry, classification.toString());

        job.rateLimiter().acquire(proxy, source.requestDelay());
        if (job.isCancelled()) {
            requeue(entry);
            return;
        }

        Fetcher fetcher = job.fetcher(classification.strategy());
        log.atInfo().addKeyValue("entry", entry.id()).addKeyValue("url", entry.url()).addKeyValue("proxy", proxy)
                .addKeyValue("classification", classification).log("Fetching");
        FetchOutcome outcome = fetcher.fetch(entry.url(), proxy, source);

        if (outcome instanceof FetchOutcome.Failed failed) {
            if (job.isCancelled()) {
                requeue(entry);
            } else {
                fail(entry, failed.kind(), failed.error(), proxy);
            }
            return;
        }
        RawContent content = ((FetchOutcome.Fetched) outcome).content();

        String rawRef;
        try {
            rawRef = job.rawStore().save(content);
        } catch (IOException e) {
            log.atError().addKeyValue("entry", entry.id()).setCause(e).log("Failed archiving raw content");
            fail(entry, ErrorKind.TRANSIENT, "Archive write failed: " + e.getMessage(), proxy);
            return;
        }

        SourceAdapter adapter = job.adapter(source);
        NormalizeOutcome normalized = job.normalizer().normalize(adapter, content, source);
        if (normalized instanceof NormalizeOutcome.Rejected rejected) {
            handleRejected(entry, classification, content, rejected.reason(), rawRef);
            return;
        }
        ParsedFields fields = ((NormalizeOutcome.Parsed) normalized).fields();
        commit(entry, source, fields, rawRef, proxy);
    }

    private void handleRejected(FrontierEntry entry, Classification classification, RawContent content,
                                String reason, String rawRef) {
        if (classification.strategy() == Strategy.DIRECT && entry.strategy() == null && !content.isPdf()) {
            log.atInfo().addKeyValue("entry", entry.id()).addKeyValue("url", entry.url())
                    .log("Escalating to rendered fetch: {}", reason);
            job.frontier().escalate(entry, Strategy.RENDERED, reason, rawRef);
            job.counters().escalated.incrementAndGet();
        } else {
            log.atWarn().addKeyValue("entry", entry.id()).addKeyValue("url", entry.url())
                    .log("Parking until the adapter is fixed: {}", reason);
            job.frontier().park(entry, reason, rawRef, job.config().crawl().parseRetryDelay());
            job.counters().parked.incrementAndGet();
        }
    }

    private void commit(FrontierEntry entry, SourceConfig source, ParsedFields fields, String rawRef,
                        ProxyEndpoint proxy) throws InterruptedException {
        Assignment assignment = job.frontier().complete(entry, draft(entry, source, fields, rawRef, proxyId(proxy)));
        var counters = job.counters();
        counters.done.incrementAndGet();
        if (assignment.isNew()) counters.newDocuments.incrementAndGet();
        log.atInfo().addKeyValue("entry", entry.id()).addKeyValue("globalId", assignment.globalId())
                .addKeyValue("new", assignment.isNew()).log("Done");

        if (fields.pdfUrl() != null && job.pdfDownloader() != null) {
            try {
                downloadPdf(assignment, source, proxy);
            } catch (JdbiException e) {
                // the entry is already DONE, so there is no lease left to give back
                counters.unconfirmed.incrementAndGet();
                log.atError().addKeyValue("entry", entry.id()).addKeyValue("globalId", assignment.globalId())
                        .setCause(e).log("PDF bookkeeping failed, download state unconfirmed");
            }
        }
    }

    private void downloadPdf(Assignment assignment, SourceConfig source, ProxyEndpoint proxy)
            throws InterruptedException {
        var document = job.db().documents().findByGlobalId(assignment.globalId());
        if (document != null && !document.pdfDownloaded()) {
            job.rateLimiter().acquire(proxy, source.requestDelay());
            if (job.pdfDownloader().download(document, proxy, source)) {
                job.counters().pdfsDownloaded.incrementAndGet();
            }
        }
    }

    private void fail(FrontierEntry entry, ErrorKind kind, String error, @Nullable ProxyEndpoint proxy) {
        var backoff = job.backoff().delay(entry.attempts() + 1);
        var state = job.frontier().fail(entry, kind, error, proxy == null ? null : proxyId(proxy), backoff);
        if (state == FrontierEntry.State.FAILED) {
            job.counters().failed.incrementAndGet();
            log.atWarn().addKeyValue("entry", entry.id()).addKeyValue("url", entry.url())
                    .addKeyValue("kind", kind).log("Failed: {}", error);
        } else {
            job.counters().retried.incrementAndGet();
            log.atInfo().addKeyValue("entry", entry.id()).addKeyValue("url", entry.url())
                    .addKeyValue("retryIn", backoff).log("Retrying: {}", error);
        }
    }

    private void requeue(FrontierEntry entry) {
        job.frontier().requeue(entry);
        job.counters().requeued.incrementAndGet();
    }

    private void unconfirmed(FrontierEntry entry, JdbiException e) {
        job.counters().unconfirmed.incrementAndGet();
        log.atError().addKeyValue("entry", entry.id()).addKeyValue("url", entry.url()).setCause(e)
                .log("Database write failed, outcome unconfirmed");
        try {
            job.frontier().requeue(entry);
        } catch (MustUpdate.NoRowsUpdatedException e2) {
            log.atWarn().addKeyValue("entry", entry.id()).log("Entry no longer leased, not requeued: {}",
                    e2.getMessage());
        } catch (JdbiException e2) {
            log.atError().addKeyValue("entry", entry.id()).setCause(e2)
                    .log("Requeue failed too, entry will be released when its lease expires");
        }
    }

    static DocumentDraft draft(FrontierEntry entry, SourceConfig source, ParsedFields fields, String rawRef,
                               @Nullable Long proxyId) {
        return new DocumentDraft(entry.url().toString(), entry.sourceId(), source.countryCode(), fields.category(),
                fields.year(), fields.title(), fields.titleShort(), null, fields.court(), fields.body(),
                extraJson(fields), rawRef, fields.pdfUrl(), proxyId);
    }

    static @Nullable Long proxyId(ProxyEndpoint proxy) {
        return proxy.isDirect() ? null : proxy.id();
    }

    static @Nullable String extraJson(ParsedFields fields) {
        if (fields.extra().isEmpty()) return null;
        try {
            return JSON.writeValueAsString(fields.extra());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }
}
