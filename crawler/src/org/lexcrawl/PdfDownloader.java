package org.lexcrawl;

import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.fetch.FetchOutcome;
import org.lexcrawl.fetch.Fetcher;
import org.lexcrawl.identity.Document;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

/**
 * Downloads the PDF linked from a document page into {@code <root>/<folder>/<filename>.pdf}.
 */
public class PdfDownloader {
    private static final Logger log = LoggerFactory.getLogger(PdfDownloader.class);
    private final Fetcher fetcher;
    private final Database db;
    private final Path root;
    private final Clock clock;

    public PdfDownloader(Fetcher fetcher, Database db, Path root, Clock clock) {
        this.fetcher = fetcher;
        this.db = db;
        this.root = root;
        this.clock = clock;
    }

    public Path pathFor(Document document) {
        return root.resolve(document.folderPath()).resolve(document.filename() + ".pdf");
    }

    /**
     * @return true if the PDF is on disk afterwards
     */
    public boolean download(Document document, ProxyEndpoint proxy, SourceConfig source)
            throws InterruptedException {
        if (document.pdfUrl() == null) return false;
        if (document.pdfDownloaded()) return true;
        var url = new Url(document.pdfUrl());
        FetchOutcome outcome = fetcher.fetch(url, proxy, source);
        if (outcome instanceof FetchOutcome.Failed failed) {
            log.atWarn().addKeyValue("globalId", document.globalId()).addKeyValue("url", url)
                    .log("PDF download failed: {}", failed.error());
            return false;
        }
        var content = ((FetchOutcome.Fetched) outcome).content();
        if (!content.isPdf()) {
            log.atWarn().addKeyValue("globalId", document.globalId()).addKeyValue("url", url)
                    .log("Linked PDF is {}", content.contentType());
            return false;
        }
        Path target = pathFor(document);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = target.resolveSibling(target.getFileName() + ".part");
            Files.write(tmp, content.body());
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.atError().addKeyValue("globalId", document.globalId()).setCause(e).log("Failed writing PDF");
            return false;
        }
        db.documents().markPdfDownloaded(document.id(), clock.instant());
        log.atInfo().addKeyValue("globalId", document.globalId()).addKeyValue("bytes", content.body().length)
                .log("PDF downloaded");
        return true;
    }
}
