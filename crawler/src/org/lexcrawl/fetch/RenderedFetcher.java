package org.lexcrawl.fetch;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.config.SourceConfig;
import org.lexcrawl.normalize.RawContent;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Renders the page in headless Chrome and takes the serialized DOM after scripts have run.
 */
public class RenderedFetcher implements Fetcher {
    private static final Logger log = LoggerFactory.getLogger(RenderedFetcher.class);
    static final List<String> BROWSER_EXECUTABLES = List.of(
            "/Applications/Google Chrome.app/Contents/MacOS/Google Chrome",
            "C:\\Program Files (x86)\\Google\\Chrome\\Application\\chrome.exe",
            "google-chrome-stable",
            "google-chrome",
            "chromium-browser",
            "chromium"
    );

    private final @Nullable String executable;
    private final Duration timeout;
    private final String userAgent;
    private final Clock clock;

    public RenderedFetcher(@Nullable String executable, Duration timeout, String userAgent, Clock clock) {
        this.executable = executable;
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.clock = clock;
    }

    /**
     * Finds the first browser that exists, checking absolute paths directly and bare names on the PATH.
     */
    public static @Nullable String probeForExecutable() {
        String path = System.getenv("PATH");
        for (String candidate : BROWSER_EXECUTABLES) {
            if (candidate.contains("/") || candidate.contains("\\")) {
                if (Files.isExecutable(Path.of(candidate))) return candidate;
            } else if (path != null) {
                for (String dir : path.split(java.io.File.pathSeparator)) {
                    if (!dir.isEmpty() && Files.isExecutable(Path.of(dir, candidate))) return candidate;
                }
            }
        }
        return null;
    }

    List<String> command(Url url, ProxyEndpoint proxy) {
        var command = new ArrayList<String>();
        command.add(executable);
        command.add("--headless=new");
        command.add("--disable-gpu");
        command.add("--no-first-run");
        command.add("--no-default-browser-check");
        command.add("--disable-background-networking");
        command.add("--disable-sync");
        command.add("--user-agent=" + userAgent);
        command.add("--virtual-time-budget=" + Math.max(1000, timeout.toMillis() / 2));
        if (!proxy.isDirect()) command.add("--proxy-server=" + proxy.proxyUrl());
        command.add("--dump-dom");
        command.add(url.toString());
        return command;
    }

    @Override
    public FetchOutcome fetch(Url url, ProxyEndpoint proxy, SourceConfig source) throws InterruptedException {
        if (executable == null) {
            return FetchOutcome.Failed.transientError("No browser executable available for rendered fetch");
        }
        long start = System.nanoTime();
        Process process;
        try {
            process = new ProcessBuilder(command(url, proxy))
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            return FetchOutcome.Failed.transientError("Failed to start browser: " + e.getMessage());
        }
        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return FetchOutcome.Failed.transientError("Render timed out after " + timeout.toSeconds() + "s");
            }
            byte[] dom = stdout.get(5, TimeUnit.SECONDS);
            if (process.exitValue() != 0 || dom.length == 0) {
                return FetchOutcome.Failed.transientError("Browser exited with status " + process.exitValue());
            }
            String text = new String(dom, StandardCharsets.UTF_8);
            var failure = ResponseRules.check(200, text, source.blockSignatures());
            if (failure != null) return failure;
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.atDebug().addKeyValue("url", url).addKeyValue("elapsedMs", elapsedMs).log("Rendered");
            return new FetchOutcome.Fetched(new RawContent(url, "text/html; charset=utf-8", dom, 200,
                    Strategy.RENDERED, clock.instant()), elapsedMs);
        } catch (ExecutionException | TimeoutException e) {
            return FetchOutcome.Failed.transientError("Failed reading browser output: " + e.getMessage());
        } finally {
            if (process.isAlive()) process.destroyForcibly();
        }
    }

    private static byte[] readAll(InputStream stream) {
        try (stream) {
            return stream.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
