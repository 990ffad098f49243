package org.lexcrawl;

import org.jetbrains.annotations.Nullable;
import org.lexcrawl.config.CrawlerConfig;
import org.lexcrawl.identity.IdentityService;
import org.lexcrawl.identity.IdentityViolationException;
import org.lexcrawl.normalize.AdapterRegistry;
import org.lexcrawl.proxy.FleetException;
import org.lexcrawl.proxy.FleetProviders;
import org.lexcrawl.proxy.HealthMonitor;
import org.lexcrawl.proxy.HealthReport;
import org.lexcrawl.proxy.HttpProber;
import org.lexcrawl.proxy.ProxyClients;
import org.lexcrawl.proxy.ProxyEndpoint;
import org.lexcrawl.proxy.ProxyFilter;
import org.lexcrawl.proxy.ProxyInventory;
import org.lexcrawl.proxy.ProxyRegistry;
import org.lexcrawl.util.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Command line entry point.
 */
public class LexCrawl {
    private static final Logger log = LoggerFactory.getLogger(LexCrawl.class);
    static final int EXIT_OK = 0;
    static final int EXIT_SETUP = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_UNCONFIRMED = 3;
    static final String DB_FILENAME = "db.sqlite3";

    private final PrintStream out;
    private final Function<String, String> env;
    private final Clock clock;
    private Path jobDir = Path.of("data");
    private @Nullable Path configFile;

    LexCrawl(PrintStream out, Function<String, String> env, Clock clock) {
        this.out = out;
        this.env = env;
        this.clock = clock;
    }

    public static void main(String[] args) {
        System.exit(new LexCrawl(System.out, System::getenv, Clock.systemUTC()).run(args));
    }

    static class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    int run(String[] args) {
        try {
            return dispatch(args);
        } catch (UsageException e) {
            System.err.println("lexcrawl: " + e.getMessage());
            System.err.println("Try 'lexcrawl --help' for usage.");
            return EXIT_USAGE;
        } catch (SetupException | FleetException e) {
            log.error("{}", e.getMessage(), e.getCause());
            System.err.println("lexcrawl: " + e.getMessage());
            return EXIT_SETUP;
        } catch (IOException e) {
            log.error("I/O error", e);
            System.err.println("lexcrawl: " + e);
            return EXIT_SETUP;
        } catch (IdentityViolationException e) {
            System.err.println("lexcrawl: FATAL: " + e.getMessage());
            return EXIT_UNCONFIRMED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return EXIT_OK;
        } catch (Exception e) {
            log.error("Unexpected error", e);
            System.err.println("lexcrawl: " + e);
            return EXIT_SETUP;
        }
    }

    private int dispatch(String[] args) throws Exception {
        var rest = new ArrayList<String>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-j", "--job-dir" -> jobDir = Path.of(value(args, ++i, "--job-dir"));
                case "--config" -> configFile = Path.of(value(args, ++i, "--config"));
                case "-h", "--help" -> {
                    usage(out);
                    return EXIT_OK;
                }
                default -> {
                    rest.addAll(List.of(args).subList(i, args.length));
                    i = args.length;
                }
            }
        }
        if (rest.isEmpty()) throw new UsageException("no command given");
        if (configFile != null && !Files.exists(configFile)) {
            throw new SetupException("Config file not found: " + configFile);
        }
        String command = rest.remove(0);
        return switch (command) {
            case "scrape" -> scrape(rest);
            case "stats" -> stats(rest);
            case "search" -> search(rest);
            case "enqueue" -> enqueue(rest);
            case "renormalize" -> renormalize(rest);
            case "requeue-failed" -> requeueFailed(rest);
            case "proxies" -> proxies(rest);
            default -> throw new UsageException("unknown command: " + command);
        };
    }

    static void usage(PrintStream out) {
        out.println("Usage: lexcrawl [-j JOBDIR] [--config FILE] <command> [options]");
        out.println("Commands:");
        out.println("  scrape --country <code|all> [--resume] [--limit N]");
        out.println("  stats [--country <code>] [--detailed]");
        out.println("  search <query> [--country <code>]");
        out.println("  enqueue --source <id> URL...");
        out.println("  renormalize [--country <code>]");
        out.println("  requeue-failed [--country <code>]");
        out.println("  proxies list | import <file> | export <file> | probe [--report FILE]");
        out.println("          | provision <provider> <region> <count> | sync <provider> | terminate <id>");
        out.println("Options:");
        out.println("  -h, --help");
        out.println("  -j, --job-dir DIR        Directory for the database, WARCs and PDFs (default: data)");
        out.println("      --config FILE        Configuration file (default: JOBDIR/lexcrawl.yaml)");
    }

    private int scrape(List<String> args) throws Exception {
        String country = null;
        Integer limit = null;
        boolean resume = false;
        for (int i = 0; i < args.size(); i++) {
            switch (args.get(i)) {
                case "--country" -> country = value(args, ++i, "--country");
                case "--resume" -> resume = true;
                case "--limit" -> limit = intValue(args, ++i, "--limit");
                default -> throw new UsageException("unexpected argument to scrape: " + args.get(i));
            }
        }
        if (country == null) throw new UsageException("scrape requires --country <code|all>");

        CrawlerConfig config = loadConfig();
        try (Database db = openDatabase();
             Job job = new Job(jobDir, config, db, clock, Ticker.SYSTEM, env)) {
            Thread hook = new Thread(() -> {
                log.info("Cancelling run, waiting for in-flight fetches");
                job.cancel();
                try {
                    job.awaitFinished(config.crawl().renderTimeout().plusSeconds(10));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            RunReport report;
            try {
                report = job.run(country, limit, resume);
            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    log.debug("JVM is shutting down, hook stays registered");
                }
            }
            report.print(out);
            return report.confirmed() ? EXIT_OK : EXIT_UNCONFIRMED;
        }
    }

    private int stats(List<String> args) throws Exception {
        String country = null;
        boolean detailed = false;
        for (int i = 0; i < args.size(); i++) {
            switch (args.get(i)) {
                case "--country" -> country = countryFilter(value(args, ++i, "--country"));
                case "--detailed" -> detailed = true;
                default -> throw new UsageException("unexpected argument to stats: " + args.get(i));
            }
        }
        try (Database db = openDatabase()) {
            new Stats(db, clock).print(country, detailed, out);
        }
        return EXIT_OK;
    }

    private int search(List<String> args) throws Exception {
        String country = null;
        var terms = new ArrayList<String>();
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).equals("--country")) {
                country = countryFilter(value(args, ++i, "--country"));
            } else {
                terms.add(args.get(i));
            }
        }
        if (terms.isEmpty()) throw new UsageException("search requires a query");
        try (Database db = openDatabase()) {
            new Stats(db, clock).printSearch(String.join(" ", terms), country, 50, out);
        }
        return EXIT_OK;
    }

    private int enqueue(List<String> args) throws Exception {
        String sourceId = null;
        var urls = new ArrayList<String>();
        for (int i = 0; i < args.size(); i++) {
            if (args.get(i).equals("--source")) {
                sourceId = value(args, ++i, "--source");
            } else {
                urls.add(args.get(i));
            }
        }
        if (sourceId == null || urls.isEmpty()) throw new UsageException("enqueue requires --source <id> URL...");
        CrawlerConfig config = loadConfig();
        var source = config.sources().get(sourceId);
        if (source == null) throw new SetupException("No source configured with id " + sourceId);
        try (Database db = openDatabase()) {
            int added = frontier(db, config).enqueue(sourceId, source.countryCode(), urls);
            out.printf("Enqueued %d new URL%s (%d already known)%n", added, added == 1 ? "" : "s",
                    urls.size() - added);
        }
        return EXIT_OK;
    }

    private int renormalize(List<String> args) throws Exception {
        String country = parseCountryOnly(args, "renormalize");
        CrawlerConfig config = loadConfig();
        try (Database db = openDatabase();
             var rawStore = new RawStore(jobDir, config.storage().prefix(), 1, clock)) {
            var result = new Renormalizer(db, frontier(db, config), rawStore, AdapterRegistry.withServiceLoader(),
                    config, clock).run(country);
            out.printf("Recovered %d parked entries (%d still parked); updated %d documents, %d unchanged, "
                       + "%d skipped%n", result.recovered(), result.stillParked(), result.updated(),
                    result.unchanged(), result.skipped());
        }
        return EXIT_OK;
    }

    private int requeueFailed(List<String> args) throws Exception {
        String country = parseCountryOnly(args, "requeue-failed");
        CrawlerConfig config = loadConfig();
        try (Database db = openDatabase()) {
            int count = frontier(db, config).requeueFailed(country);
            out.printf("Requeued %d failed entr%s%n", count, count == 1 ? "y" : "ies");
        }
        return EXIT_OK;
    }

    private int proxies(List<String> args) throws Exception {
        if (args.isEmpty()) throw new UsageException("proxies requires a subcommand");
        String sub = args.get(0);
        CrawlerConfig config = loadConfig();
        try (Database db = openDatabase()) {
            var registry = new ProxyRegistry(db, FleetProviders.create(config.fleet(), HttpClient.newHttpClient(),
                    env), clock);
            switch (sub) {
                case "list" -> {
                    for (var endpoint : registry.list(ProxyFilter.ALL)) {
                        out.printf("%5d %-13s %-12s %-21s %-8s %s%n", endpoint.id(), endpoint.state(),
                                endpoint.provider(), endpoint.address() + ":" + endpoint.port(),
                                endpoint.region() == null ? "-" : endpoint.region(),
                                endpoint.lastResponseTimeMs() == null ? "-" : endpoint.lastResponseTimeMs() + "ms");
                    }
                }
                case "import" -> {
                    Path file = Path.of(value(args, 1, "proxies import"));
                    int count = 0;
                    for (var entry : new ProxyInventory().read(file)) {
                        registry.register(entry.provider(), null, entry.ip(), entry.port(), entry.region(), null,
                                ProxyEndpoint.State.PROVISIONING);
                        count++;
                    }
                    out.printf("Imported %d proxies from %s%n", count, file);
                }
                case "export" -> {
                    Path file = Path.of(value(args, 1, "proxies export"));
                    new ProxyInventory().write(file, registry.list(ProxyFilter.ALL), clock.instant());
                    out.printf("Wrote %s%n", file);
                }
                case "probe" -> {
                    Path report = args.size() > 2 && args.get(1).equals("--report") ? Path.of(args.get(2)) : null;
                    var health = config.health();
                    var prober = new HttpProber(new ProxyClients(env, health.timeout()),
                            URI.create(health.probeUrl()), clock);
                    try (var monitor = new HealthMonitor(registry, prober, health.concurrency(), health.timeout(),
                            clock)) {
                        monitor.refresh();
                        var healthReport = HealthReport.of(clock.instant(), monitor.lastResults());
                        var summary = healthReport.summary();
                        out.printf("Probed %d: %d working (%d perfect), %d failed, avg %.2fs%n", summary.total(),
                                summary.working(), summary.perfect(), summary.failed(),
                                summary.avgResponseTimeSec());
                        if (report != null) healthReport.write(report);
                    }
                }
                case "provision" -> {
                    if (args.size() != 4) throw new UsageException("proxies provision <provider> <region> <count>");
                    var ids = registry.provision(args.get(1), args.get(2), intValue(args, 3, "count"));
                    out.printf("Provisioned %d proxies: %s%n", ids.size(), ids);
                }
                case "sync" -> {
                    int count = registry.sync(value(args, 1, "proxies sync"));
                    out.printf("Provider reports %d instances%n", count);
                }
                case "terminate" -> {
                    long id = intValue(args, 1, "proxies terminate");
                    registry.terminate(id);
                    out.printf("Terminated proxy %d%n", id);
                }
                default -> throw new UsageException("unknown proxies subcommand: " + sub);
            }
        }
        return EXIT_OK;
    }

    private Frontier frontier(Database db, CrawlerConfig config) {
        return new Frontier(db, new IdentityService(db, clock), clock, config.crawl().maxAttempts());
    }

    private CrawlerConfig loadConfig() throws SetupException {
        try {
            return CrawlerConfig.load(jobDir, configFile);
        } catch (IOException e) {
            throw new SetupException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private Database openDatabase() throws IOException {
        Files.createDirectories(jobDir);
        return Database.open(jobDir.resolve(DB_FILENAME));
    }

    private String parseCountryOnly(List<String> args, String command) throws UsageException {
        String country = null;
        for (int i = 0; i < args.size(); i++) {
            if (!args.get(i).equals("--country")) {
                throw new UsageException("unexpected argument to " + command + ": " + args.get(i));
            }
            country = countryFilter(value(args, ++i, "--country"));
        }
        return country;
    }

    static @Nullable String countryFilter(String country) {
        return country.equalsIgnoreCase("all") ? null : country.toUpperCase(Locale.ROOT);
    }

    private static String value(String[] args, int i, String option) throws UsageException {
        if (i >= args.length) throw new UsageException(option + " requires a value");
        return args[i];
    }

    private static String value(List<String> args, int i, String option) throws UsageException {
        if (i >= args.size()) throw new UsageException(option + " requires a value");
        return args.get(i);
    }

    private static int intValue(List<String> args, int i, String option) throws UsageException {
        String value = value(args, i, option);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new UsageException(option + " expects a number, got " + value);
        }
    }
}
