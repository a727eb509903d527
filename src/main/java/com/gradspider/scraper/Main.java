package com.gradspider.scraper;

import com.gradspider.sites.SiteRegistry;
import com.gradspider.sites.UniversitySite;
import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the graduate program scraper.
 * Harvests one university's program listings and exports them to CSV and, optionally, PostgreSQL.
 * <pre>
 *   Main                                   list configured universities
 *   Main &lt;key&gt; [--headful] [--workers N] [--db]
 * </pre>
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_SCAN_FAILED = 3;
    static final int EXIT_POOL_UNAVAILABLE = 4;
    static final int EXIT_EXPORT_FAILED = 5;

    static final int PREVIEW_ROWS = 5;

    /**
     * Parsed command line.
     * @param key     university key, null to list universities
     * @param headful force visible browser windows
     * @param workers requested harvester count, null for the pool capacity
     * @param db      also upsert into embedded PostgreSQL
     */
    record CliOptions(String key, boolean headful, Integer workers, boolean db) {

        static CliOptions parse(String[] args) {
            String key = null;
            boolean headful = false;
            boolean db = false;
            Integer workers = null;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i].trim();
                switch (arg) {
                    case "--headful" -> headful = true;
                    case "--db" -> db = true;
                    case "--workers" -> {
                        if (i + 1 >= args.length) throw new IllegalArgumentException("--workers needs a number");
                        try {
                            workers = Integer.parseInt(args[++i].trim());
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--workers needs a number, got " + args[i]);
                        }
                        if (workers < 1) throw new IllegalArgumentException("--workers must be at least 1");
                    }
                    default -> {
                        if (arg.startsWith("--")) throw new IllegalArgumentException("Unknown option " + arg);
                        if (key != null) throw new IllegalArgumentException("Only one university key is accepted");
                        key = arg.toLowerCase(Locale.ROOT);
                    }
                }
            }
            return new CliOptions(key, headful, workers, db);
        }
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) System.exit(code);
    }

    static int run(String[] args) {
        CliOptions options;
        try {
            options = CliOptions.parse(args == null ? new String[0] : args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: Main <university-key> [--headful] [--workers N] [--db]");
            return EXIT_USAGE;
        }

        HarvestSettings settings = ScraperConfig.loadSettings();
        List<UniversityProfile> universities = ScraperConfig.loadUniversities();
        if (options.key() == null) {
            printUniversities(universities);
            return EXIT_OK;
        }
        Optional<UniversityProfile> found = ScraperConfig.findUniversity(universities, options.key());
        if (found.isEmpty()) {
            System.err.println("Unknown university '" + options.key() + "'.");
            printUniversities(universities);
            return EXIT_USAGE;
        }
        UniversityProfile profile = options.headful() ? found.get().withVisibility(VisibilityMode.HEADFUL) : found.get();
        HarvestSettings runSettings = settings.forProfile(profile);
        int workers = options.workers() != null ? options.workers() : runSettings.poolCapacity();

        Coordinator coordinator = coordinatorFor(settings, profile);

        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            coordinator.cancel("JVM shutdown");
            try {
                // give the pool time to close every browser before the JVM exits
                if (!finished.await(runSettings.drainTimeout().toSeconds() + 5, TimeUnit.SECONDS)) {
                    logger.warn("Harvest did not finish cleaning up before shutdown.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);

        try {
            HarvestResult result = coordinator.run(profile, workers);
            preview(result);
            export(profile, result, settings, options.db());
            return EXIT_OK;
        } catch (ListScanException e) {
            logger.error("Could not read the program list of {}: {}", profile.name(), e.getMessage());
            return EXIT_SCAN_FAILED;
        } catch (PoolUnavailableException e) {
            logger.error("Browser sessions unavailable: {}", e.getMessage());
            return EXIT_POOL_UNAVAILABLE;
        } catch (IOException | SQLException e) {
            logger.error("Failed to export programs of {}: {}", profile.code(), e.getMessage());
            return EXIT_EXPORT_FAILED;
        } finally {
            finished.countDown();
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // already shutting down; the hook is running
                logger.debug("Shutdown in progress: {}", e.getMessage());
            }
        }
    }

    private static void export(UniversityProfile profile, HarvestResult result, HarvestSettings settings, boolean db)
        throws IOException, SQLException {
        ProgramSink csv = new CsvService(settings.outputDir());
        Path file = csv.write(profile, result.succeeded());
        System.out.println("Saved " + result.succeeded().size() + " programs to " + file.toAbsolutePath());
        if (!db) return;

        String portStr = ScraperConfig.envOrProp("EMBEDDED_PG_PORT");
        int port = 5432;
        try {
            if (portStr != null) port = Integer.parseInt(portStr.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid EMBEDDED_PG_PORT '{}'; using {}", portStr, port);
        }
        String dataDir = Paths.get(settings.outputDir(), "pgdata").toString();
        try (EmbeddedPostgres postgres = PostgresService.startEmbedded(dataDir, port)) {
            PostgresServiceInterface postgresService = PostgresService.forEmbedded(postgres);
            postgresService.createTables();
            postgresService.upsertPrograms(profile, result.succeeded());
            System.out.println("Stored " + postgresService.countPrograms(profile.code()) + " programs for "
                + profile.code() + " in embedded PostgreSQL (port " + postgres.getPort() + ").");
        }
    }

    private static void preview(HarvestResult result) {
        System.out.println(result.summary());
        result.succeeded().stream().limit(PREVIEW_ROWS).forEach(r ->
            System.out.println("  " + r.programName() + " | " + r.detailUrl()
                + (r.deadline().isEmpty() ? "" : " | deadline " + r.deadline())));
        if (result.succeeded().size() > PREVIEW_ROWS) {
            System.out.println("  ... and " + (result.succeeded().size() - PREVIEW_ROWS) + " more");
        }
        for (FailedTask f : result.failed()) {
            logger.info("Failed {} ({}): {}", f.task().locator(), f.kind(), f.reason());
        }
    }

    /**
     * Wires the Playwright-backed Coordinator for one university, with settings scoped to its profile.
     */
    static Coordinator coordinatorFor(HarvestSettings settings, UniversityProfile profile) {
        HarvestSettings runSettings = settings.forProfile(profile);
        UniversitySite site = SiteRegistry.forProfile(profile, runSettings.operationTimeout());
        return new Coordinator(new PlaywrightSessionFactory(runSettings.operationTimeout()), runSettings, site, site);
    }

    private static void printUniversities(List<UniversityProfile> universities) {
        System.out.println("Configured universities:");
        for (UniversityProfile p : universities) {
            String local = p.localName().isEmpty() ? "" : " (" + p.localName() + ")";
            System.out.printf("  %-8s %-8s %s%s%n", p.key(), p.code(), p.name(), local);
        }
    }
}
