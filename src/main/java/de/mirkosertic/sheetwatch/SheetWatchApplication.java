package de.mirkosertic.sheetwatch;

import de.mirkosertic.sheetwatch.audit.CsvAuditSink;
import de.mirkosertic.sheetwatch.baseline.BaselineArchiver;
import de.mirkosertic.sheetwatch.baseline.BaselineCodec;
import de.mirkosertic.sheetwatch.baseline.BaselineStore;
import de.mirkosertic.sheetwatch.batch.BaselineBuildService;
import de.mirkosertic.sheetwatch.batch.BaselineSeeder;
import de.mirkosertic.sheetwatch.batch.BatchSummary;
import de.mirkosertic.sheetwatch.batch.ProgressTracker;
import de.mirkosertic.sheetwatch.batch.ResourceGuard;
import de.mirkosertic.sheetwatch.config.ApplicationConfig;
import de.mirkosertic.sheetwatch.config.BuildInfo;
import de.mirkosertic.sheetwatch.config.LoggingConfigurator;
import de.mirkosertic.sheetwatch.detect.ChangeDetector;
import de.mirkosertic.sheetwatch.detect.ChangeFilterPolicy;
import de.mirkosertic.sheetwatch.extract.PoiSpreadsheetExtractor;
import de.mirkosertic.sheetwatch.extract.TimeLimitedExtractor;
import de.mirkosertic.sheetwatch.polling.AdaptivePollingScheduler;
import de.mirkosertic.sheetwatch.watch.DirectoryWatcherService;
import de.mirkosertic.sheetwatch.watch.DispatchExecutorService;
import de.mirkosertic.sheetwatch.watch.ForcedBaselineList;
import de.mirkosertic.sheetwatch.watch.SpreadsheetEventDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;

/**
 * Main entry point of the spreadsheet change monitor.
 * Wires all services, takes initial baselines and then watches the configured folders until shutdown.
 */
public class SheetWatchApplication {

    private static final Logger logger = LoggerFactory.getLogger(SheetWatchApplication.class);

    private final ApplicationConfig config;
    private final MonitoringSession session;
    private final BaselineStore store;
    private final BaselineArchiver archiver;
    private final TimeLimitedExtractor extractor;
    private final BaselineSeeder seeder;
    private final AdaptivePollingScheduler scheduler;
    private final DispatchExecutorService dispatchExecutor;
    private final ForcedBaselineList forcedBaselines;
    private final SpreadsheetEventDispatcher dispatcher;
    private final DirectoryWatcherService watcherService;
    private final BaselineBuildService buildService;
    private final ProcessingWatchdog watchdog;

    public SheetWatchApplication(final ApplicationConfig config) {
        this.config = config;
        final Clock clock = Clock.systemUTC();

        // Initialize services in dependency order
        this.session = new MonitoringSession(clock);

        this.store = new BaselineStore(config);

        this.archiver = new BaselineArchiver(store, BaselineCodec.byName(config.getArchiveCodec()),
                config.getArchiveAfterDays());

        this.extractor = new TimeLimitedExtractor(new PoiSpreadsheetExtractor(config), session,
                config.getExtractionTimeoutMs());

        final ChangeDetector detector = new ChangeDetector(
                store,
                extractor,
                new CsvAuditSink(Paths.get(config.getAuditFolder())),
                ChangeFilterPolicy.fromConfig(config),
                config.isRefreshAuthorOnUnchanged(),
                clock
        );

        this.seeder = new BaselineSeeder(store, extractor, clock);

        this.scheduler = new AdaptivePollingScheduler(config, detector);

        this.dispatchExecutor = new DispatchExecutorService(config.getDispatchThreads());

        this.forcedBaselines = new ForcedBaselineList(config.getForceBaselineOnFirstSeen());

        this.dispatcher = new SpreadsheetEventDispatcher(
                config,
                store,
                detector,
                seeder,
                scheduler,
                dispatchExecutor,
                forcedBaselines
        );

        this.watcherService = new DirectoryWatcherService(config.getWatchPollIntervalMs());

        this.buildService = new BaselineBuildService(
                config,
                seeder,
                new ProgressTracker(Paths.get(config.getProgressFile()), clock),
                new ResourceGuard(config.getMemoryLimitMb(), config.getMemoryPauseMs()),
                session
        );

        this.watchdog = new ProcessingWatchdog(session, config.getWatchdogIntervalMs(),
                config.getExtractionTimeoutMs());
    }

    /**
     * Initialize all services.
     */
    public void init() throws IOException {
        logger.info("Initializing {}", BuildInfo.current().banner());

        store.open();
        archiver.archiveInactive();
        watchdog.start();

        logger.info("All services initialized successfully");
    }

    /**
     * Take the initial baselines and start watching.
     */
    public void start() {
        final List<String> targets = config.getManualBaselineTargets().isEmpty()
                ? (config.isScanAllOnStartup() ? config.getWatchFolders() : List.of())
                : config.getManualBaselineTargets();
        if (!targets.isEmpty()) {
            buildInitialBaselines(targets);
        }

        for (final String folder : config.getWatchFolders()) {
            final Path directory = Paths.get(folder);
            if (!Files.isDirectory(directory)) {
                logger.warn("Watch folder does not exist: {}", directory);
                continue;
            }
            try {
                watcherService.watchDirectory(directory, dispatcher);
                logger.info("Watching {}", directory);
            } catch (final IOException e) {
                logger.error("Failed to setup watcher for directory: {}", directory, e);
            }
        }

        logger.info("Monitoring started");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    private void buildInitialBaselines(final List<String> targets) {
        try {
            final List<Path> files = buildService.collectTargets(targets);
            final BatchSummary summary = buildService.run(files);
            files.forEach(forcedBaselines::markSeen);
            if (summary.halted()) {
                logger.warn("Initial baseline build halted, it resumes on next start");
            }
        } catch (final RuntimeException e) {
            // Monitoring starts even without initial baselines
            logger.error("Initial baseline build failed", e);
        }
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down monitor...");
        session.requestStop();

        // Shutdown in reverse order of initialization
        try {
            watcherService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down watcher service", e);
        }

        try {
            dispatchExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down dispatch executor", e);
        }

        try {
            scheduler.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down polling scheduler", e);
        }

        try {
            extractor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down extractor", e);
        }

        watchdog.shutdown();

        logger.info("Monitor shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging first, before any other code that might log
            final boolean serviceMode = ApplicationConfig.isServiceModeRequested();
            LoggingConfigurator.configure(serviceMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!serviceMode) {
                logger.info("Running in console mode");
                logger.info("Baseline folder: {}", config.getBaselineFolder());
                logger.info("Watch folders: {}", config.getWatchFolders());
            }

            final SheetWatchApplication app = new SheetWatchApplication(config);
            app.init();
            app.start();

        } catch (final Exception e) {
            System.err.println("Failed to start monitor: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
