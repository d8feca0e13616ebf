package de.mirkosertic.sheetwatch.watch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import de.mirkosertic.sheetwatch.baseline.BaselineStore;
import de.mirkosertic.sheetwatch.batch.BaselineSeeder;
import de.mirkosertic.sheetwatch.config.ApplicationConfig;
import de.mirkosertic.sheetwatch.detect.ChangeDetector;
import de.mirkosertic.sheetwatch.detect.DetectionResult;
import de.mirkosertic.sheetwatch.polling.AdaptivePollingScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

/**
 * Turns directory events into detection work.
 * <ul>
 *     <li>create: wait for the file to settle, then take a baseline</li>
 *     <li>modify: debounced per path; one immediate detection cycle, then adaptive polling. Files on the
 *     forced baseline list get a fresh baseline instead on their first event of the session</li>
 *     <li>move: the baseline follows the file; an unknown file moved onto a known name is a modification
 *     of that file (editors save by renaming a temporary file over the original)</li>
 *     <li>delete: polling of the file stops, the baseline is kept</li>
 * </ul>
 * Event handling runs on the dispatch workers, never on the watcher thread, in arrival order per path.
 */
public class SpreadsheetEventDispatcher implements FileChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(SpreadsheetEventDispatcher.class);

    private final FilePatternMatcher matcher;
    private final BaselineStore store;
    private final ChangeDetector detector;
    private final BaselineSeeder seeder;
    private final AdaptivePollingScheduler scheduler;
    private final DispatchExecutorService executor;
    private final ForcedBaselineList forcedBaselines;
    private final long createSettleDelayMs;
    private final Cache<Path, Long> recentlyAccepted;

    public SpreadsheetEventDispatcher(final ApplicationConfig config,
                                      final BaselineStore store,
                                      final ChangeDetector detector,
                                      final BaselineSeeder seeder,
                                      final AdaptivePollingScheduler scheduler,
                                      final DispatchExecutorService executor,
                                      final ForcedBaselineList forcedBaselines) {
        this(new FilePatternMatcher(config.getSupportedExtensions(), config.getLockFilePrefixes()),
                store, detector, seeder, scheduler, executor, forcedBaselines,
                config.getDebounceMs(), config.getCreateSettleDelayMs(), Ticker.systemTicker());
    }

    SpreadsheetEventDispatcher(final FilePatternMatcher matcher,
                               final BaselineStore store,
                               final ChangeDetector detector,
                               final BaselineSeeder seeder,
                               final AdaptivePollingScheduler scheduler,
                               final DispatchExecutorService executor,
                               final ForcedBaselineList forcedBaselines,
                               final long debounceMs,
                               final long createSettleDelayMs,
                               final Ticker ticker) {
        this.matcher = matcher;
        this.store = store;
        this.detector = detector;
        this.seeder = seeder;
        this.scheduler = scheduler;
        this.executor = executor;
        this.forcedBaselines = forcedBaselines;
        this.createSettleDelayMs = createSettleDelayMs;
        this.recentlyAccepted = Caffeine.newBuilder()
                .expireAfterWrite(Math.max(0, debounceMs), TimeUnit.MILLISECONDS)
                .ticker(ticker)
                .build();
    }

    @Override
    public void onFileCreated(final Path file) {
        logger.debug("File created: {}", file);
        if (matcher.shouldInclude(file)) {
            executor.execute(file, () -> handleCreated(file));
        }
    }

    @Override
    public void onFileModified(final Path file) {
        logger.debug("File modified: {}", file);
        if (!matcher.shouldInclude(file)) {
            return;
        }
        if (!accept(file)) {
            logger.debug("Debounced modification of {}", file);
            return;
        }
        executor.execute(file, () -> handleModified(file));
    }

    @Override
    public void onFileDeleted(final Path file) {
        logger.debug("File deleted: {}", file);
        if (matcher.shouldInclude(file)) {
            scheduler.stop(file);
            recentlyAccepted.invalidate(file);
            logger.info("Monitored file deleted: {}", file);
        }
    }

    @Override
    public void onFileMoved(final Path from, final Path to) {
        logger.debug("File moved: {} -> {}", from, to);
        final boolean sourceMonitored = matcher.shouldInclude(from);
        final boolean targetMonitored = matcher.shouldInclude(to);
        if (sourceMonitored) {
            scheduler.stop(from);
        }
        if (!targetMonitored) {
            if (sourceMonitored) {
                logger.info("Monitored file moved out of scope: {} -> {}", from, to.getFileName());
            }
            return;
        }
        executor.execute(to, () -> handleMoved(from, sourceMonitored, to));
    }

    /**
     * Leading-edge debounce: the first event for a path is accepted, further events within the window
     * after it are dropped.
     */
    boolean accept(final Path file) {
        return recentlyAccepted.asMap().putIfAbsent(file, System.nanoTime()) == null;
    }

    void handleCreated(final Path file) {
        try {
            if (createSettleDelayMs > 0) {
                Thread.sleep(createSettleDelayMs);
            }
            if (!Files.isRegularFile(file)) {
                logger.debug("{} vanished right after creation", file);
                return;
            }
            if (store.exists(BaselineStore.keyFor(file))) {
                // Recreated under a known name
                if (accept(file)) {
                    handleModified(file);
                }
                return;
            }
            accept(file);
            forcedBaselines.markSeen(file);
            logger.info("New file detected: {}", file);
            seeder.seed(file);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while handling creation of {}", file);
        } catch (final RuntimeException e) {
            logger.error("Error handling creation of {}", file, e);
        }
    }

    void handleModified(final Path file) {
        try {
            if (forcedBaselines.claimFirstSight(file)) {
                logger.info("First event for {} in this session, taking a forced baseline", file);
                seeder.seed(file);
                scheduler.start(file);
                return;
            }
            final DetectionResult result = detector.detect(file);
            if (result.outcome() == DetectionResult.Outcome.NO_BASELINE) {
                logger.info("Modified file without baseline, taking one: {}", file);
                seeder.seed(file);
            }
            scheduler.start(file);
        } catch (final RuntimeException e) {
            logger.error("Error handling modification of {}", file, e);
        }
    }

    void handleMoved(final Path from, final boolean sourceMonitored, final Path to) {
        try {
            final String fromKey = BaselineStore.keyFor(from);
            final String toKey = BaselineStore.keyFor(to);
            recentlyAccepted.invalidate(from);

            if (sourceMonitored && !fromKey.equals(toKey) && store.exists(fromKey)) {
                if (store.withKeyLock(fromKey, () -> store.rename(fromKey, toKey))) {
                    logger.info("File renamed, baseline follows: {} -> {}", from.getFileName(), to.getFileName());
                }
                return;
            }
            if (store.exists(toKey)) {
                // Save-via-rename onto a monitored file
                if (accept(to)) {
                    handleModified(to);
                }
                return;
            }
            accept(to);
            forcedBaselines.markSeen(to);
            logger.info("File moved into watched folder, taking baseline: {}", to);
            seeder.seed(to);
        } catch (final RuntimeException e) {
            logger.error("Error handling move {} -> {}", from, to, e);
        }
    }
}
