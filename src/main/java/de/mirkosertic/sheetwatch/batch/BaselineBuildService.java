package de.mirkosertic.sheetwatch.batch;

import de.mirkosertic.sheetwatch.MonitoringSession;
import de.mirkosertic.sheetwatch.config.ApplicationConfig;
import de.mirkosertic.sheetwatch.watch.FilePatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Takes baselines for many files in one run, typically all spreadsheets in the watch folders at startup.
 * <p>
 * Files are handled in sorted path order so an interrupted run can resume from the saved position. Before
 * each file the resource guard is consulted; if memory stays over the limit the run saves its progress and
 * halts instead of failing.
 */
public class BaselineBuildService {

    private static final Logger logger = LoggerFactory.getLogger(BaselineBuildService.class);

    private final BaselineSeeder seeder;
    private final ProgressTracker progressTracker;
    private final ResourceGuard resourceGuard;
    private final MonitoringSession session;
    private final FilePatternMatcher matcher;
    private final boolean resumeEnabled;

    public BaselineBuildService(final ApplicationConfig config,
                                final BaselineSeeder seeder,
                                final ProgressTracker progressTracker,
                                final ResourceGuard resourceGuard,
                                final MonitoringSession session) {
        this(seeder, progressTracker, resourceGuard, session,
                new FilePatternMatcher(config.getSupportedExtensions(), config.getLockFilePrefixes()),
                config.isResumeEnabled());
    }

    BaselineBuildService(final BaselineSeeder seeder,
                         final ProgressTracker progressTracker,
                         final ResourceGuard resourceGuard,
                         final MonitoringSession session,
                         final FilePatternMatcher matcher,
                         final boolean resumeEnabled) {
        this.seeder = seeder;
        this.progressTracker = progressTracker;
        this.resourceGuard = resourceGuard;
        this.session = session;
        this.matcher = matcher;
        this.resumeEnabled = resumeEnabled;
    }

    /**
     * All supported spreadsheets below the given folders, or the given files themselves.
     */
    public List<Path> collectTargets(final List<String> foldersOrFiles) {
        final List<Path> targets = new ArrayList<>();
        for (final String entry : foldersOrFiles) {
            final Path path = Paths.get(entry);
            if (Files.isRegularFile(path)) {
                if (matcher.shouldInclude(path)) {
                    targets.add(path);
                }
            } else if (Files.isDirectory(path)) {
                try (final Stream<Path> files = Files.walk(path)) {
                    files.filter(Files::isRegularFile)
                            .filter(matcher::shouldInclude)
                            .forEach(targets::add);
                } catch (final IOException | RuntimeException e) {
                    logger.error("Failed to scan {}", path, e);
                }
            } else {
                logger.warn("Baseline target does not exist: {}", path);
            }
        }
        return targets;
    }

    public BatchSummary run(final List<Path> files) {
        final List<Path> ordered = files.stream().distinct().sorted().toList();
        final int total = ordered.size();
        final int start = resumePosition(total);

        logger.info("Building baselines for {} files{}", total, start > 0 ? " (resuming at " + start + ")" : "");

        int succeeded = 0;
        int skipped = 0;
        int failed = 0;
        for (int i = start; i < total; i++) {
            if (session.isStopRequested()) {
                logger.info("Baseline build stopped at {}/{}", i, total);
                saveProgress(i, total);
                return new BatchSummary(succeeded, skipped, failed, true);
            }
            if (!resourceGuard.ensureCapacity()) {
                logger.warn("Baseline build halted at {}/{} because memory stays over the limit", i, total);
                saveProgress(i, total);
                return new BatchSummary(succeeded, skipped, failed, true);
            }

            final Path file = ordered.get(i);
            switch (seeder.seed(file)) {
                case CREATED, REPLACED -> succeeded++;
                case UNCHANGED -> skipped++;
                case FAILED -> failed++;
            }
            saveProgress(i + 1, total);
        }

        progressTracker.clear();
        session.markBatchCompleted();
        logger.info("Baseline build finished: {} written, {} up to date, {} failed", succeeded, skipped, failed);
        return new BatchSummary(succeeded, skipped, failed, false);
    }

    private int resumePosition(final int total) {
        if (!resumeEnabled) {
            return 0;
        }
        final ProgressRecord progress = progressTracker.load();
        if (progress == null) {
            return 0;
        }
        if (progress.totalCount() != total || progress.completedCount() < 0 || progress.completedCount() > total) {
            logger.info("Saved progress {}/{} does not match the current {} files, starting over",
                    progress.completedCount(), progress.totalCount(), total);
            return 0;
        }
        return progress.completedCount();
    }

    private void saveProgress(final int completed, final int total) {
        try {
            progressTracker.save(completed, total);
        } catch (final IOException e) {
            logger.warn("Failed to save batch progress {}/{}: {}", completed, total, e.getMessage());
        }
    }
}
