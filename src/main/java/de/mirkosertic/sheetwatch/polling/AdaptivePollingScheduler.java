package de.mirkosertic.sheetwatch.polling;

import de.mirkosertic.sheetwatch.config.ApplicationConfig;
import de.mirkosertic.sheetwatch.detect.ChangeDetector;
import de.mirkosertic.sheetwatch.detect.DetectionResult;
import de.mirkosertic.sheetwatch.model.FailureKind;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps re-inspecting recently edited files on a size-dependent cadence.
 * <p>
 * There is at most one task per file path. Starting a task for a path that already has one cancels the old
 * task first, so a burst of edits only restarts the observation window. The task table is guarded by a single
 * lock which is never held while a detection cycle runs.
 */
public class AdaptivePollingScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AdaptivePollingScheduler.class);

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final ChangeDetector detector;
    private final ScheduledExecutorService executor;
    private final double sizeThresholdMb;
    private final long denseIntervalMs;
    private final long denseDurationMs;
    private final long sparseIntervalMs;
    private final int maxConsecutiveFailures;

    private final Object lock = new Object();
    private final Map<Path, PollingTask> tasks = new HashMap<>();
    private boolean stopped;

    public AdaptivePollingScheduler(final ApplicationConfig config, final ChangeDetector detector) {
        this(detector, createExecutor(config.getPollingThreads()),
                config.getPollingSizeThresholdMb(),
                config.getDensePollingIntervalMs(),
                config.getDensePollingDurationMs(),
                config.getSparsePollingIntervalMs(),
                config.getMaxConsecutiveFailedPolls());
    }

    AdaptivePollingScheduler(final ChangeDetector detector,
                             final ScheduledExecutorService executor,
                             final double sizeThresholdMb,
                             final long denseIntervalMs,
                             final long denseDurationMs,
                             final long sparseIntervalMs,
                             final int maxConsecutiveFailures) {
        this.detector = detector;
        this.executor = executor;
        this.sizeThresholdMb = sizeThresholdMb;
        this.denseIntervalMs = denseIntervalMs;
        this.denseDurationMs = denseDurationMs;
        this.sparseIntervalMs = sparseIntervalMs;
        this.maxConsecutiveFailures = Math.max(1, maxConsecutiveFailures);
    }

    static ScheduledExecutorService createExecutor(final int threads) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(Math.max(1, threads), r -> {
            final Thread thread = new Thread(r, "poller-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    /**
     * Start (or restart) observing a file, choosing the mode from its current size.
     */
    public void start(final Path file) {
        start(file, modeFor(file));
    }

    public void start(final Path file, final PollingMode mode) {
        final PollingTask task = mode == PollingMode.DENSE
                ? new PollingTask(file, mode, denseIntervalMs, denseDurationMs, maxConsecutiveFailures)
                : new PollingTask(file, mode, sparseIntervalMs, 0, maxConsecutiveFailures);

        synchronized (lock) {
            if (stopped) {
                logger.debug("Scheduler stopped, not polling {}", file);
                return;
            }
            final PollingTask previous = tasks.put(file, task);
            if (previous != null) {
                previous.cancel();
                logger.debug("Restarted polling of {} ({})", file.getFileName(), mode);
            } else {
                logger.info("Polling {} in {} mode every {}ms", file.getFileName(), mode, task.intervalMs());
            }
            scheduleNext(task);
        }
    }

    PollingMode modeFor(final Path file) {
        try {
            final double sizeMb = Files.size(file) / BYTES_PER_MB;
            return sizeMb < sizeThresholdMb ? PollingMode.DENSE : PollingMode.SPARSE;
        } catch (final IOException e) {
            logger.debug("Cannot determine size of {}, using dense polling: {}", file, e.getMessage());
            return PollingMode.DENSE;
        }
    }

    private void scheduleNext(final PollingTask task) {
        task.setFuture(executor.schedule(() -> tick(task), task.intervalMs(), TimeUnit.MILLISECONDS));
    }

    private void tick(final PollingTask task) {
        synchronized (lock) {
            if (stopped || tasks.get(task.file()) != task) {
                return;
            }
        }

        final DetectionResult result = runCycle(task.file());

        synchronized (lock) {
            if (stopped || tasks.get(task.file()) != task) {
                // Superseded by a newer task or stopped while detecting
                return;
            }
            if (task.advance(result)) {
                scheduleNext(task);
            } else {
                tasks.remove(task.file());
                if (task.consecutiveFailures() >= maxConsecutiveFailures) {
                    logger.warn("Stopped polling {} after {} failed attempts", task.file().getFileName(),
                            task.consecutiveFailures());
                } else {
                    logger.info("Polling of {} finished after {} ticks", task.file().getFileName(), task.ticks());
                }
            }
        }
    }

    DetectionResult runCycle(final Path file) {
        try {
            return detector.detect(file);
        } catch (final RuntimeException e) {
            // Nothing may escape a tick
            logger.error("Detection cycle for {} aborted by an unexpected error", file, e);
            return DetectionResult.failed(FailureKind.INTERNAL_ERROR);
        }
    }

    /**
     * Stop observing one file, e.g. because it was deleted.
     */
    public void stop(final Path file) {
        synchronized (lock) {
            final PollingTask task = tasks.remove(file);
            if (task != null) {
                task.cancel();
            }
        }
    }

    /**
     * Cancel every pending tick and clear the table. Ticks already running finish their cycle.
     */
    public void stopAll() {
        synchronized (lock) {
            stopped = true;
            for (final PollingTask task : tasks.values()) {
                task.cancel();
            }
            final int count = tasks.size();
            tasks.clear();
            logger.info("Polling stopped, {} active tasks cancelled", count);
        }
    }

    public void shutdown() {
        stopAll();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Polling executor did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for polling executor to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isActive(final Path file) {
        synchronized (lock) {
            return tasks.containsKey(file);
        }
    }

    public int activeCount() {
        synchronized (lock) {
            return tasks.size();
        }
    }

    public @Nullable PollingMode getMode(final Path file) {
        synchronized (lock) {
            final PollingTask task = tasks.get(file);
            return task == null ? null : task.mode();
        }
    }

    /**
     * Remaining observation budget of a dense task in milliseconds, or -1 if the file is not being polled.
     */
    public long getRemainingDuration(final Path file) {
        synchronized (lock) {
            final PollingTask task = tasks.get(file);
            return task == null ? -1 : task.remainingMs();
        }
    }

    long getInterval(final Path file) {
        synchronized (lock) {
            final PollingTask task = tasks.get(file);
            return task == null ? -1 : task.intervalMs();
        }
    }
}
