package de.mirkosertic.sheetwatch.polling;

import de.mirkosertic.sheetwatch.detect.DetectionResult;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.concurrent.ScheduledFuture;

/**
 * Observation episode of one file. All fields are guarded by the scheduler's table lock.
 */
final class PollingTask {

    private final Path file;
    private final PollingMode mode;
    private final long intervalMs;
    private final long fullDurationMs;
    private final int maxConsecutiveFailures;

    private long remainingMs;
    private int consecutiveFailures;
    private int ticks;
    private @Nullable ScheduledFuture<?> future;

    PollingTask(final Path file, final PollingMode mode, final long intervalMs, final long fullDurationMs,
                final int maxConsecutiveFailures) {
        this.file = file;
        this.mode = mode;
        this.intervalMs = intervalMs;
        this.fullDurationMs = fullDurationMs;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.remainingMs = fullDurationMs;
    }

    /**
     * Apply the result of one tick.
     *
     * @return true if the task wants another tick, false if it retires
     */
    boolean advance(final DetectionResult result) {
        ticks++;
        if (result.isFailed()) {
            consecutiveFailures++;
            return consecutiveFailures < maxConsecutiveFailures;
        }
        consecutiveFailures = 0;

        if (mode == PollingMode.SPARSE) {
            return result.changesFound();
        }
        if (result.changesFound()) {
            remainingMs = fullDurationMs;
        } else {
            remainingMs -= intervalMs;
        }
        return remainingMs > 0;
    }

    void cancel() {
        if (future != null) {
            // A tick that is already running finishes its cycle
            future.cancel(false);
        }
    }

    void setFuture(final ScheduledFuture<?> future) {
        this.future = future;
    }

    Path file() {
        return file;
    }

    PollingMode mode() {
        return mode;
    }

    long intervalMs() {
        return intervalMs;
    }

    long remainingMs() {
        return remainingMs;
    }

    int ticks() {
        return ticks;
    }

    int consecutiveFailures() {
        return consecutiveFailures;
    }
}
