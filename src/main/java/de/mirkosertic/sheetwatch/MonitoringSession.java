package de.mirkosertic.sheetwatch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared state of one monitoring run: which file is being extracted right now, whether a stop was
 * requested, and whether the initial batch build has finished.
 * <p>
 * Created at startup and handed to every component that needs it; several sessions can coexist in tests.
 */
public class MonitoringSession {

    private static final Logger logger = LoggerFactory.getLogger(MonitoringSession.class);

    /**
     * File currently being extracted and when extraction started.
     */
    public record Processing(Path file, Instant since) {

        public Duration elapsed(final Instant now) {
            return Duration.between(since, now);
        }
    }

    private final Clock clock;
    private final AtomicReference<Processing> processing = new AtomicReference<>();
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean batchCompleted = new AtomicBoolean(false);

    public MonitoringSession() {
        this(Clock.systemUTC());
    }

    public MonitoringSession(final Clock clock) {
        this.clock = clock;
    }

    public Clock getClock() {
        return clock;
    }

    public Processing beginProcessing(final Path file) {
        final Processing marker = new Processing(file, clock.instant());
        processing.set(marker);
        return marker;
    }

    /**
     * Clear the marker, but only if it still belongs to the given run.
     */
    public void endProcessing(final Processing marker) {
        processing.compareAndSet(marker, null);
    }

    public void clearProcessing() {
        processing.set(null);
    }

    public @Nullable Processing currentProcessing() {
        return processing.get();
    }

    public void requestStop() {
        if (stopRequested.compareAndSet(false, true)) {
            logger.info("Stop requested for monitoring session");
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public void markBatchCompleted() {
        batchCompleted.set(true);
    }

    public boolean isBatchCompleted() {
        return batchCompleted.get();
    }
}
