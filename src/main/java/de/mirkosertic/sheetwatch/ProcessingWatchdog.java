package de.mirkosertic.sheetwatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Reports extractions that hang longer than the extraction timeout and clears their processing marker.
 */
public class ProcessingWatchdog {

    private static final Logger logger = LoggerFactory.getLogger(ProcessingWatchdog.class);

    private final MonitoringSession session;
    private final long intervalMs;
    private final Duration stallAfter;

    private final ScheduledExecutorService timerExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "processing-watchdog");
                t.setDaemon(true);
                return t;
            });
    private volatile ScheduledFuture<?> timerFuture;

    public ProcessingWatchdog(final MonitoringSession session, final long intervalMs, final long stallAfterMs) {
        this.session = session;
        this.intervalMs = intervalMs;
        this.stallAfter = Duration.ofMillis(stallAfterMs);
    }

    public void start() {
        if (intervalMs <= 0) {
            logger.debug("Processing watchdog disabled");
            return;
        }
        timerFuture = timerExecutor.scheduleAtFixedRate(this::check, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * @return true if a stalled extraction was found
     */
    boolean check() {
        try {
            final MonitoringSession.Processing processing = session.currentProcessing();
            if (processing == null) {
                return false;
            }
            final Duration elapsed = processing.elapsed(session.getClock().instant());
            if (elapsed.compareTo(stallAfter) <= 0) {
                return false;
            }
            logger.warn("Processing of {} stalled for {}s, marker cleared", processing.file(), elapsed.toSeconds());
            session.endProcessing(processing);
            return true;
        } catch (final Exception e) {
            // Nothing may escape a periodic check
            logger.error("Processing watchdog check failed", e);
            return false;
        }
    }

    public void shutdown() {
        if (timerFuture != null) {
            timerFuture.cancel(false);
        }
        timerExecutor.shutdownNow();
    }
}
