package de.mirkosertic.sheetwatch.extract;

import de.mirkosertic.sheetwatch.MonitoringSession;
import de.mirkosertic.sheetwatch.model.FailureKind;
import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds the time a single extraction may take and maintains the session's "currently processing" marker.
 * <p>
 * An extraction that runs over budget is cancelled and reported as {@link FailureKind#TIMEOUT}; the marker
 * is cleared so the watchdog does not keep reporting the abandoned run.
 */
public class TimeLimitedExtractor implements SpreadsheetExtractor {

    private static final Logger logger = LoggerFactory.getLogger(TimeLimitedExtractor.class);

    private final SpreadsheetExtractor delegate;
    private final MonitoringSession session;
    private final long timeoutMs;
    private final ExecutorService executor;

    public TimeLimitedExtractor(final SpreadsheetExtractor delegate, final MonitoringSession session, final long timeoutMs) {
        this.delegate = delegate;
        this.session = session;
        this.timeoutMs = timeoutMs;
        final AtomicInteger threadCounter = new AtomicInteger(0);
        this.executor = Executors.newCachedThreadPool(r -> {
            final Thread t = new Thread(r, "extract-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public WorkbookSnapshot extract(final Path file) throws ExtractionException {
        final MonitoringSession.Processing marker = session.beginProcessing(file);
        final Future<WorkbookSnapshot> future = executor.submit(() -> delegate.extract(file));
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            session.clearProcessing();
            logger.warn("Extraction of {} exceeded {}ms and was abandoned", file.getFileName(), timeoutMs);
            throw new ExtractionException(FailureKind.TIMEOUT,
                    "Extraction of " + file.getFileName() + " exceeded " + timeoutMs + "ms", e);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionException(FailureKind.TIMEOUT, "Interrupted while extracting " + file.getFileName(), e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof ExtractionException extractionException) {
                throw extractionException;
            }
            throw new ExtractionException(FailureKind.CORRUPT,
                    "Extraction of " + file.getFileName() + " failed: " + cause, cause);
        } finally {
            session.endProcessing(marker);
        }
    }

    @Override
    public @Nullable String lastAuthor(final Path file) {
        return delegate.lastAuthor(file);
    }

    @Override
    public Map<Integer, String> externalLinks(final Path file) {
        return delegate.externalLinks(file);
    }

    public void shutdown() {
        executor.shutdownNow();
    }
}
