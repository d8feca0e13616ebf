package de.mirkosertic.sheetwatch.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * Memory backpressure for the batch build.
 */
public class ResourceGuard {

    private static final Logger logger = LoggerFactory.getLogger(ResourceGuard.class);

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final long limitMb;
    private final long pauseMs;
    private final LongSupplier usageMb;

    public ResourceGuard(final long limitMb, final long pauseMs) {
        this(limitMb, pauseMs, ResourceGuard::heapUsageMb);
    }

    ResourceGuard(final long limitMb, final long pauseMs, final LongSupplier usageMb) {
        this.limitMb = limitMb;
        this.pauseMs = pauseMs;
        this.usageMb = usageMb;
    }

    private static long heapUsageMb() {
        final Runtime runtime = Runtime.getRuntime();
        return (runtime.totalMemory() - runtime.freeMemory()) / BYTES_PER_MB;
    }

    public long currentUsageMB() {
        return usageMb.getAsLong();
    }

    /**
     * A limit of zero or less disables the guard.
     */
    public boolean overLimit() {
        return limitMb > 0 && currentUsageMB() > limitMb;
    }

    /**
     * Check memory before the next unit of work. When over the limit, pause, request a collection and check
     * again.
     *
     * @return true if work may continue, false if memory is still over the limit
     */
    public boolean ensureCapacity() {
        if (!overLimit()) {
            return true;
        }
        logger.warn("Memory usage {}MB over limit {}MB, pausing {}ms", currentUsageMB(), limitMb, pauseMs);
        try {
            Thread.sleep(pauseMs);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        System.gc();
        if (overLimit()) {
            logger.error("Memory usage still {}MB after pause (limit {}MB)", currentUsageMB(), limitMb);
            return false;
        }
        logger.info("Memory usage back to {}MB", currentUsageMB());
        return true;
    }

    public long getLimitMb() {
        return limitMb;
    }
}
