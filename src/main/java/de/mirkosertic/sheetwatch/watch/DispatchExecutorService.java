package de.mirkosertic.sheetwatch.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker threads that handle file events off the directory watcher thread.
 * <p>
 * Events of one path run strictly in arrival order and never in parallel: while a path has work in flight,
 * further events for it are queued behind it and picked up by the same worker. Different paths are handled
 * concurrently.
 */
public class DispatchExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(DispatchExecutorService.class);

    private final ThreadPoolExecutor executor;

    private final Object lock = new Object();
    private final Map<Path, Deque<Runnable>> inFlight = new HashMap<>();

    public DispatchExecutorService(final int threads) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "dispatch-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        final int poolSize = Math.max(1, threads);
        this.executor = new ThreadPoolExecutor(
                poolSize,
                poolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("Event dispatch started with {} workers", poolSize);
    }

    /**
     * Queue work for {@code file}. It starts once all earlier work for the same path has finished.
     */
    public void execute(final Path file, final Runnable task) {
        synchronized (lock) {
            final Deque<Runnable> waiting = inFlight.get(file);
            if (waiting != null) {
                waiting.add(task);
                logger.debug("Queued event for {} behind {} pending", file.getFileName(), waiting.size());
                return;
            }
            inFlight.put(file, new ArrayDeque<>());
        }
        executor.execute(() -> drain(file, task));
    }

    private void drain(final Path file, final Runnable first) {
        Runnable current = first;
        while (current != null) {
            try {
                current.run();
            } catch (final RuntimeException e) {
                logger.error("Unhandled error while dispatching event for {}", file, e);
            }
            synchronized (lock) {
                final Deque<Runnable> waiting = inFlight.get(file);
                current = waiting == null ? null : waiting.poll();
                if (current == null) {
                    inFlight.remove(file);
                }
            }
        }
    }

    /**
     * Number of paths with work queued or running.
     */
    int busyPaths() {
        synchronized (lock) {
            return inFlight.size();
        }
    }

    public void shutdown() {
        logger.info("Shutting down event dispatch");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Event dispatch did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for event dispatch to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        synchronized (lock) {
            inFlight.clear();
        }
    }
}
