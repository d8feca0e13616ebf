package de.mirkosertic.sheetwatch.watch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Recursive directory watching on top of {@link WatchService}.
 * <p>
 * The JDK reports a rename as a delete followed by a create. Within one batch of events of a directory,
 * deletes are paired with later creates in arrival order and reported as moves; unpaired deletes are
 * reported after the batch.
 */
public class DirectoryWatcherService {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcherService.class);

    private final long pollIntervalMs;
    private final Map<WatchKey, WatchInfo> watchKeys = new ConcurrentHashMap<>();
    private final AtomicBoolean loopStarted = new AtomicBoolean(false);
    private final ExecutorService watchExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread thread = new Thread(r, "directory-watcher");
        thread.setDaemon(true);
        return thread;
    });

    private volatile WatchService watchService;

    public DirectoryWatcherService(final long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public synchronized void watchDirectory(final Path directory, final FileChangeListener listener) throws IOException {
        if (watchService == null) {
            watchService = FileSystems.getDefault().newWatchService();
        }

        registerRecursive(directory, listener);

        if (loopStarted.compareAndSet(false, true)) {
            watchExecutor.execute(this::processEvents);
        }
    }

    private void registerRecursive(final Path directory, final FileChangeListener listener) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
                final WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                watchKeys.put(key, new WatchInfo(dir, listener));
                logger.debug("Registered watch for directory: {}", dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void processEvents() {
        logger.info("Directory watcher started");

        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = watchService.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                logger.info("Watch service closed");
                break;
            }

            final WatchInfo watchInfo = watchKeys.get(key);
            if (watchInfo == null) {
                logger.warn("Watch key not recognized");
                key.reset();
                continue;
            }

            final Deque<Path> pendingDeletes = new ArrayDeque<>();
            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();

                if (kind == OVERFLOW) {
                    logger.warn("Watch event overflow in {}", watchInfo.directory());
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path fullPath = watchInfo.directory().resolve(pathEvent.context());

                try {
                    if (kind == ENTRY_CREATE) {
                        if (Files.isDirectory(fullPath)) {
                            registerRecursive(fullPath, watchInfo.listener());
                        } else if (!pendingDeletes.isEmpty()) {
                            watchInfo.listener().onFileMoved(pendingDeletes.pollFirst(), fullPath);
                        } else {
                            watchInfo.listener().onFileCreated(fullPath);
                        }
                    } else if (kind == ENTRY_MODIFY) {
                        if (Files.isRegularFile(fullPath)) {
                            watchInfo.listener().onFileModified(fullPath);
                        }
                    } else if (kind == ENTRY_DELETE) {
                        pendingDeletes.addLast(fullPath);
                    }
                } catch (final Exception e) {
                    logger.error("Error processing watch event for: {}", fullPath, e);
                }
            }

            for (final Path deleted : pendingDeletes) {
                try {
                    watchInfo.listener().onFileDeleted(deleted);
                } catch (final Exception e) {
                    logger.error("Error processing delete event for: {}", deleted, e);
                }
            }

            final boolean valid = key.reset();
            if (!valid) {
                watchKeys.remove(key);
                logger.info("Watch key for {} no longer valid, removed from tracking", watchInfo.directory());
            }
        }

        logger.info("Directory watcher stopped");
    }

    public int watchedDirectoryCount() {
        return watchKeys.size();
    }

    public void stopAll() throws IOException {
        logger.info("Stopping all directory watchers");
        watchExecutor.shutdownNow();

        if (watchService != null) {
            watchService.close();
        }

        watchKeys.clear();
    }

    public void shutdown() {
        try {
            stopAll();
        } catch (final IOException e) {
            logger.error("Error shutting down directory watcher service", e);
        }
    }

    private record WatchInfo(Path directory, FileChangeListener listener) {
    }
}
