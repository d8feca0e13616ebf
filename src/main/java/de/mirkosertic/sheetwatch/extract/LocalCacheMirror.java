package de.mirkosertic.sheetwatch.extract;

import de.mirkosertic.sheetwatch.diff.ContentFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;

/**
 * Keeps local copies of spreadsheets that live on slow network shares.
 * <p>
 * Copies are named {@code <16 hex chars of the path hash>_<file name>} so equally named files from different
 * folders do not collide. A copy is refreshed when it is missing or older than the source.
 */
public class LocalCacheMirror {

    private static final Logger logger = LoggerFactory.getLogger(LocalCacheMirror.class);

    private final Path cacheFolder;

    public LocalCacheMirror(final Path cacheFolder) {
        this.cacheFolder = cacheFolder;
    }

    /**
     * Local path to read instead of the network path. Falls back to the network path when copying fails,
     * so reading can still be attempted directly.
     */
    public Path ensureLocalCopy(final Path networkPath) {
        final Path cached = cachePathFor(networkPath);
        try {
            final FileTime sourceModified = Files.getLastModifiedTime(networkPath);
            if (Files.exists(cached) && Files.getLastModifiedTime(cached).compareTo(sourceModified) >= 0) {
                logger.debug("Cache hit for {}", networkPath);
                return cached;
            }

            Files.createDirectories(cacheFolder);
            final long start = System.currentTimeMillis();
            Files.copy(networkPath, cached, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            logger.debug("Copied {} ({} bytes) to cache in {}ms",
                    networkPath.getFileName(), Files.size(cached), System.currentTimeMillis() - start);
            return cached;
        } catch (final IOException e) {
            logger.warn("Cannot mirror {} to local cache, reading it directly: {}", networkPath, e.toString());
            return networkPath;
        }
    }

    Path cachePathFor(final Path networkPath) {
        final String pathHash = ContentFingerprint.sha256Hex(networkPath.toAbsolutePath().toString()).substring(0, 16);
        return cacheFolder.resolve(pathHash + "_" + networkPath.getFileName());
    }

    /**
     * Remove the cached copy of a file, e.g. after the file was deleted or renamed.
     */
    public void evict(final Path networkPath) {
        try {
            Files.deleteIfExists(cachePathFor(networkPath));
        } catch (final IOException e) {
            logger.warn("Failed to evict cached copy of {}: {}", networkPath, e.getMessage());
        }
    }
}
