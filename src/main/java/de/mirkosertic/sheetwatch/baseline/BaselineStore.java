package de.mirkosertic.sheetwatch.baseline;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import de.mirkosertic.sheetwatch.config.ApplicationConfig;
import de.mirkosertic.sheetwatch.model.Baseline;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Durable, crash-safe persistence of one {@link Baseline} per monitored file name.
 * <p>
 * Each baseline lives in a single artifact {@code <fileKey><codec extension>} inside the baseline folder.
 * Writes go to a uniquely named temporary file which is flushed to disk and read back before it replaces
 * the previous artifact; the previous artifact is kept as a backup until the replacement is in place.
 * <p>
 * Writers of the same key serialize their whole read-compare-write cycle through {@link #withKeyLock};
 * writes for different keys are independent.
 */
public class BaselineStore {

    private static final Logger logger = LoggerFactory.getLogger(BaselineStore.class);

    static final String TEMP_SUFFIX = ".tmp";
    static final String BACKUP_SUFFIX = ".backup";

    private final Path folder;
    private final BaselineCodec defaultCodec;
    private final int maxAttempts;
    private final long baseDelayMs;

    // Weak values: a lock lives as long as some thread holds a reference to it
    private final LoadingCache<String, ReentrantLock> keyLocks = Caffeine.newBuilder()
            .weakValues()
            .build(key -> new ReentrantLock());

    public BaselineStore(final ApplicationConfig config) {
        this(Paths.get(config.getBaselineFolder()),
                BaselineCodec.byName(config.getDefaultCodec()),
                config.getSaveMaxAttempts(),
                config.getSaveBaseDelayMs());
    }

    public BaselineStore(final Path folder, final BaselineCodec defaultCodec, final int maxAttempts, final long baseDelayMs) {
        this.folder = folder;
        this.defaultCodec = defaultCodec;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = baseDelayMs;
    }

    /**
     * Key under which the baseline of the given spreadsheet is stored.
     */
    public static String keyFor(final Path file) {
        return file.getFileName().toString();
    }

    /**
     * Run {@code action} while holding the lock of {@code fileKey}. Detection and seeding of one file
     * never overlap, so two cycles cannot compare against the same old baseline.
     */
    public <T> T withKeyLock(final String fileKey, final Supplier<T> action) {
        final ReentrantLock lock = keyLocks.get(fileKey);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Create the baseline folder and clean up after saves that were interrupted by a crash.
     */
    public void open() throws IOException {
        Files.createDirectories(folder);
        recover();
        logger.info("Baseline store opened at {} (default codec {})", folder, defaultCodec.codecName());
    }

    public Path getFolder() {
        return folder;
    }

    public BaselineCodec getDefaultCodec() {
        return defaultCodec;
    }

    // ==================== Reading ====================

    /**
     * Load the baseline for the given key, whichever codec wrote it.
     *
     * @return the baseline, or {@code null} if none exists
     * @throws CorruptBaselineException if the artifact cannot be decoded
     * @throws IOException              if the artifact cannot be read (locked, permissions)
     */
    public @Nullable Baseline load(final String fileKey) throws IOException {
        final Path artifact = locate(fileKey);
        if (artifact == null) {
            return null;
        }
        final BaselineCodec codec = BaselineCodec.forArtifactName(artifact.getFileName().toString());
        try {
            return readArtifact(artifact, codec);
        } catch (final NoSuchFileException e) {
            // Replaced between locate and read
            logger.debug("Baseline artifact vanished while loading: {}", artifact);
            return null;
        }
    }

    /**
     * Path of the artifact for the key, probing every known codec in fixed priority order.
     */
    public @Nullable Path locate(final String fileKey) {
        for (final BaselineCodec codec : BaselineCodec.probeOrder()) {
            final Path candidate = folder.resolve(codec.artifactName(fileKey));
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    public @Nullable BaselineCodec codecOf(final String fileKey) {
        final Path artifact = locate(fileKey);
        return artifact == null ? null : BaselineCodec.forArtifactName(artifact.getFileName().toString());
    }

    public boolean exists(final String fileKey) {
        return locate(fileKey) != null;
    }

    /**
     * All keys that currently have an artifact, in sorted order.
     */
    public List<String> keys() throws IOException {
        final TreeSet<String> keys = new TreeSet<>();
        if (!Files.isDirectory(folder)) {
            return new ArrayList<>();
        }
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (final Path entry : stream) {
                final String name = entry.getFileName().toString();
                final BaselineCodec codec = BaselineCodec.forArtifactName(name);
                if (codec != null && Files.isRegularFile(entry)) {
                    keys.add(name.substring(0, name.length() - codec.extension().length()));
                }
            }
        }
        return new ArrayList<>(keys);
    }

    public @Nullable Instant lastModified(final String fileKey) throws IOException {
        final Path artifact = locate(fileKey);
        return artifact == null ? null : Files.getLastModifiedTime(artifact).toInstant();
    }

    private Baseline readArtifact(final Path artifact, final BaselineCodec codec) throws IOException {
        try (final InputStream in = codec.decode(new BufferedInputStream(Files.newInputStream(artifact)))) {
            return BaselineJson.read(in);
        } catch (final CorruptBaselineException | NoSuchFileException e) {
            throw e;
        } catch (final java.util.zip.ZipException | java.io.EOFException e) {
            throw new CorruptBaselineException("Cannot decompress " + artifact.getFileName(), e);
        }
    }

    // ==================== Writing ====================

    /**
     * Save with the configured default codec.
     *
     * @return {@code true} on success; {@code false} after all attempts failed, in which case the
     * previously stored baseline is still authoritative
     */
    public boolean save(final String fileKey, final Baseline baseline) {
        return save(fileKey, baseline, defaultCodec);
    }

    /**
     * Save with an explicit codec. Retries with exponential backoff. After a successful save, artifacts
     * of the same key under other codecs are removed.
     */
    public boolean save(final String fileKey, final Baseline baseline, final BaselineCodec codec) {
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                writeAtomically(fileKey, baseline, codec);
                removeOtherCodecArtifacts(fileKey, codec);
                logger.debug("Baseline saved: {} (attempt {}/{})", codec.artifactName(fileKey), attempt + 1, maxAttempts);
                return true;
            } catch (final IOException | RuntimeException e) {
                logger.warn("Baseline save failed for {} (attempt {}/{}): {}",
                        fileKey, attempt + 1, maxAttempts, e.toString());
            }

            if (attempt < maxAttempts - 1) {
                final long delay = baseDelayMs * (1L << attempt);
                try {
                    Thread.sleep(delay);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Interrupted while retrying baseline save for {}", fileKey);
                    return false;
                }
            }
        }
        logger.error("All {} attempts to save the baseline for {} failed", maxAttempts, fileKey);
        return false;
    }

    /**
     * Re-encode an existing baseline with another codec. The old artifact is removed only after the new
     * one has been written and verified.
     *
     * @return {@code true} if the baseline is now stored with the target codec
     */
    public boolean migrate(final String fileKey, final BaselineCodec targetCodec) {
        final Baseline baseline;
        try {
            baseline = load(fileKey);
        } catch (final IOException e) {
            logger.warn("Cannot migrate baseline {}: {}", fileKey, e.getMessage());
            return false;
        }
        if (baseline == null) {
            logger.debug("No baseline to migrate for {}", fileKey);
            return false;
        }
        if (codecOf(fileKey) == targetCodec) {
            return true;
        }
        final boolean migrated = save(fileKey, baseline, targetCodec);
        if (migrated) {
            logger.info("Migrated baseline {} to codec {}", fileKey, targetCodec.codecName());
        }
        return migrated;
    }

    /**
     * Move the baseline of a renamed file so that both names share the same history.
     *
     * @return {@code true} if an artifact was moved
     */
    public boolean rename(final String fromKey, final String toKey) {
        final Path source = locate(fromKey);
        if (source == null) {
            return false;
        }
        final BaselineCodec codec = BaselineCodec.forArtifactName(source.getFileName().toString());
        final Path target = folder.resolve(codec.artifactName(toKey));
        try {
            moveReplacing(source, target);
            removeOtherCodecArtifacts(toKey, codec);
            logger.info("Baseline renamed: {} -> {}", source.getFileName(), target.getFileName());
            return true;
        } catch (final IOException e) {
            logger.error("Failed to rename baseline {} -> {}", source.getFileName(), target.getFileName(), e);
            return false;
        }
    }

    /**
     * Remove the baseline of a key under every codec.
     */
    public boolean delete(final String fileKey) {
        boolean deleted = false;
        for (final BaselineCodec codec : BaselineCodec.probeOrder()) {
            try {
                deleted |= Files.deleteIfExists(folder.resolve(codec.artifactName(fileKey)));
            } catch (final IOException e) {
                logger.warn("Failed to delete baseline artifact {}: {}", codec.artifactName(fileKey), e.getMessage());
            }
        }
        return deleted;
    }

    /**
     * Remove every baseline in the store.
     *
     * @return number of keys removed
     */
    public int purge() throws IOException {
        int removed = 0;
        for (final String key : keys()) {
            if (delete(key)) {
                removed++;
            }
        }
        logger.info("Purged {} baselines from {}", removed, folder);
        return removed;
    }

    /**
     * One complete write cycle: temp file, verify, backup, replace, drop backup. Restores the backup
     * and removes the temp file on any failure.
     */
    void writeAtomically(final String fileKey, final Baseline baseline, final BaselineCodec codec) throws IOException {
        Files.createDirectories(folder);
        final Path target = folder.resolve(codec.artifactName(fileKey));
        final Path temp = folder.resolve(fileKey + "." + UUID.randomUUID() + TEMP_SUFFIX);
        final Path backup = folder.resolve(target.getFileName() + BACKUP_SUFFIX);
        boolean backedUp = false;
        try {
            writeTemp(temp, baseline, codec);
            verify(temp, codec, baseline);

            if (Files.exists(target)) {
                Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
                backedUp = true;
                Files.delete(target);
            }

            promote(temp, target);

            if (backedUp) {
                Files.deleteIfExists(backup);
            }
        } catch (final IOException | RuntimeException e) {
            if (backedUp) {
                restoreBackup(backup, target);
            }
            deleteQuietly(temp);
            throw e;
        }
    }

    private void writeTemp(final Path temp, final Baseline baseline, final BaselineCodec codec) throws IOException {
        try (final FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            final OutputStream raw = Channels.newOutputStream(channel);
            final BufferedOutputStream buffered = new BufferedOutputStream(raw, 64 * 1024) {
                @Override
                public void close() throws IOException {
                    // Closing happens through the channel once everything is forced to disk
                    flush();
                }
            };
            try (final OutputStream out = codec.encode(buffered)) {
                BaselineJson.write(baseline, out);
            }
            channel.force(true);
        }
    }

    private void verify(final Path temp, final BaselineCodec codec, final Baseline expected) throws IOException {
        final Baseline reread = readArtifact(temp, codec);
        if (!reread.contentHash().equals(expected.contentHash()) || !reread.cells().equals(expected.cells())) {
            throw new CorruptBaselineException("Verification of " + temp.getFileName() + " failed");
        }
    }

    /**
     * Move the verified temp file into place.
     */
    void promote(final Path temp, final Path target) throws IOException {
        moveReplacing(temp, target);
    }

    private static void moveReplacing(final Path source, final Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (final AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void restoreBackup(final Path backup, final Path target) {
        try {
            if (Files.exists(backup)) {
                moveReplacing(backup, target);
                logger.info("Restored previous baseline {} from backup", target.getFileName());
            }
        } catch (final IOException e) {
            logger.error("Failed to restore baseline backup {}; it is kept for recovery on next start", backup, e);
        }
    }

    private void removeOtherCodecArtifacts(final String fileKey, final BaselineCodec keep) {
        for (final BaselineCodec codec : BaselineCodec.probeOrder()) {
            if (codec != keep) {
                final Path stale = folder.resolve(codec.artifactName(fileKey));
                try {
                    if (Files.deleteIfExists(stale)) {
                        logger.debug("Removed stale baseline artifact {}", stale.getFileName());
                    }
                } catch (final IOException e) {
                    logger.warn("Failed to remove stale baseline artifact {}: {}", stale.getFileName(), e.getMessage());
                }
            }
        }
    }

    private static void deleteQuietly(final Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (final IOException e) {
            logger.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
        }
    }

    // ==================== Recovery ====================

    /**
     * Remove temp files of interrupted saves and restore backups whose artifact is missing
     * (crash between deleting the old artifact and moving the new one into place).
     */
    void recover() throws IOException {
        final List<Path> temps = new ArrayList<>();
        final List<Path> backups = new ArrayList<>();
        try (final DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (final Path entry : stream) {
                final String name = entry.getFileName().toString();
                if (name.endsWith(TEMP_SUFFIX)) {
                    temps.add(entry);
                } else if (name.endsWith(BACKUP_SUFFIX)) {
                    backups.add(entry);
                }
            }
        }

        for (final Path temp : temps) {
            deleteQuietly(temp);
            logger.info("Removed leftover temporary baseline {}", temp.getFileName());
        }

        for (final Path backup : backups) {
            final String name = backup.getFileName().toString();
            final Path target = backup.resolveSibling(name.substring(0, name.length() - BACKUP_SUFFIX.length()));
            if (Files.exists(target)) {
                deleteQuietly(backup);
            } else {
                try {
                    promote(backup, target);
                    logger.warn("Recovered baseline {} from backup of an interrupted save", target.getFileName());
                } catch (final IOException e) {
                    logger.error("Failed to recover baseline {} from backup; it is kept for the next start",
                            target.getFileName(), e);
                }
            }
        }
    }
}
