package de.mirkosertic.sheetwatch.batch;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persists the progress of a batch baseline build in a small YAML file so a large initial scan can resume.
 * The file exists only while a run is unfinished.
 */
public class ProgressTracker {

    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

    private final Path progressFile;
    private final Clock clock;
    private final Yaml yaml;

    public ProgressTracker(final Path progressFile, final Clock clock) {
        this.progressFile = progressFile;
        this.clock = clock;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    /**
     * Overwrite the progress record.
     */
    public synchronized void save(final int completed, final int total) throws IOException {
        final Path parent = progressFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        final Map<String, Object> stateMap = new LinkedHashMap<>();
        stateMap.put("completedCount", completed);
        stateMap.put("totalCount", total);
        stateMap.put("timestamp", clock.instant().toString());

        try (final Writer writer = Files.newBufferedWriter(progressFile,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(stateMap, writer);
        }
        logger.debug("Saved batch progress {}/{}", completed, total);
    }

    /**
     * @return the last saved record, or {@code null} if there is none or it cannot be parsed
     */
    public synchronized @Nullable ProgressRecord load() {
        if (!Files.exists(progressFile)) {
            logger.debug("No batch progress file: {}", progressFile);
            return null;
        }

        try (final Reader reader = Files.newBufferedReader(progressFile)) {
            final Map<String, Object> stateMap = yaml.load(reader);
            if (stateMap == null) {
                logger.debug("Batch progress file is empty: {}", progressFile);
                return null;
            }

            final Integer completed = count(stateMap, "completedCount");
            final Integer total = count(stateMap, "totalCount");
            if (completed == null || total == null) {
                logger.error("Invalid batch progress counts in {}: {}", progressFile, stateMap);
                return null;
            }
            final Object timestamp = stateMap.get("timestamp");
            final Instant at;
            if (timestamp == null) {
                at = Instant.EPOCH;
            } else if (timestamp instanceof Date date) {
                at = date.toInstant();
            } else {
                at = Instant.parse(timestamp.toString());
            }

            logger.info("Loaded batch progress: {}/{} (saved {})", completed, total, at);
            return new ProgressRecord(completed, total, at);

        } catch (final IOException e) {
            logger.error("Failed to load batch progress file: {}", progressFile, e);
            return null;
        } catch (final ClassCastException | YAMLException | DateTimeParseException e) {
            logger.error("Invalid batch progress structure in: {}", progressFile, e);
            return null;
        }
    }

    /**
     * A missing key counts as zero; a key without a numeric, non-negative value makes the record unusable.
     */
    private static @Nullable Integer count(final Map<String, Object> stateMap, final String key) {
        if (!stateMap.containsKey(key)) {
            return 0;
        }
        if (stateMap.get(key) instanceof Number number && number.intValue() >= 0) {
            return number.intValue();
        }
        return null;
    }

    /**
     * Remove the record after a complete run.
     */
    public synchronized void clear() {
        try {
            if (Files.deleteIfExists(progressFile)) {
                logger.debug("Batch progress file removed");
            }
        } catch (final IOException e) {
            logger.warn("Failed to remove batch progress file {}: {}", progressFile, e.getMessage());
        }
    }

    public Path getProgressFile() {
        return progressFile;
    }
}
