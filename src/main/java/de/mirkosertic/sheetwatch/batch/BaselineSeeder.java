package de.mirkosertic.sheetwatch.batch;

import de.mirkosertic.sheetwatch.baseline.BaselineStore;
import de.mirkosertic.sheetwatch.baseline.CorruptBaselineException;
import de.mirkosertic.sheetwatch.diff.ContentFingerprint;
import de.mirkosertic.sheetwatch.extract.ExtractionException;
import de.mirkosertic.sheetwatch.extract.SpreadsheetExtractor;
import de.mirkosertic.sheetwatch.model.Baseline;
import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Takes a baseline of a file without comparing cells: extract, fingerprint, save.
 * Used for newly seen files and by the batch build.
 */
public class BaselineSeeder {

    private static final Logger logger = LoggerFactory.getLogger(BaselineSeeder.class);

    public enum Outcome {
        /** No baseline existed, one was written. */
        CREATED,
        /** An existing baseline with different content was replaced. */
        REPLACED,
        /** The stored baseline already has the current fingerprint. */
        UNCHANGED,
        /** Extraction or saving failed; any stored baseline is untouched. */
        FAILED
    }

    private final BaselineStore store;
    private final SpreadsheetExtractor extractor;
    private final Clock clock;

    public BaselineSeeder(final BaselineStore store, final SpreadsheetExtractor extractor, final Clock clock) {
        this.store = store;
        this.extractor = extractor;
        this.clock = clock;
    }

    public Outcome seed(final Path file) {
        final String key = BaselineStore.keyFor(file);
        return store.withKeyLock(key, () -> seedLocked(file, key));
    }

    private Outcome seedLocked(final Path file, final String key) {
        final WorkbookSnapshot snapshot;
        try {
            snapshot = extractor.extract(file);
        } catch (final ExtractionException e) {
            logger.warn("Cannot take baseline of {} ({}): {}", key, e.getKind(), e.getMessage());
            return Outcome.FAILED;
        }
        final String hash = ContentFingerprint.of(snapshot);

        Baseline existing = null;
        boolean corrupt = false;
        try {
            existing = store.load(key);
        } catch (final CorruptBaselineException e) {
            logger.warn("Existing baseline of {} is corrupt and will be replaced: {}", key, e.getMessage());
            corrupt = true;
        } catch (final IOException e) {
            logger.warn("Cannot read existing baseline of {}: {}", key, e.getMessage());
            return Outcome.FAILED;
        }
        if (existing != null && existing.contentHash().equals(hash)) {
            logger.debug("Baseline of {} is up to date", key);
            return Outcome.UNCHANGED;
        }

        final Baseline baseline = new Baseline(hash, extractor.lastAuthor(file), snapshot, clock.instant());
        if (!store.save(key, baseline)) {
            return Outcome.FAILED;
        }
        final boolean replaced = existing != null || corrupt;
        logger.info("Baseline {} for {} ({} cells)", replaced ? "replaced" : "created", key, snapshot.cellCount());
        return replaced ? Outcome.REPLACED : Outcome.CREATED;
    }
}
