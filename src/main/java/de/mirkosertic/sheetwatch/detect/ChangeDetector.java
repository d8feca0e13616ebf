package de.mirkosertic.sheetwatch.detect;

import de.mirkosertic.sheetwatch.audit.AuditEntry;
import de.mirkosertic.sheetwatch.audit.AuditSink;
import de.mirkosertic.sheetwatch.baseline.BaselineStore;
import de.mirkosertic.sheetwatch.baseline.CorruptBaselineException;
import de.mirkosertic.sheetwatch.diff.ContentFingerprint;
import de.mirkosertic.sheetwatch.diff.ExternalLinkFormatter;
import de.mirkosertic.sheetwatch.diff.WorkbookDiffer;
import de.mirkosertic.sheetwatch.extract.ExtractionException;
import de.mirkosertic.sheetwatch.extract.SpreadsheetExtractor;
import de.mirkosertic.sheetwatch.model.Baseline;
import de.mirkosertic.sheetwatch.model.CellChange;
import de.mirkosertic.sheetwatch.model.FailureKind;
import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One detection cycle: load the baseline, extract the current content, compare, emit the reportable
 * changes and persist the new baseline.
 * <p>
 * The detector keeps no state between calls. Cycles for the same file run one after the other under the
 * store's key lock. Files without a baseline are not handled here; they have to be seeded first. A failed
 * cycle never touches the stored baseline.
 */
public class ChangeDetector {

    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    private final BaselineStore store;
    private final SpreadsheetExtractor extractor;
    private final AuditSink auditSink;
    private final ChangeFilterPolicy policy;
    private final boolean refreshAuthorOnUnchanged;
    private final Clock clock;

    public ChangeDetector(final BaselineStore store,
                          final SpreadsheetExtractor extractor,
                          final AuditSink auditSink,
                          final ChangeFilterPolicy policy,
                          final boolean refreshAuthorOnUnchanged,
                          final Clock clock) {
        this.store = store;
        this.extractor = extractor;
        this.auditSink = auditSink;
        this.policy = policy;
        this.refreshAuthorOnUnchanged = refreshAuthorOnUnchanged;
        this.clock = clock;
    }

    public DetectionResult detect(final Path file) {
        final String key = BaselineStore.keyFor(file);
        return store.withKeyLock(key, () -> detectLocked(file, key));
    }

    private DetectionResult detectLocked(final Path file, final String key) {
        final Baseline baseline;
        try {
            baseline = store.load(key);
        } catch (final CorruptBaselineException e) {
            logger.error("Baseline of {} is corrupt: {}", key, e.getMessage());
            return DetectionResult.failed(FailureKind.CORRUPT);
        } catch (final IOException e) {
            logger.warn("Cannot read baseline of {}: {}", key, e.getMessage());
            return DetectionResult.failed(FailureKind.ACCESS_DENIED);
        }
        if (baseline == null) {
            logger.debug("No baseline for {}, detection skipped", key);
            return DetectionResult.noBaseline();
        }

        final WorkbookSnapshot current;
        try {
            current = extractor.extract(file);
        } catch (final ExtractionException e) {
            logger.warn("Cannot read {} ({}): {}", key, e.getKind(), e.getMessage());
            return DetectionResult.failed(e.getKind());
        }

        final String currentHash = ContentFingerprint.of(current);
        if (currentHash.equals(baseline.contentHash())) {
            if (refreshAuthorOnUnchanged) {
                refreshAuthor(file, key, baseline);
            }
            logger.debug("{} unchanged (fingerprint match)", key);
            return DetectionResult.noChange();
        }

        final List<CellChange> changes = WorkbookDiffer.diff(baseline.cells(), current);
        if (changes.isEmpty()) {
            // Same cells, different hash: baseline written with an older fingerprint
            store.save(key, new Baseline(currentHash, baseline.lastAuthor(), current, baseline.timestamp()));
            logger.debug("{} unchanged, fingerprint of baseline upgraded", key);
            return DetectionResult.noChange();
        }

        List<CellChange> reportable = policy.reportableOf(changes);
        final String freshAuthor = extractor.lastAuthor(file);
        final String author = freshAuthor != null ? freshAuthor : baseline.lastAuthor();
        final Instant now = clock.instant();

        if (!reportable.isEmpty() && policy.suppresses(author)) {
            logger.info("{}: {} changes by whitelisted user {} not recorded", key, reportable.size(), author);
            reportable = List.of();
        }
        if (!reportable.isEmpty()) {
            final Map<Integer, String> links = ExternalLinkFormatter.anyIndexedReference(reportable)
                    ? extractor.externalLinks(file)
                    : Map.of();
            emit(key, reportable, author, links, now);
        } else {
            logger.debug("{}: {} changes, none recorded", key, changes.size());
        }

        final boolean persisted = store.save(key, new Baseline(currentHash, author, current, now));
        if (!persisted) {
            logger.error("New baseline of {} could not be saved; the previous baseline stays authoritative", key);
        }

        if (reportable.isEmpty()) {
            return DetectionResult.noChange();
        }
        return DetectionResult.changesFound(reportable, persisted);
    }

    private void emit(final String key, final List<CellChange> reportable, final @Nullable String author,
                      final Map<Integer, String> links, final Instant now) {
        logger.info("{}: {} changed cells (last author: {}{})", key, reportable.size(),
                author == null ? "unknown" : author, policy.isWhitelisted(author) ? ", whitelisted" : "");
        final List<AuditEntry> entries = new ArrayList<>(reportable.size());
        for (final CellChange raw : reportable) {
            final CellChange change = ExternalLinkFormatter.enrich(raw, links);
            logger.info("  [{}] {}!{}: {} -> {}", change.kind().auditCode(), change.worksheet(), change.address(),
                    change.oldCell() == null ? "(empty)" : change.oldCell().describe(),
                    change.newCell() == null ? "(empty)" : change.newCell().describe());
            entries.add(new AuditEntry(now, key, change, author));
        }
        try {
            auditSink.append(entries);
        } catch (final IOException e) {
            logger.error("Failed to write {} audit entries for {}", entries.size(), key, e);
        }
    }

    private void refreshAuthor(final Path file, final String key, final Baseline baseline) {
        final String author = extractor.lastAuthor(file);
        if (author != null && !Objects.equals(author, baseline.lastAuthor())) {
            if (store.save(key, baseline.withLastAuthor(author))) {
                logger.debug("Refreshed last author of {} to {}", key, author);
            }
        }
    }
}
