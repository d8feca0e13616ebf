package de.mirkosertic.sheetwatch.model;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Last known persisted cell state of one monitored file.
 * <p>
 * Baselines are only ever replaced as a whole by the baseline store, never mutated.
 *
 * @param contentHash fingerprint of {@code cells}
 * @param lastAuthor  "last modified by" metadata of the workbook when the baseline was taken
 * @param cells       the snapshot itself
 * @param timestamp   when the baseline was taken
 */
public record Baseline(String contentHash, @Nullable String lastAuthor, WorkbookSnapshot cells, Instant timestamp) {

    public Baseline {
        Objects.requireNonNull(contentHash, "contentHash");
        Objects.requireNonNull(cells, "cells");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public Baseline withTimestamp(final Instant newTimestamp) {
        return new Baseline(contentHash, lastAuthor, cells, newTimestamp);
    }

    public Baseline withLastAuthor(final @Nullable String author) {
        return new Baseline(contentHash, author, cells, timestamp);
    }

    /**
     * Compares everything except the timestamp.
     */
    public boolean sameContentAs(final Baseline other) {
        return contentHash.equals(other.contentHash)
                && Objects.equals(lastAuthor, other.lastAuthor)
                && cells.equals(other.cells);
    }
}
