package de.mirkosertic.sheetwatch.batch;

import java.time.Instant;

/**
 * Position of an interrupted batch baseline build.
 */
public record ProgressRecord(
        /** Number of files already handled, in the sorted order of the run. */
        int completedCount,
        /** Number of files in the run. */
        int totalCount,
        /** When the record was written. */
        Instant timestamp
) {
}
