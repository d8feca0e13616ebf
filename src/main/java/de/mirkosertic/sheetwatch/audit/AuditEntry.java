package de.mirkosertic.sheetwatch.audit;

import de.mirkosertic.sheetwatch.model.CellChange;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * One row of the audit trail.
 */
public record AuditEntry(Instant timestamp, String fileName, CellChange change, @Nullable String author) {
}
