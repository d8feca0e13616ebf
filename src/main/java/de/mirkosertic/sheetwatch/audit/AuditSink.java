package de.mirkosertic.sheetwatch.audit;

import java.io.IOException;
import java.util.List;

/**
 * Append-only destination of detected changes.
 */
public interface AuditSink {

    /**
     * Append the entries of one detection cycle, in order.
     */
    void append(List<AuditEntry> entries) throws IOException;
}
