package de.mirkosertic.sheetwatch.model;

/**
 * Failure taxonomy shared by extraction, persistence and batch processing. All of these are
 * recoverable at file granularity; none of them terminates the monitoring process.
 */
public enum FailureKind {
    /** Baseline or source file missing. */
    NOT_FOUND,
    /** File locked by another process or permission-restricted. */
    ACCESS_DENIED,
    /** Unreadable or invalid artifact or spreadsheet. */
    CORRUPT,
    /** Extraction exceeded its time budget. */
    TIMEOUT,
    /** Memory over the configured limit. */
    RESOURCE_EXHAUSTED,
    /** All baseline save attempts failed. */
    PERSIST_FAILURE,
    /** A detection cycle ended with an unexpected exception. */
    INTERNAL_ERROR
}
