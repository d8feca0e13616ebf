package de.mirkosertic.sheetwatch.polling;

/**
 * Cadence of the follow-up observation of an edited file.
 */
public enum PollingMode {
    /** Small files: short interval, bounded observation window that is extended on activity. */
    DENSE,
    /** Large files: long interval, continues as long as every tick finds activity. */
    SPARSE
}
