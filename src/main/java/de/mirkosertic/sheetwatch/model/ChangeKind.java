package de.mirkosertic.sheetwatch.model;

/**
 * Classification of a single cell difference between a baseline and the current workbook content.
 */
public enum ChangeKind {

    /** Cell was empty in the baseline and has content now. */
    ADDED("ADD"),
    /** Cell had content in the baseline and is empty now. */
    DELETED("DEL"),
    /** The formula text differs, whatever happened to the value. */
    FORMULA_CHANGED("FORMULA"),
    /** Neither side has a formula and the typed-in value differs. */
    DIRECT_VALUE_CHANGED("VALUE"),
    /** Same formula, different value, and the formula points into another workbook. */
    EXTERNAL_REF_UPDATED("EXTERNAL"),
    /** Same formula, different value, caused by recalculation inside the workbook. */
    INDIRECT_CHANGED("INDIRECT");

    private final String auditCode;

    ChangeKind(final String auditCode) {
        this.auditCode = auditCode;
    }

    public String auditCode() {
        return auditCode;
    }
}
