package de.mirkosertic.sheetwatch.extract;

import de.mirkosertic.sheetwatch.model.FailureKind;

import java.io.IOException;

/**
 * Reading a spreadsheet failed. The failure kind tells callers whether a retry on the next trigger makes sense.
 */
public class ExtractionException extends IOException {

    private final FailureKind kind;

    public ExtractionException(final FailureKind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(final FailureKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
