package de.mirkosertic.sheetwatch.baseline;

import java.io.IOException;

/**
 * A baseline artifact exists but cannot be decoded, or decodes to a malformed record.
 */
public class CorruptBaselineException extends IOException {

    public CorruptBaselineException(final String message) {
        super(message);
    }

    public CorruptBaselineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
