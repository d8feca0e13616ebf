package de.mirkosertic.sheetwatch.detect;

import de.mirkosertic.sheetwatch.model.CellChange;
import de.mirkosertic.sheetwatch.model.FailureKind;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of one detection cycle for one file.
 *
 * @param outcome what happened
 * @param changes the reportable changes that were emitted; empty unless {@link Outcome#CHANGES_FOUND}
 * @param failure why the cycle failed, or {@link FailureKind#PERSIST_FAILURE} when changes were emitted but
 *                the new baseline could not be saved
 */
public record DetectionResult(Outcome outcome, List<CellChange> changes, @Nullable FailureKind failure) {

    public enum Outcome {
        NO_BASELINE,
        NO_CHANGE,
        CHANGES_FOUND,
        FAILED
    }

    private static final DetectionResult NO_BASELINE = new DetectionResult(Outcome.NO_BASELINE, List.of(), null);
    private static final DetectionResult NO_CHANGE = new DetectionResult(Outcome.NO_CHANGE, List.of(), null);

    public DetectionResult {
        changes = List.copyOf(changes);
    }

    public static DetectionResult noBaseline() {
        return NO_BASELINE;
    }

    public static DetectionResult noChange() {
        return NO_CHANGE;
    }

    public static DetectionResult changesFound(final List<CellChange> changes, final boolean persisted) {
        return new DetectionResult(Outcome.CHANGES_FOUND, changes, persisted ? null : FailureKind.PERSIST_FAILURE);
    }

    public static DetectionResult failed(final FailureKind failure) {
        return new DetectionResult(Outcome.FAILED, List.of(), failure);
    }

    public boolean changesFound() {
        return outcome == Outcome.CHANGES_FOUND;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }
}
