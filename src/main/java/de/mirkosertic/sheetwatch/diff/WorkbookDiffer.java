package de.mirkosertic.sheetwatch.diff;

import de.mirkosertic.sheetwatch.model.CellChange;
import de.mirkosertic.sheetwatch.model.CellRecord;
import de.mirkosertic.sheetwatch.model.ChangeKind;
import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Structural cell-by-cell comparison of two snapshots.
 * <p>
 * Every address that has a record on either side is classified; unchanged cells are left out of the result.
 * Worksheets present on one side only are compared against an empty worksheet. The result is ordered by
 * worksheet name, then by address.
 */
public final class WorkbookDiffer {

    private WorkbookDiffer() {
    }

    public static List<CellChange> diff(final WorkbookSnapshot oldSnapshot, final WorkbookSnapshot newSnapshot) {
        final TreeSet<String> worksheets = new TreeSet<>(oldSnapshot.worksheetNames());
        worksheets.addAll(newSnapshot.worksheetNames());

        final List<CellChange> changes = new ArrayList<>();
        for (final String worksheet : worksheets) {
            diffWorksheet(worksheet, oldSnapshot.worksheet(worksheet), newSnapshot.worksheet(worksheet), changes);
        }
        return changes;
    }

    static void diffWorksheet(final String worksheet,
                              final Map<String, CellRecord> oldCells,
                              final Map<String, CellRecord> newCells,
                              final List<CellChange> into) {
        final TreeSet<String> addresses = new TreeSet<>(oldCells.keySet());
        addresses.addAll(newCells.keySet());
        for (final String address : addresses) {
            final CellRecord oldCell = oldCells.get(address);
            final CellRecord newCell = newCells.get(address);
            final ChangeKind kind = classify(oldCell, newCell);
            if (kind != null) {
                into.add(new CellChange(worksheet, address, oldCell, newCell, kind));
            }
        }
    }

    /**
     * Classify one address. Returns null when nothing changed.
     */
    public static @Nullable ChangeKind classify(final @Nullable CellRecord oldCell, final @Nullable CellRecord newCell) {
        if (oldCell == null && newCell == null) {
            return null;
        }
        if (oldCell == null) {
            return ChangeKind.ADDED;
        }
        if (newCell == null) {
            return ChangeKind.DELETED;
        }
        if (!Objects.equals(oldCell.formula(), newCell.formula())) {
            return ChangeKind.FORMULA_CHANGED;
        }
        if (Objects.equals(oldCell.value(), newCell.value())) {
            return null;
        }
        if (oldCell.formula() == null) {
            return ChangeKind.DIRECT_VALUE_CHANGED;
        }
        return ExternalReferencePattern.matches(oldCell.formula())
                ? ChangeKind.EXTERNAL_REF_UPDATED
                : ChangeKind.INDIRECT_CHANGED;
    }
}
