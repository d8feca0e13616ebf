package de.mirkosertic.sheetwatch.model;

import org.jspecify.annotations.Nullable;

/**
 * One classified cell difference. {@code oldCell} is null for {@link ChangeKind#ADDED},
 * {@code newCell} is null for {@link ChangeKind#DELETED}.
 */
public record CellChange(
        String worksheet,
        String address,
        @Nullable CellRecord oldCell,
        @Nullable CellRecord newCell,
        ChangeKind kind
) {

    public @Nullable Object oldValue() {
        return oldCell == null ? null : oldCell.value();
    }

    public @Nullable String oldFormula() {
        return oldCell == null ? null : oldCell.formula();
    }

    public @Nullable Object newValue() {
        return newCell == null ? null : newCell.value();
    }

    public @Nullable String newFormula() {
        return newCell == null ? null : newCell.formula();
    }
}
