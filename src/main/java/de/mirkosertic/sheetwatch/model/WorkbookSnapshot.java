package de.mirkosertic.sheetwatch.model;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * All non-empty cells across all worksheets of a workbook at one point in time,
 * keyed by worksheet name and then by cell address ({@code "A1"}).
 * <p>
 * Instances are immutable. Worksheets without any cell are dropped, so a sheet that was
 * emptied and a sheet that was removed look the same.
 */
public record WorkbookSnapshot(Map<String, Map<String, CellRecord>> worksheets) {

    private static final WorkbookSnapshot EMPTY = new WorkbookSnapshot(Map.of());

    public WorkbookSnapshot {
        final Map<String, Map<String, CellRecord>> copy = new TreeMap<>();
        for (final Map.Entry<String, Map<String, CellRecord>> entry : worksheets.entrySet()) {
            if (entry.getValue() != null && !entry.getValue().isEmpty()) {
                copy.put(entry.getKey(), Collections.unmodifiableMap(new TreeMap<>(entry.getValue())));
            }
        }
        worksheets = Collections.unmodifiableMap(copy);
    }

    public static WorkbookSnapshot empty() {
        return EMPTY;
    }

    public Set<String> worksheetNames() {
        return worksheets.keySet();
    }

    /**
     * Cells of the given worksheet; an unknown worksheet yields an empty map.
     */
    public Map<String, CellRecord> worksheet(final String name) {
        return worksheets.getOrDefault(name, Map.of());
    }

    public int cellCount() {
        int count = 0;
        for (final Map<String, CellRecord> cells : worksheets.values()) {
            count += cells.size();
        }
        return count;
    }

    public boolean isEmpty() {
        return worksheets.isEmpty();
    }

    /**
     * Incrementally assembles a snapshot while a workbook is being read.
     */
    public static final class Builder {

        private final Map<String, Map<String, CellRecord>> worksheets = new TreeMap<>();

        public Builder put(final String worksheet, final String address, final CellRecord cell) {
            worksheets.computeIfAbsent(worksheet, k -> new TreeMap<>()).put(address, cell);
            return this;
        }

        public WorkbookSnapshot build() {
            return new WorkbookSnapshot(worksheets);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
