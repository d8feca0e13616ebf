package de.mirkosertic.sheetwatch.extract;

import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;
import org.jspecify.annotations.Nullable;

import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the cell content of a spreadsheet file. Implementations must cope with files that another
 * process holds open and must never modify the file.
 */
public interface SpreadsheetExtractor {

    WorkbookSnapshot extract(Path file) throws ExtractionException;

    /**
     * "Last modified by" metadata of the workbook, or null if it is unknown or unreadable.
     */
    @Nullable String lastAuthor(Path file);

    /**
     * Paths of the workbooks this file links to, keyed by the index formulas use ({@code [1]} is key 1).
     * Empty if the file has no external links or they cannot be read.
     */
    default Map<Integer, String> externalLinks(final Path file) {
        return Map.of();
    }
}
