package de.mirkosertic.sheetwatch.diff;

import de.mirkosertic.sheetwatch.model.CellChange;
import de.mirkosertic.sheetwatch.model.CellRecord;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Makes indexed external references readable for the audit trail.
 * <p>
 * Excel stores {@code [1]Rates!B2} in the formula and keeps the linked workbook's path in a separate part.
 * With the link table of the workbook the reference is shown as
 * {@code [external 1: \\server\share\rates.xlsx][1]Rates!B2}. Baselines and fingerprints always keep the
 * raw formula.
 */
public final class ExternalLinkFormatter {

    private static final Pattern INDEXED_REFERENCE = Pattern.compile("\\[(\\d+)][A-Za-z0-9_.]+!");

    private ExternalLinkFormatter() {
    }

    public static boolean hasIndexedReference(final @Nullable String formula) {
        return formula != null && INDEXED_REFERENCE.matcher(formula).find();
    }

    /**
     * True if any formula of the given changes points into an external workbook by link index.
     */
    public static boolean anyIndexedReference(final Iterable<CellChange> changes) {
        for (final CellChange change : changes) {
            if (hasIndexedReference(change.oldFormula()) || hasIndexedReference(change.newFormula())) {
                return true;
            }
        }
        return false;
    }

    public static @Nullable String pretty(final @Nullable String formula, final Map<Integer, String> links) {
        if (formula == null || links.isEmpty()) {
            return formula;
        }
        final Matcher matcher = INDEXED_REFERENCE.matcher(formula);
        final StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            final String path = links.get(Integer.parseInt(matcher.group(1)));
            final String replacement = path == null || path.isEmpty()
                    ? matcher.group()
                    : "[external " + matcher.group(1) + ": " + path + "]" + matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Copy of {@code change} whose formulas show the linked workbook paths. Values and kind are unchanged.
     */
    public static CellChange enrich(final CellChange change, final Map<Integer, String> links) {
        if (links.isEmpty()) {
            return change;
        }
        return new CellChange(change.worksheet(), change.address(),
                enrich(change.oldCell(), links), enrich(change.newCell(), links), change.kind());
    }

    private static @Nullable CellRecord enrich(final @Nullable CellRecord cell, final Map<Integer, String> links) {
        if (cell == null || cell.formula() == null) {
            return cell;
        }
        return new CellRecord(cell.value(), pretty(cell.formula(), links));
    }
}
