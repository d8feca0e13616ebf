package de.mirkosertic.sheetwatch.diff;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * Recognises formulas that reference cells in another workbook file.
 * <p>
 * Matches the three spellings a stored formula can carry:
 * <ul>
 *     <li>a bracketed numeric link index, {@code =[1]Sheet1!A1}</li>
 *     <li>a quoted path, {@code ='C:\data\[Book.xlsx]Sheet1'!A1}</li>
 *     <li>a bracketed workbook name, {@code =[Book.xlsx]Sheet1!A1}</li>
 * </ul>
 */
public final class ExternalReferencePattern {

    private static final Pattern LINK_INDEX = Pattern.compile("\\[\\d+]");
    private static final Pattern QUOTED_PATH = Pattern.compile("'[^']*[\\\\/][^']*'!");
    private static final Pattern WORKBOOK_NAME = Pattern.compile("\\[[^\\[\\]]+\\.xl[a-z]{1,2}]", Pattern.CASE_INSENSITIVE);

    private ExternalReferencePattern() {
    }

    public static boolean matches(final @Nullable String formula) {
        if (formula == null || formula.isEmpty()) {
            return false;
        }
        return LINK_INDEX.matcher(formula).find()
                || QUOTED_PATH.matcher(formula).find()
                || WORKBOOK_NAME.matcher(formula).find();
    }
}
