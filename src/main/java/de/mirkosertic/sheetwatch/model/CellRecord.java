package de.mirkosertic.sheetwatch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Content of a single non-empty cell as read from a workbook: its (cached) value and its formula text.
 * <p>
 * At least one of {@code value} and {@code formula} is non-null. An empty cell is represented by the
 * absence of a record, never by a record with both fields null.
 * <p>
 * Values are restricted to scalars. Integral numbers are normalised to {@link Long} and fractional
 * numbers to {@link Double} so that a record read back from JSON compares equal to the one that was
 * written.
 */
public record CellRecord(@Nullable Object value, @Nullable String formula) {

    public CellRecord {
        if (value == null && formula == null) {
            throw new IllegalArgumentException("A cell record needs a value or a formula");
        }
        value = normalizeValue(value);
    }

    public static CellRecord ofValue(final Object value) {
        return new CellRecord(value, null);
    }

    public static CellRecord ofFormula(final String formula, final @Nullable Object cachedValue) {
        return new CellRecord(cachedValue, formula);
    }

    public boolean hasFormula() {
        return formula != null;
    }

    static @Nullable Object normalizeValue(final @Nullable Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? big.longValue() : big.doubleValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Character) {
            return value.toString();
        }
        throw new IllegalArgumentException("Unsupported cell value type: " + value.getClass().getName());
    }

    /**
     * Short human readable rendering used in log output.
     */
    public String describe() {
        if (formula == null) {
            return String.valueOf(value);
        }
        return formula + " -> " + value;
    }
}
