package de.mirkosertic.sheetwatch.baseline;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.sheetwatch.model.Baseline;
import de.mirkosertic.sheetwatch.model.CellRecord;
import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;

/**
 * JSON mapping of {@link Baseline} records.
 * <p>
 * Layout:
 * <pre>
 * {
 *   "format_version": 2,
 *   "content_hash": "...",
 *   "last_author": "jdoe",
 *   "timestamp": "2025-07-12T10:51:34.123Z",
 *   "cells": { "Sheet1": { "A1": { "value": 1, "formula": null } } }
 * }
 * </pre>
 * Format 1 artifacts (no {@code format_version}, local timestamps without offset) are still accepted.
 * Everything read is validated; malformed shapes raise {@link CorruptBaselineException}.
 */
public final class BaselineJson {

    public static final int FORMAT_VERSION = 2;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
            .configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);

    private BaselineJson() {
    }

    public static void write(final Baseline baseline, final OutputStream out) throws IOException {
        final ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put("format_version", FORMAT_VERSION);
        root.put("content_hash", baseline.contentHash());
        if (baseline.lastAuthor() == null) {
            root.putNull("last_author");
        } else {
            root.put("last_author", baseline.lastAuthor());
        }
        root.put("timestamp", baseline.timestamp().toString());
        root.set("cells", cellsToTree(baseline.cells()));
        MAPPER.writeValue(out, root);
    }

    public static Baseline read(final InputStream in) throws IOException {
        final JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (final JsonProcessingException e) {
            throw new CorruptBaselineException("Baseline is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptBaselineException("Baseline root is not a JSON object");
        }

        final JsonNode version = root.get("format_version");
        if (version != null && (!version.canConvertToInt() || version.asInt() > FORMAT_VERSION)) {
            throw new CorruptBaselineException("Unsupported baseline format version: " + version);
        }

        final JsonNode hash = root.get("content_hash");
        if (hash == null || !hash.isTextual() || hash.asText().isEmpty()) {
            throw new CorruptBaselineException("Baseline has no content_hash");
        }

        final JsonNode author = root.get("last_author");
        if (author != null && !author.isNull() && !author.isTextual()) {
            throw new CorruptBaselineException("last_author must be a string");
        }

        return new Baseline(
                hash.asText(),
                author == null || author.isNull() ? null : author.asText(),
                cellsFromTree(root.get("cells")),
                parseTimestamp(root.get("timestamp")));
    }

    /**
     * Canonical tree of a snapshot: worksheets and addresses in sorted order, every cell with both
     * {@code value} and {@code formula} keys. Also the input of the content fingerprint.
     */
    public static ObjectNode cellsToTree(final WorkbookSnapshot snapshot) {
        final ObjectNode cells = JsonNodeFactory.instance.objectNode();
        for (final Map.Entry<String, Map<String, CellRecord>> sheet : snapshot.worksheets().entrySet()) {
            final ObjectNode sheetNode = cells.putObject(sheet.getKey());
            for (final Map.Entry<String, CellRecord> cell : sheet.getValue().entrySet()) {
                final ObjectNode cellNode = sheetNode.putObject(cell.getKey());
                putValue(cellNode, cell.getValue().value());
                if (cell.getValue().formula() == null) {
                    cellNode.putNull("formula");
                } else {
                    cellNode.put("formula", cell.getValue().formula());
                }
            }
        }
        return cells;
    }

    public static String toCanonicalString(final WorkbookSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsString(cellsToTree(snapshot));
        } catch (final JsonProcessingException e) {
            // Only scalar nodes are ever put into the tree
            throw new IllegalStateException("Cannot render snapshot", e);
        }
    }

    private static void putValue(final ObjectNode cellNode, final @Nullable Object value) {
        if (value == null) {
            cellNode.putNull("value");
        } else if (value instanceof Long l) {
            cellNode.put("value", l);
        } else if (value instanceof Double d) {
            cellNode.put("value", d);
        } else if (value instanceof Boolean b) {
            cellNode.put("value", b);
        } else {
            cellNode.put("value", value.toString());
        }
    }

    static WorkbookSnapshot cellsFromTree(final @Nullable JsonNode cells) throws CorruptBaselineException {
        if (cells == null || cells.isNull()) {
            return WorkbookSnapshot.empty();
        }
        if (!cells.isObject()) {
            throw new CorruptBaselineException("cells must be an object");
        }
        final WorkbookSnapshot.Builder builder = WorkbookSnapshot.builder();
        final Iterator<Map.Entry<String, JsonNode>> sheets = cells.fields();
        while (sheets.hasNext()) {
            final Map.Entry<String, JsonNode> sheet = sheets.next();
            if (!sheet.getValue().isObject()) {
                throw new CorruptBaselineException("Worksheet " + sheet.getKey() + " is not an object");
            }
            final Iterator<Map.Entry<String, JsonNode>> addresses = sheet.getValue().fields();
            while (addresses.hasNext()) {
                final Map.Entry<String, JsonNode> address = addresses.next();
                builder.put(sheet.getKey(), address.getKey(), readCell(sheet.getKey(), address.getKey(), address.getValue()));
            }
        }
        return builder.build();
    }

    private static CellRecord readCell(final String sheet, final String address, final JsonNode node)
            throws CorruptBaselineException {
        if (!node.isObject()) {
            throw new CorruptBaselineException("Cell " + sheet + "!" + address + " is not an object");
        }
        final JsonNode formula = node.get("formula");
        if (formula != null && !formula.isNull() && !formula.isTextual()) {
            throw new CorruptBaselineException("Formula of " + sheet + "!" + address + " is not a string");
        }
        final Object value = readValue(sheet, address, node.get("value"));
        final String formulaText = formula == null || formula.isNull() ? null : formula.asText();
        if (value == null && formulaText == null) {
            throw new CorruptBaselineException("Cell " + sheet + "!" + address + " has neither value nor formula");
        }
        return new CellRecord(value, formulaText);
    }

    private static @Nullable Object readValue(final String sheet, final String address, final @Nullable JsonNode value)
            throws CorruptBaselineException {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isBigInteger()) {
            return value.bigIntegerValue();
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        throw new CorruptBaselineException("Value of " + sheet + "!" + address + " is not a scalar");
    }

    private static Instant parseTimestamp(final @Nullable JsonNode node) throws CorruptBaselineException {
        if (node == null || !node.isTextual()) {
            throw new CorruptBaselineException("Baseline has no timestamp");
        }
        final String text = node.asText();
        try {
            return Instant.parse(text);
        } catch (final DateTimeParseException e) {
            // Format 1 wrote local date-times without an offset
            try {
                return LocalDateTime.parse(text).atZone(ZoneId.systemDefault()).toInstant();
            } catch (final DateTimeParseException legacy) {
                throw new CorruptBaselineException("Unparseable baseline timestamp: " + text, legacy);
            }
        }
    }
}
