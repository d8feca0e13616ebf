package de.mirkosertic.sheetwatch.audit;

import de.mirkosertic.sheetwatch.model.CellChange;
import de.mirkosertic.sheetwatch.model.CellRecord;
import de.mirkosertic.sheetwatch.model.ChangeKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsvAuditSink Tests")
class CsvAuditSinkTest {

    private static final Instant AT = Instant.parse("2025-07-12T10:51:34Z");

    @TempDir
    Path tempDir;

    private static AuditEntry entry(final String address, final Object oldValue, final Object newValue,
                                    final String author) {
        return new AuditEntry(AT, "budget.xlsx",
                new CellChange("Sheet1", address, CellRecord.ofValue(oldValue), CellRecord.ofValue(newValue),
                        ChangeKind.DIRECT_VALUE_CHANGED),
                author);
    }

    private static String readGzip(final Path file) throws IOException {
        try (final InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @DisplayName("Rows are appended to the daily file with the header written once")
    void appendsToDailyFile() throws IOException {
        final CsvAuditSink sink = new CsvAuditSink(tempDir.resolve("audit"), ZoneOffset.UTC);

        sink.append(List.of(entry("A1", 1, 2, "alice")));
        sink.append(List.of(entry("A2", 3, 4, "bob")));

        final Path logFile = sink.logFileFor(LocalDate.of(2025, 7, 12));
        assertThat(logFile.getFileName().toString()).isEqualTo("sheet_change_log_20250712.csv.gz");
        assertThat(readGzip(logFile)).isEqualTo(
                CsvAuditSink.HEADER + "\r\n"
                        + "2025-07-12 10:51:34,budget.xlsx,Sheet1,A1,1,,2,,alice,VALUE\r\n"
                        + "2025-07-12 10:51:34,budget.xlsx,Sheet1,A2,3,,4,,bob,VALUE\r\n");
    }

    @Test
    @DisplayName("Fields with separators or quotes are escaped")
    void escapesFields() {
        final CsvAuditSink sink = new CsvAuditSink(tempDir, ZoneOffset.UTC);
        final AuditEntry entry = new AuditEntry(AT, "q3, final.xlsx",
                new CellChange("Sheet1", "B2", CellRecord.ofFormula("=SUM(A1,A2)", 3), null, ChangeKind.DELETED),
                "O\"Brien");

        assertThat(sink.toRow(entry)).isEqualTo(
                "2025-07-12 10:51:34,\"q3, final.xlsx\",Sheet1,B2,3,\"=SUM(A1,A2)\",,,\"O\"\"Brien\",DEL");
    }

    @Test
    @DisplayName("Missing author is written as Unknown")
    void unknownAuthor() {
        final CsvAuditSink sink = new CsvAuditSink(tempDir, ZoneOffset.UTC);
        final AuditEntry entry = new AuditEntry(AT, "budget.xlsx",
                new CellChange("Sheet1", "C3", null, CellRecord.ofValue("new"), ChangeKind.ADDED), null);

        assertThat(sink.toRow(entry)).endsWith(",,,new,,Unknown,ADD");
    }

    @Test
    @DisplayName("Empty batch creates no file")
    void emptyBatch() throws IOException {
        final Path folder = tempDir.resolve("audit");

        new CsvAuditSink(folder, ZoneOffset.UTC).append(List.of());

        assertThat(folder).doesNotExist();
    }
}
