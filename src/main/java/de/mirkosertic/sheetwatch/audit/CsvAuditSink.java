package de.mirkosertic.sheetwatch.audit;

import de.mirkosertic.sheetwatch.model.CellChange;
import org.apache.commons.text.StringEscapeUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.zip.GZIPOutputStream;

/**
 * Writes the audit trail as gzip-compressed CSV, one file per day ({@code sheet_change_log_YYYYMMDD.csv.gz}).
 * <p>
 * Every {@link #append(List)} adds a complete gzip member to the day's file, so the file stays readable
 * after a crash between two appends.
 */
public class CsvAuditSink implements AuditSink {

    private static final Logger logger = LoggerFactory.getLogger(CsvAuditSink.class);

    static final String HEADER =
            "Timestamp,Filename,Worksheet,Cell,Old_Value,Old_Formula,New_Value,New_Formula,Last_Author,Change_Type";

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter ROW_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path folder;
    private final ZoneId zone;

    public CsvAuditSink(final Path folder) {
        this(folder, ZoneId.systemDefault());
    }

    public CsvAuditSink(final Path folder, final ZoneId zone) {
        this.folder = folder;
        this.zone = zone;
    }

    @Override
    public synchronized void append(final List<AuditEntry> entries) throws IOException {
        if (entries.isEmpty()) {
            return;
        }
        Files.createDirectories(folder);
        final Path logFile = logFileFor(entries.get(0).timestamp().atZone(zone).toLocalDate());
        final boolean newFile = !Files.exists(logFile);

        try (final Writer writer = new BufferedWriter(new OutputStreamWriter(
                new GZIPOutputStream(Files.newOutputStream(logFile, StandardOpenOption.CREATE, StandardOpenOption.APPEND)),
                StandardCharsets.UTF_8))) {
            if (newFile) {
                writer.write(HEADER);
                writer.write("\r\n");
            }
            for (final AuditEntry entry : entries) {
                writer.write(toRow(entry));
                writer.write("\r\n");
            }
        }
        logger.debug("Appended {} audit rows to {}", entries.size(), logFile.getFileName());
    }

    public Path logFileFor(final LocalDate day) {
        return folder.resolve("sheet_change_log_" + FILE_DATE.format(day) + ".csv.gz");
    }

    String toRow(final AuditEntry entry) {
        final CellChange change = entry.change();
        return String.join(",",
                field(ROW_TIMESTAMP.format(entry.timestamp().atZone(zone))),
                field(entry.fileName()),
                field(change.worksheet()),
                field(change.address()),
                field(change.oldValue()),
                field(change.oldFormula()),
                field(change.newValue()),
                field(change.newFormula()),
                field(entry.author() == null ? "Unknown" : entry.author()),
                field(change.kind().auditCode()));
    }

    private static String field(final @Nullable Object value) {
        return value == null ? "" : StringEscapeUtils.escapeCsv(String.valueOf(value));
    }
}
