package de.mirkosertic.sheetwatch.extract;

import de.mirkosertic.sheetwatch.config.ApplicationConfig;
import de.mirkosertic.sheetwatch.model.CellRecord;
import de.mirkosertic.sheetwatch.model.FailureKind;
import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.hpsf.SummaryInformation;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.model.ExternalLinksTable;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads cell values and formulas with Apache POI.
 * <p>
 * Workbooks are opened read-only. Formula cells are recorded with their formula text (prefixed with
 * {@code =}) and their cached result; nothing is recalculated. Integral numbers become {@link Long},
 * date-formatted numbers become ISO-8601 strings, error cells their error text ({@code #DIV/0!}).
 */
public class PoiSpreadsheetExtractor implements SpreadsheetExtractor {

    private static final Logger logger = LoggerFactory.getLogger(PoiSpreadsheetExtractor.class);

    private static final double MAX_EXACT_LONG = 1e15;

    private final @Nullable LocalCacheMirror cacheMirror;

    public PoiSpreadsheetExtractor(final ApplicationConfig config) {
        this(config.isUseLocalCache() ? new LocalCacheMirror(Paths.get(config.getCacheFolder())) : null);
    }

    public PoiSpreadsheetExtractor(final @Nullable LocalCacheMirror cacheMirror) {
        this.cacheMirror = cacheMirror;
    }

    @Override
    public WorkbookSnapshot extract(final Path file) throws ExtractionException {
        final Path source = resolveReadPath(file);
        final long start = System.currentTimeMillis();
        try (final Workbook workbook = open(source)) {
            final WorkbookSnapshot.Builder builder = WorkbookSnapshot.builder();
            for (final Sheet sheet : workbook) {
                for (final Row row : sheet) {
                    for (final Cell cell : row) {
                        final CellRecord record = toRecord(cell);
                        if (record != null) {
                            builder.put(sheet.getSheetName(), cell.getAddress().formatAsString(), record);
                        }
                    }
                }
            }
            final WorkbookSnapshot snapshot = builder.build();
            logger.debug("Extracted {} cells in {} worksheets from {} in {}ms",
                    snapshot.cellCount(), snapshot.worksheetNames().size(), file.getFileName(),
                    System.currentTimeMillis() - start);
            return snapshot;
        } catch (final ExtractionException e) {
            throw e;
        } catch (final IOException | RuntimeException e) {
            throw classify(file, e);
        }
    }

    @Override
    public @Nullable String lastAuthor(final Path file) {
        final Path source = resolveReadPath(file);
        try (final Workbook workbook = open(source)) {
            if (workbook instanceof XSSFWorkbook xssf) {
                return blankToNull(xssf.getProperties().getCoreProperties().getLastModifiedByUser());
            }
            if (workbook instanceof HSSFWorkbook hssf) {
                final SummaryInformation summary = hssf.getSummaryInformation();
                return summary == null ? null : blankToNull(summary.getLastAuthor());
            }
            return null;
        } catch (final IOException | RuntimeException e) {
            logger.debug("Cannot read last author of {}: {}", file, e.toString());
            return null;
        }
    }

    /**
     * Link targets in the order of the workbook's external references, which is the order formulas index.
     */
    @Override
    public Map<Integer, String> externalLinks(final Path file) {
        final Path source = resolveReadPath(file);
        try (final Workbook workbook = open(source)) {
            if (!(workbook instanceof XSSFWorkbook xssf)) {
                return Map.of();
            }
            final List<ExternalLinksTable> tables = xssf.getExternalLinksTable();
            final Map<Integer, String> links = new TreeMap<>();
            for (int i = 0; i < tables.size(); i++) {
                final String target = tables.get(i).getLinkedFileName();
                if (target != null && !target.isBlank()) {
                    links.put(i + 1, target);
                }
            }
            logger.debug("{} external links in {}", links.size(), file.getFileName());
            return links;
        } catch (final IOException | RuntimeException e) {
            logger.debug("Cannot read external links of {}: {}", file, e.toString());
            return Map.of();
        }
    }

    private Path resolveReadPath(final Path file) {
        if (cacheMirror == null || !Files.exists(file)) {
            return file;
        }
        return cacheMirror.ensureLocalCopy(file);
    }

    private static Workbook open(final Path source) throws IOException {
        if (!Files.exists(source)) {
            throw new ExtractionException(FailureKind.NOT_FOUND, "File not found: " + source);
        }
        return WorkbookFactory.create(source.toFile(), null, true);
    }

    static @Nullable CellRecord toRecord(final Cell cell) {
        final CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            final Object cached = valueOf(cell, cell.getCachedFormulaResultType());
            return CellRecord.ofFormula("=" + cell.getCellFormula(), cached);
        }
        final Object value = valueOf(cell, type);
        return value == null ? null : CellRecord.ofValue(value);
    }

    private static @Nullable Object valueOf(final Cell cell, final CellType type) {
        switch (type) {
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toString();
                }
                return numeric(cell.getNumericCellValue());
            case STRING:
                final String text = cell.getStringCellValue();
                return text == null || text.isEmpty() ? null : text;
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case ERROR:
                return errorText(cell.getErrorCellValue());
            default:
                return null;
        }
    }

    static Object numeric(final double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_LONG) {
            return (long) value;
        }
        return value;
    }

    private static String errorText(final byte code) {
        try {
            return FormulaError.forInt(code).getString();
        } catch (final IllegalArgumentException e) {
            return "#ERR" + code;
        }
    }

    private static @Nullable String blankToNull(final @Nullable String value) {
        return value == null || value.isBlank() ? null : value;
    }

    static ExtractionException classify(final Path file, final Exception e) {
        final String name = file.getFileName().toString();
        if (e instanceof NoSuchFileException || e instanceof FileNotFoundException) {
            return new ExtractionException(FailureKind.NOT_FOUND, "File not found: " + name, e);
        }
        if (e instanceof AccessDeniedException || e instanceof FileSystemException) {
            return new ExtractionException(FailureKind.ACCESS_DENIED, "File locked or not readable: " + name, e);
        }
        if (e instanceof EncryptedDocumentException) {
            return new ExtractionException(FailureKind.ACCESS_DENIED, "Workbook is password protected: " + name, e);
        }
        return new ExtractionException(FailureKind.CORRUPT, "Cannot read workbook " + name + ": " + e.getMessage(), e);
    }
}
