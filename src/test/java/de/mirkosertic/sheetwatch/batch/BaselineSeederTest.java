package de.mirkosertic.sheetwatch.batch;

import de.mirkosertic.sheetwatch.baseline.BaselineCodec;
import de.mirkosertic.sheetwatch.baseline.BaselineStore;
import de.mirkosertic.sheetwatch.extract.ExtractionException;
import de.mirkosertic.sheetwatch.extract.SpreadsheetExtractor;
import de.mirkosertic.sheetwatch.model.Baseline;
import de.mirkosertic.sheetwatch.model.CellRecord;
import de.mirkosertic.sheetwatch.model.FailureKind;
import de.mirkosertic.sheetwatch.model.WorkbookSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("BaselineSeeder Tests")
class BaselineSeederTest {

    private static final Instant NOW = Instant.parse("2025-07-12T10:51:34Z");

    @TempDir
    Path tempDir;

    private BaselineStore store;
    private SpreadsheetExtractor extractor;
    private BaselineSeeder seeder;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        store = new BaselineStore(tempDir.resolve("baselines"), BaselineCodec.GZIP, 2, 1);
        store.open();
        extractor = mock(SpreadsheetExtractor.class);
        seeder = new BaselineSeeder(store, extractor, Clock.fixed(NOW, ZoneOffset.UTC));
        file = tempDir.resolve("budget.xlsx");
    }

    private static WorkbookSnapshot snapshot(final Object a1) {
        return WorkbookSnapshot.builder().put("Sheet1", "A1", CellRecord.ofValue(a1)).build();
    }

    @Test
    @DisplayName("First baseline is created with author and timestamp")
    void creates() throws IOException {
        when(extractor.extract(file)).thenReturn(snapshot(1));
        when(extractor.lastAuthor(file)).thenReturn("alice");

        assertThat(seeder.seed(file)).isEqualTo(BaselineSeeder.Outcome.CREATED);

        final Baseline baseline = store.load("budget.xlsx");
        assertThat(baseline.cells()).isEqualTo(snapshot(1));
        assertThat(baseline.lastAuthor()).isEqualTo("alice");
        assertThat(baseline.timestamp()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Unchanged content leaves the baseline alone, changed content replaces it")
    void unchangedAndReplaced() throws IOException {
        when(extractor.extract(file)).thenReturn(snapshot(1), snapshot(1), snapshot(2));

        assertThat(seeder.seed(file)).isEqualTo(BaselineSeeder.Outcome.CREATED);
        assertThat(seeder.seed(file)).isEqualTo(BaselineSeeder.Outcome.UNCHANGED);
        assertThat(seeder.seed(file)).isEqualTo(BaselineSeeder.Outcome.REPLACED);
        assertThat(store.load("budget.xlsx").cells()).isEqualTo(snapshot(2));
    }

    @Test
    @DisplayName("Corrupt baseline is replaced")
    void replacesCorrupt() throws IOException {
        Files.writeString(store.getFolder().resolve("budget.xlsx.baseline.json.gz"), "garbage");
        when(extractor.extract(file)).thenReturn(snapshot(1));

        assertThat(seeder.seed(file)).isEqualTo(BaselineSeeder.Outcome.REPLACED);
        assertThat(store.load("budget.xlsx").cells()).isEqualTo(snapshot(1));
    }

    @Test
    @DisplayName("Extraction failure writes nothing")
    void extractionFailure() throws IOException {
        when(extractor.extract(file)).thenThrow(new ExtractionException(FailureKind.TIMEOUT, "slow"));

        assertThat(seeder.seed(file)).isEqualTo(BaselineSeeder.Outcome.FAILED);
        assertThat(store.exists("budget.xlsx")).isFalse();
    }
}
