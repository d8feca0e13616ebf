package de.mirkosertic.sheetwatch.polling;

import de.mirkosertic.sheetwatch.detect.ChangeDetector;
import de.mirkosertic.sheetwatch.detect.DetectionResult;
import de.mirkosertic.sheetwatch.model.CellChange;
import de.mirkosertic.sheetwatch.model.CellRecord;
import de.mirkosertic.sheetwatch.model.ChangeKind;
import de.mirkosertic.sheetwatch.model.FailureKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("AdaptivePollingScheduler Tests")
class AdaptivePollingSchedulerTest {

    @TempDir
    Path tempDir;

    private ChangeDetector detector;
    private AdaptivePollingScheduler scheduler;
    private Path file;

    @BeforeEach
    void setUp() throws IOException {
        detector = mock(ChangeDetector.class);
        file = Files.writeString(tempDir.resolve("report.xlsx"), "small");
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private AdaptivePollingScheduler scheduler(final long denseInterval, final long denseDuration,
                                               final long sparseInterval, final int maxFailures) {
        return new AdaptivePollingScheduler(detector, AdaptivePollingScheduler.createExecutor(2),
                1.0, denseInterval, denseDuration, sparseInterval, maxFailures);
    }

    private static DetectionResult changes() {
        return DetectionResult.changesFound(List.of(
                new CellChange("S", "A1", CellRecord.ofValue(1), CellRecord.ofValue(2), ChangeKind.DIRECT_VALUE_CHANGED)),
                true);
    }

    @Test
    @DisplayName("Dense task runs until the quiet budget is used up")
    void denseTaskRetires() {
        // Given
        when(detector.detect(file)).thenReturn(changes(), DetectionResult.noChange());
        scheduler = scheduler(50, 150, 10_000, 3);

        // When
        scheduler.start(file);

        // Then
        assertThat(scheduler.getMode(file)).isEqualTo(PollingMode.DENSE);
        verify(detector, timeout(2_000).times(4)).detect(file);
        verify(detector, after(300).times(4)).detect(file);
        assertThat(scheduler.isActive(file)).isFalse();
        assertThat(scheduler.getRemainingDuration(file)).isEqualTo(-1);
    }

    @Test
    @DisplayName("Files at or above the size threshold are polled sparsely")
    void modeBySize() throws IOException {
        scheduler = scheduler(50, 150, 10_000, 3);
        final Path large = tempDir.resolve("large.xlsx");
        Files.write(large, new byte[2 * 1024 * 1024]);

        assertThat(scheduler.modeFor(file)).isEqualTo(PollingMode.DENSE);
        assertThat(scheduler.modeFor(large)).isEqualTo(PollingMode.SPARSE);
        assertThat(scheduler.modeFor(tempDir.resolve("missing.xlsx"))).isEqualTo(PollingMode.DENSE);
    }

    @Test
    @DisplayName("Restarting a path keeps one task with the newer parameters")
    void oneTaskPerPath() {
        when(detector.detect(file)).thenReturn(DetectionResult.noChange());
        scheduler = scheduler(10_000, 60_000, 20_000, 3);

        scheduler.start(file, PollingMode.DENSE);
        scheduler.start(file, PollingMode.SPARSE);

        assertThat(scheduler.activeCount()).isEqualTo(1);
        assertThat(scheduler.getMode(file)).isEqualTo(PollingMode.SPARSE);
        assertThat(scheduler.getInterval(file)).isEqualTo(20_000);
    }

    @Test
    @DisplayName("Sparse task retires after the first quiet tick")
    void sparseRetires() {
        when(detector.detect(file)).thenReturn(changes(), DetectionResult.noChange());
        scheduler = scheduler(10_000, 60_000, 50, 3);

        scheduler.start(file, PollingMode.SPARSE);

        verify(detector, timeout(2_000).times(2)).detect(file);
        verify(detector, after(300).times(2)).detect(file);
        assertThat(scheduler.isActive(file)).isFalse();
    }

    @Test
    @DisplayName("Polling gives up after the configured number of failed ticks")
    void failureCap() {
        when(detector.detect(file)).thenReturn(DetectionResult.failed(FailureKind.ACCESS_DENIED));
        scheduler = scheduler(30, 60_000, 10_000, 3);

        scheduler.start(file, PollingMode.DENSE);

        verify(detector, timeout(2_000).times(3)).detect(file);
        verify(detector, after(300).times(3)).detect(file);
        assertThat(scheduler.isActive(file)).isFalse();
    }

    @Test
    @DisplayName("Unexpected detector exceptions count as failures")
    void runtimeExceptionCountsAsFailure() {
        when(detector.detect(file)).thenThrow(new IllegalStateException("boom"));
        scheduler = scheduler(30, 60_000, 10_000, 2);

        scheduler.start(file, PollingMode.DENSE);

        verify(detector, timeout(2_000).times(2)).detect(file);
        verify(detector, after(300).times(2)).detect(file);
    }

    @Test
    @DisplayName("Unexpected detector exceptions are reported as internal errors")
    void runtimeExceptionIsInternalError() {
        when(detector.detect(file)).thenThrow(new IllegalStateException("boom"));
        scheduler = scheduler(30, 60_000, 10_000, 2);

        final DetectionResult result = scheduler.runCycle(file);

        assertThat(result.outcome()).isEqualTo(DetectionResult.Outcome.FAILED);
        assertThat(result.failure()).isEqualTo(FailureKind.INTERNAL_ERROR);
    }

    @Test
    @DisplayName("Stopped file is not polled again")
    void stopSingleFile() {
        scheduler = scheduler(200, 60_000, 10_000, 3);

        scheduler.start(file, PollingMode.DENSE);
        scheduler.stop(file);

        assertThat(scheduler.isActive(file)).isFalse();
        verify(detector, after(500).never()).detect(file);
    }

    @Test
    @DisplayName("Stop all cancels every task and refuses new ones")
    void stopAll() throws IOException {
        scheduler = scheduler(200, 60_000, 10_000, 3);
        final Path other = Files.writeString(tempDir.resolve("other.xlsx"), "x");
        scheduler.start(file);
        scheduler.start(other);

        scheduler.stopAll();
        scheduler.start(file);

        assertThat(scheduler.activeCount()).isZero();
        verify(detector, after(500).never()).detect(file);
        verify(detector, never()).detect(other);
    }
}
