package de.mirkosertic.sheetwatch.batch;

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

@DisplayName("ProgressTracker Tests")
class ProgressTrackerTest {

    private static final Instant NOW = Instant.parse("2025-07-12T10:51:34Z");

    @TempDir
    Path tempDir;

    private ProgressTracker tracker(final Path file) {
        return new ProgressTracker(file, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Saved progress loads back")
    void saveAndLoad() throws IOException {
        final ProgressTracker tracker = tracker(tempDir.resolve("state").resolve("progress.yaml"));

        tracker.save(40, 120);

        assertThat(tracker.load()).isEqualTo(new ProgressRecord(40, 120, NOW));
        assertThat(tracker.getProgressFile()).content()
                .contains("completedCount: 40")
                .contains("totalCount: 120");
    }

    @Test
    @DisplayName("Missing, empty or malformed files load as no progress")
    void unusableFiles() throws IOException {
        final Path file = tempDir.resolve("progress.yaml");
        final ProgressTracker tracker = tracker(file);
        assertThat(tracker.load()).isNull();

        Files.writeString(file, "");
        assertThat(tracker.load()).isNull();

        Files.writeString(file, "completedCount: many\ntotalCount: 3\n");
        assertThat(tracker.load()).isNull();

        Files.writeString(file, "completedCount: 1\ntotalCount: 3\ntimestamp: yesterday\n");
        assertThat(tracker.load()).isNull();

        Files.writeString(file, "completedCount: [unclosed\n");
        assertThat(tracker.load()).isNull();
    }

    @Test
    @DisplayName("Counts without a usable number load as no progress")
    void countsWithoutNumber() throws IOException {
        final Path file = tempDir.resolve("progress.yaml");
        final ProgressTracker tracker = tracker(file);

        Files.writeString(file, "completedCount:\ntotalCount: 3\n");
        assertThat(tracker.load()).isNull();

        Files.writeString(file, "completedCount: 1\ntotalCount: ~\n");
        assertThat(tracker.load()).isNull();

        Files.writeString(file, "completedCount: -2\ntotalCount: 3\n");
        assertThat(tracker.load()).isNull();

        Files.writeString(file, "- just\n- a list\n");
        assertThat(tracker.load()).isNull();
    }

    @Test
    @DisplayName("Clear removes the progress file")
    void clear() throws IOException {
        final ProgressTracker tracker = tracker(tempDir.resolve("progress.yaml"));
        tracker.save(1, 2);

        tracker.clear();

        assertThat(tracker.getProgressFile()).doesNotExist();
        assertThat(tracker.load()).isNull();
    }
}
