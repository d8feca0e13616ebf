package de.mirkosertic.sheetwatch.baseline;

import de.mirkosertic.sheetwatch.model.Baseline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static de.mirkosertic.sheetwatch.baseline.BaselineFixtures.baseline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BaselineStore Tests")
class BaselineStoreTest {

    @TempDir
    Path tempDir;

    private BaselineStore store;

    @BeforeEach
    void setUp() throws IOException {
        store = new BaselineStore(tempDir, BaselineCodec.GZIP, 3, 1);
        store.open();
    }

    @Test
    @DisplayName("Saved baseline loads back equal")
    void roundTrip() throws IOException {
        final Baseline original = baseline("alice", 1);

        assertThat(store.save("report.xlsx", original)).isTrue();

        assertThat(store.load("report.xlsx")).isEqualTo(original);
        assertThat(store.codecOf("report.xlsx")).isEqualTo(BaselineCodec.GZIP);
        assertThat(tempDir.resolve("report.xlsx.baseline.json.gz")).isRegularFile();
    }

    @Test
    @DisplayName("Missing baseline loads as null")
    void missingBaseline() throws IOException {
        assertThat(store.load("unknown.xlsx")).isNull();
        assertThat(store.exists("unknown.xlsx")).isFalse();
    }

    @Test
    @DisplayName("Load probes codecs in fixed priority order")
    void probeOrder() throws IOException {
        store.writeAtomically("report.xlsx", baseline("plain-writer", 1), BaselineCodec.PLAIN);
        store.writeAtomically("report.xlsx", baseline("gzip-writer", 2), BaselineCodec.GZIP);

        assertThat(store.load("report.xlsx").lastAuthor()).isEqualTo("gzip-writer");
    }

    @Test
    @DisplayName("Artifacts of other codecs are removed after a successful save")
    void removesStaleCodecArtifacts() throws IOException {
        assertThat(store.save("report.xlsx", baseline("alice", 1), BaselineCodec.PLAIN)).isTrue();
        assertThat(store.load("report.xlsx").lastAuthor()).isEqualTo("alice");

        assertThat(store.save("report.xlsx", baseline("bob", 2))).isTrue();

        try (final Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly("report.xlsx.baseline.json.gz");
        }
    }

    @Test
    @DisplayName("Crash before the move leaves the previous baseline intact")
    void failedPromoteKeepsPreviousBaseline() throws IOException {
        final Baseline previous = baseline("alice", 1);
        assertThat(store.save("report.xlsx", previous)).isTrue();

        final BaselineStore failing = new BaselineStore(tempDir, BaselineCodec.GZIP, 2, 1) {
            @Override
            void promote(final Path temp, final Path target) throws IOException {
                throw new IOException("simulated crash");
            }
        };

        assertThat(failing.save("report.xlsx", baseline("bob", 2))).isFalse();

        assertThat(store.load("report.xlsx")).isEqualTo(previous);
        try (final Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly("report.xlsx.baseline.json.gz");
        }
    }

    @Test
    @DisplayName("Save retries up to the attempt ceiling")
    void retriesWithBackoff() throws IOException {
        final AtomicInteger attempts = new AtomicInteger();
        final BaselineStore flaky = new BaselineStore(tempDir, BaselineCodec.GZIP, 4, 1) {
            @Override
            void promote(final Path temp, final Path target) throws IOException {
                if (attempts.incrementAndGet() < 3) {
                    throw new IOException("locked");
                }
                super.promote(temp, target);
            }
        };

        assertThat(flaky.save("report.xlsx", baseline("alice", 1))).isTrue();
        assertThat(attempts).hasValue(3);
        assertThat(flaky.load("report.xlsx").lastAuthor()).isEqualTo("alice");
    }

    @Test
    @DisplayName("Save reports failure after all attempts")
    void reportsFailureAfterAllAttempts() throws IOException {
        final AtomicInteger attempts = new AtomicInteger();
        final BaselineStore broken = new BaselineStore(tempDir, BaselineCodec.GZIP, 3, 1) {
            @Override
            void promote(final Path temp, final Path target) throws IOException {
                attempts.incrementAndGet();
                throw new IOException("disk full");
            }
        };

        assertThat(broken.save("report.xlsx", baseline("alice", 1))).isFalse();
        assertThat(attempts).hasValue(3);
        assertThat(broken.load("report.xlsx")).isNull();
    }

    @Test
    @DisplayName("Opening the store removes temp files and restores orphaned backups")
    void recoversInterruptedSave() throws IOException {
        final Baseline previous = baseline("alice", 1);
        store.save("report.xlsx", previous);
        final Path artifact = tempDir.resolve("report.xlsx.baseline.json.gz");
        // Crash after the original was deleted, before the temp file was moved
        Files.move(artifact, tempDir.resolve("report.xlsx.baseline.json.gz.backup"));
        Files.writeString(tempDir.resolve("report.xlsx.0f1e2d.tmp"), "half written");

        final BaselineStore reopened = new BaselineStore(tempDir, BaselineCodec.GZIP, 3, 1);
        reopened.open();

        assertThat(reopened.load("report.xlsx")).isEqualTo(previous);
        try (final Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly("report.xlsx.baseline.json.gz");
        }
    }

    @Test
    @DisplayName("A backup that cannot be restored does not prevent opening the store")
    void unrestorableBackupIsKept() throws IOException {
        // Given - two saves interrupted by a crash, one backup cannot be moved back
        store.save("locked.xlsx", baseline("alice", 1));
        store.save("report.xlsx", baseline("bob", 2));
        Files.move(tempDir.resolve("locked.xlsx.baseline.json.gz"), tempDir.resolve("locked.xlsx.baseline.json.gz.backup"));
        Files.move(tempDir.resolve("report.xlsx.baseline.json.gz"), tempDir.resolve("report.xlsx.baseline.json.gz.backup"));
        final BaselineStore reopened = new BaselineStore(tempDir, BaselineCodec.GZIP, 3, 1) {
            @Override
            void promote(final Path temp, final Path target) throws IOException {
                if (temp.getFileName().toString().startsWith("locked.xlsx")) {
                    throw new IOException("access denied");
                }
                super.promote(temp, target);
            }
        };

        // When
        reopened.open();

        // Then
        assertThat(reopened.load("report.xlsx").lastAuthor()).isEqualTo("bob");
        assertThat(tempDir.resolve("locked.xlsx.baseline.json.gz.backup")).isRegularFile();
        assertThat(reopened.exists("locked.xlsx")).isFalse();
    }

    @Test
    @DisplayName("Stale backup next to an existing artifact is discarded")
    void discardsStaleBackup() throws IOException {
        store.save("report.xlsx", baseline("alice", 1));
        Files.writeString(tempDir.resolve("report.xlsx.baseline.json.gz.backup"), "old");

        store.recover();

        assertThat(tempDir.resolve("report.xlsx.baseline.json.gz.backup")).doesNotExist();
        assertThat(store.load("report.xlsx").lastAuthor()).isEqualTo("alice");
    }

    @Test
    @DisplayName("Migrate re-encodes and removes the old artifact")
    void migrate() throws IOException {
        final Baseline original = baseline("alice", 1);
        store.save("report.xlsx", original);

        assertThat(store.migrate("report.xlsx", BaselineCodec.DEFLATE)).isTrue();

        assertThat(store.codecOf("report.xlsx")).isEqualTo(BaselineCodec.DEFLATE);
        assertThat(tempDir.resolve("report.xlsx.baseline.json.gz")).doesNotExist();
        assertThat(store.load("report.xlsx")).isEqualTo(original);
        assertThat(store.migrate("missing.xlsx", BaselineCodec.DEFLATE)).isFalse();
    }

    @Test
    @DisplayName("Rename moves the baseline to the new key")
    void rename() throws IOException {
        final Baseline original = baseline("alice", 1);
        store.save("old.xlsx", original);

        assertThat(store.rename("old.xlsx", "new.xlsx")).isTrue();

        assertThat(store.exists("old.xlsx")).isFalse();
        assertThat(store.load("new.xlsx")).isEqualTo(original);
        assertThat(store.rename("old.xlsx", "other.xlsx")).isFalse();
    }

    @Test
    @DisplayName("Keys, delete and purge")
    void keysDeleteAndPurge() throws IOException {
        store.save("b.xlsx", baseline("alice", 1));
        store.save("a.xlsx", baseline("alice", 2), BaselineCodec.PLAIN);
        store.save("c.xlsm", baseline("alice", 3), BaselineCodec.DEFLATE);

        assertThat(store.keys()).containsExactly("a.xlsx", "b.xlsx", "c.xlsm");

        assertThat(store.delete("b.xlsx")).isTrue();
        assertThat(store.keys()).containsExactly("a.xlsx", "c.xlsm");

        assertThat(store.purge()).isEqualTo(2);
        assertThat(store.keys()).isEmpty();
    }

    @Test
    @DisplayName("Undecodable artifacts raise CorruptBaselineException")
    void corruptArtifacts() throws IOException {
        Files.writeString(tempDir.resolve("broken.xlsx.baseline.json.gz"), "not gzip at all");
        Files.write(tempDir.resolve("garbage.xlsx.baseline.json"), "{\"cells\":".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> store.load("broken.xlsx")).isInstanceOf(CorruptBaselineException.class);
        assertThatThrownBy(() -> store.load("garbage.xlsx")).isInstanceOf(CorruptBaselineException.class);
    }

    @Test
    @DisplayName("Baseline key is the file name")
    void keyForUsesFileName() {
        assertThat(BaselineStore.keyFor(Path.of("/share/finance/Budget 2025.xlsx"))).isEqualTo("Budget 2025.xlsx");
    }
}
