package de.mirkosertic.sheetwatch.baseline;

import de.mirkosertic.sheetwatch.model.Baseline;
import de.mirkosertic.sheetwatch.model.CellRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneId;

import static de.mirkosertic.sheetwatch.baseline.BaselineFixtures.baseline;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BaselineJson Tests")
class BaselineJsonTest {

    private static Baseline read(final String json) throws IOException {
        return BaselineJson.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    @DisplayName("Writes the current format version with snake_case keys")
    void writesCurrentFormat() throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        BaselineJson.write(baseline("alice", 1), out);

        final String json = out.toString(StandardCharsets.UTF_8);
        assertThat(json)
                .contains("\"format_version\":2")
                .contains("\"content_hash\":")
                .contains("\"last_author\":\"alice\"")
                .contains("\"timestamp\":\"2025-07-12T10:51:34.123Z\"")
                .contains("\"formula\":\"=A1*2\"");
    }

    @Test
    @DisplayName("Legacy artifacts without version and with local timestamps are accepted")
    void readsLegacyFormat() throws IOException {
        final Baseline legacy = read("""
                {
                  "last_author": "bob",
                  "content_hash": "5d41402abc4b2a76b9719d911017c592",
                  "timestamp": "2024-05-01T10:15:30.123456",
                  "cells": {"Sheet1": {"A1": {"value": "hello", "formula": null}}}
                }
                """);

        assertThat(legacy.lastAuthor()).isEqualTo("bob");
        assertThat(legacy.cells().worksheet("Sheet1")).containsEntry("A1", CellRecord.ofValue("hello"));
        assertThat(legacy.timestamp()).isEqualTo(
                LocalDateTime.parse("2024-05-01T10:15:30.123456").atZone(ZoneId.systemDefault()).toInstant());
    }

    @Test
    @DisplayName("Future format versions are rejected")
    void rejectsFutureVersion() {
        assertThatThrownBy(() -> read("""
                {"format_version": 3, "content_hash": "x", "timestamp": "2025-01-01T00:00:00Z", "cells": {}}
                """)).isInstanceOf(CorruptBaselineException.class);
    }

    @Test
    @DisplayName("Malformed shapes are rejected")
    void rejectsMalformedShapes() {
        assertThatThrownBy(() -> read("[]")).isInstanceOf(CorruptBaselineException.class);
        assertThatThrownBy(() -> read("""
                {"timestamp": "2025-01-01T00:00:00Z", "cells": {}}
                """)).isInstanceOf(CorruptBaselineException.class);
        assertThatThrownBy(() -> read("""
                {"content_hash": "x", "timestamp": "2025-01-01T00:00:00Z", "cells": {"S": {"A1": {"value": null, "formula": null}}}}
                """)).isInstanceOf(CorruptBaselineException.class);
        assertThatThrownBy(() -> read("""
                {"content_hash": "x", "timestamp": "2025-01-01T00:00:00Z", "cells": {"S": {"A1": {"value": [1, 2]}}}}
                """)).isInstanceOf(CorruptBaselineException.class);
        assertThatThrownBy(() -> read("""
                {"content_hash": "x", "timestamp": "yesterday", "cells": {}}
                """)).isInstanceOf(CorruptBaselineException.class);
    }
}
