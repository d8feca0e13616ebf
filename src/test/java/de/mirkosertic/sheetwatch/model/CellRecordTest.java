package de.mirkosertic.sheetwatch.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CellRecord Tests")
class CellRecordTest {

    @Test
    @DisplayName("A record without value and formula is rejected")
    void rejectsEmptyRecord() {
        assertThatThrownBy(() -> new CellRecord(null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Numbers are normalised to Long and Double")
    void normalisesNumbers() {
        assertThat(CellRecord.ofValue(42).value()).isEqualTo(42L);
        assertThat(CellRecord.ofValue((short) 3).value()).isEqualTo(3L);
        assertThat(CellRecord.ofValue(1.5f).value()).isEqualTo(1.5d);
        assertThat(CellRecord.ofValue(new BigDecimal("2.25")).value()).isEqualTo(2.25d);
        assertThat(CellRecord.ofValue(42)).isEqualTo(CellRecord.ofValue(42L));
    }

    @Test
    @DisplayName("Non-scalar values are rejected")
    void rejectsNonScalars() {
        assertThatThrownBy(() -> CellRecord.ofValue(List.of(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Formula cells keep cached value and formula")
    void formulaCell() {
        final CellRecord cell = CellRecord.ofFormula("=A1*2", 4);

        assertThat(cell.hasFormula()).isTrue();
        assertThat(cell.value()).isEqualTo(4L);
        assertThat(cell.describe()).isEqualTo("=A1*2 -> 4");
    }
}
