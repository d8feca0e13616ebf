package de.mirkosertic.sheetwatch.diff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExternalReferencePattern Tests")
class ExternalReferencePatternTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "=[1]Sheet1!A1",
            "=SUM([12]Rates!B2:B9)",
            "='C:\\Users\\ops\\[Rates.xlsx]Sheet1'!A1",
            "='//server/share/[Book.xlsx]Data'!C3*2",
            "=[Budget.xlsx]Sheet1!A1"
    })
    @DisplayName("External workbook references are recognised")
    void recognisesExternalReferences(final String formula) {
        assertThat(ExternalReferencePattern.matches(formula)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "=1+1",
            "=SUM(A1:A3)",
            "='My Sheet'!A1",
            "=Table1[@Amount]",
            ""
    })
    @DisplayName("Workbook-internal formulas are not external references")
    void ignoresInternalFormulas(final String formula) {
        assertThat(ExternalReferencePattern.matches(formula)).isFalse();
    }
}
