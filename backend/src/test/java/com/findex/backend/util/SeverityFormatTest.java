package com.findex.backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityFormatTest {

    @Test
    void wholeNumbersGetOneDecimal() {
        assertThat(SeverityFormat.format(7)).isEqualTo("7.0");
        assertThat(SeverityFormat.format(0)).isEqualTo("0.0");
    }

    @Test
    void roundsHalfUpOnTheDecimalValue() {
        assertThat(SeverityFormat.format(4.25)).isEqualTo("4.3");
        assertThat(SeverityFormat.format(4.24)).isEqualTo("4.2");
        assertThat(SeverityFormat.format(2.05)).isEqualTo("2.1");
        assertThat(SeverityFormat.format(8.95)).isEqualTo("9.0");
    }

    @Test
    void rejectsNonFiniteValues() {
        assertThatThrownBy(() -> SeverityFormat.format(Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
