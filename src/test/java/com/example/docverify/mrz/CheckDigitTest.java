package com.example.docverify.mrz;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static com.example.docverify.TestFixtures.TD3_LINE2;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Check digit examples from ICAO Doc 9303 Part 3, Appendix A.
 */
@DisplayName("CheckDigit")
class CheckDigitTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "520727, 3",
            "AB2134<<<, 5",
            "D23145890, 7",
            "L898902C3, 6",
            "740812, 2",
            "120415, 9"
    })
    void computesIcaoExamples(String data, int expected) {
        assertThat(CheckDigit.compute(data)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Composite of a passport line 2")
    void computesComposite() {
        String lower = TD3_LINE2;
        String composite = lower.substring(0, 10) + lower.substring(13, 20) + lower.substring(21, 43);

        assertThat(CheckDigit.compute(composite)).isZero();
    }

    @Test
    @DisplayName("Filler and letters are valued 0 and 10-35")
    void valuesCharacters() {
        assertThat(CheckDigit.valueOf('<')).isZero();
        assertThat(CheckDigit.valueOf('7')).isEqualTo(7);
        assertThat(CheckDigit.valueOf('A')).isEqualTo(10);
        assertThat(CheckDigit.valueOf('Z')).isEqualTo(35);
    }

    @Test
    @DisplayName("A filler in the check position is treated as not provided")
    void fillerMatchesAnything() {
        assertThat(CheckDigit.matches("L898902C3", '<')).isTrue();
        assertThat(CheckDigit.matches("L898902C3", '6')).isTrue();
        assertThat(CheckDigit.matches("L898902C3", '5')).isFalse();
        assertThat(CheckDigit.matches("L898902C3", 'O')).isFalse();
    }
}
