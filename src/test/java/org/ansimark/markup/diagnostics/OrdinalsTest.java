package org.ansimark.markup.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for {@link Ordinals}.
 */
@Tag("unit")
class OrdinalsTest {

    @ParameterizedTest
    @CsvSource({
            "1, a 1st",
            "2, a 2nd",
            "3, a 3rd",
            "4, a 4th",
            "8, an 8th",
            "11, an 11th",
            "12, a 12th",
            "13, a 13th",
            "18, an 18th",
            "21, a 21st",
            "80, an 80th",
            "111, a 111th",
            "112, a 112th",
            "1100, a 1100th",
            "11000, an 11000th"
    })
    void spellsOrdinalWithArticle(int number, String expected) {
        assertThat(Ordinals.withArticle(number)).isEqualTo(expected);
    }
}
