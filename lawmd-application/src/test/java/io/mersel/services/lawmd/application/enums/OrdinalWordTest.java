package io.mersel.services.lawmd.application.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OrdinalWord")
class OrdinalWordTest {

    @ParameterizedTest(name = "{0} → {1}")
    @CsvSource({
            "2, bis",
            "3, ter",
            "4, quater",
            "12, duodecies",
            "13, 13"
    })
    @DisplayName("Tekrar sırası ek kelimesine çevrilmeli")
    void shouldMapOccurrenceToWord(int occurrence, String expected) {
        assertThat(OrdinalWord.suffixFor(occurrence)).isEqualTo(expected);
    }

    @Test
    @DisplayName("quater, ter'den önce tanınmalı")
    void shouldDetectQuaterFirst() {
        assertThat(OrdinalWord.detectFilenameSuffix("7quater")).contains(OrdinalWord.QUATER);
        assertThat(OrdinalWord.detectFilenameSuffix("7TER")).contains(OrdinalWord.TER);
        assertThat(OrdinalWord.detectFilenameSuffix("7bis")).contains(OrdinalWord.BIS);
        assertThat(OrdinalWord.detectFilenameSuffix("7a")).isEmpty();
        assertThat(OrdinalWord.detectFilenameSuffix(null)).isEmpty();
    }
}
