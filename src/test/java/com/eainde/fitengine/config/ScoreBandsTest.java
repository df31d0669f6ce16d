package com.eainde.fitengine.config;

import com.eainde.fitengine.model.Recommendation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreBandsTest {

    private final ScoreBands bands = new ScoreBands(40, 55, 75);

    @ParameterizedTest
    @CsvSource({
            "0, PASS",
            "39, PASS",
            "40, LONG_SHOT",
            "54, LONG_SHOT",
            "55, CONDITIONAL_APPLY",
            "74, CONDITIONAL_APPLY",
            "75, APPLY",
            "100, APPLY"
    })
    void bandBoundaries(int score, Recommendation expected) {
        assertThat(bands.bandFor(score)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Floors must be strictly increasing")
    void invalidOrder() {
        assertThatThrownBy(() -> new ScoreBands(50, 50, 75)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScoreBands(40, 55, 101)).isInstanceOf(IllegalArgumentException.class);
    }
}
