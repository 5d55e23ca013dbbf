package com.ryuqq.feed.adapter.file.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SafeNamesTest {

    @Test
    void of_ReplacesUnsafeCharacters() {
        assertThat(SafeNames.of("espn_api/scoreboard?week=1&season=2025"))
            .isEqualTo("espn_api_scoreboard_week_1_season_2025");
    }

    @Test
    void of_LongKeys_AreShortenedAndStayDistinct() {
        // Given
        String base = "odds_api/americanfootball_nfl/odds?" + "x".repeat(200);

        // When
        String first = SafeNames.of(base + "&a=1");
        String second = SafeNames.of(base + "&a=2");

        // Then
        assertThat(first).hasSize(80 + 1 + 12 + 1 + 40);
        assertThat(first).isNotEqualTo(second);
        assertThat(first).matches("[a-zA-Z0-9._-]+");
    }

    @Test
    void of_Blank_ThrowsException() {
        assertThatThrownBy(() -> SafeNames.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
