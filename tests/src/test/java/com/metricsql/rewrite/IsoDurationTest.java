package com.metricsql.rewrite;

import com.metricsql.test.TestBase;
import com.metricsql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("ISO Duration Tests")
public class IsoDurationTest extends TestBase {

    private static final ZonedDateTime T = ZonedDateTime.of(2024, 3, 31, 12, 0, 0, 0, ZoneOffset.UTC);

    @Test
    @DisplayName("Date and time parts combine")
    void testCombined() {
        assertThat(IsoDuration.parse("P1DT12H").subtractFrom(T))
            .isEqualTo(ZonedDateTime.of(2024, 3, 30, 0, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Weeks and months use calendar arithmetic")
    void testCalendar() {
        assertThat(IsoDuration.parse("P2W").subtractFrom(T)).isEqualTo(T.minusDays(14));
        assertThat(IsoDuration.parse("P1M").subtractFrom(T).getDayOfMonth()).isEqualTo(29);
        assertThat(IsoDuration.parse("PT6H").addTo(T)).isEqualTo(T.plusHours(6));
    }

    @Test
    @DisplayName("inf is infinite")
    void testInfinite() {
        assertThat(IsoDuration.parse("inf").isInfinite()).isTrue();
        assertThat(IsoDuration.parse("P1D").isInfinite()).isFalse();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "P", "PT", "1D", "P1X", "P1DT"})
    @DisplayName("Malformed durations are rejected")
    void testMalformed(String text) {
        assertThatThrownBy(() -> IsoDuration.parse(text)).isInstanceOf(IllegalArgumentException.class);
    }
}
