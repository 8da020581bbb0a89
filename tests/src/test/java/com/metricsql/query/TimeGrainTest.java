package com.metricsql.query;

import com.metricsql.test.TestBase;
import com.metricsql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("Time Grain Tests")
public class TimeGrainTest extends TestBase {

    // Wednesday
    private static final ZonedDateTime T = ZonedDateTime.of(2024, 5, 15, 13, 45, 30, 0, ZoneOffset.UTC);

    private static ZonedDateTime at(int year, int month, int day) {
        return ZonedDateTime.of(year, month, day, 0, 0, 0, 0, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Codes are case-sensitive")
    void testCodes() {
        assertThat(TimeGrain.fromCode("m")).isEqualTo(TimeGrain.MINUTE);
        assertThat(TimeGrain.fromCode("M")).isEqualTo(TimeGrain.MONTH);
        assertThatThrownBy(() -> TimeGrain.fromCode("d")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Weeks start on the configured day")
    void testWeek() {
        assertThat(TimeGrain.WEEK.truncate(T, 1, 1)).isEqualTo(at(2024, 5, 13));
        assertThat(TimeGrain.WEEK.truncate(T, 7, 1)).isEqualTo(at(2024, 5, 12));
    }

    @Test
    @DisplayName("Quarters and years follow the fiscal start month")
    void testFiscal() {
        assertThat(TimeGrain.QUARTER.truncate(T, 1, 1)).isEqualTo(at(2024, 4, 1));
        assertThat(TimeGrain.QUARTER.truncate(T, 1, 2)).isEqualTo(at(2024, 5, 1));
        assertThat(TimeGrain.YEAR.truncate(T, 1, 7)).isEqualTo(at(2023, 7, 1));
    }

    @Test
    @DisplayName("Adding grains uses calendar arithmetic")
    void testPlus() {
        assertThat(TimeGrain.QUARTER.plus(at(2024, 1, 31), 1)).isEqualTo(at(2024, 4, 30));
        assertThat(TimeGrain.MONTH.plus(at(2024, 3, 31), -1)).isEqualTo(at(2024, 2, 29));
        assertThat(TimeGrain.HOUR.truncate(T, 1, 1).getMinute()).isZero();
    }
}
