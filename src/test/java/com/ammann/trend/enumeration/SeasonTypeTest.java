/* (C)2026 */
package com.ammann.trend.enumeration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SeasonType")
class SeasonTypeTest {

    private static double epoch(int year, int month, int day, int hour, int minute) {
        return LocalDateTime.of(year, month, day, hour, minute).toEpochSecond(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("calendar keys are evaluated in UTC")
    void calendarKeys() {
        double t = epoch(2024, 5, 15, 13, 42);

        assertThat(SeasonType.MONTH.seasonOf(t, 0, 12)).isEqualTo(5);
        assertThat(SeasonType.QUARTER.seasonOf(t, 0, 4)).isEqualTo(2);
        assertThat(SeasonType.HOUR.seasonOf(t, 0, 24)).isEqualTo(13);
        assertThat(SeasonType.MINUTE.seasonOf(t, 0, 60)).isEqualTo(42);
        assertThat(SeasonType.DAY_OF_YEAR.seasonOf(t, 0, 366)).isEqualTo(136);
        // 2024-05-15 is a Wednesday
        assertThat(SeasonType.DAY_OF_WEEK.seasonOf(t, 0, 7)).isEqualTo(3);
        assertThat(SeasonType.WEEK_OF_YEAR.seasonOf(t, 0, 53)).isEqualTo(20);
    }

    @Test
    @DisplayName("period keys cycle from the series origin")
    void periodKeys() {
        assertThat(SeasonType.PERIOD.seasonOf(100, 100, 4)).isZero();
        assertThat(SeasonType.PERIOD.seasonOf(105, 100, 4)).isEqualTo(1);
        assertThat(SeasonType.PERIOD.seasonOf(107.9, 100, 4)).isEqualTo(3);
        assertThat(SeasonType.PERIOD.seasonOf(99, 100, 4)).isEqualTo(3);
    }

    @Test
    @DisplayName("period keys need a positive period")
    void periodMustBePositive() {
        assertThatThrownBy(() -> SeasonType.PERIOD.seasonOf(1, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
