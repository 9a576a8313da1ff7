package dev.devanks.voltedge.pipeline.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CalendarUtils Unit Tests")
class CalendarUtilsTest {

    @ParameterizedTest(name = "month {0} is season {1}")
    @CsvSource({"12,0", "1,0", "2,0", "3,1", "5,1", "6,2", "8,2", "9,3", "11,3"})
    @DisplayName("season: meteorological seasons starting with winter")
    void season_byMonth(int month, int expected) {
        assertThat(CalendarUtils.season(month)).isEqualTo(expected);
    }

    @Test
    @DisplayName("dayOfWeekIndex: Monday is 0 and Sunday is 6")
    void dayOfWeekIndex_mondayFirst() {
        assertThat(CalendarUtils.dayOfWeekIndex(LocalDateTime.of(2007, 1, 1, 0, 0))).isZero();
        assertThat(CalendarUtils.dayOfWeekIndex(LocalDateTime.of(2007, 1, 7, 0, 0))).isEqualTo(6);
        assertThat(CalendarUtils.isWeekend(LocalDateTime.of(2007, 1, 7, 0, 0))).isTrue();
    }

    @Test
    @DisplayName("hourBucket: truncates to the start of the hour")
    void hourBucket_truncates() {
        assertThat(CalendarUtils.hourBucket(LocalDateTime.of(2007, 1, 1, 13, 59, 30)))
                .isEqualTo(LocalDateTime.of(2007, 1, 1, 13, 0));
    }
}
