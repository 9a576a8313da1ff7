package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.model.QualityFlag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static dev.devanks.voltedge.pipeline.TestData.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Calendar, interaction and cyclical feature Unit Tests")
class CalendarFeaturesTest {

    private final PipelineOptions options = PipelineOptions.defaults();

    private static HourlySeries seriesAt(LocalDateTime... timestamps) {
        return new HourlySeries(List.of(timestamps).stream()
                .map(timestamp -> hourly(timestamp, 1.0, QualityFlag.OK))
                .toList());
    }

    @Test
    @DisplayName("calendar: business hours are 07:00 to 19:00 on weekdays, peak hours 18:00 to 22:00")
    void calendar_businessAndPeakHours() {
        // Monday 2007-01-01
        var series = seriesAt(
                LocalDateTime.of(2007, 1, 1, 7, 0),
                LocalDateTime.of(2007, 1, 1, 19, 0),
                LocalDateTime.of(2007, 1, 6, 10, 0),
                LocalDateTime.of(2007, 1, 6, 21, 0));

        Map<String, double[]> columns = new CalendarFeatures().derive(series, options);

        assertThat(columns.get("is_business_hours")).containsExactly(1, 0, 0, 0);
        assertThat(columns.get("is_peak_hours")).containsExactly(0, 1, 0, 1);
    }

    @Test
    @DisplayName("calendar: date parts, ISO week and meteorological season")
    void calendar_dateParts() {
        var series = seriesAt(
                LocalDateTime.of(2007, 1, 1, 0, 0),
                LocalDateTime.of(2007, 3, 15, 0, 0),
                LocalDateTime.of(2007, 12, 31, 0, 0));

        Map<String, double[]> columns = new CalendarFeatures().derive(series, options);

        assertThat(columns.get("day_of_month")).containsExactly(1, 15, 31);
        assertThat(columns.get("day_of_year")).containsExactly(1, 74, 365);
        assertThat(columns.get("week_of_year")).containsExactly(1, 11, 1);
        assertThat(columns.get("quarter")).containsExactly(1, 1, 4);
        assertThat(columns.get("season")).containsExactly(0, 1, 0);
    }

    @Test
    @DisplayName("interaction: hour times season, and hour on weekends only")
    void interaction_products() {
        var series = seriesAt(
                LocalDateTime.of(2007, 7, 2, 10, 0),   // Monday, summer
                LocalDateTime.of(2007, 7, 7, 10, 0));  // Saturday

        Map<String, double[]> columns = new InteractionFeatures().derive(series, options);

        assertThat(columns.get("hour_season_interaction")).containsExactly(20, 20);
        assertThat(columns.get("weekend_hour_interaction")).containsExactly(0, 10);
    }

    @Test
    @DisplayName("cyclical: day of year uses the length of its own year")
    void cyclical_leapYearPeriod() {
        var series = seriesAt(LocalDateTime.of(2008, 12, 31, 0, 0), LocalDateTime.of(2007, 12, 31, 0, 0));

        Map<String, double[]> columns = new CyclicalFeatures().derive(series, options);

        assertThat(columns.get("day_of_year_sin")[0]).isCloseTo(0.0, within(1e-9));
        assertThat(columns.get("day_of_year_cos")[0]).isCloseTo(1.0, within(1e-9));
        assertThat(columns.get("day_of_year_cos")[1]).isCloseTo(1.0, within(1e-9));
        assertThat(columns.get("hour_cos")[0]).isCloseTo(1.0, within(1e-9));
    }
}
