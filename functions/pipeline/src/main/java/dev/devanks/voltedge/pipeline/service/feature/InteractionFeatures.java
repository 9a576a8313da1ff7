package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.util.CalendarUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Products of calendar fields. Only emitted together with the calendar group.
 */
@Component
@Order(50)
public class InteractionFeatures implements FeatureGroup {

    @Override
    public String name() {
        return "interaction";
    }

    @Override
    public boolean isEnabled(PipelineOptions options) {
        return options.isIncludeCalendar();
    }

    @Override
    public Map<String, double[]> derive(HourlySeries series, PipelineOptions options) {
        double[] hourSeason = HourlySeries.column(series.size());
        double[] weekendHour = HourlySeries.column(series.size());
        for (int row = 0; row < series.size(); row++) {
            HourlyRecord record = series.record(row);
            hourSeason[row] = record.getHourOfDay() * CalendarUtils.season(record.getMonth());
            weekendHour[row] = record.isWeekend() ? record.getHourOfDay() : 0;
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("hour_season_interaction", hourSeason);
        columns.put("weekend_hour_interaction", weekendHour);
        return Collections.unmodifiableMap(columns);
    }
}
