package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.util.CalendarUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.IsoFields;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@Order(30)
public class CalendarFeatures implements FeatureGroup {

    @Override
    public String name() {
        return "calendar";
    }

    @Override
    public boolean isEnabled(PipelineOptions options) {
        return options.isIncludeCalendar();
    }

    @Override
    public Map<String, double[]> derive(HourlySeries series, PipelineOptions options) {
        int size = series.size();
        double[] dayOfMonth = HourlySeries.column(size);
        double[] dayOfYear = HourlySeries.column(size);
        double[] weekOfYear = HourlySeries.column(size);
        double[] quarter = HourlySeries.column(size);
        double[] season = HourlySeries.column(size);
        double[] businessHours = HourlySeries.column(size);
        double[] peakHours = HourlySeries.column(size);

        for (int row = 0; row < size; row++) {
            LocalDateTime timestamp = series.timestamp(row);
            dayOfMonth[row] = timestamp.getDayOfMonth();
            dayOfYear[row] = timestamp.getDayOfYear();
            weekOfYear[row] = timestamp.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
            quarter[row] = CalendarUtils.quarter(timestamp.getMonthValue());
            season[row] = CalendarUtils.season(timestamp.getMonthValue());
            businessHours[row] = CalendarUtils.isBusinessHour(timestamp) ? 1 : 0;
            peakHours[row] = CalendarUtils.isPeakHour(timestamp) ? 1 : 0;
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("day_of_month", dayOfMonth);
        columns.put("day_of_year", dayOfYear);
        columns.put("week_of_year", weekOfYear);
        columns.put("quarter", quarter);
        columns.put("season", season);
        columns.put("is_business_hours", businessHours);
        columns.put("is_peak_hours", peakHours);
        return Collections.unmodifiableMap(columns);
    }
}
