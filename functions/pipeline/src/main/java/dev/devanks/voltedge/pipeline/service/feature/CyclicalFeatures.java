package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;

/**
 * Sine/cosine encoding of periodic calendar fields, so that e.g. hour 23 sits next to hour 0.
 */
@Component
@Order(40)
public class CyclicalFeatures implements FeatureGroup {

    @Override
    public String name() {
        return "cyclical";
    }

    @Override
    public boolean isEnabled(PipelineOptions options) {
        return options.isIncludeCyclical();
    }

    @Override
    public Map<String, double[]> derive(HourlySeries series, PipelineOptions options) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        encode(columns, "hour", series, HourlyRecord::getHourOfDay, record -> 24);
        encode(columns, "day", series, HourlyRecord::getDayOfWeek, record -> 7);
        encode(columns, "month", series, HourlyRecord::getMonth, record -> 12);
        encode(columns, "day_of_year", series,
                record -> record.getTimestamp().getDayOfYear(),
                record -> record.getTimestamp().toLocalDate().lengthOfYear());
        return Collections.unmodifiableMap(columns);
    }

    private void encode(Map<String, double[]> columns, String prefix, HourlySeries series,
                        ToIntFunction<HourlyRecord> field, ToDoubleFunction<HourlyRecord> period) {
        double[] sin = HourlySeries.column(series.size());
        double[] cos = HourlySeries.column(series.size());
        for (int row = 0; row < series.size(); row++) {
            HourlyRecord record = series.record(row);
            double angle = 2 * Math.PI * field.applyAsInt(record) / period.applyAsDouble(record);
            sin[row] = Math.sin(angle);
            cos[row] = Math.cos(angle);
        }
        columns.put(prefix + "_sin", sin);
        columns.put(prefix + "_cos", cos);
    }
}
