package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Total power exactly {@code h} hours earlier.
 */
@Component
@Order(10)
public class LagFeatures implements FeatureGroup {

    @Override
    public String name() {
        return "lag";
    }

    @Override
    public boolean isHistoryDependent() {
        return true;
    }

    @Override
    public int lookback(PipelineOptions options) {
        return options.getLagHours().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    @Override
    public Map<String, double[]> derive(HourlySeries series, PipelineOptions options) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        for (int lag : options.getLagHours()) {
            double[] values = HourlySeries.column(series.size());
            for (int row = 0; row < values.length; row++) {
                values[row] = series.totalPower(row - lag);
            }
            columns.put(columnName(lag), values);
        }
        return Collections.unmodifiableMap(columns);
    }

    public static String columnName(int lag) {
        return "total_power_lag_" + lag + "h";
    }
}
