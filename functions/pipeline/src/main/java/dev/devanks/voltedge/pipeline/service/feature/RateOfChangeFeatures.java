package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hour-over-hour and day-over-day differences in total power, and the change of the hourly difference.
 */
@Component
@Order(70)
public class RateOfChangeFeatures implements FeatureGroup {

    static final int DAY_HOURS = 24;

    @Override
    public String name() {
        return "rateOfChange";
    }

    @Override
    public boolean isHistoryDependent() {
        return true;
    }

    @Override
    public int lookback(PipelineOptions options) {
        // acceleration reads two rows back
        return Math.max(DAY_HOURS, 2);
    }

    @Override
    public Map<String, double[]> derive(HourlySeries series, PipelineOptions options) {
        int size = series.size();
        double[] change1h = HourlySeries.column(size);
        double[] change24h = HourlySeries.column(size);
        double[] acceleration = HourlySeries.column(size);
        for (int row = 0; row < size; row++) {
            change1h[row] = series.totalPower(row) - series.totalPower(row - 1);
            change24h[row] = series.totalPower(row) - series.totalPower(row - DAY_HOURS);
            acceleration[row] = row == 0 ? Double.NaN : change1h[row] - change1h[row - 1];
        }
        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("power_change_1h", change1h);
        columns.put("power_change_24h", change24h);
        columns.put("power_acceleration", acceleration);
        return Collections.unmodifiableMap(columns);
    }
}
