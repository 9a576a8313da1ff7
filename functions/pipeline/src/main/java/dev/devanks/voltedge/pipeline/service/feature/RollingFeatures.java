package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Trailing window statistics over total power. The window includes the current row and needs a single
 * defined value, so early rows get statistics over a shorter history.
 */
@Component
@Order(20)
public class RollingFeatures implements FeatureGroup {

    private static final String PREFIX = "total_power_rolling_";

    @Override
    public String name() {
        return "rolling";
    }

    @Override
    public boolean isHistoryDependent() {
        return true;
    }

    @Override
    public Map<String, double[]> derive(HourlySeries series, PipelineOptions options) {
        Map<String, double[]> columns = new LinkedHashMap<>();
        int size = series.size();
        for (int window : options.getRollingWindows()) {
            double[] mean = HourlySeries.column(size);
            double[] std = HourlySeries.column(size);
            double[] min = HourlySeries.column(size);
            double[] max = HourlySeries.column(size);
            for (int row = 0; row < size; row++) {
                WindowStats stats = WindowStats.over(series, row - window + 1, row);
                mean[row] = stats.mean();
                std[row] = stats.sampleStd();
                min[row] = stats.min;
                max[row] = stats.max;
            }
            columns.put(PREFIX + "mean_" + window + "h", mean);
            columns.put(PREFIX + "std_" + window + "h", std);
            columns.put(PREFIX + "min_" + window + "h", min);
            columns.put(PREFIX + "max_" + window + "h", max);
        }
        return Collections.unmodifiableMap(columns);
    }

    private static final class WindowStats {
        private int count;
        private double mean;
        private double m2;
        private double min = Double.NaN;
        private double max = Double.NaN;

        // Welford's online update
        static WindowStats over(HourlySeries series, int from, int to) {
            WindowStats stats = new WindowStats();
            for (int row = Math.max(0, from); row <= to; row++) {
                double value = series.totalPower(row);
                if (Double.isNaN(value)) {
                    continue;
                }
                stats.count++;
                double delta = value - stats.mean;
                stats.mean += delta / stats.count;
                stats.m2 += delta * (value - stats.mean);
                stats.min = Double.isNaN(stats.min) ? value : Math.min(stats.min, value);
                stats.max = Double.isNaN(stats.max) ? value : Math.max(stats.max, value);
            }
            return stats;
        }

        double mean() {
            return count == 0 ? Double.NaN : mean;
        }

        double sampleStd() {
            if (count == 0) {
                return Double.NaN;
            }
            return count == 1 ? 0.0 : Math.sqrt(m2 / (count - 1));
        }
    }
}
