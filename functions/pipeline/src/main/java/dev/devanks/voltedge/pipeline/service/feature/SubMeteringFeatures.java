package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.Channel;
import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Total sub-metered energy and each circuit's share of it, in percent.
 */
@Component
@Order(60)
public class SubMeteringFeatures implements FeatureGroup {

    private static final List<Channel> SUB_METERS =
            List.of(Channel.SUB_METERING_1, Channel.SUB_METERING_2, Channel.SUB_METERING_3);

    @Override
    public String name() {
        return "subMetering";
    }

    @Override
    public Map<String, double[]> derive(HourlySeries series, PipelineOptions options) {
        int size = series.size();
        double[] total = HourlySeries.column(size);
        double[][] shares = new double[SUB_METERS.size()][size];

        for (int row = 0; row < size; row++) {
            HourlyRecord record = series.record(row);
            double sum = 0;
            for (Channel meter : SUB_METERS) {
                sum += HourlySeries.toDouble(record.value(meter));
            }
            total[row] = sum;
            for (int i = 0; i < SUB_METERS.size(); i++) {
                double part = HourlySeries.toDouble(record.value(SUB_METERS.get(i)));
                if (Double.isNaN(sum)) {
                    shares[i][row] = Double.NaN;
                } else {
                    shares[i][row] = sum == 0 ? 0.0 : part / sum * 100;
                }
            }
        }

        Map<String, double[]> columns = new LinkedHashMap<>();
        columns.put("total_sub_metering", total);
        for (int i = 0; i < SUB_METERS.size(); i++) {
            columns.put("sub" + (i + 1) + "_pct", shares[i]);
        }
        return Collections.unmodifiableMap(columns);
    }
}
