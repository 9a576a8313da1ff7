package dev.devanks.voltedge.pipeline.model;

import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * An hourly record together with its derived feature columns, in column order.
 */
@Value
public class FeatureRecord {
    HourlyRecord hourly;
    Map<String, Double> features;

    public LocalDateTime getTimestamp() {
        return hourly.getTimestamp();
    }

    public Double feature(String column) {
        if (!features.containsKey(column)) {
            throw new IllegalArgumentException("Unknown feature column " + column);
        }
        return features.get(column);
    }
}
