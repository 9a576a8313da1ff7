package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.PipelineOptions;

import java.util.Map;

/**
 * A stateless derivation of named feature columns from the hourly series.
 * Values are aligned with the series rows; {@code NaN} marks an undefined value.
 */
public interface FeatureGroup {

    String name();

    default boolean isEnabled(PipelineOptions options) {
        return true;
    }

    /**
     * Whether an undefined value in this group's columns removes the row from the feature table.
     */
    default boolean isHistoryDependent() {
        return false;
    }

    /**
     * How many hours before a row this group reads from.
     */
    default int lookback(PipelineOptions options) {
        return 0;
    }

    /**
     * @return columns in output order; the map must preserve insertion order
     */
    Map<String, double[]> derive(HourlySeries series, PipelineOptions options);
}
