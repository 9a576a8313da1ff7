package dev.devanks.voltedge.pipeline.model;

import lombok.Value;

/**
 * Closed interval {@code [min, max]}.
 */
@Value(staticConstructor = "of")
public class ValueRange {
    double min;
    double max;

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
