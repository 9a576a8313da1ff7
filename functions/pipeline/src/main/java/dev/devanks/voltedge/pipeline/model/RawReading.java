package dev.devanks.voltedge.pipeline.model;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.Arrays;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * One per-minute sample from the raw meter file. Missing channel values are held as {@code NaN}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class RawReading {

    private final LocalDateTime timestamp;
    @Getter(AccessLevel.NONE)
    private final double[] values;

    public RawReading(LocalDateTime timestamp, double[] values) {
        requireNonNull(timestamp, "timestamp");
        requireNonNull(values, "values");
        checkArgument(values.length == Channel.values().length,
                "Expected %s channel values but got %s", Channel.values().length, values.length);
        this.timestamp = timestamp;
        this.values = values.clone();
    }

    public static RawReading of(LocalDateTime timestamp, double... values) {
        return new RawReading(timestamp, values);
    }

    public double value(Channel channel) {
        return values[channel.ordinal()];
    }

    public boolean isMissing(Channel channel) {
        return Double.isNaN(values[channel.ordinal()]);
    }

    public boolean hasMissingValues() {
        return Arrays.stream(values).anyMatch(Double::isNaN);
    }
}
