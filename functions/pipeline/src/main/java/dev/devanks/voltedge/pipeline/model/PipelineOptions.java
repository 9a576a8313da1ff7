package dev.devanks.voltedge.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable tunables for one pipeline run. Every stage receives this value explicitly.
 */
@Value
@Builder(toBuilder = true)
public class PipelineOptions {

    @Builder.Default
    int gapFillLimit = 5;
    @Builder.Default
    double completenessThreshold = 0.9;
    @Builder.Default
    ValueRange voltageBand = ValueRange.of(200.0, 260.0);

    @Builder.Default
    double maxMissingDataPct = 10.0;
    @Builder.Default
    Map<Channel, ValueRange> physicalRanges = defaultPhysicalRanges();

    @Builder.Default
    List<Integer> lagHours = List.of(1, 24, 168);
    @Builder.Default
    List<Integer> rollingWindows = List.of(24, 168);
    @Builder.Default
    boolean includeCalendar = true;
    @Builder.Default
    boolean includeCyclical = true;

    // Null means no limit
    Integer rowLimit;

    public static PipelineOptions defaults() {
        return PipelineOptions.builder().build();
    }

    public static Map<Channel, ValueRange> defaultPhysicalRanges() {
        Map<Channel, ValueRange> ranges = new EnumMap<>(Channel.class);
        ranges.put(Channel.GLOBAL_ACTIVE_POWER, ValueRange.of(0.0, 20.0));
        ranges.put(Channel.GLOBAL_REACTIVE_POWER, ValueRange.of(0.0, 5.0));
        ranges.put(Channel.VOLTAGE, ValueRange.of(0.0, 300.0));
        ranges.put(Channel.GLOBAL_INTENSITY, ValueRange.of(0.0, 100.0));
        ranges.put(Channel.SUB_METERING_1, ValueRange.of(0.0, Double.POSITIVE_INFINITY));
        ranges.put(Channel.SUB_METERING_2, ValueRange.of(0.0, Double.POSITIVE_INFINITY));
        ranges.put(Channel.SUB_METERING_3, ValueRange.of(0.0, Double.POSITIVE_INFINITY));
        return Collections.unmodifiableMap(ranges);
    }
}
