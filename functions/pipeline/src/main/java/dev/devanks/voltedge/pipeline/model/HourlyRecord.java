package dev.devanks.voltedge.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One hour-aligned aggregation bucket. Undefined aggregates are {@code null}.
 */
@Value
@Builder(toBuilder = true)
public class HourlyRecord {

    public static final List<String> BASE_COLUMNS = baseColumns();

    LocalDateTime timestamp;

    Double globalActivePower;
    Double globalReactivePower;
    Double voltage;
    Double globalIntensity;
    Double subMetering1;
    Double subMetering2;
    Double subMetering3;

    // Sum of the aggregated power channels
    Double totalPower;

    int samplesPresent;
    int samplesExpected;
    double completeness;
    QualityFlag qualityFlag;

    int hourOfDay;
    int dayOfWeek; // Monday = 0
    int month;
    boolean weekend;

    public Double value(Channel channel) {
        switch (channel) {
            case GLOBAL_ACTIVE_POWER:
                return globalActivePower;
            case GLOBAL_REACTIVE_POWER:
                return globalReactivePower;
            case VOLTAGE:
                return voltage;
            case GLOBAL_INTENSITY:
                return globalIntensity;
            case SUB_METERING_1:
                return subMetering1;
            case SUB_METERING_2:
                return subMetering2;
            case SUB_METERING_3:
                return subMetering3;
            default:
                throw new IllegalArgumentException("Unknown channel " + channel);
        }
    }

    /**
     * Values in {@link #BASE_COLUMNS} order.
     */
    public Object[] baseValues() {
        List<Object> row = new ArrayList<>(BASE_COLUMNS.size());
        row.add(timestamp);
        for (Channel channel : Channel.values()) {
            row.add(value(channel));
        }
        row.add(totalPower);
        row.add(qualityFlag);
        row.add(completeness);
        row.add(hourOfDay);
        row.add(dayOfWeek);
        row.add(month);
        row.add(weekend);
        return row.toArray();
    }

    private static List<String> baseColumns() {
        List<String> columns = new ArrayList<>();
        columns.add("timestamp");
        for (Channel channel : Channel.values()) {
            columns.add(channel.getColumnName());
        }
        columns.add("total_power");
        columns.add("quality_flag");
        columns.add("completeness");
        columns.add("hour_of_day");
        columns.add("day_of_week");
        columns.add("month");
        columns.add("is_weekend");
        return List.copyOf(columns);
    }

    public static class HourlyRecordBuilder {

        public HourlyRecordBuilder value(Channel channel, Double value) {
            switch (channel) {
                case GLOBAL_ACTIVE_POWER:
                    return globalActivePower(value);
                case GLOBAL_REACTIVE_POWER:
                    return globalReactivePower(value);
                case VOLTAGE:
                    return voltage(value);
                case GLOBAL_INTENSITY:
                    return globalIntensity(value);
                case SUB_METERING_1:
                    return subMetering1(value);
                case SUB_METERING_2:
                    return subMetering2(value);
                case SUB_METERING_3:
                    return subMetering3(value);
                default:
                    throw new IllegalArgumentException("Unknown channel " + channel);
            }
        }
    }
}
