package dev.devanks.voltedge.pipeline.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The seven numeric channels recorded by the household meter, in input order.
 */
@Getter
@RequiredArgsConstructor
public enum Channel {

    GLOBAL_ACTIVE_POWER("Global_active_power", "global_active_power", Aggregation.MEAN, true),
    GLOBAL_REACTIVE_POWER("Global_reactive_power", "global_reactive_power", Aggregation.MEAN, true),
    VOLTAGE("Voltage", "voltage", Aggregation.MEAN, false),
    GLOBAL_INTENSITY("Global_intensity", "global_intensity", Aggregation.MEAN, false),
    SUB_METERING_1("Sub_metering_1", "sub_metering_1", Aggregation.SUM, false),
    SUB_METERING_2("Sub_metering_2", "sub_metering_2", Aggregation.SUM, false),
    SUB_METERING_3("Sub_metering_3", "sub_metering_3", Aggregation.SUM, false);

    public enum Aggregation {
        MEAN, SUM
    }

    private final String headerName;   // Name in the raw file header
    private final String columnName;   // Name in exported tables
    private final Aggregation aggregation;
    private final boolean power;
}
