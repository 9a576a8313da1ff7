package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.model.HourlyRecord;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-only view of the hourly table shared by the feature groups.
 */
public final class HourlySeries {

    private final List<HourlyRecord> records;
    private final double[] totalPower;

    public HourlySeries(List<HourlyRecord> records) {
        this.records = List.copyOf(records);
        this.totalPower = new double[records.size()];
        for (int i = 0; i < totalPower.length; i++) {
            totalPower[i] = toDouble(records.get(i).getTotalPower());
        }
    }

    public int size() {
        return records.size();
    }

    public HourlyRecord record(int row) {
        return records.get(row);
    }

    public LocalDateTime timestamp(int row) {
        return records.get(row).getTimestamp();
    }

    /**
     * @return total power at {@code row}, {@code NaN} when undefined or outside the series
     */
    public double totalPower(int row) {
        return row >= 0 && row < totalPower.length ? totalPower[row] : Double.NaN;
    }

    static double toDouble(Double value) {
        return value == null ? Double.NaN : value;
    }

    static double[] column(int size) {
        return new double[size];
    }
}
