package dev.devanks.voltedge.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Terminal output of the pipeline. Row deletion counts are part of the value so callers can assert on them.
 */
@Value
@Builder
public class FeatureTable {

    List<String> featureColumns;
    List<FeatureRecord> records;
    int inputRows;
    int droppedRows;
    int droppedLeadingRows;
    int maxLookback;

    /**
     * Full output schema: the hourly base columns followed by the feature columns.
     */
    public List<String> columnNames() {
        List<String> columns = new ArrayList<>(HourlyRecord.BASE_COLUMNS);
        columns.addAll(featureColumns);
        return columns;
    }

    /**
     * Output rows in {@link #columnNames()} order.
     */
    public Stream<Object[]> rows() {
        return records.stream().map(record -> {
            Object[] base = record.getHourly().baseValues();
            Object[] row = new Object[base.length + featureColumns.size()];
            System.arraycopy(base, 0, row, 0, base.length);
            int i = base.length;
            for (String column : featureColumns) {
                row[i++] = record.getFeatures().get(column);
            }
            return row;
        });
    }

    public int size() {
        return records.size();
    }
}
