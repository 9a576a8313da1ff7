package dev.devanks.voltedge.pipeline.service.feature;

import dev.devanks.voltedge.pipeline.exception.StructuralViolationException;
import dev.devanks.voltedge.pipeline.model.FeatureRecord;
import dev.devanks.voltedge.pipeline.model.FeatureTable;
import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Builds the feature table by concatenating the enabled feature groups, then dropping every row
 * whose history columns are not fully defined.
 */
@Service
@Slf4j
public class FeatureEngineer {

    private final List<FeatureGroup> groups;

    public FeatureEngineer(List<FeatureGroup> groups) {
        List<FeatureGroup> ordered = new ArrayList<>(groups);
        AnnotationAwareOrderComparator.sort(ordered);
        this.groups = List.copyOf(ordered);
    }

    /**
     * @param hourly contiguous hourly series, one record per hour
     * @throws StructuralViolationException if consecutive records are not exactly one hour apart
     * @throws IllegalArgumentException     if lag hours or rolling windows are not distinct positive values
     */
    public FeatureTable engineer(List<HourlyRecord> hourly, PipelineOptions options) {
        validateOptions(options);
        verifyContiguous(hourly);
        log.info("Engineering features for {} hourly records.", hourly.size());

        HourlySeries series = new HourlySeries(hourly);
        Map<String, double[]> columns = new LinkedHashMap<>();
        Set<String> historyColumns = new HashSet<>();
        int maxLookback = 0;
        for (FeatureGroup group : groups) {
            if (!group.isEnabled(options)) {
                log.debug("Feature group {} disabled.", group.name());
                continue;
            }
            Map<String, double[]> derived = group.derive(series, options);
            for (Map.Entry<String, double[]> column : derived.entrySet()) {
                if (columns.putIfAbsent(column.getKey(), column.getValue()) != null) {
                    throw new IllegalStateException("Feature column " + column.getKey() + " produced twice");
                }
            }
            if (group.isHistoryDependent()) {
                historyColumns.addAll(derived.keySet());
                maxLookback = Math.max(maxLookback, group.lookback(options));
            }
            log.debug("Feature group {} added {} column(s).", group.name(), derived.size());
        }

        List<FeatureRecord> records = new ArrayList<>();
        int droppedLeading = 0;
        for (int row = 0; row < series.size(); row++) {
            if (hasUndefinedHistory(columns, historyColumns, row)) {
                if (records.isEmpty()) {
                    droppedLeading++;
                }
                continue;
            }
            records.add(new FeatureRecord(series.record(row), rowValues(columns, row)));
        }
        int dropped = series.size() - records.size();

        FeatureTable table = FeatureTable.builder()
                .featureColumns(List.copyOf(columns.keySet()))
                .records(Collections.unmodifiableList(records))
                .inputRows(series.size())
                .droppedRows(dropped)
                .droppedLeadingRows(droppedLeading)
                .maxLookback(maxLookback)
                .build();
        log.info("Feature engineering complete: {} feature columns, {} rows kept, {} dropped ({} leading).",
                columns.size(), records.size(), dropped, droppedLeading);
        return table;
    }

    private void validateOptions(PipelineOptions options) {
        checkDistinctPositive("Lag hours", options.getLagHours());
        checkDistinctPositive("Rolling windows", options.getRollingWindows());
    }

    private static void checkDistinctPositive(String label, List<Integer> values) {
        checkArgument(values != null, "%s must be set", label);
        checkArgument(values.stream().allMatch(value -> value != null && value > 0),
                "%s must be positive, got %s", label, values);
        checkArgument(new HashSet<>(values).size() == values.size(),
                "%s must be distinct, got %s", label, values);
    }

    private void verifyContiguous(List<HourlyRecord> hourly) {
        for (int i = 1; i < hourly.size(); i++) {
            Duration step = Duration.between(hourly.get(i - 1).getTimestamp(), hourly.get(i).getTimestamp());
            if (!step.equals(Duration.ofHours(1))) {
                throw new StructuralViolationException(String.format(
                        "Hourly series is not contiguous: %s follows %s",
                        hourly.get(i).getTimestamp(), hourly.get(i - 1).getTimestamp()));
            }
        }
    }

    private boolean hasUndefinedHistory(Map<String, double[]> columns, Set<String> historyColumns, int row) {
        for (String column : historyColumns) {
            if (Double.isNaN(columns.get(column)[row])) {
                return true;
            }
        }
        return false;
    }

    private Map<String, Double> rowValues(Map<String, double[]> columns, int row) {
        Map<String, Double> values = new LinkedHashMap<>();
        columns.forEach((name, column) -> values.put(name, Double.isNaN(column[row]) ? null : column[row]));
        return Collections.unmodifiableMap(values);
    }
}
