package dev.devanks.voltedge.pipeline.service.check;

import dev.devanks.voltedge.pipeline.model.Channel;
import dev.devanks.voltedge.pipeline.model.CheckResult;
import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.QualityFlag;
import dev.devanks.voltedge.pipeline.model.ValueRange;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Factory for the table rules run by the validator.
 */
public final class QualityChecks {

    public static final String NON_EMPTY_TABLE = "non_empty_table";
    public static final String UNIQUE_TIMESTAMPS = "unique_timestamps";
    public static final String CHRONOLOGICAL_ORDER = "chronological_order";
    public static final String MISSING_DATA_THRESHOLD = "missing_data_threshold";
    public static final String RANGE_PREFIX = "range_";

    private QualityChecks() {
    }

    public static QualityCheck nonEmpty() {
        return of(NON_EMPTY_TABLE, hourly -> hourly.isEmpty()
                ? CheckResult.fail(NON_EMPTY_TABLE, 1, "Hourly table has no rows")
                : CheckResult.pass(NON_EMPTY_TABLE, 0, hourly.size() + " rows"));
    }

    public static QualityCheck uniqueTimestamps() {
        return of(UNIQUE_TIMESTAMPS, hourly -> {
            Set<LocalDateTime> seen = new HashSet<>();
            long duplicates = hourly.stream().filter(record -> !seen.add(record.getTimestamp())).count();
            return duplicates == 0
                    ? CheckResult.pass(UNIQUE_TIMESTAMPS, 0, "All timestamps unique")
                    : CheckResult.fail(UNIQUE_TIMESTAMPS, duplicates, duplicates + " duplicate timestamp(s)");
        });
    }

    public static QualityCheck chronologicalOrder() {
        return of(CHRONOLOGICAL_ORDER, hourly -> {
            long outOfOrder = 0;
            for (int i = 1; i < hourly.size(); i++) {
                if (!hourly.get(i).getTimestamp().isAfter(hourly.get(i - 1).getTimestamp())) {
                    outOfOrder++;
                }
            }
            return outOfOrder == 0
                    ? CheckResult.pass(CHRONOLOGICAL_ORDER, 0, "Timestamps strictly increasing")
                    : CheckResult.fail(CHRONOLOGICAL_ORDER, outOfOrder, outOfOrder + " row(s) out of order");
        });
    }

    /**
     * Counts defined values outside {@code range}. Fails only when a violating row is flagged {@code OK}.
     */
    public static QualityCheck physicalRange(Channel channel, ValueRange range) {
        String name = RANGE_PREFIX + channel.getColumnName();
        return of(name, hourly -> {
            long violations = 0;
            long unflagged = 0;
            for (HourlyRecord record : hourly) {
                Double value = record.value(channel);
                if (value == null || range.contains(value)) {
                    continue;
                }
                violations++;
                if (record.getQualityFlag() == QualityFlag.OK) {
                    unflagged++;
                }
            }
            String message = String.format(Locale.ROOT, "%d value(s) outside [%s, %s], %d on OK rows",
                    violations, range.getMin(), range.getMax(), unflagged);
            return unflagged == 0
                    ? CheckResult.pass(name, violations, message)
                    : CheckResult.fail(name, violations, message);
        });
    }

    public static QualityCheck missingDataThreshold(double maxMissingDataPct) {
        return of(MISSING_DATA_THRESHOLD, hourly -> {
            long missing = countFlagged(hourly, QualityFlag.MISSING_DATA);
            double pct = missingPct(hourly);
            String message = String.format(Locale.ROOT, "%.2f%% of rows flagged MISSING_DATA (limit %.2f%%)",
                    pct, maxMissingDataPct);
            return pct > maxMissingDataPct
                    ? CheckResult.fail(MISSING_DATA_THRESHOLD, missing, message)
                    : CheckResult.pass(MISSING_DATA_THRESHOLD, missing, message);
        });
    }

    public static double missingPct(List<HourlyRecord> hourly) {
        if (hourly.isEmpty()) {
            return 0.0;
        }
        return 100.0 * countFlagged(hourly, QualityFlag.MISSING_DATA) / hourly.size();
    }

    private static long countFlagged(List<HourlyRecord> hourly, QualityFlag flag) {
        return hourly.stream().filter(record -> record.getQualityFlag() == flag).count();
    }

    private static QualityCheck of(String name, Function<List<HourlyRecord>, CheckResult> rule) {
        return new QualityCheck() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public CheckResult evaluate(List<HourlyRecord> hourly) {
                return rule.apply(hourly);
            }
        };
    }
}
