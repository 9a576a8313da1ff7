package dev.devanks.voltedge.pipeline.service;

import dev.devanks.voltedge.pipeline.model.Channel;
import dev.devanks.voltedge.pipeline.model.CheckResult;
import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.model.QualityFlag;
import dev.devanks.voltedge.pipeline.model.QualityReport;
import dev.devanks.voltedge.pipeline.model.ValueRange;
import dev.devanks.voltedge.pipeline.service.check.QualityCheck;
import dev.devanks.voltedge.pipeline.service.check.QualityChecks;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs the table-level quality checks and summarises them. Never modifies or removes rows.
 */
@Service
@Slf4j
public class QualityValidator {

    public QualityReport validate(List<HourlyRecord> hourly, PipelineOptions options) {
        log.info("Validating {} hourly records.", hourly.size());

        QualityReport.QualityReportBuilder report = QualityReport.builder().totalRecords(hourly.size());
        boolean valid = true;
        for (QualityCheck check : checksFor(options)) {
            CheckResult result = check.evaluate(hourly);
            report.check(result);
            if (result.isPassed()) {
                log.debug("Check {} passed: {}", result.getName(), result.getMessage());
            } else {
                log.warn("Check {} failed: {}", result.getName(), result.getMessage());
                valid = false;
            }
        }

        double missingPct = QualityChecks.missingPct(hourly);
        int validRows = countRowsWithinRanges(hourly, options.getPhysicalRanges());
        QualityReport built = report
                .validRecords(validRows)
                .invalidRecords(hourly.size() - validRows)
                .flagCounts(countFlags(hourly))
                .undefinedPctByColumn(undefinedPercentages(hourly))
                .missingDataPct(missingPct)
                .valid(valid)
                .build();

        log.info("Row validity: {} valid, {} invalid ({}% within physical ranges).",
                built.getValidRecords(), built.getInvalidRecords(),
                String.format(Locale.ROOT, "%.1f", built.getSuccessRate()));
        if (valid) {
            log.info("Validation passed: {} rows, {} flagged.", built.getTotalRecords(), built.flaggedRows());
        } else {
            log.warn("Validation failed: {} of {} checks failed, {} rows flagged MISSING_DATA ({}%).",
                    built.failedChecks().size(), built.getChecks().size(),
                    built.getFlagCounts().get(QualityFlag.MISSING_DATA), String.format(Locale.ROOT, "%.2f", missingPct));
        }
        return built;
    }

    List<QualityCheck> checksFor(PipelineOptions options) {
        List<QualityCheck> checks = new ArrayList<>();
        checks.add(QualityChecks.nonEmpty());
        checks.add(QualityChecks.uniqueTimestamps());
        checks.add(QualityChecks.chronologicalOrder());
        for (Channel channel : Channel.values()) {
            ValueRange range = options.getPhysicalRanges().get(channel);
            if (range != null) {
                checks.add(QualityChecks.physicalRange(channel, range));
            }
        }
        checks.add(QualityChecks.missingDataThreshold(options.getMaxMissingDataPct()));
        return checks;
    }

    /**
     * Counts rows whose defined values all fall within the configured ranges. Undefined values do not invalidate a row.
     */
    private int countRowsWithinRanges(List<HourlyRecord> hourly, Map<Channel, ValueRange> ranges) {
        int valid = 0;
        for (HourlyRecord record : hourly) {
            boolean withinRanges = ranges.entrySet().stream().allMatch(entry -> {
                Double value = record.value(entry.getKey());
                return value == null || entry.getValue().contains(value);
            });
            if (withinRanges) {
                valid++;
            }
        }
        return valid;
    }

    private Map<QualityFlag, Long> countFlags(List<HourlyRecord> hourly) {
        Map<QualityFlag, Long> counts = new EnumMap<>(QualityFlag.class);
        for (QualityFlag flag : QualityFlag.values()) {
            counts.put(flag, 0L);
        }
        hourly.forEach(record -> counts.merge(record.getQualityFlag(), 1L, Long::sum));
        return Collections.unmodifiableMap(counts);
    }

    private Map<String, Double> undefinedPercentages(List<HourlyRecord> hourly) {
        Map<String, Double> percentages = new LinkedHashMap<>();
        for (Channel channel : Channel.values()) {
            long undefined = hourly.stream().filter(record -> record.value(channel) == null).count();
            percentages.put(channel.getColumnName(), hourly.isEmpty() ? 0.0 : 100.0 * undefined / hourly.size());
        }
        return Collections.unmodifiableMap(percentages);
    }
}
