package dev.devanks.voltedge.pipeline.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Table-level validation result. {@code valid} is the conjunction of every check.
 */
@Value
@Builder
public class QualityReport {

    int totalRecords;
    @Singular
    List<CheckResult> checks;
    Map<QualityFlag, Long> flagCounts;
    Map<String, Double> undefinedPctByColumn;
    double missingDataPct;
    // Rows whose defined channel values all lie within their physical ranges
    int validRecords;
    int invalidRecords;
    boolean valid;

    /**
     * Percentage of rows counted in {@code validRecords}; 0 for an empty table.
     */
    public double getSuccessRate() {
        return totalRecords == 0 ? 0.0 : 100.0 * validRecords / totalRecords;
    }

    public Optional<CheckResult> check(String name) {
        return checks.stream().filter(check -> check.getName().equals(name)).findFirst();
    }

    public List<CheckResult> failedChecks() {
        return checks.stream().filter(check -> !check.isPassed()).toList();
    }

    public long flaggedRows() {
        return flagCounts.entrySet().stream()
                .filter(entry -> entry.getKey() != QualityFlag.OK)
                .mapToLong(Map.Entry::getValue)
                .sum();
    }
}
