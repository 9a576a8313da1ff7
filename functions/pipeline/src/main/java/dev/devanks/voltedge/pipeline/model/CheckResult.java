package dev.devanks.voltedge.pipeline.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one named quality check.
 */
@Value
@Builder
public class CheckResult {
    String name;
    boolean passed;
    long violations;
    String message;

    public static CheckResult pass(String name, long violations, String message) {
        return new CheckResult(name, true, violations, message);
    }

    public static CheckResult fail(String name, long violations, String message) {
        return new CheckResult(name, false, violations, message);
    }
}
