package dev.devanks.voltedge.pipeline.model;

/**
 * Per-bucket data trustworthiness marker. Declaration order is assignment priority.
 */
public enum QualityFlag {
    MISSING_DATA,
    SUSPICIOUS_VOLTAGE,
    OK
}
