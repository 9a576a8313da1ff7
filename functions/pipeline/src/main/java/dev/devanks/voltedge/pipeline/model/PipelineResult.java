package dev.devanks.voltedge.pipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
@Builder
public class PipelineResult {

    public enum Status {
        COMPLETED, COMPLETED_WITH_OVERRIDE, REFUSED
    }

    Status status;
    List<HourlyRecord> hourlyRecords;
    QualityReport qualityReport;
    FeatureTable featureTable; // Null when refused

    public Optional<FeatureTable> features() {
        return Optional.ofNullable(featureTable);
    }

    public boolean isRefused() {
        return status == Status.REFUSED;
    }
}
