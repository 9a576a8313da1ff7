package dev.devanks.voltedge.pipeline.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.voltedge.pipeline.exception.PipelineException;
import dev.devanks.voltedge.pipeline.model.FeatureTable;
import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.model.PipelineRequest;
import dev.devanks.voltedge.pipeline.model.PipelineResult;
import dev.devanks.voltedge.pipeline.model.QualityReport;
import dev.devanks.voltedge.pipeline.model.RawReading;
import dev.devanks.voltedge.pipeline.service.feature.FeatureEngineer;
import dev.devanks.voltedge.pipeline.service.io.ArchiveResourceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Runs the stages in order: read, transform, validate, then engineer features when the table passes
 * validation or the caller overrides the gate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineService {

    private final ArchiveResourceProvider archiveResourceProvider;
    private final ReadingReader readingReader;
    private final HourlyTransformer hourlyTransformer;
    private final QualityValidator qualityValidator;
    private final FeatureEngineer featureEngineer;

    /**
     * Runs the full pipeline on the configured archive.
     *
     * @param request archive location, optional checksum and the validation override
     * @param options tunables for every stage
     * @return the hourly table, the quality report and, unless refused, the feature table
     */
    public PipelineResult execute(PipelineRequest request, PipelineOptions options) {
        log.info("Starting pipeline run for archive {} (row limit: {}, allow invalid: {}).",
                request.getArchivePath(), options.getRowLimit(), request.isAllowInvalid());

        archiveResourceProvider.verifyChecksum(request.getArchivePath(), request.getExpectedSha256());

        List<RawReading> readings;
        try (InputStream input = archiveResourceProvider.openArchive(request.getArchivePath())) {
            readings = readingReader.read(input, options.getRowLimit());
        } catch (IOException e) {
            throw new PipelineException("Failed to close archive " + request.getArchivePath(), e);
        }
        return process(readings, options, request.isAllowInvalid());
    }

    /**
     * Transform, validate and featurize already-parsed readings.
     */
    @VisibleForTesting
    PipelineResult process(List<RawReading> readings, PipelineOptions options, boolean allowInvalid) {
        List<HourlyRecord> hourly = hourlyTransformer.transform(readings, options);
        QualityReport report = qualityValidator.validate(hourly, options);

        if (!report.isValid() && !allowInvalid) {
            log.warn("Quality validation failed ({} failed checks); refusing to engineer features. "
                    + "Rerun with the override to proceed anyway.", report.failedChecks().size());
            return PipelineResult.builder()
                    .status(PipelineResult.Status.REFUSED)
                    .hourlyRecords(hourly)
                    .qualityReport(report)
                    .build();
        }
        if (!report.isValid()) {
            log.warn("Quality validation failed but the override is set; continuing to feature engineering.");
        }

        FeatureTable features = featureEngineer.engineer(hourly, options);
        PipelineResult.Status status = report.isValid()
                ? PipelineResult.Status.COMPLETED
                : PipelineResult.Status.COMPLETED_WITH_OVERRIDE;
        log.info("Pipeline finished with status {}: {} hourly records, {} feature rows.",
                status, hourly.size(), features.size());
        return PipelineResult.builder()
                .status(status)
                .hourlyRecords(hourly)
                .qualityReport(report)
                .featureTable(features)
                .build();
    }
}
