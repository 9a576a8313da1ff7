package dev.devanks.voltedge.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.voltedge.pipeline.config.PipelineProperties;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.model.PipelineResult;
import dev.devanks.voltedge.pipeline.model.QualityFlag;
import dev.devanks.voltedge.pipeline.model.RawReading;
import dev.devanks.voltedge.pipeline.service.feature.CalendarFeatures;
import dev.devanks.voltedge.pipeline.service.feature.CyclicalFeatures;
import dev.devanks.voltedge.pipeline.service.feature.FeatureEngineer;
import dev.devanks.voltedge.pipeline.service.feature.InteractionFeatures;
import dev.devanks.voltedge.pipeline.service.feature.LagFeatures;
import dev.devanks.voltedge.pipeline.service.feature.RateOfChangeFeatures;
import dev.devanks.voltedge.pipeline.service.feature.RollingFeatures;
import dev.devanks.voltedge.pipeline.service.feature.SubMeteringFeatures;
import dev.devanks.voltedge.pipeline.service.io.ArchiveResourceProvider;
import dev.devanks.voltedge.pipeline.service.io.OutputResourceProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static dev.devanks.voltedge.pipeline.TestData.minutes;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Pipeline end-to-end scenarios over real stages")
class PipelineScenarioTest {

    private static final LocalDateTime START = LocalDateTime.of(2007, 1, 1, 0, 0);

    private final PipelineService pipelineService = new PipelineService(
            new ArchiveResourceProvider(),
            new ReadingReader(),
            new HourlyTransformer(),
            new QualityValidator(),
            new FeatureEngineer(List.of(new LagFeatures(), new RollingFeatures(), new CalendarFeatures(),
                    new CyclicalFeatures(), new InteractionFeatures(), new SubMeteringFeatures(),
                    new RateOfChangeFeatures())));

    private final TableExportService exportService =
            new TableExportService(new PipelineProperties(), new OutputResourceProvider(), new ObjectMapper());

    private final PipelineOptions options = PipelineOptions.defaults();

    /**
     * Minute readings for {@code hours} hours; the listed hours keep only their first half.
     */
    private static List<RawReading> readingsWithSparseHours(int hours, List<Integer> sparseHours) {
        List<RawReading> readings = new ArrayList<>();
        for (int hour = 0; hour < hours; hour++) {
            int minutesInHour = sparseHours.contains(hour) ? 30 : 60;
            readings.addAll(minutes(START.plusHours(hour), minutesInHour));
        }
        return readings;
    }

    @Test
    @DisplayName("15% MISSING_DATA hours are refused without the override")
    void fifteenPercentMissing_isRefused() {
        // Arrange
        var readings = readingsWithSparseHours(20, List.of(5, 10, 15));

        // Act
        PipelineResult result = pipelineService.process(readings, options, false);

        // Assert
        assertThat(result.getHourlyRecords()).hasSize(20);
        assertThat(result.getQualityReport().getFlagCounts()).containsEntry(QualityFlag.MISSING_DATA, 3L);
        assertThat(result.getQualityReport().isValid()).isFalse();
        assertThat(result.isRefused()).isTrue();
        assertThat(result.features()).isEmpty();
    }

    @Test
    @DisplayName("the override featurizes an invalid table")
    void fifteenPercentMissing_withOverride_producesFeatures() {
        var readings = readingsWithSparseHours(40, List.of(5, 10, 15, 20, 25, 30));
        var shortLags = options.toBuilder().lagHours(List.of(1, 2)).rollingWindows(List.of(3)).build();

        PipelineResult result = pipelineService.process(readings, shortLags, true);

        assertThat(result.getStatus()).isEqualTo(PipelineResult.Status.COMPLETED_WITH_OVERRIDE);
        assertThat(result.features()).hasValueSatisfying(table -> {
            assertThat(table.getInputRows()).isEqualTo(40);
            assertThat(table.getDroppedLeadingRows()).isEqualTo(24);
            assertThat(table.size()).isEqualTo(16);
        });
    }

    @Test
    @DisplayName("a complete series passes validation and completes")
    void completeSeries_completes() {
        var readings = minutes(START, 26 * 60);
        var shortLags = options.toBuilder().lagHours(List.of(1)).rollingWindows(List.of(2)).build();

        PipelineResult result = pipelineService.process(readings, shortLags, false);

        assertThat(result.getStatus()).isEqualTo(PipelineResult.Status.COMPLETED);
        assertThat(result.features()).hasValueSatisfying(table -> assertThat(table.size()).isEqualTo(2));
    }

    @Test
    @DisplayName("two runs over identical input export byte-identical features and quality report")
    void repeatedRuns_exportIdenticalBytes(@TempDir Path firstDir, @TempDir Path secondDir) throws IOException {
        // Arrange
        var readings = readingsWithSparseHours(40, List.of(7));
        var shortLags = options.toBuilder().lagHours(List.of(1, 2)).rollingWindows(List.of(3)).build();

        // Act
        PipelineResult first = pipelineService.process(readings, shortLags, false);
        PipelineResult second = pipelineService.process(readings, shortLags, false);
        export(first, firstDir);
        export(second, secondDir);

        // Assert
        assertThat(first.getStatus()).isEqualTo(PipelineResult.Status.COMPLETED);
        for (String file : List.of("household_power_hourly.csv.gz", "household_power_features.csv.gz",
                "quality_report.json")) {
            assertThat(Files.readAllBytes(firstDir.resolve(file)))
                    .as(file)
                    .isNotEmpty()
                    .isEqualTo(Files.readAllBytes(secondDir.resolve(file)));
        }
    }

    private void export(PipelineResult result, Path directory) {
        String dir = directory.toString();
        StepVerifier.create(exportService.exportHourly(result.getHourlyRecords(), dir)).expectNextCount(1).verifyComplete();
        StepVerifier.create(exportService.exportFeatures(result.getFeatureTable(), dir)).expectNextCount(1).verifyComplete();
        StepVerifier.create(exportService.exportQualityReport(result.getQualityReport(), dir)).expectNextCount(1).verifyComplete();
    }
}
