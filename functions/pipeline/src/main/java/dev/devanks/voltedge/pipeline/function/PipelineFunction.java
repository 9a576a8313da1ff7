package dev.devanks.voltedge.pipeline.function;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.voltedge.pipeline.config.PipelineProperties;
import dev.devanks.voltedge.pipeline.exception.InvalidPayloadException;
import dev.devanks.voltedge.pipeline.exception.PipelineException;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.model.PipelineRequest;
import dev.devanks.voltedge.pipeline.model.PipelineResult;
import dev.devanks.voltedge.pipeline.service.PipelineService;
import dev.devanks.voltedge.pipeline.service.TableExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static reactor.core.scheduler.Schedulers.boundedElastic;

@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineFunction {

    static final String INPUT_KEY = "input";
    static final String LIMIT_KEY = "limit";
    static final String ALLOW_INVALID_KEY = "allowInvalid";
    static final String OUTPUT_DIR_KEY = "outputDir";

    private final PipelineService pipelineService;
    private final TableExportService exportService;
    private final PipelineProperties properties;

    /**
     * Main function bean: meterFeaturePipeline. Every payload key is optional and falls back to configuration.
     */
    @Bean
    public Function<Map<String, Object>, String> meterFeaturePipeline() {
        return payload -> {
            log.info("meterFeaturePipeline function triggered with payload: {}", payload);
            try {
                return runPipeline(payload == null ? Map.of() : payload).block();
            } catch (InvalidPayloadException e) {
                log.error("Invalid payload {}: {}", payload, e.getMessage(), e);
                return "Error: Invalid payload. Expected optional keys 'input', 'limit' (positive integer), "
                        + "'allowInvalid' (boolean), 'outputDir'. Details: " + e.getMessage();
            } catch (IllegalArgumentException e) {
                log.error("Pipeline configuration rejected for payload {}: {}", payload, e.getMessage(), e);
                return "Error: Pipeline configuration rejected. Details: " + e.getMessage();
            }
        };
    }

    /**
     * Runs the pipeline for the given payload and exports its outputs.
     *
     * @return a one-line summary of the run
     * @throws InvalidPayloadException  when a payload value cannot be interpreted
     * @throws IllegalArgumentException when the configured options are inconsistent
     */
    @VisibleForTesting
    Mono<String> runPipeline(Map<String, Object> payload) {
        PipelineRequest request = toRequest(payload);
        PipelineOptions options = toOptions(payload);
        String outputDir = stringValue(payload, OUTPUT_DIR_KEY, properties.getOutput().getDirectory());

        return Mono.fromCallable(() -> pipelineService.execute(request, options))
                .subscribeOn(boundedElastic())
                .flatMap(result -> exportOutputs(result, outputDir)
                        .map(paths -> buildSummary(request, result, paths)))
                .onErrorResume(PipelineException.class, e -> handlePipelineError(e, request));
    }

    private Mono<List<String>> exportOutputs(PipelineResult result, String outputDir) {
        List<String> written = new ArrayList<>();
        Mono<Void> exports = exportService.exportHourly(result.getHourlyRecords(), outputDir)
                .doOnNext(written::add)
                .then(exportService.exportQualityReport(result.getQualityReport(), outputDir).doOnNext(written::add))
                .then();
        if (result.getFeatureTable() != null) {
            exports = exports.then(exportService.exportFeatures(result.getFeatureTable(), outputDir)
                    .doOnNext(written::add)
                    .then());
        }
        return exports.then(Mono.fromCallable(() -> List.copyOf(written)));
    }

    @VisibleForTesting
    PipelineRequest toRequest(Map<String, Object> payload) {
        String input = stringValue(payload, INPUT_KEY, properties.getInput().getArchivePath());
        if (input == null || input.isBlank()) {
            throw new InvalidPayloadException("No input archive given in payload or configuration.");
        }
        return PipelineRequest.builder()
                .archivePath(Path.of(input))
                .expectedSha256(properties.getInput().getExpectedSha256())
                .allowInvalid(booleanValue(payload, ALLOW_INVALID_KEY))
                .build();
    }

    @VisibleForTesting
    PipelineOptions toOptions(Map<String, Object> payload) {
        PipelineOptions options = properties.toOptions();
        Object limit = payload.get(LIMIT_KEY);
        if (limit == null) {
            return options;
        }
        int rowLimit;
        if (limit instanceof Number) {
            rowLimit = ((Number) limit).intValue();
        } else {
            try {
                rowLimit = Integer.parseInt(limit.toString().trim());
            } catch (NumberFormatException e) {
                throw new InvalidPayloadException("'limit' must be an integer, got '" + limit + "'", e);
            }
        }
        if (rowLimit <= 0) {
            throw new InvalidPayloadException("'limit' must be positive, got " + rowLimit);
        }
        return options.toBuilder().rowLimit(rowLimit).build();
    }

    private static String stringValue(Map<String, Object> payload, String key, String fallback) {
        Object value = payload.get(key);
        return value == null ? fallback : value.toString();
    }

    private static boolean booleanValue(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true") || text.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(text);
        }
        throw new InvalidPayloadException("'" + key + "' must be true or false, got '" + value + "'");
    }

    private Mono<String> handlePipelineError(PipelineException e, PipelineRequest request) {
        log.error("Pipeline run for archive {} failed: {}", request.getArchivePath(), e.getMessage(), e);
        return Mono.just(String.format("Pipeline run for archive %s failed. Status: FAILED. Details: %s",
                request.getArchivePath(), e.getMessage()));
    }

    private String buildSummary(PipelineRequest request, PipelineResult result, List<String> paths) {
        String features = result.features()
                .map(table -> String.format("Feature rows: %d (dropped %d, %d columns).",
                        table.size(), table.getDroppedRows(), table.getFeatureColumns().size()))
                .orElse("Feature rows: none (refused).");
        var summary = String.format(
                "Pipeline run for archive %s completed. Status: %s. Hourly records: %d, flagged: %d. Quality valid: %s. %s Outputs: %s",
                request.getArchivePath(), result.getStatus(), result.getHourlyRecords().size(),
                result.getQualityReport().flaggedRows(), result.getQualityReport().isValid(), features,
                String.join(", ", paths));
        log.info(summary);
        return summary;
    }
}
