package dev.devanks.voltedge.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devanks.voltedge.pipeline.config.PipelineProperties;
import dev.devanks.voltedge.pipeline.exception.ExportException;
import dev.devanks.voltedge.pipeline.model.FeatureTable;
import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.QualityFlag;
import dev.devanks.voltedge.pipeline.model.QualityReport;
import dev.devanks.voltedge.pipeline.service.io.OutputResourceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.WritableResource;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.BufferedWriter;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.zip.GZIPOutputStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static reactor.core.scheduler.Schedulers.boundedElastic;

/**
 * Writes the hourly and feature tables as gzip-compressed CSV and the quality report as JSON.
 * Identical input produces identical bytes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TableExportService {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss");
    private static final String LINE_SEPARATOR = "\n";

    private final PipelineProperties properties;
    private final OutputResourceProvider resourceProvider;
    private final ObjectMapper objectMapper;

    public Mono<String> exportHourly(List<HourlyRecord> hourly, String directory) {
        if (hourly == null) {
            return Mono.error(new IllegalArgumentException("Hourly records cannot be null."));
        }
        String path = resolve(directory, properties.getOutput().getHourlyFile());
        return writeCsv(path, HourlyRecord.BASE_COLUMNS, () -> hourly.stream().map(HourlyRecord::baseValues), hourly.size());
    }

    public Mono<String> exportFeatures(FeatureTable table, String directory) {
        if (table == null) {
            return Mono.error(new IllegalArgumentException("Feature table cannot be null."));
        }
        String path = resolve(directory, properties.getOutput().getFeaturesFile());
        return writeCsv(path, table.columnNames(), table::rows, table.size());
    }

    public Mono<String> exportQualityReport(QualityReport report, String directory) {
        if (report == null) {
            return Mono.error(new IllegalArgumentException("Quality report cannot be null."));
        }
        String path = resolve(directory, properties.getOutput().getReportFile());
        return Mono.fromCallable(() -> {
                    WritableResource resource = resourceProvider.createWritableResource(path);
                    try (OutputStream os = resource.getOutputStream()) {
                        objectMapper.writerWithDefaultPrettyPrinter().writeValue(os, report);
                    }
                    log.info("Wrote quality report (valid: {}) to {}", report.isValid(), path);
                    return path;
                })
                .subscribeOn(boundedElastic())
                .doOnError(e -> log.error("Quality report write failed for path {}: {}", path, e.getMessage(), e))
                .onErrorMap(e -> mapError(e, path));
    }

    private Mono<String> writeCsv(String path, List<String> header, Supplier<Stream<Object[]>> rows, int rowCount) {
        return Mono.fromCallable(() -> {
                    log.info("Writing {} rows to {} on thread: {}", rowCount, path, Thread.currentThread().getName());
                    WritableResource resource = resourceProvider.createWritableResource(path);

                    try (OutputStream os = resource.getOutputStream();
                         GZIPOutputStream gzipOs = new GZIPOutputStream(os);
                         Writer writer = new BufferedWriter(new OutputStreamWriter(gzipOs, UTF_8))) {

                        writer.write(String.join(",", header));
                        writer.write(LINE_SEPARATOR);
                        try (Stream<Object[]> stream = rows.get()) {
                            for (Object[] row : (Iterable<Object[]>) stream::iterator) {
                                writer.write(convertToCsvRow(row));
                                writer.write(LINE_SEPARATOR);
                            }
                        }
                    }
                    log.info("Successfully wrote {} rows to {}", rowCount, path);
                    return path;
                })
                .subscribeOn(boundedElastic())
                .doOnError(e -> log.error("CSV write failed for path {}: {} (occurred on thread: {})",
                        path, e.getMessage(), Thread.currentThread().getName(), e))
                .onErrorMap(e -> mapError(e, path));
    }

    private Throwable mapError(Throwable e, String path) {
        if (e instanceof ExportException) {
            return e;
        }
        return new ExportException("Export failed for path " + path, e);
    }

    private String resolve(String directory, String fileName) {
        String base = (directory == null || directory.isBlank()) ? properties.getOutput().getDirectory() : directory;
        return Path.of(base, fileName).toString();
    }

    private String convertToCsvRow(Object[] row) {
        StringJoiner joiner = new StringJoiner(",");
        for (Object value : row) {
            joiner.add(formatValue(value));
        }
        return joiner.toString();
    }

    static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double) {
            double d = (Double) value;
            return Double.isNaN(d) ? "" : Double.toString(d);
        }
        if (value instanceof Boolean) {
            return ((Boolean) value) ? "1" : "0";
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(TIMESTAMP_FORMAT);
        }
        if (value instanceof QualityFlag) {
            return ((QualityFlag) value).name();
        }
        return escapeCsvField(value.toString());
    }

    private static String escapeCsvField(String field) {
        if (field.contains(",") || field.contains("\n") || field.contains("\"")) {
            return "\"" + field.replace("\"", "\"\"") + "\"";
        }
        return field;
    }
}
