package dev.devanks.voltedge.pipeline.config;

import dev.devanks.voltedge.pipeline.model.Channel;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.model.ValueRange;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    @Data
    public static class InputProperties {
        /**
         * Zip archive holding the semicolon-delimited readings file.
         */
        private String archivePath;
        /**
         * Optional SHA-256 of the archive. Verification is skipped when blank.
         */
        private String expectedSha256;
    }

    @Data
    public static class TransformProperties {
        @Min(0)
        private int gapFillLimit = 5;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double completenessThreshold = 0.9;
        private double voltageMin = 200.0;
        private double voltageMax = 260.0;
    }

    @Data
    public static class ValidationProperties {
        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double maxMissingDataPct = 10.0;
        /**
         * Absolute physical bounds per channel. Channels not listed keep their defaults.
         */
        @NotNull
        private Map<Channel, RangeProperties> ranges = new EnumMap<>(Channel.class);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RangeProperties {
        private double min;
        private double max;
    }

    @Data
    public static class FeatureProperties {
        @NotEmpty
        private List<@Positive Integer> lagHours = new ArrayList<>(List.of(1, 24, 168));
        @NotEmpty
        private List<@Positive Integer> rollingWindows = new ArrayList<>(List.of(24, 168));
        private boolean includeCalendar = true;
        private boolean includeCyclical = true;
    }

    @Data
    public static class OutputProperties {
        @NotEmpty
        private String directory = "data/processed";
        @NotEmpty
        private String hourlyFile = "household_power_hourly.csv.gz";
        @NotEmpty
        private String featuresFile = "household_power_features.csv.gz";
        @NotEmpty
        private String reportFile = "quality_report.json";
    }

    @NotNull
    @Valid
    private InputProperties input = new InputProperties();

    @NotNull
    @Valid
    private TransformProperties transform = new TransformProperties();

    @NotNull
    @Valid
    private ValidationProperties validation = new ValidationProperties();

    @NotNull
    @Valid
    private FeatureProperties features = new FeatureProperties();

    @NotNull
    @Valid
    private OutputProperties output = new OutputProperties();

    /**
     * Truncates the raw input to the first N rows for quick runs.
     */
    @Positive
    private Integer rowLimit;

    /**
     * Snapshot of the bound properties as the immutable value handed to every stage.
     */
    public PipelineOptions toOptions() {
        checkArgument(transform.getVoltageMin() < transform.getVoltageMax(),
                "pipeline.transform.voltage-min (%s) must be below voltage-max (%s)",
                transform.getVoltageMin(), transform.getVoltageMax());

        Map<Channel, ValueRange> ranges = new EnumMap<>(PipelineOptions.defaultPhysicalRanges());
        validation.getRanges().forEach((channel, range) -> {
            checkArgument(range.getMin() <= range.getMax(),
                    "pipeline.validation.ranges.%s: min must not exceed max", channel);
            ranges.put(channel, ValueRange.of(range.getMin(), range.getMax()));
        });

        return PipelineOptions.builder()
                .gapFillLimit(transform.getGapFillLimit())
                .completenessThreshold(transform.getCompletenessThreshold())
                .voltageBand(ValueRange.of(transform.getVoltageMin(), transform.getVoltageMax()))
                .maxMissingDataPct(validation.getMaxMissingDataPct())
                .physicalRanges(Collections.unmodifiableMap(ranges))
                .lagHours(List.copyOf(features.getLagHours()))
                .rollingWindows(List.copyOf(features.getRollingWindows()))
                .includeCalendar(features.isIncludeCalendar())
                .includeCyclical(features.isIncludeCyclical())
                .rowLimit(rowLimit)
                .build();
    }
}
