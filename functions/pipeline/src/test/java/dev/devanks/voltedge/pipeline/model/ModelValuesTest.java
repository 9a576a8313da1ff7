package dev.devanks.voltedge.pipeline.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

import static dev.devanks.voltedge.pipeline.TestData.hourly;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Model value Unit Tests")
class ModelValuesTest {

    private static final LocalDateTime TIMESTAMP = LocalDateTime.of(2007, 1, 1, 0, 0);

    @Test
    @DisplayName("RawReading: requires one value per channel and copies its input")
    void rawReading_defensiveCopy() {
        double[] values = {1, 2, 3, 4, 5, 6, 7};
        RawReading reading = new RawReading(TIMESTAMP, values);
        values[0] = 99;

        assertThat(reading.value(Channel.GLOBAL_ACTIVE_POWER)).isEqualTo(1.0);
        assertThatThrownBy(() -> RawReading.of(TIMESTAMP, 1, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Channel: only active and reactive power contribute to total power")
    void channel_powerChannels() {
        assertThat(Channel.values())
                .filteredOn(Channel::isPower)
                .containsExactly(Channel.GLOBAL_ACTIVE_POWER, Channel.GLOBAL_REACTIVE_POWER);
    }

    @Test
    @DisplayName("FeatureRecord: unknown columns are rejected, undefined values are null")
    void featureRecord_lookup() {
        var features = new HashMap<String, Double>();
        features.put("sub1_pct", null);
        var record = new FeatureRecord(hourly(TIMESTAMP, 1.0, QualityFlag.OK), features);

        assertThat(record.feature("sub1_pct")).isNull();
        assertThatThrownBy(() -> record.feature("nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("HourlyRecord: base values follow the base column order")
    void hourlyRecord_baseValuesAlignWithColumns() {
        HourlyRecord record = hourly(TIMESTAMP, 1.0, QualityFlag.OK);

        Object[] values = record.baseValues();

        assertThat(values).hasSize(HourlyRecord.BASE_COLUMNS.size());
        assertThat(values[HourlyRecord.BASE_COLUMNS.indexOf("timestamp")]).isEqualTo(TIMESTAMP);
        assertThat(values[HourlyRecord.BASE_COLUMNS.indexOf("total_power")]).isEqualTo(1.0);
        assertThat(values[HourlyRecord.BASE_COLUMNS.indexOf("quality_flag")]).isEqualTo(QualityFlag.OK);
        assertThat(values[HourlyRecord.BASE_COLUMNS.indexOf("is_weekend")]).isEqualTo(false);
    }

    @Test
    @DisplayName("QualityReport: counts flagged rows across non-OK flags")
    void qualityReport_flaggedRows() {
        var report = QualityReport.builder()
                .flagCounts(Map.of(QualityFlag.OK, 5L, QualityFlag.MISSING_DATA, 2L, QualityFlag.SUSPICIOUS_VOLTAGE, 1L))
                .build();

        assertThat(report.flaggedRows()).isEqualTo(3);
    }
}
