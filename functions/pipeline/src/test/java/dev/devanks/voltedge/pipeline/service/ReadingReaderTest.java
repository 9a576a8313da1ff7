package dev.devanks.voltedge.pipeline.service;

import dev.devanks.voltedge.pipeline.exception.ReadingParseException;
import dev.devanks.voltedge.pipeline.exception.StructuralViolationException;
import dev.devanks.voltedge.pipeline.model.Channel;
import dev.devanks.voltedge.pipeline.model.RawReading;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.List;

import static dev.devanks.voltedge.pipeline.TestData.HEADER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ReadingReader Unit Tests")
class ReadingReaderTest {

    private final ReadingReader reader = new ReadingReader();

    private static InputStream input(String... lines) {
        return new ByteArrayInputStream(String.join("\n", lines).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("read: parses day-first dates, values and the '?' missing marker")
    void read_validRows_parsesReadings() {
        // Arrange
        var stream = input(HEADER,
                "16/12/2006;17:24:00;4.216;0.418;234.840;18.400;0.000;1.000;17.000",
                "16/12/2006;17:25:00;?;?;?;?;?;?;");

        // Act
        List<RawReading> readings = reader.read(stream, null);

        // Assert
        assertThat(readings).hasSize(2);
        RawReading first = readings.get(0);
        assertThat(first.getTimestamp()).isEqualTo(LocalDateTime.of(2006, 12, 16, 17, 24));
        assertThat(first.value(Channel.GLOBAL_ACTIVE_POWER)).isEqualTo(4.216);
        assertThat(first.value(Channel.VOLTAGE)).isEqualTo(234.84);
        assertThat(first.value(Channel.SUB_METERING_3)).isEqualTo(17.0);
        assertThat(first.hasMissingValues()).isFalse();

        RawReading second = readings.get(1);
        for (Channel channel : Channel.values()) {
            assertThat(second.isMissing(channel)).as(channel.name()).isTrue();
        }
    }

    @Test
    @DisplayName("read: resolves columns by header name regardless of order")
    void read_reorderedHeader_matchesColumnsByName() {
        var stream = input(
                "Time;Date;Voltage;Global_active_power;Global_reactive_power;Global_intensity;Sub_metering_3;Sub_metering_2;Sub_metering_1",
                "08:00:00;1/2/2007;240.5;2.0;0.2;8.0;3.0;2.0;1.0");

        List<RawReading> readings = reader.read(stream, null);

        RawReading reading = readings.get(0);
        assertThat(reading.getTimestamp()).isEqualTo(LocalDateTime.of(2007, 2, 1, 8, 0));
        assertThat(reading.value(Channel.VOLTAGE)).isEqualTo(240.5);
        assertThat(reading.value(Channel.GLOBAL_ACTIVE_POWER)).isEqualTo(2.0);
        assertThat(reading.value(Channel.SUB_METERING_1)).isEqualTo(1.0);
        assertThat(reading.value(Channel.SUB_METERING_3)).isEqualTo(3.0);
    }

    @Test
    @DisplayName("read: limit keeps the first rows in file order, then sorts them")
    void read_withLimit_keepsFirstRowsInFileOrderThenSorts() {
        var stream = input(HEADER,
                "16/12/2006;17:26:00;1;0;235;4;0;0;0",
                "16/12/2006;17:24:00;1;0;235;4;0;0;0",
                "16/12/2006;17:25:00;1;0;235;4;0;0;0");

        List<RawReading> readings = reader.read(stream, 2);

        assertThat(readings).extracting(RawReading::getTimestamp).containsExactly(
                LocalDateTime.of(2006, 12, 16, 17, 24),
                LocalDateTime.of(2006, 12, 16, 17, 26));
    }

    @Test
    @DisplayName("read: skips blank lines and strips a byte order mark")
    void read_blankLinesAndBom_areIgnored() {
        var stream = input("\uFEFF" + HEADER,
                "",
                "16/12/2006;17:24:00;1;0;235;4;0;0;0",
                "   ");

        assertThat(reader.read(stream, null)).hasSize(1);
    }

    @Test
    @DisplayName("read: malformed timestamp fails with the 1-based line number")
    void read_malformedTimestamp_throwsWithLineNumber() {
        var stream = input(HEADER,
                "16/12/2006;17:24:00;1;0;235;4;0;0;0",
                "2006-12-16;17:25:00;1;0;235;4;0;0;0");

        assertThatThrownBy(() -> reader.read(stream, null))
                .isInstanceOf(ReadingParseException.class)
                .hasMessageStartingWith("Line 3:")
                .hasMessageContaining("Malformed timestamp")
                .extracting(e -> ((ReadingParseException) e).getLineNumber())
                .isEqualTo(3L);
    }

    @Test
    @DisplayName("read: wrong field count fails")
    void read_wrongFieldCount_throws() {
        var stream = input(HEADER, "16/12/2006;17:24:00;1;0;235");

        assertThatThrownBy(() -> reader.read(stream, null))
                .isInstanceOf(ReadingParseException.class)
                .hasMessageContaining("Expected 9 fields but found 5");
    }

    @Test
    @DisplayName("read: non-numeric value other than the marker fails")
    void read_unparsableValue_throws() {
        var stream = input(HEADER, "16/12/2006;17:24:00;1;0;n/a;4;0;0;0");

        assertThatThrownBy(() -> reader.read(stream, null))
                .isInstanceOf(ReadingParseException.class)
                .hasMessageContaining("'n/a'")
                .hasMessageContaining("Voltage");
    }

    @Test
    @DisplayName("read: header missing a channel is a parse error on line 1")
    void read_headerMissingColumn_throws() {
        var stream = input("Date;Time;Global_active_power", "16/12/2006;17:24:00;1");

        assertThatThrownBy(() -> reader.read(stream, null))
                .isInstanceOf(ReadingParseException.class)
                .hasMessageStartingWith("Line 1:")
                .hasMessageContaining("Voltage");
    }

    @Test
    @DisplayName("read: duplicate timestamps are a structural violation")
    void read_duplicateTimestamps_throws() {
        var stream = input(HEADER,
                "16/12/2006;17:24:00;1;0;235;4;0;0;0",
                "16/12/2006;17:24:00;2;0;235;4;0;0;0");

        assertThatThrownBy(() -> reader.read(stream, null))
                .isInstanceOf(StructuralViolationException.class)
                .hasMessageContaining("2006-12-16T17:24");
    }

    @Test
    @DisplayName("read: rejects a non-positive limit")
    void read_zeroLimit_throws() {
        assertThatThrownBy(() -> reader.read(input(HEADER), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("read: closes the stream even when parsing fails")
    void read_parseFailure_closesStream() {
        var closed = new boolean[1];
        var stream = new ByteArrayInputStream((HEADER + "\nbad").getBytes(StandardCharsets.UTF_8)) {
            @Override
            public void close() {
                closed[0] = true;
            }
        };

        assertThatThrownBy(() -> reader.read(stream, null)).isInstanceOf(ReadingParseException.class);
        assertThat(closed[0]).isTrue();
    }
}
