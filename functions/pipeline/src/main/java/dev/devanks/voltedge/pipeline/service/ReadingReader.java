package dev.devanks.voltedge.pipeline.service;

import com.google.common.base.Splitter;
import dev.devanks.voltedge.pipeline.exception.PipelineException;
import dev.devanks.voltedge.pipeline.exception.ReadingParseException;
import dev.devanks.voltedge.pipeline.exception.StructuralViolationException;
import dev.devanks.voltedge.pipeline.model.Channel;
import dev.devanks.voltedge.pipeline.model.RawReading;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Parses the semicolon-delimited meter file into readings ordered by timestamp.
 */
@Component
@Slf4j
public class ReadingReader {

    public static final String MISSING_SENTINEL = "?";
    static final String DATE_COLUMN = "Date";
    static final String TIME_COLUMN = "Time";

    private static final Splitter FIELD_SPLITTER = Splitter.on(';').trimResults();
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("d/M/uuuu");
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("H:mm[:ss]");

    /**
     * Reads every data row, or only the first {@code limit} rows in file order when a limit is given.
     * The stream is closed before returning, whatever the outcome.
     *
     * @param input raw delimited text, header first
     * @param limit maximum number of data rows to keep, or {@code null} for all
     * @return readings sorted ascending by timestamp
     * @throws ReadingParseException        on the first malformed row
     * @throws StructuralViolationException when two rows share a timestamp
     */
    public List<RawReading> read(InputStream input, Integer limit) {
        checkArgument(limit == null || limit > 0, "Row limit must be positive, got %s", limit);

        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, UTF_8))) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new ReadingParseException(1, "Input is empty, expected a header row");
            }
            HeaderLayout layout = HeaderLayout.parse(headerLine);

            List<RawReading> readings = new ArrayList<>();
            long lineNumber = 1;
            String line;
            while ((limit == null || readings.size() < limit) && (line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                readings.add(parseLine(line, lineNumber, layout));
            }
            if (limit != null) {
                log.info("Row limit {} applied, kept the first {} rows in file order.", limit, readings.size());
            }

            // List.sort is stable, so rows already in order keep their file order
            readings.sort(Comparator.comparing(RawReading::getTimestamp));
            rejectDuplicateTimestamps(readings);

            long incomplete = readings.stream().filter(RawReading::hasMissingValues).count();
            if (incomplete > 0) {
                log.warn("{} of {} rows carry the '{}' missing-value marker.", incomplete, readings.size(), MISSING_SENTINEL);
            }
            log.info("Parsed {} raw readings ({} lines read).", readings.size(), lineNumber);
            return Collections.unmodifiableList(readings);
        } catch (IOException e) {
            throw new PipelineException("Failed to read raw readings: " + e.getMessage(), e);
        }
    }

    private RawReading parseLine(String line, long lineNumber, HeaderLayout layout) {
        List<String> fields = FIELD_SPLITTER.splitToList(line);
        if (fields.size() != layout.width) {
            throw new ReadingParseException(lineNumber,
                    String.format("Expected %d fields but found %d", layout.width, fields.size()));
        }

        LocalDateTime timestamp;
        String date = fields.get(layout.dateIndex);
        String time = fields.get(layout.timeIndex);
        try {
            timestamp = LocalDateTime.of(LocalDate.parse(date, DATE_FORMAT), LocalTime.parse(time, TIME_FORMAT))
                    .truncatedTo(ChronoUnit.MINUTES);
        } catch (DateTimeParseException e) {
            throw new ReadingParseException(lineNumber, "Malformed timestamp '" + date + " " + time + "'", e);
        }

        Channel[] channels = Channel.values();
        double[] values = new double[channels.length];
        for (Channel channel : channels) {
            values[channel.ordinal()] = parseValue(fields.get(layout.channelIndex[channel.ordinal()]), channel, lineNumber);
        }
        return new RawReading(timestamp, values);
    }

    private double parseValue(String raw, Channel channel, long lineNumber) {
        if (raw.isEmpty() || MISSING_SENTINEL.equals(raw)) {
            return Double.NaN;
        }
        try {
            double value = Double.parseDouble(raw);
            if (!Double.isFinite(value)) {
                throw new ReadingParseException(lineNumber,
                        "Non-finite value '" + raw + "' in column " + channel.getHeaderName());
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ReadingParseException(lineNumber,
                    "Unparsable value '" + raw + "' in column " + channel.getHeaderName(), e);
        }
    }

    private void rejectDuplicateTimestamps(List<RawReading> readings) {
        for (int i = 1; i < readings.size(); i++) {
            LocalDateTime timestamp = readings.get(i).getTimestamp();
            if (timestamp.equals(readings.get(i - 1).getTimestamp())) {
                log.error("Duplicate reading timestamp {} in raw input.", timestamp);
                throw new StructuralViolationException("Duplicate reading timestamp " + timestamp);
            }
        }
    }

    /**
     * Column positions resolved from the header row, so column order in the file does not matter.
     */
    private static final class HeaderLayout {
        private final int width;
        private final int dateIndex;
        private final int timeIndex;
        private final int[] channelIndex;

        private HeaderLayout(int width, int dateIndex, int timeIndex, int[] channelIndex) {
            this.width = width;
            this.dateIndex = dateIndex;
            this.timeIndex = timeIndex;
            this.channelIndex = channelIndex;
        }

        static HeaderLayout parse(String headerLine) {
            // Strip a UTF-8 byte order mark if the file has one
            String header = headerLine.startsWith("\uFEFF") ? headerLine.substring(1) : headerLine;
            List<String> names = FIELD_SPLITTER.splitToList(header);
            List<String> missing = new ArrayList<>();

            int dateIndex = indexOf(names, DATE_COLUMN, missing);
            int timeIndex = indexOf(names, TIME_COLUMN, missing);
            int[] channelIndex = new int[Channel.values().length];
            for (Channel channel : Channel.values()) {
                channelIndex[channel.ordinal()] = indexOf(names, channel.getHeaderName(), missing);
            }
            if (!missing.isEmpty()) {
                throw new ReadingParseException(1, "Header is missing column(s) " + missing);
            }
            return new HeaderLayout(names.size(), dateIndex, timeIndex, channelIndex);
        }

        private static int indexOf(List<String> names, String wanted, List<String> missing) {
            for (int i = 0; i < names.size(); i++) {
                if (names.get(i).equalsIgnoreCase(wanted)) {
                    return i;
                }
            }
            missing.add(wanted);
            return -1;
        }
    }
}
