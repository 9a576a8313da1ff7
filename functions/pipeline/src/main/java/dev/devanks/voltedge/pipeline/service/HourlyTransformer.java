package dev.devanks.voltedge.pipeline.service;

import com.google.common.annotations.VisibleForTesting;
import dev.devanks.voltedge.pipeline.exception.StructuralViolationException;
import dev.devanks.voltedge.pipeline.model.Channel;
import dev.devanks.voltedge.pipeline.model.HourlyRecord;
import dev.devanks.voltedge.pipeline.model.PipelineOptions;
import dev.devanks.voltedge.pipeline.model.QualityFlag;
import dev.devanks.voltedge.pipeline.model.RawReading;
import dev.devanks.voltedge.pipeline.util.CalendarUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Cleans per-minute readings and resamples them into a contiguous, quality-flagged hourly series.
 */
@Service
@Slf4j
public class HourlyTransformer {

    static final int MINUTES_PER_HOUR = 60;

    /**
     * Fills short gaps, buckets by hour, aggregates, tags the calendar and assigns quality flags.
     * Never fails on data quality; only on input ordering problems.
     *
     * @param readings raw readings, strictly increasing by timestamp
     * @param options  run configuration
     * @return one record per hour from the first to the last observed hour, inclusive
     * @throws StructuralViolationException if the readings are duplicated or out of order
     */
    public List<HourlyRecord> transform(List<RawReading> readings, PipelineOptions options) {
        if (readings.isEmpty()) {
            log.warn("No raw readings to transform.");
            return List.of();
        }
        log.info("Starting transformation of {} raw readings.", readings.size());
        verifyStrictlyIncreasing(readings);

        double[][] filled = fillShortGaps(readings, options.getGapFillLimit());
        List<HourlyRecord> hourly = resample(readings, filled, options);

        Map<QualityFlag, Long> flagCounts = new EnumMap<>(QualityFlag.class);
        hourly.forEach(record -> flagCounts.merge(record.getQualityFlag(), 1L, Long::sum));
        log.info("Transformation complete: {} hourly records from {} to {}. Flags: {}",
                hourly.size(), hourly.get(0).getTimestamp(), hourly.get(hourly.size() - 1).getTimestamp(), flagCounts);
        return Collections.unmodifiableList(hourly);
    }

    private void verifyStrictlyIncreasing(List<RawReading> readings) {
        for (int i = 1; i < readings.size(); i++) {
            LocalDateTime previous = readings.get(i - 1).getTimestamp();
            LocalDateTime current = readings.get(i).getTimestamp();
            if (!current.isAfter(previous)) {
                throw new StructuralViolationException(String.format(
                        "Raw readings must be strictly increasing: %s at position %d follows %s",
                        current, i, previous));
            }
        }
    }

    /**
     * Forward-fills runs of missing samples no longer than {@code limit}. Longer runs, and runs with no
     * preceding value, stay missing in full.
     *
     * @return values indexed {@code [channel.ordinal()][row]}
     */
    @VisibleForTesting
    double[][] fillShortGaps(List<RawReading> readings, int limit) {
        Channel[] channels = Channel.values();
        int rows = readings.size();
        double[][] values = new double[channels.length][rows];
        for (int row = 0; row < rows; row++) {
            RawReading reading = readings.get(row);
            for (Channel channel : channels) {
                values[channel.ordinal()][row] = reading.value(channel);
            }
        }

        for (Channel channel : channels) {
            double[] series = values[channel.ordinal()];
            int filledCount = 0;
            int unfilledRuns = 0;
            int row = 0;
            while (row < rows) {
                if (!Double.isNaN(series[row])) {
                    row++;
                    continue;
                }
                int runEnd = row;
                while (runEnd < rows && Double.isNaN(series[runEnd])) {
                    runEnd++;
                }
                int runLength = runEnd - row;
                if (row > 0 && runLength <= limit) {
                    double lastKnown = series[row - 1];
                    for (int i = row; i < runEnd; i++) {
                        series[i] = lastKnown;
                    }
                    filledCount += runLength;
                } else {
                    unfilledRuns++;
                }
                row = runEnd;
            }
            if (filledCount > 0 || unfilledRuns > 0) {
                log.debug("Channel {}: forward-filled {} samples, left {} gap run(s) unfilled.",
                        channel.getHeaderName(), filledCount, unfilledRuns);
            }
        }
        return values;
    }

    private List<HourlyRecord> resample(List<RawReading> readings, double[][] values, PipelineOptions options) {
        LocalDateTime firstMinute = readings.get(0).getTimestamp();
        LocalDateTime lastMinute = readings.get(readings.size() - 1).getTimestamp();
        LocalDateTime lastBucket = CalendarUtils.hourBucket(lastMinute);

        List<HourlyRecord> hourly = new ArrayList<>();
        int row = 0;
        for (LocalDateTime bucket = CalendarUtils.hourBucket(firstMinute); !bucket.isAfter(lastBucket); bucket = bucket.plusHours(1)) {
            LocalDateTime nextBucket = bucket.plusHours(1);
            BucketAccumulator accumulator = new BucketAccumulator();
            while (row < readings.size() && readings.get(row).getTimestamp().isBefore(nextBucket)) {
                accumulator.add(values, row);
                row++;
            }
            int expected = expectedSamples(bucket, firstMinute, lastMinute);
            hourly.add(buildRecord(bucket, accumulator, expected, options));
        }
        return hourly;
    }

    /**
     * Minutes of this bucket that fall inside the observed range. Interior buckets expect 60.
     */
    @VisibleForTesting
    static int expectedSamples(LocalDateTime bucket, LocalDateTime firstMinute, LocalDateTime lastMinute) {
        LocalDateTime start = firstMinute.isAfter(bucket) ? firstMinute : bucket;
        LocalDateTime bucketLastMinute = bucket.plusMinutes(MINUTES_PER_HOUR - 1);
        LocalDateTime end = lastMinute.isBefore(bucketLastMinute) ? lastMinute : bucketLastMinute;
        return (int) ChronoUnit.MINUTES.between(start, end) + 1;
    }

    private HourlyRecord buildRecord(LocalDateTime bucket, BucketAccumulator accumulator, int expected,
                                     PipelineOptions options) {
        HourlyRecord.HourlyRecordBuilder builder = HourlyRecord.builder().timestamp(bucket);
        for (Channel channel : Channel.values()) {
            builder.value(channel, accumulator.aggregate(channel));
        }
        Double totalPower = accumulator.totalPower();

        double completeness = (double) accumulator.present / expected;
        QualityFlag flag = assignFlag(accumulator.present, completeness, accumulator.aggregate(Channel.VOLTAGE), options);
        if (flag != QualityFlag.OK) {
            log.trace("Bucket {} flagged {} (completeness {}).", bucket, flag, completeness);
        }

        return builder
                .totalPower(totalPower)
                .samplesPresent(accumulator.present)
                .samplesExpected(expected)
                .completeness(completeness)
                .qualityFlag(flag)
                .hourOfDay(bucket.getHour())
                .dayOfWeek(CalendarUtils.dayOfWeekIndex(bucket))
                .month(bucket.getMonthValue())
                .weekend(CalendarUtils.isWeekend(bucket))
                .build();
    }

    /**
     * An hour without a single complete sample is always missing data, whatever the threshold.
     */
    @VisibleForTesting
    static QualityFlag assignFlag(int samplesPresent, double completeness, Double voltage, PipelineOptions options) {
        if (samplesPresent == 0 || completeness < options.getCompletenessThreshold()) {
            return QualityFlag.MISSING_DATA;
        }
        if (voltage != null && !options.getVoltageBand().contains(voltage)) {
            return QualityFlag.SUSPICIOUS_VOLTAGE;
        }
        return QualityFlag.OK;
    }

    /**
     * Running sums for one bucket. A minute counts as present when every channel is defined after gap fill.
     */
    private static final class BucketAccumulator {
        private final double[] sums = new double[Channel.values().length];
        private final int[] counts = new int[Channel.values().length];
        private int present;

        void add(double[][] values, int row) {
            boolean complete = true;
            for (Channel channel : Channel.values()) {
                double value = values[channel.ordinal()][row];
                if (Double.isNaN(value)) {
                    complete = false;
                } else {
                    sums[channel.ordinal()] += value;
                    counts[channel.ordinal()]++;
                }
            }
            if (complete) {
                present++;
            }
        }

        Double aggregate(Channel channel) {
            int count = counts[channel.ordinal()];
            if (count == 0) {
                return null;
            }
            double sum = sums[channel.ordinal()];
            return channel.getAggregation() == Channel.Aggregation.MEAN ? sum / count : sum;
        }

        /**
         * Sum of the power channel aggregates, or null when any of them is undefined.
         */
        Double totalPower() {
            double total = 0.0;
            for (Channel channel : Channel.values()) {
                if (!channel.isPower()) {
                    continue;
                }
                Double value = aggregate(channel);
                if (value == null) {
                    return null;
                }
                total += value;
            }
            return total;
        }
    }
}
