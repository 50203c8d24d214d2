package com.di.qualityguard.profile;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.table.RawValue;
import com.di.qualityguard.util.DateFormatUtils;
import com.di.qualityguard.util.DateFormatUtils.ParsedDateTime;
import com.di.qualityguard.util.TypeConverter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Computes the {@link ColumnProfile} of a single column for a given type. Columns are
 * independent, so one instance can profile many columns concurrently.
 *
 * <p>A column that cannot be profiled as its assigned type degrades to a text profile with
 * {@code degraded = true}; this never fails the analysis.
 */
@Slf4j
public class ColumnProfiler {

    private final AnalysisConfig config;

    public ColumnProfiler(AnalysisConfig config) {
        this.config = config;
    }

    public ProfiledColumn profile(String name, List<RawValue> column, ColumnType type) {
        List<String> values = SchemaInferencer.presentValues(column);
        try {
            switch (type) {
                case NUMERIC:
                    return numeric(name, column.size(), values);
                case BOOLEAN:
                    return frequencies(name, column.size(), values, ColumnType.BOOLEAN);
                case CATEGORICAL:
                    return frequencies(name, column.size(), values, ColumnType.CATEGORICAL);
                case DATETIME:
                    return datetime(name, column.size(), values);
                default:
                    return text(name, column.size(), values, type, false);
            }
        } catch (UnprofilableColumnException | NumberFormatException e) {
            log.warn("[PROFILER] Column '{}' does not fit type {} ({}); falling back to text",
                    name, type.wireName(), e.getMessage());
            return text(name, column.size(), values, type, true);
        }
    }

    private ProfiledColumn numeric(String name, int rowCount, List<String> values) {
        requireValues(values);
        double[] sorted = new double[values.size()];
        for (int i = 0; i < sorted.length; i++) {
            sorted[i] = TypeConverter.toDouble(values.get(i));
        }
        SummaryStatistics summary = Statistics.summarize(sorted);
        Arrays.sort(sorted);
        double[] quartiles = Statistics.quantiles(sorted, 0.25, 0.50, 0.75);
        double p25 = quartiles[0];
        double p75 = quartiles[2];

        Map<String, Long> counts = countValues(values, false);
        NumericStats stats = NumericStats.builder()
                .min(summary.getMin())
                .max(summary.getMax())
                .mean(summary.getMean())
                .stdDev(Statistics.populationStdDev(summary))
                .p25(p25)
                .p50(quartiles[1])
                .p75(p75)
                .outlierCount(Statistics.iqrOutliers(sorted, p25, p75))
                .build();
        ColumnProfile profile = base(name, ColumnType.NUMERIC, rowCount, values.size(), counts, false)
                .numeric(stats)
                .build();
        return new ProfiledColumn(ColumnType.NUMERIC, profile, sorted, null);
    }

    private ProfiledColumn frequencies(String name, int rowCount, List<String> values, ColumnType type) {
        requireValues(values);
        boolean bool = type == ColumnType.BOOLEAN;
        if (bool && !values.stream().allMatch(TypeConverter::isBooleanLiteral)) {
            throw new UnprofilableColumnException("non-boolean literal present");
        }
        Map<String, Long> counts = countValues(values, bool);
        ColumnProfile profile = base(name, type, rowCount, values.size(), counts, false)
                .topValues(topValues(counts, values.size()))
                .build();
        return new ProfiledColumn(type, profile, null, counts);
    }

    private ProfiledColumn datetime(String name, int rowCount, List<String> values) {
        requireValues(values);
        List<ParsedDateTime> parsed = new ArrayList<>(values.size());
        for (String value : values) {
            parsed.add(DateFormatUtils.parse(value)
                    .orElseThrow(() -> new UnprofilableColumnException("unparsable timestamp '" + value + "'")));
        }
        LocalDateTime min = parsed.get(0).value();
        LocalDateTime max = min;
        for (ParsedDateTime p : parsed) {
            if (p.value().isBefore(min)) min = p.value();
            if (p.value().isAfter(max)) max = p.value();
        }
        DatetimeStats stats = DatetimeStats.builder()
                .min(min)
                .max(max)
                .granularity(granularity(parsed))
                .build();
        ColumnProfile profile = base(name, ColumnType.DATETIME, rowCount, values.size(),
                countValues(values, false), false)
                .datetime(stats)
                .build();
        return new ProfiledColumn(ColumnType.DATETIME, profile, null, null);
    }

    private ProfiledColumn text(String name, int rowCount, List<String> values, ColumnType inferredType,
                                boolean degraded) {
        TextStats.TextStatsBuilder stats = TextStats.builder();
        if (!values.isEmpty()) {
            int min = Integer.MAX_VALUE;
            int max = 0;
            long total = 0;
            for (String value : values) {
                int length = value.length();
                min = Math.min(min, length);
                max = Math.max(max, length);
                total += length;
            }
            stats.minLength(min).maxLength(max).meanLength((double) total / values.size());
        }
        ColumnProfile profile = base(name, ColumnType.TEXT, rowCount, values.size(),
                countValues(values, false), degraded)
                .text(stats.build())
                .build();
        return new ProfiledColumn(inferredType, profile, null, null);
    }

    private ColumnProfile.ColumnProfileBuilder base(String name, ColumnType type, int rowCount, int nonNull,
                                                    Map<String, Long> counts, boolean degraded) {
        int nullCount = rowCount - nonNull;
        List<String> samples = new ArrayList<>(config.getSampleSize());
        for (String value : counts.keySet()) {
            if (samples.size() >= config.getSampleSize()) break;
            samples.add(value);
        }
        return ColumnProfile.builder()
                .name(name)
                .type(type)
                .rowCount(rowCount)
                .nullCount(nullCount)
                .nullRate(rowCount == 0 ? null : (double) nullCount / rowCount)
                .distinctCount(counts.size())
                .degraded(degraded)
                .sampleValues(samples);
    }

    /** Descending count; {@code List.sort} is stable so ties keep first-seen order. */
    private List<ValueFrequency> topValues(Map<String, Long> counts, int nonNull) {
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()));
        List<ValueFrequency> top = new ArrayList<>(Math.min(entries.size(), config.getTopN()));
        for (Map.Entry<String, Long> e : entries.subList(0, Math.min(entries.size(), config.getTopN()))) {
            top.add(new ValueFrequency(e.getKey(), e.getValue(), (double) e.getValue() / nonNull));
        }
        return top;
    }

    private static Map<String, Long> countValues(List<String> values, boolean lowerCase) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String value : values) {
            counts.merge(lowerCase ? value.toLowerCase(Locale.ROOT) : value, 1L, Long::sum);
        }
        return counts;
    }

    private static DatetimeGranularity granularity(List<ParsedDateTime> parsed) {
        boolean anyTime = false;
        boolean anyNanos = false;
        boolean anySeconds = false;
        boolean anyMinutes = false;
        boolean anyHours = false;
        boolean allFirstOfMonth = true;
        for (ParsedDateTime p : parsed) {
            LocalDateTime v = p.value();
            anyTime |= p.hasTime();
            anyNanos |= v.getNano() != 0;
            anySeconds |= v.getSecond() != 0;
            anyMinutes |= v.getMinute() != 0;
            anyHours |= v.getHour() != 0;
            allFirstOfMonth &= v.getDayOfMonth() == 1;
        }
        if (anyNanos) return DatetimeGranularity.SUB_SECOND;
        if (anySeconds) return DatetimeGranularity.SECOND;
        if (anyMinutes) return DatetimeGranularity.MINUTE;
        if (anyHours) return DatetimeGranularity.HOUR;
        if (!anyTime && allFirstOfMonth && parsed.size() > 1) return DatetimeGranularity.MONTH;
        return DatetimeGranularity.DAY;
    }

    private static void requireValues(List<String> values) {
        if (values.isEmpty()) {
            throw new UnprofilableColumnException("no non-missing values");
        }
    }

    /** Signals that a column's values do not fit the requested type. */
    static final class UnprofilableColumnException extends RuntimeException {
        UnprofilableColumnException(String message) {
            super(message);
        }
    }
}
