package com.di.qualityguard.report;

import com.di.qualityguard.profile.ColumnProfile;
import com.di.qualityguard.schema.SchemaFinding;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Assembles the {@link Report}; no computation beyond formatting the summary line. */
public class ReportBuilder {

    public Report build(int rowCount,
                        List<ColumnProfile> columns,
                        Integer baselineRowCount,
                        List<SchemaFinding> schemaFindings,
                        FindingAggregator.AggregatedFindings aggregated,
                        List<Recommendation> recommendations,
                        DataPreview preview) {
        Map<String, Long> counts = new LinkedHashMap<>();
        aggregated.severityCounts().forEach((severity, count) -> counts.put(severity.wireName(), count));
        boolean baselineProvided = baselineRowCount != null;
        return Report.builder()
                .rowCount(rowCount)
                .columnCount(columns.size())
                .baselineProvided(baselineProvided)
                .baselineRowCount(baselineRowCount)
                .qualityScore(aggregated.qualityScore())
                .severityCounts(Collections.unmodifiableMap(counts))
                .summary(summary(rowCount, columns.size(), counts, aggregated.qualityScore(), baselineProvided))
                .columns(List.copyOf(columns))
                .schemaFindings(List.copyOf(schemaFindings))
                .driftFindings(aggregated.driftFindings())
                .findings(aggregated.ordered())
                .recommendations(List.copyOf(recommendations))
                .sampleColumns(preview.getColumns())
                .sampleRows(preview.getRows())
                .build();
    }

    private static String summary(int rows, int columns, Map<String, Long> counts, int score, boolean baseline) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "Rows: %d, Columns: %d. Findings: %d critical, %d warning, %d info. Quality score: %d.",
                rows, columns,
                counts.getOrDefault(Severity.CRITICAL.wireName(), 0L),
                counts.getOrDefault(Severity.WARNING.wireName(), 0L),
                counts.getOrDefault(Severity.INFO.wireName(), 0L),
                score));
        if (baseline) {
            sb.append(" Baseline drift comparison included.");
        }
        return sb.toString();
    }
}
