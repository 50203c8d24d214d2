package com.di.qualityguard.ai.insights;

import com.di.qualityguard.ai.config.AiInsightsProperties;
import com.di.qualityguard.profile.ColumnProfile;
import com.di.qualityguard.report.Report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Compact, ordered view of a report sent to the model as the user message. */
final class InsightsPayload {

    static final List<String> REQUIRED_KEYS = List.of(
            "summary_bullets", "cleaning_recipe", "semantic_types", "drift_narrative", "anomaly_explanation");

    private static final int SAMPLE_VALUES = 3;

    private InsightsPayload() {}

    static Map<String, Object> of(Report report, AiInsightsProperties.PayloadConfig limits) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("rowCount", report.getRowCount());
        summary.put("columnCount", report.getColumnCount());
        summary.put("baselineProvided", report.isBaselineProvided());
        summary.put("qualityScore", report.getQualityScore());
        summary.put("severityCounts", report.getSeverityCounts());
        summary.put("columns", columns(report.getColumns(), limits.getMaxColumns()));
        summary.put("schemaFindings", head(report.getSchemaFindings(), limits.getMaxFindings()));
        summary.put("driftFindings", head(report.getDriftFindings(), limits.getMaxFindings()));
        summary.put("recommendations", head(report.getRecommendations(), limits.getMaxRecommendations()));

        Map<String, Object> constraints = new LinkedHashMap<>();
        constraints.put("summary_bullets_max", 6);
        constraints.put("cleaning_recipe_max_lines", 12);
        constraints.put("semantic_types_max", 12);
        constraints.put("tone", "clear, pragmatic");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task", "Generate insights as one JSON object with exactly the required keys.");
        payload.put("report", summary);
        payload.put("required_keys", REQUIRED_KEYS);
        payload.put("constraints", constraints);
        return payload;
    }

    private static List<Map<String, Object>> columns(List<ColumnProfile> profiles, int max) {
        List<Map<String, Object>> columns = new ArrayList<>();
        for (ColumnProfile p : head(profiles, max)) {
            Map<String, Object> column = new LinkedHashMap<>();
            column.put("name", p.getName());
            column.put("type", p.getType());
            column.put("nullRate", p.getNullRate());
            column.put("distinctCount", p.getDistinctCount());
            column.put("sampleValues", head(p.getSampleValues(), SAMPLE_VALUES));
            if (p.getNumeric() != null) {
                column.put("numeric", p.getNumeric());
            }
            columns.add(column);
        }
        return columns;
    }

    private static <T> List<T> head(List<T> items, int max) {
        if (items == null) {
            return List.of();
        }
        return items.size() <= max ? items : items.subList(0, max);
    }
}
