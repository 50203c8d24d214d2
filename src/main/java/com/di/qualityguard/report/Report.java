package com.di.qualityguard.report;

import com.di.qualityguard.ai.insights.AiInsights;
import com.di.qualityguard.drift.DriftFinding;
import com.di.qualityguard.profile.ColumnProfile;
import com.di.qualityguard.schema.SchemaFinding;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * The data-quality report handed to the serving layer. Holds no timestamps or generated ids,
 * so identical inputs always serialise to identical bytes while AI insights are disabled.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({"rowCount", "columnCount", "baselineProvided", "baselineRowCount", "qualityScore",
        "severityCounts", "summary", "columns", "schemaFindings", "driftFindings", "findings", "recommendations",
        "sampleColumns", "sampleRows", "aiInsights"})
public class Report {
    int rowCount;
    int columnCount;
    boolean baselineProvided;
    /** Row count of the analysed baseline; null when no baseline was used. */
    Integer baselineRowCount;
    /** 0..100. */
    int qualityScore;
    /** Finding tally per severity wire name, critical first; absent severities count 0. */
    Map<String, Long> severityCounts;
    String summary;
    /** Dataset profiles in column order. */
    List<ColumnProfile> columns;
    /** Removed, then added, then type-changed columns. */
    List<SchemaFinding> schemaFindings;
    /** Severity descending, column, metric. */
    List<DriftFinding> driftFindings;
    /** Schema and drift findings merged, same order as {@link #driftFindings}. */
    List<Finding> findings;
    List<Recommendation> recommendations;
    /** Dataset column names, in order. */
    List<String> sampleColumns;
    /** Leading dataset rows as raw text keyed by column name; missing cells are null. */
    List<Map<String, String>> sampleRows;
    /** Narrative insights; null until the service attaches them. */
    AiInsights aiInsights;
}
