package com.di.qualityguard.analysis;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.drift.DriftFinding;
import com.di.qualityguard.drift.DriftMetric;
import com.di.qualityguard.profile.ColumnProfile;
import com.di.qualityguard.profile.ColumnType;
import com.di.qualityguard.report.Finding;
import com.di.qualityguard.report.RecommendationIssue;
import com.di.qualityguard.report.Report;
import com.di.qualityguard.report.Severity;
import com.di.qualityguard.schema.SchemaChangeKind;
import com.di.qualityguard.schema.SchemaFinding;
import com.di.qualityguard.table.InvalidTableException;
import com.di.qualityguard.table.Table;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for QualityAnalyzer over in-memory tables.
 */
@DisplayName("QualityAnalyzer Tests")
class QualityAnalyzerTest {

    private ExecutorService executor;
    private QualityAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        analyzer = new QualityAnalyzer(AnalysisConfig.defaults(), executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static List<String> repeated(int times, String... cells) {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            values.addAll(Arrays.asList(cells));
        }
        return values;
    }

    private static Table customers(List<String> ages, List<String> statuses) {
        Map<String, List<String>> data = new LinkedHashMap<>();
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < ages.size(); i++) {
            ids.add("c-" + i);
        }
        data.put("id", ids);
        data.put("age", ages);
        data.put("status", statuses);
        return Table.ofStrings(data);
    }

    // ============================================================================
    // Without baseline
    // ============================================================================

    @Test
    @DisplayName("Should profile every column and report no findings without a baseline")
    void testAnalyze_NoBaseline() {
        Table dataset = customers(repeated(10, "30", "50"), repeated(10, "active", "closed"));

        Report report = analyzer.analyze(dataset, null);

        assertEquals(20, report.getRowCount());
        assertEquals(3, report.getColumnCount());
        assertFalse(report.isBaselineProvided());
        assertNull(report.getBaselineRowCount());
        assertTrue(report.getSchemaFindings().isEmpty());
        assertTrue(report.getDriftFindings().isEmpty());
        assertTrue(report.getFindings().isEmpty());
        assertEquals(100, report.getQualityScore());
        assertEquals(0L, report.getSeverityCounts().get("critical"));

        List<ColumnProfile> columns = report.getColumns();
        assertEquals(List.of("id", "age", "status"), columns.stream().map(ColumnProfile::getName).toList());
        assertEquals(ColumnType.TEXT, columns.get(0).getType());
        assertEquals(ColumnType.NUMERIC, columns.get(1).getType());
        assertEquals(ColumnType.CATEGORICAL, columns.get(2).getType());
        assertTrue(report.getSummary().startsWith("Rows: 20, Columns: 3."));
        assertNull(report.getAiInsights());
    }

    @Test
    @DisplayName("Should preview only the leading dataset rows")
    void testAnalyze_Preview() {
        Table dataset = customers(repeated(15, "30", "50"), repeated(15, "active", "closed"));

        Report report = analyzer.analyze(dataset, null);

        assertEquals(List.of("id", "age", "status"), report.getSampleColumns());
        assertEquals(20, report.getSampleRows().size());
        assertEquals("c-0", report.getSampleRows().get(0).get("id"));
        assertEquals("50", report.getSampleRows().get(19).get("age"));
        assertEquals("closed", report.getSampleRows().get(19).get("status"));
    }

    @Test
    @DisplayName("Should treat a zero-row baseline as absent")
    void testAnalyze_ZeroRowBaseline() {
        Table dataset = customers(repeated(10, "30", "50"), repeated(10, "active", "closed"));
        Table empty = customers(List.of(), List.of());

        Report report = analyzer.analyze(dataset, empty);

        assertFalse(report.isBaselineProvided());
        assertTrue(report.getFindings().isEmpty());
        assertEquals(100, report.getQualityScore());
    }

    @Test
    @DisplayName("Should analyse a zero-row dataset without dividing by zero")
    void testAnalyze_ZeroRowDataset() {
        Report report = analyzer.analyze(customers(List.of(), List.of()), null);

        assertEquals(0, report.getRowCount());
        report.getColumns().forEach(c -> {
            assertNull(c.getNullRate());
            assertEquals(ColumnType.TEXT, c.getType());
        });
    }

    @Test
    @DisplayName("Should reject a missing dataset")
    void testAnalyze_NullDataset() {
        assertThrows(InvalidTableException.class, () -> analyzer.analyze(null, null));
    }

    // ============================================================================
    // With baseline
    // ============================================================================

    @Test
    @DisplayName("Should report schema changes and drift against a baseline")
    void testAnalyze_WithBaseline() {
        List<String> baselineStatus = repeated(18, "active");
        baselineStatus.addAll(repeated(2, "closed"));
        List<String> currentStatus = repeated(18, "active");
        currentStatus.addAll(repeated(2, "pending"));

        Table baseline = customers(repeated(10, "30", "50"), baselineStatus);
        Map<String, List<String>> current = new LinkedHashMap<>();
        current.put("age", repeated(10, "65", "85"));
        current.put("status", currentStatus);
        current.put("region", repeated(20, "north"));

        Report report = analyzer.analyze(Table.ofStrings(current), baseline);

        assertTrue(report.isBaselineProvided());
        assertEquals(20, report.getBaselineRowCount());
        assertEquals(List.of(SchemaFinding.removed("id"), SchemaFinding.added("region")), report.getSchemaFindings());

        List<DriftFinding> drift = report.getDriftFindings();
        assertTrue(drift.stream().anyMatch(f -> f.getColumn().equals("age")
                && f.getMetric() == DriftMetric.MEAN_SHIFT && f.getSeverity() == Severity.CRITICAL));
        assertTrue(drift.stream().anyMatch(f -> f.getMetric() == DriftMetric.MISSING_CATEGORY
                && "closed".equals(f.getDetail())));
        assertTrue(drift.stream().anyMatch(f -> f.getMetric() == DriftMetric.NEW_CATEGORY
                && "pending".equals(f.getDetail())));

        List<Finding> findings = report.getFindings();
        assertEquals(report.getSchemaFindings().size() + drift.size(), findings.size());
        for (int i = 1; i < findings.size(); i++) {
            assertTrue(findings.get(i - 1).getSeverity().compareTo(findings.get(i).getSeverity()) >= 0);
        }
        long total = report.getSeverityCounts().values().stream().mapToLong(Long::longValue).sum();
        assertEquals(findings.size(), total);
        assertTrue(report.getQualityScore() < 100);
        assertTrue(report.getSummary().endsWith("Baseline drift comparison included."));
    }

    @Test
    @DisplayName("Should report a type change and skip drift for that column")
    void testAnalyze_TypeChangeSkipsDrift() {
        Map<String, List<String>> before = new LinkedHashMap<>();
        before.put("code", repeated(10, "1", "2"));
        Map<String, List<String>> after = new LinkedHashMap<>();
        after.put("code", Arrays.asList("A1", "B2", "C3", "D4", "E5", "F6", "G7", "H8", "I9", "J0",
                "K1", "L2", "M3", "N4", "O5", "P6", "Q7", "R8", "S9", "T0"));

        Report report = analyzer.analyze(Table.ofStrings(after), Table.ofStrings(before));

        assertEquals(1, report.getSchemaFindings().size());
        assertEquals(SchemaChangeKind.TYPE_CHANGED, report.getSchemaFindings().get(0).getChangeKind());
        assertTrue(report.getDriftFindings().isEmpty());
        assertEquals(95, report.getQualityScore());
    }

    @Test
    @DisplayName("Should report nothing when dataset and baseline match")
    void testAnalyze_Identical() {
        Table table = customers(repeated(10, "30", "50"), repeated(10, "active", "closed"));
        Report report = analyzer.analyze(table, table);

        assertTrue(report.getFindings().isEmpty());
        assertEquals(100, report.getQualityScore());
    }

    // ============================================================================
    // Degradation, recommendations, determinism
    // ============================================================================

    @Test
    @DisplayName("Should recommend imputation for columns with many missing values")
    void testAnalyze_Recommendations() {
        List<String> ages = new ArrayList<>(repeated(7, "30", "50"));
        ages.addAll(Collections.nCopies(6, null));
        Report report = analyzer.analyze(customers(ages, repeated(10, "a", "b")), null);

        assertTrue(report.getRecommendations().stream().anyMatch(r -> r.getColumn().equals("age")
                && r.getIssue() == RecommendationIssue.MISSING_VALUES && r.getSeverity() == Severity.CRITICAL));
        assertEquals(100, report.getQualityScore());
    }

    @Test
    @DisplayName("Should produce byte-identical JSON for repeated runs")
    void testAnalyze_Deterministic() throws Exception {
        Map<String, List<String>> data = new LinkedHashMap<>();
        data.put("when", repeated(5, "2024-01-01", "2024-02-01", "2024-03-01", "2024-04-01"));
        data.put("amount", repeated(5, "10.5", "20", "7", "1000"));
        data.put("flag", repeated(5, "true", "false", "TRUE", "false"));
        data.put("note", repeated(5, "a", "bb", "ccc", "dddd"));
        Table dataset = Table.ofStrings(data);
        Map<String, List<String>> old = new LinkedHashMap<>(data);
        old.put("amount", repeated(5, "1", "2", "3", "4"));
        Table baseline = Table.ofStrings(old);

        ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        String first = mapper.writeValueAsString(analyzer.analyze(dataset, baseline));
        String second = mapper.writeValueAsString(analyzer.analyze(dataset, baseline));

        assertEquals(first, second);
        assertTrue(first.contains("\"granularity\":\"month\""));
        assertTrue(first.contains("\"metric\":\"mean-shift\""));
    }

    // ============================================================================
    // Cancellation and parallelism
    // ============================================================================

    @Test
    @DisplayName("Should stop when the cancellation signal is raised")
    void testAnalyze_Cancelled() {
        Table dataset = customers(repeated(10, "30", "50"), repeated(10, "a", "b"));
        assertThrows(AnalysisCancelledException.class, () -> analyzer.analyze(dataset, null, () -> true));
    }

    @Test
    @DisplayName("Should stop once the signal is raised part-way")
    void testAnalyze_CancelledLater() {
        Table dataset = customers(repeated(10, "30", "50"), repeated(10, "a", "b"));
        AtomicInteger polls = new AtomicInteger();
        CancellationSignal afterFirstStage = () -> polls.incrementAndGet() > dataset.getColumnCount();

        assertThrows(AnalysisCancelledException.class, () -> analyzer.analyze(dataset, dataset, afterFirstStage));
    }

    @Test
    @DisplayName("Should give the same result on a single worker thread")
    void testAnalyze_SingleThread() {
        Table dataset = customers(repeated(10, "30", "50"), repeated(10, "a", "b"));
        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            Report parallel = analyzer.analyze(dataset, dataset);
            Report serial = new QualityAnalyzer(AnalysisConfig.defaults(), single).analyze(dataset, dataset);
            assertEquals(parallel, serial);
        } finally {
            single.shutdownNow();
        }
    }
}
