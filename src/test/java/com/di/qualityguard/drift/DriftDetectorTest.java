package com.di.qualityguard.drift;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.profile.ColumnProfiler;
import com.di.qualityguard.profile.ColumnType;
import com.di.qualityguard.profile.ProfiledColumn;
import com.di.qualityguard.report.Severity;
import com.di.qualityguard.table.RawValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for DriftDetector.
 */
@DisplayName("DriftDetector Tests")
class DriftDetectorTest {

    private ColumnProfiler profiler;
    private DriftDetector detector;

    @BeforeEach
    void setUp() {
        AnalysisConfig config = AnalysisConfig.defaults();
        profiler = new ColumnProfiler(config);
        detector = new DriftDetector(config);
    }

    private static List<RawValue> repeated(int times, String... cells) {
        List<RawValue> values = new ArrayList<>();
        for (int i = 0; i < times; i++) {
            for (String cell : cells) {
                values.add(RawValue.text(cell));
            }
        }
        return values;
    }

    private ProfiledColumn profile(ColumnType type, List<RawValue> values) {
        return profiler.profile("col", values, type);
    }

    private static Optional<DriftFinding> find(List<DriftFinding> findings, DriftMetric metric) {
        return findings.stream().filter(f -> f.getMetric() == metric).findFirst();
    }

    // ============================================================================
    // Numeric
    // ============================================================================

    @Test
    @DisplayName("Should flag a critical mean shift of 3.5 standard deviations")
    void testDetect_CriticalMeanShift() {
        ProfiledColumn baseline = profile(ColumnType.NUMERIC, repeated(10, "30", "50"));
        ProfiledColumn current = profile(ColumnType.NUMERIC, repeated(10, "65", "85"));

        List<DriftFinding> findings = detector.detect(current, baseline);

        DriftFinding shift = find(findings, DriftMetric.MEAN_SHIFT).orElseThrow();
        assertEquals(3.5, shift.getObservedValue(), 1e-9);
        assertEquals(Severity.CRITICAL, shift.getSeverity());
        assertEquals("col", shift.getColumn());
        assertEquals(Severity.CRITICAL, find(findings, DriftMetric.POPULATION_STABILITY_INDEX).orElseThrow().getSeverity());
    }

    @Test
    @DisplayName("Should not flag a mean shift of half a standard deviation")
    void testDetect_SmallMeanShift() {
        ProfiledColumn baseline = profile(ColumnType.NUMERIC, repeated(10, "30", "50"));
        ProfiledColumn current = profile(ColumnType.NUMERIC, repeated(10, "35", "55"));

        assertTrue(find(detector.detect(current, baseline), DriftMetric.MEAN_SHIFT).isEmpty());
    }

    @Test
    @DisplayName("Should flag a warning mean shift between 1 and 3 standard deviations")
    void testDetect_WarningMeanShift() {
        ProfiledColumn baseline = profile(ColumnType.NUMERIC, repeated(10, "30", "50"));
        ProfiledColumn current = profile(ColumnType.NUMERIC, repeated(10, "50", "70"));

        DriftFinding shift = find(detector.detect(current, baseline), DriftMetric.MEAN_SHIFT).orElseThrow();
        assertEquals(2.0, shift.getObservedValue(), 1e-9);
        assertEquals(Severity.WARNING, shift.getSeverity());
    }

    @Test
    @DisplayName("Should report nothing for an unchanged numeric column")
    void testDetect_NoDrift() {
        ProfiledColumn baseline = profile(ColumnType.NUMERIC, repeated(10, "30", "50"));
        ProfiledColumn current = profile(ColumnType.NUMERIC, repeated(5, "50", "30"));

        assertTrue(detector.detect(current, baseline).isEmpty());
    }

    @Test
    @DisplayName("Should not divide by zero for a constant baseline")
    void testDetect_ConstantBaseline() {
        ProfiledColumn baseline = profile(ColumnType.NUMERIC, repeated(5, "7"));
        ProfiledColumn current = profile(ColumnType.NUMERIC, repeated(5, "8"));

        DriftFinding shift = find(detector.detect(current, baseline), DriftMetric.MEAN_SHIFT).orElseThrow();
        assertTrue(Double.isFinite(shift.getObservedValue()));
        assertEquals(Severity.CRITICAL, shift.getSeverity());
    }

    // ============================================================================
    // Null rate
    // ============================================================================

    @Test
    @DisplayName("Should flag a critical null-rate increase")
    void testDetect_NullRateCritical() {
        List<RawValue> withNulls = repeated(7, "30", "50");
        withNulls.addAll(repeated(6, (String) null));
        ProfiledColumn baseline = profile(ColumnType.NUMERIC, repeated(10, "30", "50"));
        ProfiledColumn current = profile(ColumnType.NUMERIC, withNulls);

        DriftFinding nullRate = find(detector.detect(current, baseline), DriftMetric.NULL_RATE_DELTA).orElseThrow();
        assertEquals(0.3, nullRate.getObservedValue(), 1e-9);
        assertEquals(Severity.CRITICAL, nullRate.getSeverity());
    }

    @Test
    @DisplayName("Should ignore null-rate noise below the minimum")
    void testDetect_NullRateNoise() {
        List<RawValue> baselineValues = repeated(100, "x");
        List<RawValue> currentValues = repeated(99, "x");
        currentValues.add(RawValue.missing());

        List<DriftFinding> findings = detector.detect(profile(ColumnType.TEXT, currentValues), profile(ColumnType.TEXT, baselineValues));
        assertTrue(find(findings, DriftMetric.NULL_RATE_DELTA).isEmpty());
    }

    // ============================================================================
    // Categorical
    // ============================================================================

    @Test
    @DisplayName("Should flag missing and new categories")
    void testDetect_CategoryChanges() {
        List<RawValue> baselineValues = repeated(18, "active");
        baselineValues.addAll(repeated(2, "closed"));
        List<RawValue> currentValues = repeated(18, "active");
        currentValues.addAll(repeated(2, "pending"));

        List<DriftFinding> findings = detector.detect(
                profile(ColumnType.CATEGORICAL, currentValues),
                profile(ColumnType.CATEGORICAL, baselineValues));

        DriftFinding missing = find(findings, DriftMetric.MISSING_CATEGORY).orElseThrow();
        assertEquals("closed", missing.getDetail());
        assertEquals(Severity.CRITICAL, missing.getSeverity());
        assertEquals(0.1, missing.getObservedValue(), 1e-12);

        DriftFinding added = find(findings, DriftMetric.NEW_CATEGORY).orElseThrow();
        assertEquals("pending", added.getDetail());
        assertEquals(Severity.WARNING, added.getSeverity());
    }

    @Test
    @DisplayName("Should not flag rare vanished categories")
    void testDetect_RareMissingCategory() {
        List<RawValue> baselineValues = repeated(99, "a");
        baselineValues.add(RawValue.text("rare"));

        List<DriftFinding> findings = detector.detect(
                profile(ColumnType.CATEGORICAL, repeated(100, "a")),
                profile(ColumnType.CATEGORICAL, baselineValues));
        assertTrue(find(findings, DriftMetric.MISSING_CATEGORY).isEmpty());
    }

    @Test
    @DisplayName("Should compare boolean and categorical columns by frequencies")
    void testDetect_BooleanAgainstCategorical() {
        List<DriftFinding> findings = detector.detect(
                profile(ColumnType.CATEGORICAL, repeated(10, "yes", "no")),
                profile(ColumnType.BOOLEAN, repeated(10, "true", "false")));

        assertEquals(2, findings.stream().filter(f -> f.getMetric() == DriftMetric.NEW_CATEGORY).count());
        assertEquals(2, findings.stream().filter(f -> f.getMetric() == DriftMetric.MISSING_CATEGORY).count());
    }

    @Test
    @DisplayName("Should match boolean literals against categorical values regardless of case")
    void testDetect_BooleanAgainstCategoricalMixedCase() {
        List<RawValue> currentValues = repeated(9, "True", "False");
        currentValues.addAll(repeated(2, "Unknown"));

        List<DriftFinding> findings = detector.detect(
                profile(ColumnType.CATEGORICAL, currentValues),
                profile(ColumnType.BOOLEAN, repeated(10, "True", "False")));

        assertTrue(find(findings, DriftMetric.MISSING_CATEGORY).isEmpty());
        List<DriftFinding> added = findings.stream()
                .filter(f -> f.getMetric() == DriftMetric.NEW_CATEGORY)
                .toList();
        assertEquals(1, added.size());
        assertEquals("unknown", added.get(0).getDetail());
        assertEquals(0.1, added.get(0).getObservedValue(), 1e-12);
    }

    // ============================================================================
    // Incompatible types
    // ============================================================================

    @Test
    @DisplayName("Should skip drift when types are not comparable")
    void testDetect_IncompatibleTypes() {
        ProfiledColumn baseline = profile(ColumnType.NUMERIC, repeated(10, "1", "2"));
        ProfiledColumn current = profile(ColumnType.TEXT, repeated(10, "a", "b"));

        assertTrue(detector.detect(current, baseline).isEmpty());
    }
}
