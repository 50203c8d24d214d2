package com.di.qualityguard.report;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.drift.DriftFinding;
import com.di.qualityguard.drift.DriftMetric;
import com.di.qualityguard.schema.SchemaFinding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for FindingAggregator.
 */
@DisplayName("FindingAggregator Tests")
class FindingAggregatorTest {

    private FindingAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new FindingAggregator(AnalysisConfig.defaults());
    }

    @Test
    @DisplayName("Should score 65 for two critical and one warning finding")
    void testAggregate_Score() {
        List<SchemaFinding> schema = List.of(SchemaFinding.removed("a"));
        List<DriftFinding> drift = List.of(
                DriftFinding.of("b", DriftMetric.MEAN_SHIFT, 4.0, Severity.CRITICAL),
                DriftFinding.of("c", DriftMetric.POPULATION_STABILITY_INDEX, 0.15, Severity.WARNING));

        FindingAggregator.AggregatedFindings result = aggregator.aggregate(schema, drift);

        assertEquals(65, result.qualityScore());
        assertEquals(2L, result.severityCounts().get(Severity.CRITICAL));
        assertEquals(1L, result.severityCounts().get(Severity.WARNING));
        assertEquals(0L, result.severityCounts().get(Severity.INFO));
    }

    @Test
    @DisplayName("Should score 100 with no findings")
    void testAggregate_Empty() {
        FindingAggregator.AggregatedFindings result = aggregator.aggregate(List.of(), List.of());
        assertEquals(100, result.qualityScore());
        assertTrue(result.ordered().isEmpty());
        assertEquals(List.of(Severity.CRITICAL, Severity.WARNING, Severity.INFO),
                new ArrayList<>(result.severityCounts().keySet()));
    }

    @Test
    @DisplayName("Should floor the score at zero")
    void testAggregate_ScoreFloor() {
        List<DriftFinding> drift = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            drift.add(DriftFinding.of("c" + i, DriftMetric.MEAN_SHIFT, 5.0, Severity.CRITICAL));
        }
        assertEquals(0, aggregator.aggregate(List.of(), drift).qualityScore());
    }

    @Test
    @DisplayName("Should order by severity, then column, then kind, then detail")
    void testAggregate_Order() {
        DriftFinding infoA = DriftFinding.of("a", DriftMetric.NULL_RATE_DELTA, 0.02, Severity.INFO);
        DriftFinding warnB = DriftFinding.of("b", DriftMetric.POPULATION_STABILITY_INDEX, 0.2, Severity.WARNING);
        DriftFinding warnAShift = DriftFinding.of("a", DriftMetric.MEAN_SHIFT, 1.5, Severity.WARNING);
        DriftFinding newZ = new DriftFinding("a", DriftMetric.NEW_CATEGORY, 0.1, Severity.WARNING, "z");
        DriftFinding newY = new DriftFinding("a", DriftMetric.NEW_CATEGORY, 0.1, Severity.WARNING, "y");
        SchemaFinding removedC = SchemaFinding.removed("c");

        FindingAggregator.AggregatedFindings result = aggregator.aggregate(
                List.of(removedC), List.of(infoA, warnB, warnAShift, newZ, newY));

        assertEquals(List.of(removedC, warnAShift, newY, newZ, warnB, infoA), result.ordered());
        assertEquals(List.of(warnAShift, newY, newZ, warnB, infoA), result.driftFindings());
    }

    @ParameterizedTest
    @CsvSource({"CRITICAL, 15", "WARNING, 5", "INFO, 1"})
    @DisplayName("Should use the configured penalty per severity")
    void testPenaltyOf(Severity severity, int expected) {
        assertEquals(expected, aggregator.penaltyOf(severity));
    }

    @Test
    @DisplayName("Should honour custom penalties")
    void testAggregate_CustomPenalties() {
        FindingAggregator custom = new FindingAggregator(AnalysisConfig.defaults().toBuilder().infoPenalty(10).build());
        assertEquals(90, custom.aggregate(List.of(SchemaFinding.added("x")), List.of()).qualityScore());
    }
}
