package com.di.qualityguard.report;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.drift.DriftFinding;
import com.di.qualityguard.schema.SchemaFinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges schema and drift findings, orders them and derives the quality score.
 *
 * <p>Order: severity descending, then column name, then finding kind, then detail. Score:
 * 100 minus a fixed penalty per finding by severity, floored at 0.
 */
public class FindingAggregator {

    public static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::getSeverity, Comparator.reverseOrder())
            .thenComparing(Finding::getColumn)
            .thenComparing(Finding::getKind)
            .thenComparing(Finding::getDetail, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final AnalysisConfig config;

    public FindingAggregator(AnalysisConfig config) {
        this.config = config;
    }

    public AggregatedFindings aggregate(List<SchemaFinding> schemaFindings, List<DriftFinding> driftFindings) {
        List<Finding> all = new ArrayList<>(schemaFindings.size() + driftFindings.size());
        all.addAll(schemaFindings);
        all.addAll(driftFindings);
        all.sort(ORDER);

        List<DriftFinding> sortedDrift = new ArrayList<>(driftFindings);
        sortedDrift.sort(ORDER);

        Map<Severity, Long> tallies = new LinkedHashMap<>();
        for (Severity s : new Severity[] {Severity.CRITICAL, Severity.WARNING, Severity.INFO}) {
            tallies.put(s, 0L);
        }
        int penalty = 0;
        for (Finding f : all) {
            tallies.merge(f.getSeverity(), 1L, Long::sum);
            penalty += penaltyOf(f.getSeverity());
        }
        return new AggregatedFindings(
                Collections.unmodifiableList(all),
                Collections.unmodifiableList(sortedDrift),
                Math.max(0, 100 - penalty),
                Collections.unmodifiableMap(tallies));
    }

    public int penaltyOf(Severity severity) {
        switch (severity) {
            case CRITICAL:
                return config.getCriticalPenalty();
            case WARNING:
                return config.getWarningPenalty();
            default:
                return config.getInfoPenalty();
        }
    }

    /** Result of {@link #aggregate}; drift findings are re-ordered, schema findings are not touched. */
    public record AggregatedFindings(List<Finding> ordered,
                                     List<DriftFinding> driftFindings,
                                     int qualityScore,
                                     Map<Severity, Long> severityCounts) {}
}
