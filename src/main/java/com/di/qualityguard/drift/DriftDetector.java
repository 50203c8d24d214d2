package com.di.qualityguard.drift;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.profile.ColumnProfile;
import com.di.qualityguard.profile.ColumnType;
import com.di.qualityguard.profile.ProfiledColumn;
import com.di.qualityguard.report.Severity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares one dataset column with the same-named baseline column. Every metric is evaluated
 * independently and reported only when it crosses its warning (or, for null rate, its noise)
 * threshold. Columns whose types are not drift-compatible yield no findings; the schema
 * differ reports the type change instead.
 */
public class DriftDetector {

    private final AnalysisConfig config;

    public DriftDetector(AnalysisConfig config) {
        this.config = config;
    }

    public List<DriftFinding> detect(ProfiledColumn current, ProfiledColumn baseline) {
        if (!baseline.getType().isDriftCompatibleWith(current.getType())) {
            return List.of();
        }
        List<DriftFinding> findings = new ArrayList<>();
        nullRateDelta(current.getProfile(), baseline.getProfile(), findings);

        if (current.getType() == ColumnType.NUMERIC && baseline.getType() == ColumnType.NUMERIC) {
            meanShift(current.getProfile(), baseline.getProfile(), findings);
            if (current.getSortedValues().length > 0 && baseline.getSortedValues().length > 0) {
                double psi = PopulationStabilityIndex.numeric(baseline.getSortedValues(), current.getSortedValues(),
                        config.getPsiBins(), config.getPsiEpsilon());
                psiFinding(current.getName(), psi, findings);
            }
        } else if (current.getType().isFrequencyBased()
                && !current.getValueCounts().isEmpty() && !baseline.getValueCounts().isEmpty()) {
            Map<String, Long> now = current.getValueCounts();
            Map<String, Long> before = baseline.getValueCounts();
            if (current.getType() != baseline.getType()) {
                // boolean counts are keyed in lower case
                now = foldCase(now);
                before = foldCase(before);
            }
            double psi = PopulationStabilityIndex.categorical(before, now, config.getPsiEpsilon());
            psiFinding(current.getName(), psi, findings);
            categoryChanges(current, baseline, now, before, findings);
        }
        return findings;
    }

    private void nullRateDelta(ColumnProfile current, ColumnProfile baseline, List<DriftFinding> findings) {
        if (current.getNullRate() == null || baseline.getNullRate() == null) {
            return;
        }
        double delta = Math.abs(current.getNullRate() - baseline.getNullRate());
        Severity severity;
        if (delta > config.getNullRateCritical()) {
            severity = Severity.CRITICAL;
        } else if (delta > config.getNullRateWarning()) {
            severity = Severity.WARNING;
        } else if (delta > config.getNullRateMinimum()) {
            severity = Severity.INFO;
        } else {
            return;
        }
        findings.add(DriftFinding.of(current.getName(), DriftMetric.NULL_RATE_DELTA, delta, severity));
    }

    private void meanShift(ColumnProfile current, ColumnProfile baseline, List<DriftFinding> findings) {
        if (current.getNumeric() == null || baseline.getNumeric() == null) {
            return;
        }
        double denominator = Math.max(baseline.getNumeric().getStdDev(), config.getMeanShiftEpsilon());
        double shift = Math.abs(current.getNumeric().getMean() - baseline.getNumeric().getMean()) / denominator;
        if (shift >= config.getMeanShiftCritical()) {
            findings.add(DriftFinding.of(current.getName(), DriftMetric.MEAN_SHIFT, shift, Severity.CRITICAL));
        } else if (shift >= config.getMeanShiftWarning()) {
            findings.add(DriftFinding.of(current.getName(), DriftMetric.MEAN_SHIFT, shift, Severity.WARNING));
        }
    }

    private void psiFinding(String column, double psi, List<DriftFinding> findings) {
        if (psi >= config.getPsiCritical()) {
            findings.add(DriftFinding.of(column, DriftMetric.POPULATION_STABILITY_INDEX, psi, Severity.CRITICAL));
        } else if (psi >= config.getPsiWarning()) {
            findings.add(DriftFinding.of(column, DriftMetric.POPULATION_STABILITY_INDEX, psi, Severity.WARNING));
        }
    }

    private void categoryChanges(ProfiledColumn current, ProfiledColumn baseline,
                                 Map<String, Long> now, Map<String, Long> before, List<DriftFinding> findings) {
        double nowTotal = current.getProfile().getNonNullCount();
        double beforeTotal = baseline.getProfile().getNonNullCount();

        for (Map.Entry<String, Long> e : now.entrySet()) {
            if (!before.containsKey(e.getKey())) {
                findings.add(new DriftFinding(current.getName(), DriftMetric.NEW_CATEGORY,
                        e.getValue() / nowTotal, Severity.WARNING, e.getKey()));
            }
        }
        for (Map.Entry<String, Long> e : before.entrySet()) {
            double share = e.getValue() / beforeTotal;
            if (!now.containsKey(e.getKey()) && share >= config.getMissingCategoryMinShare()) {
                findings.add(new DriftFinding(current.getName(), DriftMetric.MISSING_CATEGORY,
                        share, Severity.CRITICAL, e.getKey()));
            }
        }
    }

    private static Map<String, Long> foldCase(Map<String, Long> counts) {
        Map<String, Long> folded = new LinkedHashMap<>();
        counts.forEach((value, count) -> folded.merge(value.toLowerCase(Locale.ROOT), count, Long::sum));
        return folded;
    }
}
