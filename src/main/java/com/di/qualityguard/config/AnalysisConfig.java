package com.di.qualityguard.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable thresholds for one analysis. Built once at startup from {@link AnalysisProperties}
 * and passed explicitly to every analysis component; {@link #defaults()} gives the documented
 * defaults used by tests.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisConfig {

    // ---- schema inference ----
    /** Max distinct/non-null ratio for a column to be typed categorical. */
    @Builder.Default double categoricalMaxFraction = 0.2;
    /** Absolute cap on distinct values for a categorical column. */
    @Builder.Default int categoricalMaxDistinct = 50;

    // ---- profiling ----
    /** Size of the top-value list in categorical/boolean profiles. */
    @Builder.Default int topN = 10;
    /** Number of distinct sample values kept per profile. */
    @Builder.Default int sampleSize = 5;
    /** Leading dataset rows copied verbatim into the report preview. */
    @Builder.Default int previewRows = 20;

    // ---- null-rate delta ----
    @Builder.Default double nullRateCritical = 0.2;
    @Builder.Default double nullRateWarning = 0.05;
    /** Deltas at or below this are noise and never reported. */
    @Builder.Default double nullRateMinimum = 0.01;

    // ---- mean shift (in baseline standard deviations) ----
    @Builder.Default double meanShiftCritical = 3.0;
    @Builder.Default double meanShiftWarning = 1.0;
    /** Floor for the baseline standard deviation in the mean-shift denominator. */
    @Builder.Default double meanShiftEpsilon = 1e-9;

    // ---- population stability index ----
    @Builder.Default int psiBins = 10;
    @Builder.Default double psiCritical = 0.25;
    @Builder.Default double psiWarning = 0.1;
    /** Floor applied to every bucket share so empty buckets do not yield infinite PSI. */
    @Builder.Default double psiEpsilon = 1e-4;

    // ---- categories ----
    /** Baseline share from which a vanished category is reported. */
    @Builder.Default double missingCategoryMinShare = 0.05;

    // ---- scoring ----
    @Builder.Default int criticalPenalty = 15;
    @Builder.Default int warningPenalty = 5;
    @Builder.Default int infoPenalty = 1;

    // ---- recommendations ----
    /** Null rate from which a missing-values recommendation is made. */
    @Builder.Default double missingValuesWarning = 0.05;
    /** Null rate from which that recommendation becomes critical. */
    @Builder.Default double missingValuesCritical = 0.2;

    public static AnalysisConfig defaults() {
        return AnalysisConfig.builder().build();
    }
}
