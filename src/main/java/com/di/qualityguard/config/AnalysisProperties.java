package com.di.qualityguard.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Single binding for all analysis configuration. Values are read once at startup and
 * frozen into an {@link AnalysisConfig}; nothing here is mutated afterwards.
 *
 * <pre>
 * qualityguard:
 *   analysis:
 *     worker-threads: 0
 *     request-timeout: 60s
 *     categorical-max-fraction: 0.2
 *     categorical-max-distinct: 50
 *     top-n: 10
 *     sample-size: 5
 *     preview-rows: 20
 *     null-rate-critical: 0.2
 *     null-rate-warning: 0.05
 *     null-rate-minimum: 0.01
 *     mean-shift-critical: 3
 *     mean-shift-warning: 1
 *     psi-bins: 10
 *     psi-critical: 0.25
 *     psi-warning: 0.1
 *     missing-category-min-share: 0.05
 *     critical-penalty: 15
 *     warning-penalty: 5
 *     info-penalty: 1
 * </pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "qualityguard.analysis")
public class AnalysisProperties {

    // ------------------------------------------------------------------ //
    // Execution                                                            //
    // ------------------------------------------------------------------ //

    /** Column worker pool size. 0 = number of available processors. */
    @Min(0)
    private int workerThreads = 0;

    /** Per-request budget; the analysis is cancelled cooperatively once it runs out. */
    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(60);

    // ------------------------------------------------------------------ //
    // Schema inference and profiling                                      //
    // ------------------------------------------------------------------ //

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double categoricalMaxFraction = 0.2;
    @Min(1)
    private int categoricalMaxDistinct = 50;
    @Min(1)
    private int topN = 10;
    @Min(0)
    private int sampleSize = 5;
    @Min(0)
    private int previewRows = 20;

    // ------------------------------------------------------------------ //
    // Drift thresholds                                                    //
    // ------------------------------------------------------------------ //

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double nullRateCritical = 0.2;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double nullRateWarning = 0.05;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double nullRateMinimum = 0.01;

    @DecimalMin("0.0")
    private double meanShiftCritical = 3.0;
    @DecimalMin("0.0")
    private double meanShiftWarning = 1.0;
    @DecimalMin(value = "0.0", inclusive = false)
    private double meanShiftEpsilon = 1e-9;

    @Min(1)
    private int psiBins = 10;
    @DecimalMin("0.0")
    private double psiCritical = 0.25;
    @DecimalMin("0.0")
    private double psiWarning = 0.1;
    @DecimalMin(value = "0.0", inclusive = false)
    private double psiEpsilon = 1e-4;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double missingCategoryMinShare = 0.05;

    // ------------------------------------------------------------------ //
    // Scoring and recommendations                                         //
    // ------------------------------------------------------------------ //

    @Min(0)
    private int criticalPenalty = 15;
    @Min(0)
    private int warningPenalty = 5;
    @Min(0)
    private int infoPenalty = 1;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double missingValuesWarning = 0.05;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double missingValuesCritical = 0.2;

    /** Freezes the current values into the immutable config handed to the analyzer. */
    public AnalysisConfig toAnalysisConfig() {
        return AnalysisConfig.builder()
                .categoricalMaxFraction(categoricalMaxFraction)
                .categoricalMaxDistinct(categoricalMaxDistinct)
                .topN(topN)
                .sampleSize(sampleSize)
                .previewRows(previewRows)
                .nullRateCritical(nullRateCritical)
                .nullRateWarning(nullRateWarning)
                .nullRateMinimum(nullRateMinimum)
                .meanShiftCritical(meanShiftCritical)
                .meanShiftWarning(meanShiftWarning)
                .meanShiftEpsilon(meanShiftEpsilon)
                .psiBins(psiBins)
                .psiCritical(psiCritical)
                .psiWarning(psiWarning)
                .psiEpsilon(psiEpsilon)
                .missingCategoryMinShare(missingCategoryMinShare)
                .criticalPenalty(criticalPenalty)
                .warningPenalty(warningPenalty)
                .infoPenalty(infoPenalty)
                .missingValuesWarning(missingValuesWarning)
                .missingValuesCritical(missingValuesCritical)
                .build();
    }

    /** Resolved pool size: configured value, or the processor count when 0. */
    public int getEffectiveWorkerThreads() {
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }
}
