package com.di.qualityguard.analysis;

import com.di.qualityguard.report.Report;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for analysis requests: duration, outcome counts, table width, quality
 * score and findings per severity.
 */
@Slf4j
@Component
public class AnalysisMetrics {

    private final MeterRegistry meterRegistry;

    private final Timer analysisTimer;
    private final Counter successCounter;
    private final Counter errorCounter;
    private final DistributionSummary columnCountDistribution;
    private final DistributionSummary rowCountDistribution;
    private final DistributionSummary qualityScoreDistribution;

    public AnalysisMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.analysisTimer = Timer.builder("qualityguard.analysis.duration")
                .description("Time taken to analyse a dataset (and baseline)")
                .register(meterRegistry);

        this.successCounter = Counter.builder("qualityguard.analysis.total")
                .description("Total number of analyses")
                .tag("status", "success")
                .register(meterRegistry);

        this.errorCounter = Counter.builder("qualityguard.analysis.total")
                .description("Total number of failed analyses")
                .tag("status", "error")
                .register(meterRegistry);

        this.columnCountDistribution = DistributionSummary.builder("qualityguard.analysis.columns")
                .description("Distribution of dataset column counts")
                .register(meterRegistry);

        this.rowCountDistribution = DistributionSummary.builder("qualityguard.analysis.rows")
                .description("Distribution of dataset row counts")
                .baseUnit("rows")
                .register(meterRegistry);

        this.qualityScoreDistribution = DistributionSummary.builder("qualityguard.analysis.quality.score")
                .description("Distribution of report quality scores")
                .register(meterRegistry);
    }

    /**
     * Records a completed analysis.
     *
     * @param report     the produced report
     * @param durationMs wall-clock time in milliseconds
     */
    public void recordSuccess(Report report, long durationMs) {
        successCounter.increment();
        analysisTimer.record(durationMs, TimeUnit.MILLISECONDS);
        columnCountDistribution.record(report.getColumnCount());
        rowCountDistribution.record(report.getRowCount());
        qualityScoreDistribution.record(report.getQualityScore());
        for (Map.Entry<String, Long> e : report.getSeverityCounts().entrySet()) {
            Counter.builder("qualityguard.findings.total")
                    .description("Findings reported, by severity")
                    .tag("severity", e.getKey())
                    .register(meterRegistry)
                    .increment(e.getValue());
        }
        log.debug("Recorded analysis: columns={}, score={}, durationMs={}",
                report.getColumnCount(), report.getQualityScore(), durationMs);
    }

    /**
     * Records a failed analysis.
     *
     * @param errorType  simple class name of the failure
     * @param durationMs wall-clock time in milliseconds
     */
    public void recordFailure(String errorType, long durationMs) {
        errorCounter.increment();
        analysisTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded analysis failure: errorType={}, durationMs={}", errorType, durationMs);
    }
}
