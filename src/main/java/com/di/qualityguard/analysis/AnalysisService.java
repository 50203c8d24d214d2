package com.di.qualityguard.analysis;

import com.di.qualityguard.ai.insights.AiInsightsService;
import com.di.qualityguard.config.AnalysisProperties;
import com.di.qualityguard.report.Report;
import com.di.qualityguard.table.CsvTableLoader;
import com.di.qualityguard.table.Table;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Request-level orchestration: parse the uploads, run the analyzer under the request deadline,
 * attach AI insights and record metrics. The analyzer itself never touches bytes or HTTP.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final CsvTableLoader tableLoader;
    private final QualityAnalyzer qualityAnalyzer;
    private final AnalysisMetrics analysisMetrics;
    private final AnalysisProperties analysisProperties;
    private final AiInsightsService aiInsightsService;

    /**
     * @param datasetCsv  dataset CSV bytes; required
     * @param baselineCsv baseline CSV bytes, or null/empty when there is no baseline
     * @return the report
     */
    public Report analyze(byte[] datasetCsv, byte[] baselineCsv) {
        long startMs = System.currentTimeMillis();
        try {
            Table dataset = tableLoader.load(datasetCsv, "dataset");
            Table baseline = baselineCsv != null && baselineCsv.length > 0
                    ? tableLoader.load(baselineCsv, "baseline")
                    : null;
            log.info("[ANALYZE] Starting dataset={}x{} baseline={}",
                    dataset.getRowCount(), dataset.getColumnCount(),
                    baseline != null ? baseline.getRowCount() + "x" + baseline.getColumnCount() : "none");

            CancellationSignal deadline = CancellationSignal.deadline(analysisProperties.getRequestTimeout());
            Report report = qualityAnalyzer.analyze(dataset, baseline, deadline);
            report = report.toBuilder()
                    .aiInsights(aiInsightsService.generate(report))
                    .build();

            long durationMs = System.currentTimeMillis() - startMs;
            analysisMetrics.recordSuccess(report, durationMs);
            log.info("[ANALYZE] Finished in {}ms: {}", durationMs, report.getSummary());
            return report;
        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - startMs;
            analysisMetrics.recordFailure(e.getClass().getSimpleName(), durationMs);
            log.warn("[ANALYZE] Failed after {}ms: {}", durationMs, e.getMessage());
            throw e;
        }
    }
}
