package com.di.qualityguard.analysis;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.drift.DriftDetector;
import com.di.qualityguard.drift.DriftFinding;
import com.di.qualityguard.profile.ColumnProfile;
import com.di.qualityguard.profile.ColumnProfiler;
import com.di.qualityguard.profile.ColumnType;
import com.di.qualityguard.profile.ProfiledColumn;
import com.di.qualityguard.profile.SchemaInferencer;
import com.di.qualityguard.report.DataPreview;
import com.di.qualityguard.report.FindingAggregator;
import com.di.qualityguard.report.RecommendationEngine;
import com.di.qualityguard.report.Report;
import com.di.qualityguard.report.ReportBuilder;
import com.di.qualityguard.schema.SchemaDiffer;
import com.di.qualityguard.schema.SchemaFinding;
import com.di.qualityguard.table.InvalidTableException;
import com.di.qualityguard.table.RawValue;
import com.di.qualityguard.table.Table;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Entry point of the profiling-and-comparison engine.
 *
 * <p>Flow: infer + profile every dataset column (and baseline column, when there is a baseline)
 * in parallel → schema diff → per-column drift in parallel → aggregate, recommend, build.
 * A baseline with zero rows carries no distribution and is treated as absent.
 *
 * <p>Holds only the immutable config and the executor; safe to share across requests.
 */
@Slf4j
public class QualityAnalyzer {

    private final AnalysisConfig config;
    private final ColumnTaskRunner runner;

    public QualityAnalyzer(AnalysisConfig config, Executor executor) {
        this.config = config;
        this.runner = new ColumnTaskRunner(executor);
    }

    /** {@link #analyze(Table, Table, CancellationSignal)} without cancellation. */
    public Report analyze(Table dataset, Table baseline) {
        return analyze(dataset, baseline, CancellationSignal.NONE);
    }

    /**
     * @param dataset      table under test; required
     * @param baseline     trusted reference table, or null
     * @param cancellation polled between column computations
     * @throws InvalidTableException       when no dataset is given
     * @throws AnalysisCancelledException  when the signal is raised before the report is complete
     */
    public Report analyze(Table dataset, Table baseline, CancellationSignal cancellation) {
        if (dataset == null) {
            throw new InvalidTableException("No dataset supplied");
        }
        Table reference = baseline;
        if (reference != null && reference.getRowCount() == 0) {
            log.info("[ANALYZE] Baseline has no rows; analysing without baseline");
            reference = null;
        }

        SchemaInferencer inferencer = new SchemaInferencer(config);
        ColumnProfiler profiler = new ColumnProfiler(config);

        List<ProfiledColumn> current = profileTable("dataset", dataset, inferencer, profiler, cancellation);
        List<ColumnProfile> currentProfiles = profilesOf(current);

        List<SchemaFinding> schemaFindings = List.of();
        List<DriftFinding> driftFindings = List.of();
        if (reference != null) {
            List<ProfiledColumn> previous = profileTable("baseline", reference, inferencer, profiler, cancellation);
            cancellation.throwIfCancelled("schema diff");
            schemaFindings = new SchemaDiffer().diff(schemaOf(current), schemaOf(previous));
            driftFindings = detectDrift(current, previous, reference, cancellation);
        }

        cancellation.throwIfCancelled("aggregation");
        FindingAggregator.AggregatedFindings aggregated =
                new FindingAggregator(config).aggregate(schemaFindings, driftFindings);
        Report report = new ReportBuilder().build(
                dataset.getRowCount(),
                currentProfiles,
                reference != null ? reference.getRowCount() : null,
                schemaFindings,
                aggregated,
                new RecommendationEngine(config).recommend(currentProfiles),
                DataPreview.of(dataset, config.getPreviewRows()));

        log.info("[ANALYZE] Completed rows={} columns={} baseline={} schemaFindings={} driftFindings={} score={}",
                report.getRowCount(), report.getColumnCount(), report.isBaselineProvided(),
                schemaFindings.size(), driftFindings.size(), report.getQualityScore());
        return report;
    }

    private List<ProfiledColumn> profileTable(String label, Table table, SchemaInferencer inferencer,
                                              ColumnProfiler profiler, CancellationSignal cancellation) {
        return runner.runAll(label + " profiling", table.getColumnCount(), index -> {
            String name = table.getColumnNames().get(index);
            List<RawValue> column = table.getColumn(index);
            try {
                ColumnType type = inferencer.infer(column);
                return profiler.profile(name, column, type);
            } catch (RuntimeException e) {
                log.error("[PROFILER] Unexpected failure profiling {} column '{}'; reporting it as text",
                        label, name, e);
                return profiler.profile(name, column, ColumnType.TEXT);
            }
        }, cancellation);
    }

    private List<DriftFinding> detectDrift(List<ProfiledColumn> current, List<ProfiledColumn> previous,
                                           Table reference, CancellationSignal cancellation) {
        DriftDetector detector = new DriftDetector(config);
        Map<String, Integer> baselineIndex = reference.getColumnIndex();
        List<List<DriftFinding>> perColumn = runner.runAll("drift detection", current.size(), index -> {
            ProfiledColumn column = current.get(index);
            Integer baselinePosition = baselineIndex.get(column.getName());
            if (baselinePosition == null) {
                return List.of();
            }
            try {
                return detector.detect(column, previous.get(baselinePosition));
            } catch (RuntimeException e) {
                log.warn("[DRIFT] Skipping drift for column '{}': {}", column.getName(), e.getMessage(), e);
                return List.of();
            }
        }, cancellation);

        List<DriftFinding> all = new ArrayList<>();
        perColumn.forEach(all::addAll);
        return all;
    }

    private static Map<String, ColumnType> schemaOf(List<ProfiledColumn> columns) {
        Map<String, ColumnType> schema = new LinkedHashMap<>();
        for (ProfiledColumn c : columns) {
            schema.put(c.getName(), c.getInferredType());
        }
        return schema;
    }

    private static List<ColumnProfile> profilesOf(List<ProfiledColumn> columns) {
        List<ColumnProfile> profiles = new ArrayList<>(columns.size());
        for (ProfiledColumn c : columns) {
            profiles.add(c.getProfile());
        }
        return profiles;
    }
}
