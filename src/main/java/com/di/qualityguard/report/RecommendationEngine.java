package com.di.qualityguard.report;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.profile.ColumnProfile;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives fix suggestions from the dataset profiles: missing values, outliers, and columns
 * that did not fit their inferred type. Output follows column order, then the issue order above.
 */
public class RecommendationEngine {

    private final AnalysisConfig config;

    public RecommendationEngine(AnalysisConfig config) {
        this.config = config;
    }

    public List<Recommendation> recommend(List<ColumnProfile> profiles) {
        List<Recommendation> out = new ArrayList<>();
        for (ColumnProfile p : profiles) {
            Double nullRate = p.getNullRate();
            if (nullRate != null && nullRate >= config.getMissingValuesWarning()) {
                out.add(new Recommendation(p.getName(), RecommendationIssue.MISSING_VALUES,
                        "Consider imputing missing values (mean/median for numeric, mode for categorical).",
                        nullRate >= config.getMissingValuesCritical() ? Severity.CRITICAL : Severity.WARNING));
            }
            if (p.getNumeric() != null && p.getNumeric().getOutlierCount() > 0) {
                out.add(new Recommendation(p.getName(), RecommendationIssue.OUTLIERS,
                        "Consider clipping, winsorization, or removing outliers.",
                        Severity.WARNING));
            }
            if (p.isDegraded()) {
                out.add(new Recommendation(p.getName(), RecommendationIssue.TYPE_MISMATCH,
                        "Consider casting values to a single type or cleaning invalid entries.",
                        Severity.CRITICAL));
            }
        }
        return out;
    }
}
