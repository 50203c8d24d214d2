package com.di.qualityguard.profile;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Descriptive statistics over primitive arrays, backed by Commons Math. Callers guarantee
 * non-empty input.
 *
 * <p>Moments come from {@link SummaryStatistics}, which updates the mean one value at a time,
 * so a column of large finite values keeps a finite mean.
 */
public final class Statistics {

    private Statistics() {}

    public static SummaryStatistics summarize(double[] values) {
        SummaryStatistics summary = new SummaryStatistics();
        for (double v : values) {
            summary.addValue(v);
        }
        return summary;
    }

    /** Population standard deviation (divides by N). */
    public static double populationStdDev(SummaryStatistics summary) {
        return Math.sqrt(summary.getPopulationVariance());
    }

    /** Single quantile; see {@link #quantiles(double[], double...)}. */
    public static double quantile(double[] sorted, double q) {
        return quantiles(sorted, q)[0];
    }

    /**
     * Quantiles by linear interpolation between the order statistics around {@code q * (n - 1)}
     * (estimation type R-7). Each result is clamped to its two neighbours so successive
     * quantiles never decrease.
     *
     * @param sorted ascending values
     * @param qs     quantiles in [0, 1]
     */
    public static double[] quantiles(double[] sorted, double... qs) {
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(sorted);
        double[] result = new double[qs.length];
        for (int i = 0; i < qs.length; i++) {
            double q = Math.min(Math.max(qs[i], 0.0), 1.0);
            double position = q * (sorted.length - 1);
            double lower = sorted[(int) Math.floor(position)];
            double upper = sorted[(int) Math.ceil(position)];
            double estimate = q == 0.0 ? sorted[0] : percentile.evaluate(q * 100.0);
            result[i] = Math.min(Math.max(estimate, lower), upper);
        }
        return result;
    }

    /** Count of values outside {@code [q1 - 1.5 IQR, q3 + 1.5 IQR]}; 0 for a zero IQR. */
    public static long iqrOutliers(double[] values, double q1, double q3) {
        double iqr = q3 - q1;
        if (iqr == 0.0) {
            return 0;
        }
        double lowerFence = q1 - 1.5 * iqr;
        double upperFence = q3 + 1.5 * iqr;
        long outliers = 0;
        for (double v : values) {
            if (v < lowerFence || v > upperFence) {
                outliers++;
            }
        }
        return outliers;
    }
}
