package com.di.qualityguard.drift;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Population stability index between an expected (baseline) and an actual (dataset)
 * distribution: {@code sum((a - e) * ln(a / e))} over buckets. Bucket shares are floored at
 * {@code epsilon} so empty buckets contribute a large but finite term.
 */
public final class PopulationStabilityIndex {

    private PopulationStabilityIndex() {}

    /**
     * Numeric PSI over {@code bins} equal-width bins spanning the baseline range. Values outside
     * that range fall into the first or last bin. A constant baseline collapses to one bin.
     *
     * @param expected non-empty baseline values
     * @param actual   non-empty dataset values
     */
    public static double numeric(double[] expected, double[] actual, int bins, double epsilon) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : expected) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        int binCount = max > min ? bins : 1;
        double width = (max - min) / binCount;
        double[] expectedShares = histogram(expected, min, width, binCount);
        double[] actualShares = histogram(actual, min, width, binCount);
        return index(expectedShares, actualShares, epsilon);
    }

    /** Categorical PSI over the union of categories (baseline order, then new ones). */
    public static double categorical(Map<String, Long> expected, Map<String, Long> actual, double epsilon) {
        Set<String> categories = new LinkedHashSet<>(expected.keySet());
        categories.addAll(actual.keySet());
        double expectedTotal = total(expected);
        double actualTotal = total(actual);
        double[] e = new double[categories.size()];
        double[] a = new double[categories.size()];
        int i = 0;
        for (String category : categories) {
            e[i] = expected.getOrDefault(category, 0L) / expectedTotal;
            a[i] = actual.getOrDefault(category, 0L) / actualTotal;
            i++;
        }
        return index(e, a, epsilon);
    }

    private static double[] histogram(double[] values, double min, double width, int binCount) {
        double[] shares = new double[binCount];
        for (double v : values) {
            int bin = width > 0 ? (int) Math.floor((v - min) / width) : 0;
            bin = Math.max(0, Math.min(binCount - 1, bin));
            shares[bin]++;
        }
        for (int i = 0; i < binCount; i++) {
            shares[i] /= values.length;
        }
        return shares;
    }

    private static double index(double[] expected, double[] actual, double epsilon) {
        double psi = 0.0;
        for (int i = 0; i < expected.length; i++) {
            double e = Math.max(expected[i], epsilon);
            double a = Math.max(actual[i], epsilon);
            psi += (a - e) * Math.log(a / e);
        }
        return psi;
    }

    private static double total(Map<String, Long> counts) {
        long sum = 0;
        for (long c : counts.values()) {
            sum += c;
        }
        return sum;
    }
}
