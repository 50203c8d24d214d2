package com.di.qualityguard.profile;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for Statistics.
 */
@DisplayName("Statistics Tests")
class StatisticsTest {

    @Test
    @DisplayName("Should compute mean and population standard deviation")
    void testMeanAndStdDev() {
        SummaryStatistics summary = Statistics.summarize(new double[] {2, 4, 4, 4, 5, 5, 7, 9});
        assertEquals(5.0, summary.getMean(), 1e-12);
        assertEquals(2.0, Statistics.populationStdDev(summary), 1e-12);
    }

    @Test
    @DisplayName("Should keep the mean finite for values near the double range limit")
    void testMean_LargeFiniteValues() {
        double[] values = {1e308, 1e308, 1e308, 1e308};
        SummaryStatistics summary = Statistics.summarize(values);

        assertEquals(1e308, summary.getMean());
        assertEquals(0.0, Statistics.populationStdDev(summary));
        assertTrue(summary.getMin() <= summary.getMean());
        assertTrue(summary.getMean() <= summary.getMax());
    }

    @Test
    @DisplayName("Should return ordered quartiles in one call")
    void testQuantiles_Quartiles() {
        double[] quartiles = Statistics.quantiles(new double[] {1, 2, 3, 4, 5}, 0.25, 0.5, 0.75);
        assertArrayEquals(new double[] {2.0, 3.0, 4.0}, quartiles, 1e-12);
    }

    @ParameterizedTest
    @CsvSource({"0.0, 1.0", "0.25, 1.75", "0.5, 2.5", "0.75, 3.25", "1.0, 4.0"})
    @DisplayName("Should interpolate quantiles linearly")
    void testQuantile(double q, double expected) {
        assertEquals(expected, Statistics.quantile(new double[] {1, 2, 3, 4}, q), 1e-12);
    }

    @Test
    @DisplayName("Should return the single value for every quantile of one element")
    void testQuantile_SingleValue() {
        double[] one = {7.5};
        assertEquals(7.5, Statistics.quantile(one, 0.25));
        assertEquals(7.5, Statistics.quantile(one, 0.75));
    }

    @Test
    @DisplayName("Should count values outside the IQR fences")
    void testIqrOutliers() {
        double[] sorted = {1, 2, 3, 4, 100};
        double q1 = Statistics.quantile(sorted, 0.25);
        double q3 = Statistics.quantile(sorted, 0.75);
        assertEquals(1, Statistics.iqrOutliers(sorted, q1, q3));
    }

    @Test
    @DisplayName("Should report no outliers for a zero IQR")
    void testIqrOutliers_ZeroIqr() {
        double[] sorted = {5, 5, 5, 5, 50};
        assertEquals(0, Statistics.iqrOutliers(sorted, 5, 5));
    }
}
