package com.di.qualityguard.profile;

import java.util.Collections;
import java.util.Map;

/**
 * A {@link ColumnProfile} together with the distribution data drift detection needs but the
 * report does not carry: the sorted numeric values and the full value-frequency table
 * (first-seen order). Lives only for the duration of one analysis.
 */
public final class ProfiledColumn {

    private static final double[] NO_VALUES = new double[0];

    private final ColumnType inferredType;
    private final ColumnProfile profile;
    private final double[] sortedValues;
    private final Map<String, Long> valueCounts;

    ProfiledColumn(ColumnType inferredType, ColumnProfile profile, double[] sortedValues,
                   Map<String, Long> valueCounts) {
        this.inferredType = inferredType;
        this.profile = profile;
        this.sortedValues = sortedValues != null ? sortedValues : NO_VALUES;
        this.valueCounts = valueCounts != null ? Collections.unmodifiableMap(valueCounts) : Map.of();
    }

    public ColumnProfile getProfile() {
        return profile;
    }

    public String getName() {
        return profile.getName();
    }

    /** Type of the profile; TEXT when the column degraded. */
    public ColumnType getType() {
        return profile.getType();
    }

    /** Type the column was profiled as, before any degradation. Schema comparison uses this. */
    public ColumnType getInferredType() {
        return inferredType;
    }

    /** Parsed numeric values in ascending order; empty for non-numeric columns. */
    public double[] getSortedValues() {
        return sortedValues;
    }

    /** Every distinct non-null value with its count, in order of first appearance. */
    public Map<String, Long> getValueCounts() {
        return valueCounts;
    }
}
