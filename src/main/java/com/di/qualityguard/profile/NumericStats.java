package com.di.qualityguard.profile;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/** Summary of a numeric column. Standard deviation is the population one (divide by N). */
@Value
@Builder
@JsonPropertyOrder({"min", "max", "mean", "stdDev", "p25", "p50", "p75", "outlierCount"})
public class NumericStats {
    double min;
    double max;
    double mean;
    double stdDev;
    double p25;
    double p50;
    double p75;
    /** Values outside the 1.5 x IQR fences; 0 when the IQR is 0. */
    long outlierCount;
}
