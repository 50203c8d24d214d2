package com.di.qualityguard.drift;

import com.di.qualityguard.report.Finding;
import com.di.qualityguard.report.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * One drift metric that crossed a threshold for one column.
 *
 * <p>{@code observedValue} is the metric itself (delta, shift in standard deviations, PSI) or,
 * for category findings, the share of the category on the side where it is present.
 * {@code detail} names the category for category findings.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"column", "metric", "observedValue", "severity", "detail"})
public class DriftFinding implements Finding {
    String column;
    DriftMetric metric;
    double observedValue;
    Severity severity;
    String detail;

    public static DriftFinding of(String column, DriftMetric metric, double observedValue, Severity severity) {
        return new DriftFinding(column, metric, observedValue, severity, null);
    }

    @Override
    @JsonIgnore
    public String getKind() {
        return metric.wireName();
    }
}
