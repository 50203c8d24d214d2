package com.di.qualityguard.report;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/** Remediation advice for one column. Does not count towards the quality score. */
@Value
@JsonPropertyOrder({"column", "issue", "recommendation", "severity"})
public class Recommendation {
    String column;
    RecommendationIssue issue;
    String recommendation;
    Severity severity;
}
