package com.di.qualityguard.report;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationIssue {
    MISSING_VALUES,
    OUTLIERS,
    TYPE_MISMATCH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
