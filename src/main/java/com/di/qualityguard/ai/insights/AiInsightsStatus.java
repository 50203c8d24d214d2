package com.di.qualityguard.ai.insights;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AiInsightsStatus {
    OK,
    DISABLED,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
