package com.di.qualityguard.report;

import com.fasterxml.jackson.annotation.JsonValue;

/** Urgency of a finding. Declaration order is the severity order: INFO &lt; WARNING &lt; CRITICAL. */
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
