package com.di.qualityguard.drift;

import com.fasterxml.jackson.annotation.JsonValue;

/** Drift measures computed per shared column. */
public enum DriftMetric {
    NULL_RATE_DELTA,
    MEAN_SHIFT,
    POPULATION_STABILITY_INDEX,
    NEW_CATEGORY,
    MISSING_CATEGORY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }
}
