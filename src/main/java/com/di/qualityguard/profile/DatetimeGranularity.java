package com.di.qualityguard.profile;

import com.fasterxml.jackson.annotation.JsonValue;

/** Finest time unit actually used by the values of a datetime column. */
public enum DatetimeGranularity {
    MONTH,
    DAY,
    HOUR,
    MINUTE,
    SECOND,
    SUB_SECOND;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
