package com.di.qualityguard.profile;

import com.fasterxml.jackson.annotation.JsonValue;

/** Semantic type assigned to a column once per table by {@link SchemaInferencer}. */
public enum ColumnType {
    NUMERIC,
    BOOLEAN,
    CATEGORICAL,
    DATETIME,
    TEXT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** Boolean and categorical columns are both summarised by value frequencies. */
    public boolean isFrequencyBased() {
        return this == BOOLEAN || this == CATEGORICAL;
    }

    /**
     * Whether drift between a baseline column of this type and a dataset column of
     * {@code other} can be measured. Same type always; boolean and categorical interchangeably.
     */
    public boolean isDriftCompatibleWith(ColumnType other) {
        return this == other || (isFrequencyBased() && other != null && other.isFrequencyBased());
    }
}
