package com.di.qualityguard.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Statistical summary of one column. Exactly one of the type-specific blocks is set,
 * matching {@link #type}: {@code numeric}, {@code topValues} (boolean and categorical),
 * {@code datetime} or {@code text}.
 *
 * <p>Invariants: {@code 0 <= nullCount <= rowCount}; {@code distinctCount} ignores nulls;
 * {@code nullRate} is null for a zero-row column.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "type", "rowCount", "nullCount", "nullRate", "distinctCount", "degraded",
        "sampleValues", "numeric", "topValues", "datetime", "text"})
public class ColumnProfile {
    String name;
    ColumnType type;
    int rowCount;
    int nullCount;
    Double nullRate;
    int distinctCount;
    /** True when the column could not be profiled as its inferred type and fell back to text. */
    boolean degraded;
    /** First few distinct non-null values in table order. */
    @Singular
    List<String> sampleValues;
    NumericStats numeric;
    List<ValueFrequency> topValues;
    DatetimeStats datetime;
    TextStats text;

    @JsonIgnore
    public int getNonNullCount() {
        return rowCount - nullCount;
    }
}
