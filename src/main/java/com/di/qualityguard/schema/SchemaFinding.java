package com.di.qualityguard.schema;

import com.di.qualityguard.profile.ColumnType;
import com.di.qualityguard.report.Finding;
import com.di.qualityguard.report.Severity;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/** A column added, removed, or re-typed between baseline and dataset. */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"changeKind", "column", "previousType", "currentType", "severity"})
public class SchemaFinding implements Finding {
    SchemaChangeKind changeKind;
    String column;
    /** Baseline type; only for {@link SchemaChangeKind#TYPE_CHANGED}. */
    ColumnType previousType;
    /** Dataset type; only for {@link SchemaChangeKind#TYPE_CHANGED}. */
    ColumnType currentType;

    public static SchemaFinding removed(String column) {
        return new SchemaFinding(SchemaChangeKind.COLUMN_REMOVED, column, null, null);
    }

    public static SchemaFinding added(String column) {
        return new SchemaFinding(SchemaChangeKind.COLUMN_ADDED, column, null, null);
    }

    public static SchemaFinding typeChanged(String column, ColumnType previous, ColumnType current) {
        return new SchemaFinding(SchemaChangeKind.TYPE_CHANGED, column, previous, current);
    }

    @Override
    public Severity getSeverity() {
        return changeKind.getSeverity();
    }

    @Override
    @JsonIgnore
    public String getKind() {
        return changeKind.wireName();
    }
}
