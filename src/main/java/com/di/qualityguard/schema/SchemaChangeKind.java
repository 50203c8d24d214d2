package com.di.qualityguard.schema;

import com.di.qualityguard.report.Severity;
import com.fasterxml.jackson.annotation.JsonValue;

/** What changed in the schema, with the severity such a change carries. */
public enum SchemaChangeKind {
    COLUMN_REMOVED(Severity.CRITICAL),
    COLUMN_ADDED(Severity.INFO),
    TYPE_CHANGED(Severity.WARNING);

    private final Severity severity;

    SchemaChangeKind(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
