package com.di.qualityguard.report;

/**
 * Common view over schema and drift findings, used for ordering and scoring.
 */
public interface Finding {

    String getColumn();

    Severity getSeverity();

    /** Stable wire name of what was found, e.g. {@code column_removed} or {@code mean-shift}. */
    String getKind();

    /** Extra discriminator (a category value) or null. */
    default String getDetail() {
        return null;
    }
}
