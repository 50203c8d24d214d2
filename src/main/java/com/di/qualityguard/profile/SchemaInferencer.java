package com.di.qualityguard.profile;

import com.di.qualityguard.config.AnalysisConfig;
import com.di.qualityguard.table.RawValue;
import com.di.qualityguard.util.DateFormatUtils;
import com.di.qualityguard.util.TypeConverter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Assigns a {@link ColumnType} to a column from its non-missing values (trimmed).
 *
 * <p>Rules, first match wins: no values → text; all {@code true}/{@code false} → boolean;
 * all decimal numbers → numeric; all recognised dates/timestamps → datetime; few distinct
 * values (relative and absolute cap) → categorical; otherwise text. The result depends only
 * on the multiset of values, never on their order.
 */
public class SchemaInferencer {

    private final AnalysisConfig config;

    public SchemaInferencer(AnalysisConfig config) {
        this.config = config;
    }

    public ColumnType infer(List<RawValue> column) {
        List<String> values = presentValues(column);
        if (values.isEmpty()) {
            return ColumnType.TEXT;
        }
        if (values.stream().allMatch(TypeConverter::isBooleanLiteral)) {
            return ColumnType.BOOLEAN;
        }
        if (values.stream().allMatch(TypeConverter::isNumeric)) {
            return ColumnType.NUMERIC;
        }
        if (values.stream().allMatch(DateFormatUtils::isDateTime)) {
            return ColumnType.DATETIME;
        }
        Set<String> distinct = new HashSet<>(values);
        if (distinct.size() <= config.getCategoricalMaxFraction() * values.size()
                && distinct.size() <= config.getCategoricalMaxDistinct()) {
            return ColumnType.CATEGORICAL;
        }
        return ColumnType.TEXT;
    }

    /** Trimmed text of every non-missing cell, in table order. */
    static List<String> presentValues(List<RawValue> column) {
        List<String> values = new ArrayList<>(column.size());
        for (RawValue value : column) {
            if (!value.isMissing()) {
                values.add(value.getText().trim());
            }
        }
        return values;
    }
}
