package com.di.qualityguard.schema;

import com.di.qualityguard.profile.ColumnType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compares the dataset schema with the baseline schema. A schema maps column names, in column
 * order, to inferred types; a column that degraded while profiling keeps its inferred type here.
 * Columns are matched by exact name. Output order: removed columns in baseline order, then added
 * columns in dataset order, then type changes in dataset order.
 */
public class SchemaDiffer {

    public List<SchemaFinding> diff(Map<String, ColumnType> current, Map<String, ColumnType> previous) {
        List<SchemaFinding> findings = new ArrayList<>();
        for (String column : previous.keySet()) {
            if (!current.containsKey(column)) {
                findings.add(SchemaFinding.removed(column));
            }
        }
        for (String column : current.keySet()) {
            if (!previous.containsKey(column)) {
                findings.add(SchemaFinding.added(column));
            }
        }
        for (Map.Entry<String, ColumnType> e : current.entrySet()) {
            ColumnType before = previous.get(e.getKey());
            if (before != null && before != e.getValue()) {
                findings.add(SchemaFinding.typeChanged(e.getKey(), before, e.getValue()));
            }
        }
        return findings;
    }
}
