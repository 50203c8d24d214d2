package com.di.qualityguard.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable column-major table of raw cells.
 *
 * <p>Column names are unique and ordered; every column holds exactly {@link #getRowCount()}
 * values. Validation happens at construction, so a {@code Table} instance is always
 * analysable.
 */
public final class Table {

    private final List<String> columnNames;
    private final Map<String, Integer> columnIndex;
    private final List<List<RawValue>> columns;
    private final int rowCount;

    private Table(List<String> columnNames, List<List<RawValue>> columns) {
        if (columnNames.isEmpty()) {
            throw new InvalidTableException("Table has no columns");
        }
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < columnNames.size(); i++) {
            String name = columnNames.get(i);
            if (name == null) {
                throw new InvalidTableException("Column " + i + " has no name");
            }
            if (index.putIfAbsent(name, i) != null) {
                throw new InvalidTableException("Duplicate column name: " + name);
            }
        }
        int expected = columns.get(0).size();
        for (int i = 1; i < columns.size(); i++) {
            if (columns.get(i).size() != expected) {
                throw new InvalidTableException(String.format(
                        "Column '%s' has %d values, expected %d (column '%s')",
                        columnNames.get(i), columns.get(i).size(), expected, columnNames.get(0)));
            }
        }
        List<List<RawValue>> copies = new ArrayList<>(columns.size());
        for (List<RawValue> column : columns) {
            copies.add(Collections.unmodifiableList(new ArrayList<>(column)));
        }
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.columnIndex = Collections.unmodifiableMap(index);
        this.columns = Collections.unmodifiableList(copies);
        this.rowCount = expected;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a table from plain strings; {@code null} cells become {@link RawValue#missing()}.
     * Iteration order of the map is the column order.
     */
    public static Table ofStrings(Map<String, List<String>> data) {
        Builder builder = builder();
        data.forEach(builder::stringColumn);
        return builder.build();
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    /** Column name to position mapping, in column order. */
    public Map<String, Integer> getColumnIndex() {
        return columnIndex;
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    public int getRowCount() {
        return rowCount;
    }

    public boolean hasColumn(String name) {
        return columnIndex.containsKey(name);
    }

    public List<RawValue> getColumn(int index) {
        return columns.get(index);
    }

    public List<RawValue> getColumn(String name) {
        Integer index = columnIndex.get(name);
        if (index == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return columns.get(index);
    }

    @Override
    public String toString() {
        return "Table{columns=" + columnNames + ", rows=" + rowCount + "}";
    }

    public static final class Builder {
        private final List<String> names = new ArrayList<>();
        private final List<List<RawValue>> values = new ArrayList<>();

        private Builder() {
        }

        public Builder column(String name, List<RawValue> columnValues) {
            names.add(name);
            values.add(columnValues);
            return this;
        }

        public Builder stringColumn(String name, List<String> columnValues) {
            List<RawValue> raw = new ArrayList<>(columnValues.size());
            for (String v : columnValues) {
                raw.add(RawValue.text(v));
            }
            return column(name, raw);
        }

        /**
         * @throws InvalidTableException when the collected columns do not form a valid table
         */
        public Table build() {
            return new Table(names, values);
        }
    }
}
