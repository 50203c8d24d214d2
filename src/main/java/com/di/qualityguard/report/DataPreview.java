package com.di.qualityguard.report;

import com.di.qualityguard.table.RawValue;
import com.di.qualityguard.table.Table;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The leading rows of the dataset as loaded, for display next to the report. Cells keep their
 * raw text; missing cells are null.
 */
@Value
public class DataPreview {
    List<String> columns;
    List<Map<String, String>> rows;

    public static DataPreview of(Table table, int maxRows) {
        int rowCount = Math.min(table.getRowCount(), Math.max(maxRows, 0));
        List<String> names = table.getColumnNames();
        List<Map<String, String>> rows = new ArrayList<>(rowCount);
        for (int r = 0; r < rowCount; r++) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int c = 0; c < names.size(); c++) {
                RawValue cell = table.getColumn(c).get(r);
                row.put(names.get(c), cell.isMissing() ? null : cell.getText());
            }
            rows.add(Collections.unmodifiableMap(row));
        }
        return new DataPreview(List.copyOf(names), Collections.unmodifiableList(rows));
    }
}
