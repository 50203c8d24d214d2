package com.di.qualityguard.table;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns uploaded CSV bytes into a {@link Table}. The first record is the header; blank
 * header cells are named {@code Unnamed: <index>}. Short records are padded with missing
 * values, long records are rejected.
 */
@Slf4j
@Component
public class CsvTableLoader {

    private final CsvMapper csvMapper;
    private final Set<String> missingMarkers;
    private final int maxRows;

    public CsvTableLoader(TableLoaderProperties properties) {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.missingMarkers = new HashSet<>(properties.getMissingMarkersList());
        this.maxRows = properties.getMaxRows();
    }

    /**
     * @param content raw CSV bytes (UTF-8)
     * @param label   name of the upload, used in error messages (e.g. "dataset")
     * @return parsed table
     * @throws InvalidTableException when the bytes are not a usable CSV table
     */
    public Table load(byte[] content, String label) {
        if (content == null || content.length == 0) {
            throw new InvalidTableException("Invalid " + label + " CSV: upload is empty");
        }
        List<String> header = null;
        List<List<RawValue>> columns = new ArrayList<>();
        int row = 0;
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class).readValues(content)) {
            while (it.hasNextValue()) {
                String[] record = it.nextValue();
                if (header == null) {
                    header = headerFrom(record);
                    for (int i = 0; i < header.size(); i++) {
                        columns.add(new ArrayList<>());
                    }
                    continue;
                }
                row++;
                if (maxRows > 0 && row > maxRows) {
                    throw new InvalidTableException(String.format(
                            "Invalid %s CSV: more than %d data rows", label, maxRows));
                }
                if (record.length > header.size()) {
                    throw new InvalidTableException(String.format(
                            "Invalid %s CSV: row %d has %d fields, header has %d",
                            label, row, record.length, header.size()));
                }
                for (int c = 0; c < header.size(); c++) {
                    columns.get(c).add(c < record.length ? toRawValue(record[c]) : RawValue.missing());
                }
            }
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new InvalidTableException("Invalid " + label + " CSV: " + e.getMessage(), e);
        }
        if (header == null) {
            throw new InvalidTableException("Invalid " + label + " CSV: no header row");
        }

        Table.Builder builder = Table.builder();
        for (int c = 0; c < header.size(); c++) {
            builder.column(header.get(c), columns.get(c));
        }
        Table table = builder.build();
        log.debug("[LOADER] Loaded {} CSV: columns={} rows={}", label, table.getColumnCount(), table.getRowCount());
        return table;
    }

    private static List<String> headerFrom(String[] record) {
        List<String> header = new ArrayList<>(record.length);
        for (int i = 0; i < record.length; i++) {
            String name = record[i] == null ? "" : record[i].trim();
            header.add(name.isEmpty() ? "Unnamed: " + i : name);
        }
        return header;
    }

    private RawValue toRawValue(String cell) {
        if (cell == null) {
            return RawValue.missing();
        }
        String trimmed = cell.trim();
        if (trimmed.isEmpty() || missingMarkers.contains(trimmed)) {
            return RawValue.missing();
        }
        return RawValue.text(cell);
    }
}
