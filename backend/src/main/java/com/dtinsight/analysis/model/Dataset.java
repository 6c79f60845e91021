package com.dtinsight.analysis.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, ordered table of company records. Built once per load and never mutated.
 */
public final class Dataset {
    private final String source;
    private final List<String> columns;
    private final List<CompanyRecord> records;

    private Dataset(String source, List<String> columns, List<CompanyRecord> records) {
        this.source = source;
        this.columns = List.copyOf(columns);
        this.records = List.copyOf(records);
    }

    /**
     * Builds a dataset from raw rows. Keys outside {@code columns} are ignored and absent keys
     * become missing values.
     */
    public static Dataset of(String source, List<String> columns, List<? extends Map<String, ?>> rows) {
        List<CompanyRecord> records = new ArrayList<>(rows.size());
        int index = 0;
        for (Map<String, ?> row : rows) {
            Map<String, Object> values = new LinkedHashMap<>();
            for (String column : columns) {
                values.put(column, row.get(column));
            }
            records.add(new CompanyRecord(index++, values));
        }
        return new Dataset(source, columns, records);
    }

    /**
     * A dataset over an existing selection of records, e.g. a ranked or matched subset.
     */
    public static Dataset ofRecords(String source, List<String> columns, List<CompanyRecord> records) {
        return new Dataset(source, columns, records);
    }

    public String source() {
        return source;
    }

    public List<String> columns() {
        return columns;
    }

    public List<CompanyRecord> records() {
        return records;
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
