package com.dtinsight.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of a loaded dataset. Values are {@code Long}, {@code Double}, {@code String} or {@code null}
 * (missing). The value map is read-only and keeps the dataset's column order.
 */
public final class CompanyRecord {
    private final int rowIndex;
    private final Map<String, Object> values;

    public CompanyRecord(int rowIndex, Map<String, Object> values) {
        this.rowIndex = rowIndex;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int rowIndex() {
        return rowIndex;
    }

    @JsonValue
    public Map<String, Object> values() {
        return values;
    }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Numeric value of a column, or {@code null} when missing, non-numeric or NaN.
     */
    public Double metric(String column) {
        Object value = values.get(column);
        if (!(value instanceof Number number)) {
            return null;
        }
        double d = number.doubleValue();
        return Double.isNaN(d) ? null : d;
    }

    /**
     * Text value of a column, or {@code null} when missing or not text.
     */
    public String text(String column) {
        Object value = values.get(column);
        return value instanceof String s ? s : null;
    }

    /**
     * Integer identifier held in the given column. Callers rely on the classifier having
     * verified that the column is integral and complete.
     */
    public long identifier(String column) {
        Object value = values.get(column);
        if (value instanceof Number number) {
            return number.longValue();
        }
        throw new IllegalStateException("row " + rowIndex + " has no integer value in " + column);
    }

    /**
     * Label used when an entity is shown by itself: the name when present, else the identifier.
     */
    public String label(ColumnClassification classification) {
        if (classification.hasNameColumn()) {
            String name = text(classification.nameColumn());
            if (name != null && !name.isBlank()) {
                return name;
            }
        }
        return Long.toString(identifier(classification.identifierColumn()));
    }

    @Override
    public String toString() {
        return "CompanyRecord{row=" + rowIndex + ", values=" + values + "}";
    }
}
