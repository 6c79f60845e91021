package com.dtinsight.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Column roles of one dataset. {@code groupingColumn} and {@code nameColumn} are {@code null}
 * when the dataset has no such column.
 */
public record ColumnClassification(
    String identifierColumn,
    String groupingColumn,
    String nameColumn,
    List<String> metricColumns
) {
    public ColumnClassification {
        metricColumns = List.copyOf(metricColumns);
    }

    @JsonIgnore
    public boolean hasGroupingColumn() {
        return groupingColumn != null;
    }

    @JsonIgnore
    public boolean hasNameColumn() {
        return nameColumn != null;
    }

    public boolean isMetric(String column) {
        return column != null && metricColumns.contains(column);
    }

    /**
     * Column that keys per-entity views: the name column when present, else the identifier.
     */
    @JsonIgnore
    public String entityKeyColumn() {
        return hasNameColumn() ? nameColumn : identifierColumn;
    }
}
