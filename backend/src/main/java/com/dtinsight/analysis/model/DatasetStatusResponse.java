package com.dtinsight.analysis.model;

import java.time.Instant;

/**
 * State of the current dataset snapshot. {@code schemaError} is set when the last load could not be classified.
 */
public record DatasetStatusResponse(
    boolean loaded,
    String source,
    Instant loadedAt,
    int recordCount,
    int columnCount,
    ColumnClassification classification,
    String schemaError
) {}
