package com.dtinsight.analysis.model;

import java.util.List;

/**
 * Long-form comparison plus what a renderer needs to draw it. {@code range} is {@code null}
 * when no value is present.
 */
public record ComparisonResponse(
    String keyColumn,
    List<String> metrics,
    int entityCount,
    boolean withinComparisonCap,
    ValueRange range,
    List<LongRecord> records
) {}
