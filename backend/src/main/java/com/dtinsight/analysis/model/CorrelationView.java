package com.dtinsight.analysis.model;

import java.util.List;

public record CorrelationView(
    String xMetric,
    String yMetric,
    String groupingColumn,
    List<CorrelationPoint> points,
    Double pearson
) {
    public CorrelationView {
        points = List.copyOf(points);
    }
}
