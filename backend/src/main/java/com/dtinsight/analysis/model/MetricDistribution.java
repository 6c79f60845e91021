package com.dtinsight.analysis.model;

import java.util.List;

/**
 * Summary of one metric's non-missing values. Statistics are {@code null} when {@code count} is zero.
 */
public record MetricDistribution(
    String metric,
    int count,
    Double mean,
    Double median,
    Double min,
    Double max,
    List<HistogramBin> bins
) {
    public MetricDistribution {
        bins = List.copyOf(bins);
    }
}
