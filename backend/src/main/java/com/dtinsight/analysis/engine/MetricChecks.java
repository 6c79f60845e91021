package com.dtinsight.analysis.engine;

import com.dtinsight.analysis.model.ColumnClassification;

import java.util.List;

final class MetricChecks {

    private MetricChecks() {}

    static void requireMetrics(ColumnClassification classification, List<String> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            throw new ConfigurationException("at least one metric is required");
        }
        for (String metric : metrics) {
            requireMetric(classification, metric);
        }
    }

    static void requireMetric(ColumnClassification classification, String metric) {
        if (!classification.isMetric(metric)) {
            throw new ConfigurationException("unknown metric column: " + metric);
        }
    }
}
