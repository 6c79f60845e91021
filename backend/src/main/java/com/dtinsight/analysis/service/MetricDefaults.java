package com.dtinsight.analysis.service;

import com.dtinsight.analysis.engine.ConfigurationException;
import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.config.AnalysisProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Metric choices used when a request does not name its metrics. Only consulted for omitted
 * parameters; a metric the caller names is passed to the engine as is.
 */
@Component
public class MetricDefaults {
    private static final int INDUSTRY_FALLBACK_COUNT = 3;
    private static final int RADAR_FALLBACK_COUNT = 6;
    private static final int BAR_DEFAULT_COUNT = 3;

    private final AnalysisProperties properties;

    public MetricDefaults(AnalysisProperties properties) {
        this.properties = properties;
    }

    public String primaryMetric(ColumnClassification classification) {
        List<String> metrics = requireMetricColumns(classification);
        String preferred = properties.getDefaults().getPreferredMetric();
        return classification.isMetric(preferred) ? preferred : metrics.get(0);
    }

    public String secondaryMetric(ColumnClassification classification) {
        List<String> metrics = requireMetricColumns(classification);
        String secondary = properties.getDefaults().getSecondaryMetric();
        if (classification.isMetric(secondary)) {
            return secondary;
        }
        return metrics.size() > 1 ? metrics.get(1) : metrics.get(0);
    }

    public List<String> industryComparisonMetrics(ColumnClassification classification) {
        return keyMetricsOr(classification, INDUSTRY_FALLBACK_COUNT);
    }

    public List<String> entityRadarMetrics(ColumnClassification classification) {
        return keyMetricsOr(classification, RADAR_FALLBACK_COUNT);
    }

    public List<String> entityBarMetrics(ColumnClassification classification) {
        List<String> metrics = requireMetricColumns(classification);
        return List.copyOf(metrics.subList(0, Math.min(BAR_DEFAULT_COUNT, metrics.size())));
    }

    private List<String> keyMetricsOr(ColumnClassification classification, int fallbackCount) {
        List<String> metrics = requireMetricColumns(classification);
        List<String> present = new ArrayList<>();
        for (String key : properties.getDefaults().getKeyMetrics()) {
            if (classification.isMetric(key)) {
                present.add(key);
            }
        }
        if (!present.isEmpty()) {
            return List.copyOf(present);
        }
        return List.copyOf(metrics.subList(0, Math.min(fallbackCount, metrics.size())));
    }

    private List<String> requireMetricColumns(ColumnClassification classification) {
        List<String> metrics = classification.metricColumns();
        if (metrics.isEmpty()) {
            throw new ConfigurationException("dataset has no metric columns");
        }
        return metrics;
    }
}
