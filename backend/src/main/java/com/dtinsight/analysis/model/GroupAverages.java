package com.dtinsight.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-metric means for one group. A metric with no non-missing values in the group has no entry.
 */
public record GroupAverages(String group, int recordCount, Map<String, Double> means) {
    public GroupAverages {
        means = Collections.unmodifiableMap(new LinkedHashMap<>(means));
    }

    public Double mean(String metric) {
        return means.get(metric);
    }
}
