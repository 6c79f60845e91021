package com.dtinsight.analysis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Group value to metric means, in first-appearance order of the group value.
 */
public record AggregatedView(String groupingColumn, List<String> metrics, List<GroupAverages> groups) {
    public AggregatedView {
        metrics = List.copyOf(metrics);
        groups = List.copyOf(groups);
    }

    public GroupAverages group(String group) {
        for (GroupAverages averages : groups) {
            if (averages.group().equals(group)) {
                return averages;
            }
        }
        return null;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /**
     * Wide rows keyed by the grouping column plus one entry per metric (absent means are null).
     */
    public List<Map<String, Object>> toWideRows() {
        List<Map<String, Object>> rows = new ArrayList<>(groups.size());
        for (GroupAverages averages : groups) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(groupingColumn, averages.group());
            for (String metric : metrics) {
                row.put(metric, averages.mean(metric));
            }
            rows.add(row);
        }
        return rows;
    }
}
