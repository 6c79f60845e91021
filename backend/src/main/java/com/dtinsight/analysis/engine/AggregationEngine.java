package com.dtinsight.analysis.engine;

import com.dtinsight.analysis.model.AggregatedView;
import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CompanyRecord;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.GroupAverages;
import com.dtinsight.analysis.model.LongRecord;
import com.dtinsight.analysis.model.ValueRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Industry averages, wide-to-long reshaping and the padded value range used by radar views.
 */
@Component
public class AggregationEngine {
    private static final double LOWER_PADDING = 0.9;
    private static final double UPPER_PADDING = 1.1;

    /**
     * Mean of each metric per grouping value. Groups appear in the order their value first occurs
     * in the dataset; records with a missing grouping value are skipped.
     */
    public AggregatedView aggregateByGroup(Dataset dataset, ColumnClassification classification, List<String> metrics) {
        if (!classification.hasGroupingColumn()) {
            throw new ConfigurationException("dataset has no grouping column");
        }
        MetricChecks.requireMetrics(classification, metrics);
        String groupingColumn = classification.groupingColumn();

        Map<String, GroupAccumulator> accumulators = new LinkedHashMap<>();
        for (CompanyRecord record : dataset.records()) {
            Object groupValue = record.get(groupingColumn);
            if (groupValue == null) {
                continue;
            }
            String group = String.valueOf(groupValue);
            GroupAccumulator accumulator = accumulators.computeIfAbsent(group, ignored -> new GroupAccumulator(metrics.size()));
            accumulator.records++;
            for (int i = 0; i < metrics.size(); i++) {
                Double value = record.metric(metrics.get(i));
                if (value != null) {
                    accumulator.sums[i] += value;
                    accumulator.counts[i]++;
                }
            }
        }

        List<GroupAverages> groups = new ArrayList<>(accumulators.size());
        for (Map.Entry<String, GroupAccumulator> entry : accumulators.entrySet()) {
            GroupAccumulator accumulator = entry.getValue();
            Map<String, Double> means = new LinkedHashMap<>();
            for (int i = 0; i < metrics.size(); i++) {
                if (accumulator.counts[i] > 0) {
                    means.put(metrics.get(i), accumulator.sums[i] / accumulator.counts[i]);
                }
            }
            groups.add(new GroupAverages(entry.getKey(), accumulator.records, means));
        }
        return new AggregatedView(groupingColumn, metrics, groups);
    }

    /**
     * Emits one record per (row, value column), row order first and value-column order second.
     * Missing values are carried through as {@code null}.
     */
    public List<LongRecord> toLongForm(List<? extends Map<String, ?>> wideRows, String keyColumn, List<String> valueColumns) {
        if (keyColumn == null || keyColumn.isBlank()) {
            throw new ConfigurationException("key column is required");
        }
        if (valueColumns == null || valueColumns.isEmpty()) {
            throw new ConfigurationException("at least one value column is required");
        }
        List<LongRecord> records = new ArrayList<>(wideRows.size() * valueColumns.size());
        for (Map<String, ?> row : wideRows) {
            Object key = row.get(keyColumn);
            String entityKey = key == null ? null : String.valueOf(key);
            for (String column : valueColumns) {
                records.add(new LongRecord(entityKey, column, numericValue(row.get(column), column)));
            }
        }
        return records;
    }

    /**
     * Radar axis range: {@code [min * 0.9, max * 1.1]}. A non-positive bound is returned unpadded.
     * Missing values are ignored.
     */
    public ValueRange suggestRange(List<Double> values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int count = 0;
        if (values != null) {
            for (Double value : values) {
                if (value == null || value.isNaN()) {
                    continue;
                }
                min = Math.min(min, value);
                max = Math.max(max, value);
                count++;
            }
        }
        if (count == 0) {
            throw new ValidationException("no values to compute a range from");
        }
        double low = min > 0 ? min * LOWER_PADDING : min;
        double high = max > 0 ? max * UPPER_PADDING : max;
        return new ValueRange(low, high);
    }

    private Double numericValue(Object value, String column) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        throw new ConfigurationException("column " + column + " is not numeric");
    }

    private static final class GroupAccumulator {
        private final double[] sums;
        private final int[] counts;
        private int records;

        private GroupAccumulator(int metricCount) {
            this.sums = new double[metricCount];
            this.counts = new int[metricCount];
        }
    }
}
