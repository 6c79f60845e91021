package com.dtinsight.analysis.engine;

import com.dtinsight.analysis.model.AggregatedView;
import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CompanyRecord;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.LongRecord;
import com.dtinsight.analysis.model.MatchResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-form tables for radar/bar comparisons, either per matched company or per industry.
 * No cap on the number of entities is applied here.
 */
@Component
public class ComparisonBuilder {
    private final AggregationEngine aggregationEngine;

    public ComparisonBuilder(AggregationEngine aggregationEngine) {
        this.aggregationEngine = aggregationEngine;
    }

    /**
     * Keyed by company name when the dataset has one, else by stock code. A record without a
     * name falls back to its stock code.
     */
    public List<LongRecord> buildEntityComparison(
        MatchResult matchResult,
        ColumnClassification classification,
        List<String> metrics
    ) {
        MetricChecks.requireMetrics(classification, metrics);
        if (matchResult == null || matchResult.isEmpty()) {
            return List.of();
        }
        String keyColumn = classification.entityKeyColumn();
        List<Map<String, Object>> rows = new ArrayList<>(matchResult.size());
        for (CompanyRecord record : matchResult.records()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(keyColumn, record.label(classification));
            for (String metric : metrics) {
                row.put(metric, record.metric(metric));
            }
            rows.add(row);
        }
        return aggregationEngine.toLongForm(rows, keyColumn, metrics);
    }

    public List<LongRecord> buildIndustryComparison(
        Dataset dataset,
        ColumnClassification classification,
        List<String> metrics
    ) {
        AggregatedView view = aggregationEngine.aggregateByGroup(dataset, classification, metrics);
        return aggregationEngine.toLongForm(view.toWideRows(), view.groupingColumn(), view.metrics());
    }
}
