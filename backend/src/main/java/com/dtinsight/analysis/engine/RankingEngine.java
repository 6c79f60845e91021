package com.dtinsight.analysis.engine;

import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CompanyRecord;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.RankDirection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
public class RankingEngine {

    /**
     * Top {@code limit} records ordered by {@code metric}. The sort is stable, so equal values keep
     * dataset order, and records missing the metric always come last.
     */
    public List<CompanyRecord> rank(
        Dataset dataset,
        ColumnClassification classification,
        String metric,
        RankDirection direction,
        int limit
    ) {
        MetricChecks.requireMetric(classification, metric);
        if (direction == null) {
            throw new ConfigurationException("ranking direction is required");
        }
        if (limit < 1) {
            throw new ConfigurationException("ranking limit must be positive, got " + limit);
        }

        Comparator<Double> valueOrder = direction == RankDirection.DESCENDING
            ? Comparator.reverseOrder()
            : Comparator.naturalOrder();
        Comparator<CompanyRecord> order = Comparator.comparing(
            (CompanyRecord record) -> record.metric(metric),
            Comparator.nullsLast(valueOrder)
        );

        List<CompanyRecord> sorted = new ArrayList<>(dataset.records());
        sorted.sort(order);
        return List.copyOf(sorted.subList(0, Math.min(limit, sorted.size())));
    }
}
