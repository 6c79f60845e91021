package com.dtinsight.analysis.engine;

import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CompanyRecord;
import com.dtinsight.analysis.model.CorrelationPoint;
import com.dtinsight.analysis.model.CorrelationView;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.GroupCount;
import com.dtinsight.analysis.model.HistogramBin;
import com.dtinsight.analysis.model.MetricDistribution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-sectional summaries: companies per industry, one metric's distribution and the
 * relation between two metrics.
 */
@Component
public class DistributionAnalyzer {

    /**
     * Companies per grouping value, most populous first; equal counts keep first-appearance order.
     */
    public List<GroupCount> countByGroup(Dataset dataset, ColumnClassification classification) {
        if (!classification.hasGroupingColumn()) {
            throw new ConfigurationException("dataset has no grouping column");
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CompanyRecord record : dataset.records()) {
            Object value = record.get(classification.groupingColumn());
            if (value != null) {
                counts.merge(String.valueOf(value), 1, Integer::sum);
            }
        }
        List<GroupCount> result = new ArrayList<>(counts.size());
        counts.forEach((group, count) -> result.add(new GroupCount(group, count)));
        result.sort(Comparator.comparingInt(GroupCount::count).reversed());
        return result;
    }

    public MetricDistribution describe(Dataset dataset, ColumnClassification classification, String metric, int bins) {
        MetricChecks.requireMetric(classification, metric);
        if (bins < 1) {
            throw new ConfigurationException("histogram needs at least one bin, got " + bins);
        }
        List<Double> values = new ArrayList<>();
        for (CompanyRecord record : dataset.records()) {
            Double value = record.metric(metric);
            if (value != null) {
                values.add(value);
            }
        }
        if (values.isEmpty()) {
            return new MetricDistribution(metric, 0, null, null, null, null, List.of());
        }

        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Comparator.naturalOrder());
        int n = sorted.size();
        double median = n % 2 == 1
            ? sorted.get(n / 2)
            : (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
        double min = sorted.get(0);
        double max = sorted.get(n - 1);

        return new MetricDistribution(metric, n, sum / n, median, min, max, histogram(sorted, min, max, bins));
    }

    /**
     * Scatter points for two metrics. Records missing either value are left out.
     */
    public CorrelationView correlate(
        Dataset dataset,
        ColumnClassification classification,
        String xMetric,
        String yMetric,
        boolean colorByGroup
    ) {
        if (classification.metricColumns().size() < 2) {
            throw new ConfigurationException("correlation needs at least two metric columns");
        }
        MetricChecks.requireMetric(classification, xMetric);
        MetricChecks.requireMetric(classification, yMetric);
        if (colorByGroup && !classification.hasGroupingColumn()) {
            throw new ConfigurationException("dataset has no grouping column");
        }

        List<CorrelationPoint> points = new ArrayList<>();
        for (CompanyRecord record : dataset.records()) {
            Double x = record.metric(xMetric);
            Double y = record.metric(yMetric);
            if (x == null || y == null) {
                continue;
            }
            String group = null;
            if (colorByGroup) {
                Object value = record.get(classification.groupingColumn());
                group = value == null ? null : String.valueOf(value);
            }
            points.add(new CorrelationPoint(
                record.label(classification),
                record.identifier(classification.identifierColumn()),
                group,
                x,
                y
            ));
        }
        return new CorrelationView(
            xMetric,
            yMetric,
            colorByGroup ? classification.groupingColumn() : null,
            points,
            pearson(points)
        );
    }

    private List<HistogramBin> histogram(List<Double> sorted, double min, double max, int bins) {
        if (min == max) {
            return List.of(new HistogramBin(min, max, sorted.size()));
        }
        double width = (max - min) / bins;
        int[] counts = new int[bins];
        for (double value : sorted) {
            int index = (int) ((value - min) / width);
            counts[Math.min(index, bins - 1)]++;
        }
        List<HistogramBin> result = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            double lower = min + i * width;
            double upper = i == bins - 1 ? max : min + (i + 1) * width;
            result.add(new HistogramBin(lower, upper, counts[i]));
        }
        return result;
    }

    private Double pearson(List<CorrelationPoint> points) {
        int n = points.size();
        if (n < 2) {
            return null;
        }
        double meanX = 0;
        double meanY = 0;
        for (CorrelationPoint point : points) {
            meanX += point.x();
            meanY += point.y();
        }
        meanX /= n;
        meanY /= n;
        double covariance = 0;
        double varianceX = 0;
        double varianceY = 0;
        for (CorrelationPoint point : points) {
            double dx = point.x() - meanX;
            double dy = point.y() - meanY;
            covariance += dx * dy;
            varianceX += dx * dx;
            varianceY += dy * dy;
        }
        if (varianceX == 0 || varianceY == 0) {
            return null;
        }
        return covariance / Math.sqrt(varianceX * varianceY);
    }
}
