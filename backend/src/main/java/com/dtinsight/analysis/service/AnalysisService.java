package com.dtinsight.analysis.service;

import com.dtinsight.analysis.engine.AggregationEngine;
import com.dtinsight.analysis.engine.ComparisonBuilder;
import com.dtinsight.analysis.engine.DistributionAnalyzer;
import com.dtinsight.analysis.engine.LookupResolver;
import com.dtinsight.analysis.engine.RankingEngine;
import com.dtinsight.analysis.engine.ValidationException;
import com.dtinsight.analysis.model.AggregatedView;
import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CompanyRecord;
import com.dtinsight.analysis.model.ComparisonChart;
import com.dtinsight.analysis.model.ComparisonResponse;
import com.dtinsight.analysis.model.CorrelationView;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.DatasetPreview;
import com.dtinsight.analysis.model.GroupCount;
import com.dtinsight.analysis.model.LongRecord;
import com.dtinsight.analysis.model.LookupField;
import com.dtinsight.analysis.model.LookupMode;
import com.dtinsight.analysis.model.LookupResponse;
import com.dtinsight.analysis.model.MatchResult;
import com.dtinsight.analysis.model.MetricDistribution;
import com.dtinsight.analysis.model.RankDirection;
import com.dtinsight.analysis.model.RankedEntry;
import com.dtinsight.analysis.model.RankingResponse;
import com.dtinsight.analysis.model.ValueRange;
import com.dtinsight.config.AnalysisProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Request-facing side of the engine. Fills in omitted parameters from {@link MetricDefaults} and
 * the configured limits, then delegates to the engine against the current snapshot.
 */
@Service
public class AnalysisService {
    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    private final DatasetRegistry registry;
    private final MetricDefaults metricDefaults;
    private final AggregationEngine aggregationEngine;
    private final RankingEngine rankingEngine;
    private final LookupResolver lookupResolver;
    private final ComparisonBuilder comparisonBuilder;
    private final DistributionAnalyzer distributionAnalyzer;
    private final AnalysisProperties properties;

    public AnalysisService(
        DatasetRegistry registry,
        MetricDefaults metricDefaults,
        AggregationEngine aggregationEngine,
        RankingEngine rankingEngine,
        LookupResolver lookupResolver,
        ComparisonBuilder comparisonBuilder,
        DistributionAnalyzer distributionAnalyzer,
        AnalysisProperties properties
    ) {
        this.registry = registry;
        this.metricDefaults = metricDefaults;
        this.aggregationEngine = aggregationEngine;
        this.rankingEngine = rankingEngine;
        this.lookupResolver = lookupResolver;
        this.comparisonBuilder = comparisonBuilder;
        this.distributionAnalyzer = distributionAnalyzer;
        this.properties = properties;
    }

    public DatasetPreview preview(Integer rows) {
        Dataset dataset = registry.current().dataset();
        int safeRows = rows == null ? properties.getDefaults().getPreviewRows() : Math.max(1, Math.min(rows, 100));
        List<CompanyRecord> head = dataset.records().subList(0, Math.min(safeRows, dataset.size()));
        return new DatasetPreview(dataset.columns(), dataset.size(), List.copyOf(head));
    }

    public List<GroupCount> industryCounts() {
        DatasetSnapshot snapshot = registry.current();
        return distributionAnalyzer.countByGroup(snapshot.dataset(), snapshot.classification());
    }

    public AggregatedView industryAverages(List<String> metrics) {
        DatasetSnapshot snapshot = registry.current();
        ColumnClassification classification = snapshot.classification();
        List<String> selected = isEmpty(metrics) ? metricDefaults.industryComparisonMetrics(classification) : metrics;
        return aggregationEngine.aggregateByGroup(snapshot.dataset(), classification, selected);
    }

    public ComparisonResponse industryComparison(List<String> metrics) {
        DatasetSnapshot snapshot = registry.current();
        ColumnClassification classification = snapshot.classification();
        List<String> selected = isEmpty(metrics) ? metricDefaults.industryComparisonMetrics(classification) : metrics;
        List<LongRecord> records = comparisonBuilder.buildIndustryComparison(snapshot.dataset(), classification, selected);
        int groups = countDistinctKeys(records);
        return new ComparisonResponse(
            classification.groupingColumn(),
            selected,
            groups,
            groups <= properties.getDefaults().getComparisonCap(),
            rangeOf(records),
            records
        );
    }

    public MetricDistribution distribution(String metric, Integer bins) {
        DatasetSnapshot snapshot = registry.current();
        ColumnClassification classification = snapshot.classification();
        String selected = isDefaultToken(metric) ? metricDefaults.primaryMetric(classification) : metric;
        int safeBins = bins == null ? properties.getDefaults().getHistogramBins() : bins;
        return distributionAnalyzer.describe(snapshot.dataset(), classification, selected, safeBins);
    }

    public CorrelationView correlation(String xMetric, String yMetric, Boolean colorByGroup) {
        DatasetSnapshot snapshot = registry.current();
        ColumnClassification classification = snapshot.classification();
        String x = isBlank(xMetric) ? metricDefaults.primaryMetric(classification) : xMetric;
        String y = isBlank(yMetric) ? metricDefaults.secondaryMetric(classification) : yMetric;
        boolean byGroup = colorByGroup == null ? classification.hasGroupingColumn() : colorByGroup;
        return distributionAnalyzer.correlate(snapshot.dataset(), classification, x, y, byGroup);
    }

    public RankingResponse ranking(String metric, String direction, Integer limit) {
        DatasetSnapshot snapshot = registry.current();
        ColumnClassification classification = snapshot.classification();
        String selected = isBlank(metric) ? metricDefaults.primaryMetric(classification) : metric;
        RankDirection rankDirection = parseDirection(direction);
        AnalysisProperties.Defaults defaults = properties.getDefaults();
        int safeLimit = limit == null
            ? defaults.getRankingLimit()
            : Math.max(defaults.getMinRankingLimit(), Math.min(limit, defaults.getMaxRankingLimit()));

        List<CompanyRecord> ranked = rankingEngine.rank(
            snapshot.dataset(), classification, selected, rankDirection, safeLimit);
        List<RankedEntry> entries = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            CompanyRecord record = ranked.get(i);
            entries.add(new RankedEntry(
                i + 1,
                record.identifier(classification.identifierColumn()),
                classification.hasNameColumn() ? record.text(classification.nameColumn()) : null,
                record.metric(selected),
                record
            ));
        }
        return new RankingResponse(selected, rankDirection, safeLimit, entries);
    }

    public LookupResponse lookup(String query, String field, String mode) {
        DatasetSnapshot snapshot = registry.current();
        LookupField lookupField = parseField(field);
        LookupMode lookupMode = parseMode(mode);
        MatchResult result = lookupResolver.resolve(
            snapshot.dataset(), snapshot.classification(), query, lookupField, lookupMode);
        return new LookupResponse(query == null ? null : query.strip(), lookupField, lookupMode, result.size(), result.records());
    }

    public ComparisonResponse companyComparison(
        String query,
        String field,
        String mode,
        List<String> metrics,
        String chart
    ) {
        DatasetSnapshot snapshot = registry.current();
        ColumnClassification classification = snapshot.classification();
        ComparisonChart comparisonChart = parseChart(chart);
        MatchResult matches = lookupResolver.resolve(
            snapshot.dataset(), classification, query, parseField(field), parseMode(mode));

        List<String> selected = metrics;
        if (isEmpty(selected)) {
            selected = comparisonChart == ComparisonChart.BAR
                ? metricDefaults.entityBarMetrics(classification)
                : metricDefaults.entityRadarMetrics(classification);
        }
        List<LongRecord> records = comparisonBuilder.buildEntityComparison(matches, classification, selected);
        boolean withinCap = matches.size() <= properties.getDefaults().getComparisonCap();
        if (!withinCap) {
            log.debug("Comparison for '{}' covers {} companies, above the display cap", query, matches.size());
        }
        return new ComparisonResponse(
            classification.entityKeyColumn(),
            selected,
            matches.size(),
            withinCap,
            rangeOf(records),
            records
        );
    }

    public ValueRange suggestRange(List<Double> values) {
        return aggregationEngine.suggestRange(values);
    }

    private ValueRange rangeOf(List<LongRecord> records) {
        List<Double> values = new ArrayList<>(records.size());
        for (LongRecord record : records) {
            if (record.value() != null) {
                values.add(record.value());
            }
        }
        return values.isEmpty() ? null : aggregationEngine.suggestRange(values);
    }

    private int countDistinctKeys(List<LongRecord> records) {
        return (int) records.stream().map(LongRecord::entityKey).distinct().count();
    }

    private RankDirection parseDirection(String raw) {
        if (isBlank(raw)) {
            return RankDirection.DESCENDING;
        }
        RankDirection direction = RankDirection.fromRaw(raw);
        if (direction == null) {
            throw new ValidationException("unsupported direction: " + raw);
        }
        return direction;
    }

    private LookupField parseField(String raw) {
        if (isBlank(raw)) {
            return LookupField.IDENTIFIER;
        }
        LookupField field = LookupField.fromRaw(raw);
        if (field == null) {
            throw new ValidationException("unsupported lookup field: " + raw);
        }
        return field;
    }

    private LookupMode parseMode(String raw) {
        if (isBlank(raw)) {
            return LookupMode.EXACT;
        }
        LookupMode mode = LookupMode.fromRaw(raw);
        if (mode == null) {
            throw new ValidationException("unsupported lookup mode: " + raw);
        }
        return mode;
    }

    private ComparisonChart parseChart(String raw) {
        if (isBlank(raw)) {
            return ComparisonChart.RADAR;
        }
        ComparisonChart chart = ComparisonChart.fromRaw(raw);
        if (chart == null) {
            throw new ValidationException("unsupported chart: " + raw);
        }
        return chart;
    }

    private boolean isDefaultToken(String metric) {
        return isBlank(metric) || "_default".equals(metric.trim());
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }
}
