package com.dtinsight.analysis.engine;

import com.dtinsight.analysis.TestDatasets;
import com.dtinsight.analysis.model.AggregatedView;
import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.LongRecord;
import com.dtinsight.analysis.model.LookupField;
import com.dtinsight.analysis.model.LookupMode;
import com.dtinsight.analysis.model.MatchResult;
import com.dtinsight.analysis.schema.SchemaClassifier;
import com.dtinsight.config.AnalysisProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.dtinsight.analysis.TestDatasets.CODE;
import static com.dtinsight.analysis.TestDatasets.TECH;
import static com.dtinsight.analysis.TestDatasets.TOTAL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparisonBuilderTest {

    private final AggregationEngine aggregationEngine = new AggregationEngine();
    private final ComparisonBuilder builder = new ComparisonBuilder(aggregationEngine);
    private final LookupResolver resolver = new LookupResolver();
    private final SchemaClassifier classifier = new SchemaClassifier(new AnalysisProperties());
    private Dataset dataset;
    private ColumnClassification classification;

    @BeforeEach
    void setUp() {
        dataset = TestDatasets.companies();
        classification = classifier.classify(dataset);
    }

    @Test
    void entityComparisonIsKeyedByName() {
        MatchResult matches = resolver.resolve(dataset, classification, "308", LookupField.IDENTIFIER, LookupMode.FUZZY);

        List<LongRecord> records = builder.buildEntityComparison(matches, classification, List.of(TOTAL, TECH));

        assertThat(records).containsExactly(
            new LongRecord("中际旭创", TOTAL, 64.0),
            new LongRecord("中际旭创", TECH, null),
            new LongRecord("测试公司", TOTAL, 55.5),
            new LongRecord("测试公司", TECH, 58.0)
        );
    }

    @Test
    void entityComparisonFallsBackToIdentifierKey() {
        Dataset noNames = TestDatasets.of(
            List.of(CODE, "score"),
            new Object[] {600001L, 1.5},
            new Object[] {600002L, 2.5}
        );
        ColumnClassification noNameClassification = classifier.classify(noNames);
        MatchResult matches = new MatchResult(noNames.records());

        List<LongRecord> records = builder.buildEntityComparison(matches, noNameClassification, List.of("score"));

        assertThat(records).extracting(LongRecord::entityKey).containsExactly("600001", "600002");
    }

    @Test
    void emptyMatchGivesEmptyComparison() {
        assertThat(builder.buildEntityComparison(MatchResult.empty(), classification, List.of(TOTAL))).isEmpty();
    }

    @Test
    void entityComparisonValidatesMetrics() {
        MatchResult matches = new MatchResult(dataset.records());

        assertThatThrownBy(() -> builder.buildEntityComparison(matches, classification, List.of()))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> builder.buildEntityComparison(matches, classification, List.of("missing")))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void entityComparisonHasNoEntityCap() {
        MatchResult everything = new MatchResult(dataset.records());

        assertThat(builder.buildEntityComparison(everything, classification, List.of(TOTAL))).hasSize(dataset.size());
    }

    @Test
    void industryComparisonComposesAggregationAndReshape() {
        List<String> metrics = List.of(TOTAL, TECH);
        AggregatedView view = aggregationEngine.aggregateByGroup(dataset, classification, metrics);

        List<LongRecord> records = builder.buildIndustryComparison(dataset, classification, metrics);

        assertThat(records).hasSize(view.groups().size() * metrics.size());
        assertThat(records.get(0)).isEqualTo(new LongRecord("软件服务", TOTAL, view.group("软件服务").mean(TOTAL)));
        assertThat(records).extracting(LongRecord::entityKey).startsWith("软件服务", "软件服务", "人工智能");
        assertThat(records).contains(new LongRecord("通信设备", TECH, null));
    }
}
