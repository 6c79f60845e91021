package com.dtinsight.analysis.engine;

import com.dtinsight.analysis.TestDatasets;
import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CorrelationView;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.GroupCount;
import com.dtinsight.analysis.model.HistogramBin;
import com.dtinsight.analysis.model.MetricDistribution;
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
import static org.assertj.core.api.Assertions.within;

class DistributionAnalyzerTest {

    private final DistributionAnalyzer analyzer = new DistributionAnalyzer();
    private final SchemaClassifier classifier = new SchemaClassifier(new AnalysisProperties());
    private Dataset dataset;
    private ColumnClassification classification;

    @BeforeEach
    void setUp() {
        dataset = TestDatasets.companies();
        classification = classifier.classify(dataset);
    }

    @Test
    void countsCompaniesPerIndustryLargestFirst() {
        List<GroupCount> counts = analyzer.countByGroup(dataset, classification);

        assertThat(counts).containsExactly(
            new GroupCount("软件服务", 3),
            new GroupCount("人工智能", 2),
            new GroupCount("通信设备", 1)
        );
    }

    @Test
    void describeSummarizesNonMissingValues() {
        MetricDistribution distribution = analyzer.describe(dataset, classification, TOTAL, 5);

        assertThat(distribution.count()).isEqualTo(5);
        assertThat(distribution.mean()).isCloseTo(72.2, within(1e-9));
        assertThat(distribution.median()).isEqualTo(72.5);
        assertThat(distribution.min()).isEqualTo(55.5);
        assertThat(distribution.max()).isEqualTo(88.0);
        assertThat(distribution.bins()).hasSize(5);
        assertThat(distribution.bins()).extracting(HistogramBin::count).containsExactly(1, 1, 1, 1, 1);
        assertThat(distribution.bins().get(0).lower()).isEqualTo(55.5);
        assertThat(distribution.bins().get(4).upper()).isEqualTo(88.0);
    }

    @Test
    void medianOfEvenCountAveragesMiddleValues() {
        Dataset even = TestDatasets.of(
            List.of(CODE, "score"),
            new Object[] {1L, 4.0},
            new Object[] {2L, 1.0},
            new Object[] {3L, 3.0},
            new Object[] {4L, 2.0}
        );

        MetricDistribution distribution = analyzer.describe(even, classifier.classify(even), "score", 20);

        assertThat(distribution.median()).isEqualTo(2.5);
        assertThat(distribution.bins()).extracting(HistogramBin::count).containsOnly(0, 1);
        assertThat(distribution.bins().stream().mapToInt(HistogramBin::count).sum()).isEqualTo(4);
    }

    @Test
    void constantMetricHasSingleBin() {
        Dataset constant = TestDatasets.of(
            List.of(CODE, "score"),
            new Object[] {1L, 7.0},
            new Object[] {2L, 7.0}
        );

        MetricDistribution distribution = analyzer.describe(constant, classifier.classify(constant), "score", 20);

        assertThat(distribution.bins()).containsExactly(new HistogramBin(7.0, 7.0, 2));
    }

    @Test
    void allMissingMetricHasNoStatistics() {
        Dataset missing = TestDatasets.of(
            List.of(CODE, "score"),
            new Object[] {1L, null},
            new Object[] {2L, null}
        );

        MetricDistribution distribution = analyzer.describe(missing, classifier.classify(missing), "score", 20);

        assertThat(distribution.count()).isZero();
        assertThat(distribution.mean()).isNull();
        assertThat(distribution.bins()).isEmpty();
    }

    @Test
    void describeRejectsInvalidBinCount() {
        assertThatThrownBy(() -> analyzer.describe(dataset, classification, TOTAL, 0))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void correlationUsesRecordsWithBothValues() {
        CorrelationView view = analyzer.correlate(dataset, classification, TOTAL, TECH, true);

        assertThat(view.points()).extracting(p -> p.identifier()).containsExactly(300884L, 2230L, 30884L, 688111L);
        assertThat(view.points().get(0).label()).isEqualTo("狄耐克");
        assertThat(view.points().get(0).group()).isEqualTo("软件服务");
        assertThat(view.groupingColumn()).isEqualTo(TestDatasets.INDUSTRY);
        assertThat(view.pearson()).isGreaterThan(0.9);
    }

    @Test
    void correlationWithoutGroupingLeavesGroupsEmpty() {
        CorrelationView view = analyzer.correlate(dataset, classification, TOTAL, TECH, false);

        assertThat(view.groupingColumn()).isNull();
        assertThat(view.points()).allSatisfy(point -> assertThat(point.group()).isNull());
    }

    @Test
    void correlationNeedsTwoMetricColumns() {
        Dataset single = TestDatasets.of(List.of(CODE, "score"), new Object[] {1L, 1.0});

        assertThatThrownBy(() -> analyzer.correlate(single, classifier.classify(single), "score", "score", false))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void colorByGroupNeedsGroupingColumn() {
        Dataset noIndustry = TestDatasets.of(List.of(CODE, "a", "b"), new Object[] {1L, 1.0, 2.0});

        assertThatThrownBy(() -> analyzer.correlate(noIndustry, classifier.classify(noIndustry), "a", "b", true))
            .isInstanceOf(ConfigurationException.class);
    }
}
