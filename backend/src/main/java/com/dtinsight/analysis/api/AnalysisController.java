package com.dtinsight.analysis.api;

import com.dtinsight.analysis.model.AggregatedView;
import com.dtinsight.analysis.model.ComparisonResponse;
import com.dtinsight.analysis.model.CorrelationView;
import com.dtinsight.analysis.model.DatasetPreview;
import com.dtinsight.analysis.model.DatasetStatusResponse;
import com.dtinsight.analysis.model.GroupCount;
import com.dtinsight.analysis.model.LookupResponse;
import com.dtinsight.analysis.model.MetricDistribution;
import com.dtinsight.analysis.model.RankingResponse;
import com.dtinsight.analysis.model.ValueRange;
import com.dtinsight.analysis.service.AnalysisService;
import com.dtinsight.analysis.service.DatasetRegistry;
import com.dtinsight.analysis.load.DatasetLoadException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@RestController
@RequestMapping("/api")
public class AnalysisController {
    private final AnalysisService analysisService;
    private final DatasetRegistry datasetRegistry;

    public AnalysisController(AnalysisService analysisService, DatasetRegistry datasetRegistry) {
        this.analysisService = analysisService;
        this.datasetRegistry = datasetRegistry;
    }

    @GetMapping("/dataset")
    public DatasetStatusResponse getDatasetStatus() {
        return datasetRegistry.status();
    }

    @PostMapping("/dataset")
    public DatasetStatusResponse uploadDataset(@RequestParam("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DatasetLoadException("uploaded file is empty");
        }
        String name = file.getOriginalFilename() == null ? file.getName() : file.getOriginalFilename();
        try (InputStream in = file.getInputStream()) {
            datasetRegistry.load(name, in);
        } catch (IOException e) {
            throw new DatasetLoadException("failed to read upload " + name, e);
        }
        return datasetRegistry.status();
    }

    @PostMapping("/dataset/reload")
    public DatasetStatusResponse reloadDataset() {
        datasetRegistry.reloadDefault();
        return datasetRegistry.status();
    }

    @GetMapping("/dataset/preview")
    public DatasetPreview previewDataset(@RequestParam(name = "rows", required = false) Integer rows) {
        return analysisService.preview(rows);
    }

    @GetMapping("/industries/counts")
    public List<GroupCount> industryCounts() {
        return analysisService.industryCounts();
    }

    @GetMapping("/industries/averages")
    public AggregatedView industryAverages(@RequestParam(name = "metrics", required = false) List<String> metrics) {
        return analysisService.industryAverages(trimAll(metrics));
    }

    @GetMapping("/industries/comparison")
    public ComparisonResponse industryComparison(@RequestParam(name = "metrics", required = false) List<String> metrics) {
        return analysisService.industryComparison(trimAll(metrics));
    }

    @GetMapping("/metrics/{metric}/distribution")
    public MetricDistribution metricDistribution(
        @PathVariable("metric") String metric,
        @RequestParam(name = "bins", required = false) Integer bins
    ) {
        return analysisService.distribution(metric, bins);
    }

    @GetMapping("/metrics/correlation")
    public CorrelationView metricCorrelation(
        @RequestParam(name = "x", required = false) String x,
        @RequestParam(name = "y", required = false) String y,
        @RequestParam(name = "colorByGroup", required = false) Boolean colorByGroup
    ) {
        return analysisService.correlation(x, y, colorByGroup);
    }

    @GetMapping("/ranking")
    public RankingResponse ranking(
        @RequestParam(name = "metric", required = false) String metric,
        @RequestParam(name = "direction", required = false) String direction,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return analysisService.ranking(metric, direction, limit);
    }

    @GetMapping("/companies")
    public LookupResponse lookupCompanies(
        @RequestParam(name = "query", required = false) String query,
        @RequestParam(name = "field", required = false) String field,
        @RequestParam(name = "mode", required = false) String mode
    ) {
        return analysisService.lookup(query, field, mode);
    }

    @GetMapping("/companies/comparison")
    public ComparisonResponse compareCompanies(
        @RequestParam(name = "query", required = false) String query,
        @RequestParam(name = "field", required = false) String field,
        @RequestParam(name = "mode", required = false) String mode,
        @RequestParam(name = "metrics", required = false) List<String> metrics,
        @RequestParam(name = "chart", required = false) String chart
    ) {
        return analysisService.companyComparison(query, field, mode, trimAll(metrics), chart);
    }

    @GetMapping("/range")
    public ValueRange suggestRange(@RequestParam(name = "values") List<Double> values) {
        return analysisService.suggestRange(values);
    }

    private List<String> trimAll(List<String> values) {
        if (values == null) {
            return null;
        }
        return values.stream()
            .map(String::trim)
            .filter(s -> !s.isBlank())
            .toList();
    }
}
