package com.dtinsight.analysis.service;

import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.LookupResponse;
import com.dtinsight.analysis.model.RankedEntry;
import com.dtinsight.analysis.model.RankingResponse;
import com.dtinsight.config.AnalysisProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * One-shot console run: log the active dataset's classification, the default ranking and an optional
 * lookup, then exit. The default file is loaded only when no usable dataset is active.
 */
@Component
public class AnalysisCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AnalysisCliRunner.class);

    private final AnalysisProperties properties;
    private final DatasetRegistry registry;
    private final AnalysisService analysisService;
    private final ConfigurableApplicationContext applicationContext;

    public AnalysisCliRunner(
        AnalysisProperties properties,
        DatasetRegistry registry,
        AnalysisService analysisService,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.registry = registry;
        this.analysisService = analysisService;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        DatasetSnapshot snapshot = registry.currentOrReloadDefault();
        ColumnClassification classification = snapshot.classification();
        log.info(
            "Dataset {}: identifier={}, grouping={}, name={}, metrics={}",
            snapshot.dataset().source(),
            classification.identifierColumn(),
            classification.groupingColumn(),
            classification.nameColumn(),
            classification.metricColumns()
        );

        if (!classification.metricColumns().isEmpty()) {
            RankingResponse ranking = analysisService.ranking(null, null, properties.getCli().getLimit());
            for (RankedEntry entry : ranking.entries()) {
                log.info(
                    "Rank {} by {}: code={}, name={}, value={}",
                    entry.rank(),
                    ranking.metric(),
                    entry.identifier(),
                    entry.name(),
                    entry.value()
                );
            }
        }

        String query = properties.getCli().getQuery().strip();
        if (!query.isEmpty()) {
            boolean numeric = query.chars().allMatch(Character::isDigit);
            String field = numeric || !classification.hasNameColumn() ? "identifier" : "name";
            LookupResponse lookup = analysisService.lookup(query, field, "fuzzy");
            log.info("Lookup '{}' by {} matched {} companies", query, field, lookup.matchCount());
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
