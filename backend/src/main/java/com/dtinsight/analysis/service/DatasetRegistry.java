package com.dtinsight.analysis.service;

import com.dtinsight.analysis.load.DatasetLoadException;
import com.dtinsight.analysis.load.DatasetLoader;
import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.DatasetStatusResponse;
import com.dtinsight.analysis.schema.SchemaClassifier;
import com.dtinsight.analysis.schema.SchemaException;
import com.dtinsight.config.AnalysisProperties;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current dataset snapshot. Loading swaps in a new snapshot atomically, so readers that
 * already hold the previous one keep a consistent view.
 */
@Service
public class DatasetRegistry {
    private static final Logger log = LoggerFactory.getLogger(DatasetRegistry.class);

    private final AnalysisProperties properties;
    private final DatasetLoader loader;
    private final SchemaClassifier classifier;
    private final Clock clock;
    private final AtomicReference<DatasetSnapshot> current = new AtomicReference<>();

    public DatasetRegistry(
        AnalysisProperties properties,
        DatasetLoader loader,
        SchemaClassifier classifier,
        Clock clock
    ) {
        this.properties = properties;
        this.loader = loader;
        this.classifier = classifier;
        this.clock = clock;
    }

    @PostConstruct
    public void loadDefaultIfEnabled() {
        if (!properties.getData().isLoadOnStartup()) {
            return;
        }
        Path path = resolvePath(properties.getData().getDefaultFile());
        if (!Files.isRegularFile(path)) {
            log.warn("Default dataset {} not found, waiting for an upload", path);
            return;
        }
        try {
            reloadDefault();
        } catch (DatasetLoadException | SchemaException e) {
            log.warn("Default dataset {} could not be used: {}", path, e.getMessage());
        }
    }

    public DatasetSnapshot reloadDefault() {
        Path path = resolvePath(properties.getData().getDefaultFile());
        return install(loader.load(path));
    }

    /**
     * The active snapshot when it is usable, otherwise a fresh load of the default file.
     */
    public DatasetSnapshot currentOrReloadDefault() {
        DatasetSnapshot snapshot = current.get();
        if (snapshot != null && snapshot.isUsable()) {
            log.debug("Reusing active dataset {}", snapshot.dataset().source());
            return snapshot;
        }
        return reloadDefault();
    }

    public DatasetSnapshot load(String sourceName, InputStream in) {
        return install(loader.load(sourceName, in));
    }

    /**
     * Classifies and publishes a dataset. A dataset that fails classification still replaces the
     * current snapshot, which then rejects every engine call until a usable dataset is installed.
     */
    public DatasetSnapshot install(Dataset dataset) {
        DatasetSnapshot snapshot;
        try {
            ColumnClassification classification = classifier.classify(dataset);
            snapshot = DatasetSnapshot.classified(dataset, classification, clock.instant());
        } catch (SchemaException e) {
            current.set(DatasetSnapshot.failed(dataset, e, clock.instant()));
            log.warn("Dataset {} rejected: {}", dataset.source(), e.getMessage());
            throw e;
        }
        current.set(snapshot);
        ColumnClassification classification = snapshot.classification();
        log.info(
            "Dataset {} active. records={}, metrics={}, grouping={}, name={}",
            dataset.source(),
            dataset.size(),
            classification.metricColumns().size(),
            classification.groupingColumn(),
            classification.nameColumn()
        );
        return snapshot;
    }

    /**
     * The snapshot engine calls run against.
     *
     * @throws DatasetUnavailableException when nothing has been loaded yet
     * @throws SchemaException when the active dataset could not be classified
     */
    public DatasetSnapshot current() {
        DatasetSnapshot snapshot = current.get();
        if (snapshot == null) {
            throw new DatasetUnavailableException("no dataset loaded");
        }
        if (!snapshot.isUsable()) {
            throw new SchemaException(snapshot.schemaError().getMessage());
        }
        return snapshot;
    }

    public DatasetStatusResponse status() {
        DatasetSnapshot snapshot = current.get();
        if (snapshot == null) {
            return new DatasetStatusResponse(false, null, null, 0, 0, null, null);
        }
        Dataset dataset = snapshot.dataset();
        return new DatasetStatusResponse(
            snapshot.isUsable(),
            dataset.source(),
            snapshot.loadedAt(),
            dataset.size(),
            dataset.columns().size(),
            snapshot.classification(),
            snapshot.isUsable() ? null : snapshot.schemaError().getMessage()
        );
    }

    private Path resolvePath(String configuredPath) {
        Path path = Paths.get(configuredPath);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return Paths.get("").toAbsolutePath().resolve(path).normalize();
    }
}
