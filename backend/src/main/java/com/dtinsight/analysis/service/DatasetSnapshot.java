package com.dtinsight.analysis.service;

import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.schema.SchemaException;

import java.time.Instant;

/**
 * A dataset together with its classification, or the schema failure that prevented classifying it.
 * Never mutated; a reload produces a new snapshot.
 */
public record DatasetSnapshot(
    Dataset dataset,
    ColumnClassification classification,
    SchemaException schemaError,
    Instant loadedAt
) {
    public static DatasetSnapshot classified(Dataset dataset, ColumnClassification classification, Instant loadedAt) {
        return new DatasetSnapshot(dataset, classification, null, loadedAt);
    }

    public static DatasetSnapshot failed(Dataset dataset, SchemaException schemaError, Instant loadedAt) {
        return new DatasetSnapshot(dataset, null, schemaError, loadedAt);
    }

    public boolean isUsable() {
        return schemaError == null;
    }
}
