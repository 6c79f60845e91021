package com.dtinsight.analysis.schema;

import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CompanyRecord;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.config.AnalysisProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Assigns column roles to a dataset: identifier, optional grouping (industry) column, optional
 * company name column and the ordered metric columns.
 */
@Component
public class SchemaClassifier {
    private static final Logger log = LoggerFactory.getLogger(SchemaClassifier.class);

    private final AnalysisProperties properties;

    public SchemaClassifier(AnalysisProperties properties) {
        this.properties = properties;
    }

    public ColumnClassification classify(Dataset dataset) {
        AnalysisProperties.Columns columns = properties.getColumns();
        String identifierColumn = findIdentifierColumn(dataset, columns);
        verifyIdentifierValues(dataset, identifierColumn);

        String groupingColumn = firstPresent(dataset, columns.getGroupingCandidates());
        String nameColumn = firstPresent(dataset, columns.getNameCandidates());

        List<String> metricColumns = new ArrayList<>();
        if (!dataset.isEmpty()) {
            for (String column : dataset.columns()) {
                if (!column.equals(identifierColumn)
                    && !columns.getAnonymousIndexNames().contains(column)
                    && isNumericColumn(dataset, column)) {
                    metricColumns.add(column);
                }
            }
        }

        log.debug(
            "Classified dataset {}: identifier={}, grouping={}, name={}, metrics={}",
            dataset.source(),
            identifierColumn,
            groupingColumn,
            nameColumn,
            metricColumns.size()
        );
        return new ColumnClassification(identifierColumn, groupingColumn, nameColumn, metricColumns);
    }

    /**
     * A named stock-code column wins; an anonymous export index is used only when none exists.
     */
    private String findIdentifierColumn(Dataset dataset, AnalysisProperties.Columns columns) {
        String identifier = firstPresent(dataset, columns.getIdentifierCandidates());
        if (identifier != null) {
            return identifier;
        }
        String anonymous = firstPresent(dataset, columns.getAnonymousIndexNames());
        if (anonymous == null) {
            throw new SchemaException("missing identifier column, expected one of " + columns.getIdentifierCandidates());
        }
        return anonymous;
    }

    private void verifyIdentifierValues(Dataset dataset, String identifierColumn) {
        Set<Long> seen = new HashSet<>();
        int duplicates = 0;
        for (CompanyRecord record : dataset.records()) {
            Object value = record.get(identifierColumn);
            if (value == null) {
                throw new SchemaException(
                    "identifier column " + identifierColumn + " is empty at row " + record.rowIndex());
            }
            if (!isIntegral(value)) {
                throw new SchemaException(
                    "identifier column " + identifierColumn + " has non-integer value at row " + record.rowIndex());
            }
            if (!seen.add(((Number) value).longValue())) {
                duplicates++;
            }
        }
        if (duplicates > 0) {
            log.warn("Dataset {} has {} duplicate identifiers in {}", dataset.source(), duplicates, identifierColumn);
        }
    }

    private boolean isNumericColumn(Dataset dataset, String column) {
        for (CompanyRecord record : dataset.records()) {
            Object value = record.get(column);
            if (value != null && !(value instanceof Number)) {
                return false;
            }
        }
        return true;
    }

    private boolean isIntegral(Object value) {
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return !Double.isNaN(d) && !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }

    private String firstPresent(Dataset dataset, List<String> candidates) {
        for (String candidate : candidates) {
            if (dataset.hasColumn(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
