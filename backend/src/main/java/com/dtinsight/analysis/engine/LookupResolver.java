package com.dtinsight.analysis.engine;

import com.dtinsight.analysis.model.ColumnClassification;
import com.dtinsight.analysis.model.CompanyRecord;
import com.dtinsight.analysis.model.Dataset;
import com.dtinsight.analysis.model.LookupField;
import com.dtinsight.analysis.model.LookupMode;
import com.dtinsight.analysis.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Finds companies by stock code or name. Exact mode compares whole values; fuzzy mode is plain
 * case-sensitive substring containment. Matches keep dataset order.
 */
@Component
public class LookupResolver {
    private static final Logger log = LoggerFactory.getLogger(LookupResolver.class);

    public MatchResult resolve(
        Dataset dataset,
        ColumnClassification classification,
        String queryText,
        LookupField field,
        LookupMode mode
    ) {
        if (field == null || mode == null) {
            throw new ConfigurationException("lookup field and mode are required");
        }
        String query = queryText == null ? "" : queryText.strip();
        if (query.isEmpty()) {
            throw new ValidationException("query must not be empty");
        }

        Predicate<CompanyRecord> matcher = field == LookupField.IDENTIFIER
            ? identifierMatcher(classification.identifierColumn(), query, mode)
            : nameMatcher(classification, query, mode);

        List<CompanyRecord> matches = new ArrayList<>();
        for (CompanyRecord record : dataset.records()) {
            if (matcher.test(record)) {
                matches.add(record);
            }
        }
        log.debug("Lookup field={} mode={} query='{}' matched {} records", field, mode, query, matches.size());
        return new MatchResult(matches);
    }

    private Predicate<CompanyRecord> identifierMatcher(String identifierColumn, String query, LookupMode mode) {
        if (mode == LookupMode.EXACT) {
            long code = parseIdentifier(query);
            return record -> record.identifier(identifierColumn) == code;
        }
        return record -> Long.toString(record.identifier(identifierColumn)).contains(query);
    }

    private Predicate<CompanyRecord> nameMatcher(ColumnClassification classification, String query, LookupMode mode) {
        if (!classification.hasNameColumn()) {
            throw new ConfigurationException("dataset has no company name column");
        }
        String nameColumn = classification.nameColumn();
        if (mode == LookupMode.EXACT) {
            return record -> query.equals(record.text(nameColumn));
        }
        return record -> {
            String name = record.text(nameColumn);
            return name != null && name.contains(query);
        };
    }

    private long parseIdentifier(String query) {
        try {
            return Long.parseLong(query);
        } catch (NumberFormatException e) {
            throw new ValidationException("non-integer identifier", e);
        }
    }
}
