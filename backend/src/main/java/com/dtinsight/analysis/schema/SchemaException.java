package com.dtinsight.analysis.schema;

import com.dtinsight.analysis.engine.AnalysisException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The dataset cannot be used at all, typically because the identifier column is missing.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class SchemaException extends AnalysisException {
    public SchemaException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "schema_error";
    }
}
