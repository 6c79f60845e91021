package com.dtinsight.analysis.engine;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Operation parameters do not fit the dataset's classification, e.g. an unknown metric or a
 * grouping request on a dataset without a grouping column.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ConfigurationException extends AnalysisException {
    public ConfigurationException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "configuration_error";
    }
}
