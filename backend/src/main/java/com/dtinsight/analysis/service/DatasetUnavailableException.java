package com.dtinsight.analysis.service;

import com.dtinsight.analysis.engine.AnalysisException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class DatasetUnavailableException extends AnalysisException {
    public DatasetUnavailableException(String message) {
        super(message);
    }

    @Override
    public String errorCode() {
        return "dataset_unavailable";
    }
}
