package com.dtinsight.analysis.load;

import com.dtinsight.analysis.engine.AnalysisException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class DatasetLoadException extends AnalysisException {
    public DatasetLoadException(String message) {
        super(message);
    }

    public DatasetLoadException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String errorCode() {
        return "dataset_load_failed";
    }
}
