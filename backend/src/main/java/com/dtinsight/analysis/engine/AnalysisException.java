package com.dtinsight.analysis.engine;

/**
 * Base for failures raised by the analysis engine. Each subtype carries a stable error code.
 */
public abstract class AnalysisException extends RuntimeException {
    protected AnalysisException(String message) {
        super(message);
    }

    protected AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String errorCode();
}
