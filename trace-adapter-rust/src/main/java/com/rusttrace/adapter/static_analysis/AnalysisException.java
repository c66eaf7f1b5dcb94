package com.rusttrace.adapter.static_analysis;

/**
 * Fatal analysis failure: the run cannot produce a trustworthy result and is aborted.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
