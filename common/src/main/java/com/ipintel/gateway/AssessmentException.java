package com.ipintel.gateway;

/**
 * Failed assessment call, including a stream that broke before completion.
 * Fatal for the record being enriched, never for the run.
 */
public class AssessmentException extends Exception {

    private static final long serialVersionUID = 1L;

    public AssessmentException(String message) {
        super(message);
    }

    public AssessmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
