package org.operaton.rungrade.exception;

/**
 * Exception thrown when an analysis request is malformed, e.g. it carries no results.
 */
public class InvalidAnalysisRequestException extends RuntimeException {

    public InvalidAnalysisRequestException(String message) {
        super(message);
    }

    public InvalidAnalysisRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
