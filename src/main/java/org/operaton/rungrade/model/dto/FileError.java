package org.operaton.rungrade.model.dto;

/**
 * A file that could not be analyzed, reported next to the successful results.
 *
 * @param filename  original upload name
 * @param error     human readable reason
 * @param errorType one of the {@link ErrorType} constants
 */
public record FileError(String filename, String error, String errorType) {

    /**
     * Error type constants for categorizing file failures.
     */
    public static final class ErrorType {
        public static final String PARSING_ERROR = "PARSING_ERROR";
        public static final String UNSUPPORTED_FORMAT = "UNSUPPORTED_FORMAT";
        public static final String EMPTY_TRACK = "EMPTY_TRACK";
        public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
        public static final String UNKNOWN_ERROR = "UNKNOWN_ERROR";

        private ErrorType() {
        }
    }
}
