package org.operaton.rungrade.exception;

/**
 * Exception thrown when an activity file parses but holds no usable track points.
 */
public class EmptyTrackException extends RuntimeException {

    public EmptyTrackException(String message) {
        super(message);
    }

    public EmptyTrackException(String message, Throwable cause) {
        super(message, cause);
    }
}
