package org.operaton.rungrade.model.dto;

/**
 * Body of every failed API request.
 */
public record ErrorResponse(boolean success, String error) {

    public ErrorResponse(String error) {
        this(false, error);
    }
}
