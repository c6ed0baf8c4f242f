package com.team.detection.extract;

import com.team.detection.core.TeamDetectionException;

/**
 * Thrown when an expected field cannot be read from fetched content.
 * Fatal: there is no safe default for a missing identifier.
 */
public class ExtractionException extends TeamDetectionException {

    private final String field;

    public ExtractionException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ExtractionException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    /**
     * Returns the name of the field that could not be read.
     */
    public String getField() {
        return field;
    }
}
