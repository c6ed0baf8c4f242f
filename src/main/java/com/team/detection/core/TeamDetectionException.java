package com.team.detection.core;

/**
 * Base class for every failure that terminates a team detection run.
 * Visibility restrictions on a profile are not failures and never surface as exceptions.
 */
public class TeamDetectionException extends RuntimeException {

    public TeamDetectionException(String message) {
        super(message);
    }

    public TeamDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
