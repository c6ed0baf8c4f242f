package com.team.detection.source;

import com.team.detection.core.TeamDetectionException;

import java.util.OptionalInt;

/**
 * Thrown when a page cannot be fetched: the request failed or the response status was not 2xx.
 * Always fatal to the run.
 */
public class TransportException extends TeamDetectionException {

    private final String url;
    private final Integer statusCode;

    public TransportException(String url, int statusCode) {
        super("Request to " + url + " returned status " + statusCode);
        this.url = url;
        this.statusCode = statusCode;
    }

    public TransportException(String url, Throwable cause) {
        super("Request to " + url + " failed: " + cause.getMessage(), cause);
        this.url = url;
        this.statusCode = null;
    }

    public String getUrl() {
        return url;
    }

    /**
     * Returns the HTTP status, or empty if no response was received.
     */
    public OptionalInt getStatusCode() {
        return statusCode != null ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }
}
