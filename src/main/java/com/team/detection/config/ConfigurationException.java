package com.team.detection.config;

import com.team.detection.core.TeamDetectionException;

/**
 * Thrown when a run cannot be configured: a required value is missing from both the command line
 * and the persisted configuration, or a supplied value is malformed. Raised before any network activity.
 */
public class ConfigurationException extends TeamDetectionException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
