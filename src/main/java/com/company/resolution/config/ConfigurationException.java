package com.company.resolution.config;

/**
 * Thrown when a threshold, weight, batch size or other setting is invalid.
 * Raised while options are built, before any records are processed.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
