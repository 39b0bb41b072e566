package com.ipintel.config;

/**
 * Startup-fatal configuration problem: missing credentials, invalid pool settings or an
 * unusable gateway definition.  Raised before any record is processed.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
