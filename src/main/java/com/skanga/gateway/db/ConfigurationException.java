package com.skanga.gateway.db;

/**
 * Raised when configuration values are missing or cannot be parsed.
 */
public class ConfigurationException extends GatewayException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
