package com.skanga.sqlgate.config;

/**
 * Raised when the gateway configuration is incomplete or inconsistent.
 * Covers missing mandatory backend settings, unknown engine or backend names,
 * and logical database names that do not map to a configured database.
 * These errors are not retried.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
