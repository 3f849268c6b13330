package com.skanga.sqlgate.config;

import java.util.Locale;

/**
 * Persistence backends available to the execution logger.
 * Exactly one kind is active for the whole process.
 */
public enum LogBackendKind {
    CLIENT_SERVER("mysql"),
    EMBEDDED_FILE("sqlite"),
    APPEND_ONLY_FILE("file");

    private final String configName;

    LogBackendKind(String configName) {
        this.configName = configName;
    }

    /**
     * @return the value used for this kind in the LOG_TYPE setting
     */
    public String configName() {
        return configName;
    }

    /**
     * Parses a LOG_TYPE value.
     *
     * @param logType the configured value, case-insensitive
     * @return the matching backend kind
     * @throws ConfigurationException if the value is not one of mysql, sqlite, file
     */
    public static LogBackendKind fromName(String logType) {
        if (logType != null) {
            String normalized = logType.trim().toLowerCase(Locale.ROOT);
            for (LogBackendKind kind : values()) {
                if (kind.configName.equals(normalized)) {
                    return kind;
                }
            }
        }
        throw new ConfigurationException("Invalid LOG_TYPE: " + logType + ". Must be one of: mysql, sqlite, file");
    }
}
