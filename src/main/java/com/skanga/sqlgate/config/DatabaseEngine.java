package com.skanga.sqlgate.config;

import java.util.Locale;

/**
 * Relational engines a logical database can be mapped to.
 */
public enum DatabaseEngine {
    /** In-process engine persisting to a local file (SQLite). */
    EMBEDDED_FILE("embedded-file", "org.sqlite.JDBC"),
    /** Engine reached over the network (MySQL). */
    CLIENT_SERVER("client-server", "com.mysql.cj.jdbc.Driver");

    private final String configName;
    private final String driverClassName;

    DatabaseEngine(String configName, String driverClassName) {
        this.configName = configName;
        this.driverClassName = driverClassName;
    }

    public String configName() {
        return configName;
    }

    public String driverClassName() {
        return driverClassName;
    }

    /**
     * Parses an engine name as it appears in configuration.
     * Accepts the canonical names as well as the concrete engine names ("sqlite", "mysql").
     *
     * @param engineName the configured engine name
     * @return the matching engine
     * @throws ConfigurationException if the name is unknown
     */
    public static DatabaseEngine fromName(String engineName) {
        if (engineName == null || engineName.isBlank()) {
            throw new ConfigurationException("Database engine cannot be empty");
        }
        return switch (engineName.trim().toLowerCase(Locale.ROOT).replace('_', '-')) {
            case "embedded-file", "sqlite" -> EMBEDDED_FILE;
            case "client-server", "mysql" -> CLIENT_SERVER;
            default -> throw new ConfigurationException("Unknown database engine: " + engineName
                    + ". Must be one of: embedded-file (sqlite), client-server (mysql)");
        };
    }
}
