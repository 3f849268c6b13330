package com.skanga.sqlgate.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Location and credentials of the execution log store.
 * Validation happens at construction so a misconfigured client-server backend
 * fails at startup instead of at the first log write.
 *
 * @param kind           the active backend
 * @param fileDirectory  directory holding the daily JSON-lines files (append-only-file backend)
 * @param sqliteFilePath database file (embedded-file backend)
 * @param host           server host (client-server backend, mandatory)
 * @param port           server port (client-server backend, mandatory)
 * @param user           user name (client-server backend, mandatory)
 * @param password       password (client-server backend, mandatory)
 * @param database       schema holding the execution_logs table (client-server backend)
 * @param charset        connection character set (client-server backend)
 */
public record LogBackendConfig(
        LogBackendKind kind,
        Path fileDirectory,
        Path sqliteFilePath,
        String host,
        Integer port,
        String user,
        String password,
        String database,
        String charset
) {
    public static final Path DEFAULT_FILE_DIRECTORY = Paths.get("execution_logs");
    public static final Path DEFAULT_SQLITE_FILE = Paths.get("execution_logs.db");
    public static final String DEFAULT_DATABASE = "execution_logs";

    public LogBackendConfig {
        if (kind == null) {
            throw new ConfigurationException("Log backend kind must be set");
        }
        if (kind == LogBackendKind.CLIENT_SERVER) {
            List<String> missing = new ArrayList<>();
            if (host == null || host.isBlank()) missing.add("DB_IP");
            if (port == null || port <= 0) missing.add("DB_PORT");
            if (user == null || user.isBlank()) missing.add("DB_USER");
            if (password == null || password.isEmpty()) missing.add("DB_PASSWORD");
            if (!missing.isEmpty()) {
                throw new ConfigurationException("Missing required settings for mysql log backend: " + missing);
            }
        }
        fileDirectory = fileDirectory != null ? fileDirectory : DEFAULT_FILE_DIRECTORY;
        sqliteFilePath = sqliteFilePath != null ? sqliteFilePath : DEFAULT_SQLITE_FILE;
        database = database != null && !database.isBlank() ? database : DEFAULT_DATABASE;
        charset = charset != null && !charset.isBlank() ? charset : DatabaseDescriptor.DEFAULT_CHARSET;
    }

    public static LogBackendConfig appendOnlyFile(Path directory) {
        return new LogBackendConfig(LogBackendKind.APPEND_ONLY_FILE, directory, null,
                null, null, null, null, null, null);
    }

    public static LogBackendConfig embeddedFile(Path sqliteFile) {
        return new LogBackendConfig(LogBackendKind.EMBEDDED_FILE, null, sqliteFile,
                null, null, null, null, null, null);
    }

    public static LogBackendConfig clientServer(String host, int port, String user, String password, String database) {
        return new LogBackendConfig(LogBackendKind.CLIENT_SERVER, null, null,
                host, port, user, password, database, null);
    }

    /**
     * @return JDBC URL of the client-server log database; the schema is created on first connect
     */
    public String mysqlJdbcUrl() {
        return String.format("jdbc:mysql://%s:%d/%s?characterEncoding=%s&createDatabaseIfNotExist=true",
                host, port, database, DatabaseDescriptor.javaCharset(charset));
    }

    @Override
    public String toString() {
        return switch (kind) {
            case APPEND_ONLY_FILE -> String.format("LogBackend{kind=file, directory='%s'}", fileDirectory);
            case EMBEDDED_FILE -> String.format("LogBackend{kind=sqlite, file='%s'}", sqliteFilePath);
            case CLIENT_SERVER -> String.format("LogBackend{kind=mysql, host='%s', port=%d, user='%s', password='***', database='%s'}",
                    host, port, user, database);
        };
    }
}
