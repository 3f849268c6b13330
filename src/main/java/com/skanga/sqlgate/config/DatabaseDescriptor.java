package com.skanga.sqlgate.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Static description of one logical database a statement can be routed to.
 *
 * @param name     logical identifier used in statement routing
 * @param engine   the engine backing this database
 * @param filePath database file for the embedded-file engine; relative paths are rooted under the data directory
 * @param host     server host for the client-server engine
 * @param port     server port for the client-server engine
 * @param user     user name for the client-server engine
 * @param password password for the client-server engine
 * @param database physical schema name on the server (defaults to the logical name)
 * @param charset  connection character set for the client-server engine
 */
public record DatabaseDescriptor(
        String name,
        DatabaseEngine engine,
        String filePath,
        String host,
        int port,
        String user,
        String password,
        String database,
        String charset
) {
    public static final int DEFAULT_MYSQL_PORT = 3306;
    public static final String DEFAULT_CHARSET = "utf8mb4";

    public DatabaseDescriptor {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Database name cannot be null or empty");
        }
        if (engine == null) {
            throw new ConfigurationException("Database engine must be set for database: " + name);
        }
        name = name.trim();
        if (engine == DatabaseEngine.EMBEDDED_FILE) {
            if (filePath == null || filePath.isBlank()) {
                filePath = name + ".db";
            }
        } else {
            if (host == null || host.isBlank()) {
                throw new ConfigurationException("Host is required for client-server database: " + name);
            }
            if (port <= 0) {
                port = DEFAULT_MYSQL_PORT;
            }
            if (database == null || database.isBlank()) {
                database = name;
            }
            if (charset == null || charset.isBlank()) {
                charset = DEFAULT_CHARSET;
            }
        }
    }

    /**
     * Describes an embedded-file database.
     *
     * @param name     logical name
     * @param filePath database file, or null for {@code <name>.db}
     * @return the descriptor
     */
    public static DatabaseDescriptor embedded(String name, String filePath) {
        return new DatabaseDescriptor(name, DatabaseEngine.EMBEDDED_FILE, filePath,
                null, 0, null, null, null, null);
    }

    /**
     * Describes a client-server database.
     */
    public static DatabaseDescriptor clientServer(String name, String host, int port, String user,
                                                  String password, String database) {
        return new DatabaseDescriptor(name, DatabaseEngine.CLIENT_SERVER, null,
                host, port, user, password, database, DEFAULT_CHARSET);
    }

    /**
     * Resolves the database file of an embedded-file database.
     *
     * @param dataDirectory directory that roots relative file paths
     * @return absolute, normalized path of the database file
     * @throws IllegalStateException if this is not an embedded-file database
     */
    public Path resolveFilePath(Path dataDirectory) {
        if (engine != DatabaseEngine.EMBEDDED_FILE) {
            throw new IllegalStateException("Database " + name + " is not file based");
        }
        Path path = Paths.get(filePath);
        if (!path.isAbsolute()) {
            path = dataDirectory.resolve(path);
        }
        return path.toAbsolutePath().normalize();
    }

    /**
     * Builds the JDBC URL for this database.
     *
     * @param dataDirectory directory that roots relative embedded file paths
     * @return the JDBC URL
     */
    public String jdbcUrl(Path dataDirectory) {
        if (engine == DatabaseEngine.EMBEDDED_FILE) {
            return "jdbc:sqlite:" + resolveFilePath(dataDirectory);
        }
        return String.format("jdbc:mysql://%s:%d/%s?characterEncoding=%s", host, port, database, javaCharset(charset));
    }

    /**
     * Maps a MySQL character set name to the Java encoding Connector/J expects.
     */
    static String javaCharset(String mysqlCharset) {
        String normalized = mysqlCharset.toLowerCase(Locale.ROOT);
        if (normalized.equals("utf8mb4") || normalized.equals("utf8") || normalized.equals("utf8mb3")) {
            return "UTF-8";
        }
        if (normalized.equals("latin1")) {
            return "ISO-8859-1";
        }
        return mysqlCharset;
    }

    @Override
    public String toString() {
        if (engine == DatabaseEngine.EMBEDDED_FILE) {
            return String.format("Database{name='%s', engine=%s, file='%s'}", name, engine.configName(), filePath);
        }
        return String.format("Database{name='%s', engine=%s, host='%s', port=%d, user='%s', password='%s', database='%s'}",
                name, engine.configName(), host, port, user, password == null ? null : "***", database);
    }
}
