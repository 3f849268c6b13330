package com.skanga.sqlgate.exelog;

import com.skanga.sqlgate.config.LogBackendKind;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Audit store in an embedded SQLite file. Execution times are stored as fixed-width UTC text
 * so that text order is chronological order.
 */
public class SqliteLogStore extends JdbcLogStore {
    private static final Logger logger = LoggerFactory.getLogger(SqliteLogStore.class);

    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter CREATED_AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS " + TABLE_NAME + " ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, "
                    + "user_name TEXT NOT NULL, "
                    + "command TEXT NOT NULL, "
                    + "result TEXT, "
                    + "execution_time TEXT NOT NULL, "
                    + "time_cost_ms INTEGER NOT NULL, "
                    + "command_type TEXT NOT NULL DEFAULT 'unknown', "
                    + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)",
            "CREATE INDEX IF NOT EXISTS idx_user_time ON " + TABLE_NAME + " (user_name, execution_time)",
            "CREATE INDEX IF NOT EXISTS idx_execution_time ON " + TABLE_NAME + " (execution_time)");

    private final Path databaseFile;

    public SqliteLogStore(Path databaseFile) {
        this(databaseFile, createDataSource(databaseFile));
    }

    SqliteLogStore(Path databaseFile, HikariDataSource dataSource) {
        super(dataSource);
        this.databaseFile = databaseFile.toAbsolutePath().normalize();
    }

    private static HikariDataSource createDataSource(Path databaseFile) {
        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setPoolName("execution-log-sqlite");
        poolConfig.setDriverClassName("org.sqlite.JDBC");
        poolConfig.setJdbcUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath().normalize());
        poolConfig.setMaximumPoolSize(4);
        poolConfig.setAutoCommit(true);
        // Writers from several callers wait on the file lock instead of failing with SQLITE_BUSY
        poolConfig.addDataSourceProperty("busy_timeout", "5000");
        // Defer the first connection so an unwritable location surfaces from initialize()
        poolConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(poolConfig);
    }

    @Override
    public LogBackendKind kind() {
        return LogBackendKind.EMBEDDED_FILE;
    }

    @Override
    public synchronized void initialize() throws LogStoreException {
        Path parent = databaseFile.getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new LogStoreException("Cannot create directory for SQLite log database: " + parent, e);
            }
        }
        super.initialize();
    }

    @Override
    protected List<String> schemaStatements() {
        return SCHEMA;
    }

    @Override
    protected void bindTime(PreparedStatement prepStmt, int index, Instant time) throws SQLException {
        prepStmt.setString(index, TIME_FORMAT.format(time));
    }

    @Override
    protected Instant readTime(ResultSet resultSet, String column) throws SQLException {
        String text = resultSet.getString(column);
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new SQLException("Unreadable " + column + " value: " + text, e);
        }
    }

    @Override
    protected Instant readCreatedAt(ResultSet resultSet) throws SQLException {
        String text = resultSet.getString("created_at");
        if (text == null) {
            return null;
        }
        try {
            return LocalDateTime.parse(text, CREATED_AT_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unreadable created_at value: {}", text);
            return null;
        }
    }

    public Path databaseFile() {
        return databaseFile;
    }

    @Override
    public void close() {
        ((HikariDataSource) dataSource()).close();
    }
}
