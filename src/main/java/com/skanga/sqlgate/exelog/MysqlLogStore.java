package com.skanga.sqlgate.exelog;

import com.skanga.sqlgate.config.LogBackendConfig;
import com.skanga.sqlgate.config.LogBackendKind;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Audit store in a MySQL schema. Execution times are kept as UTC {@code DATETIME(3)} values.
 */
public class MysqlLogStore extends JdbcLogStore {

    private static final List<String> SCHEMA = List.of(
            "CREATE TABLE IF NOT EXISTS " + TABLE_NAME + " ("
                    + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
                    + "user_name VARCHAR(255) NOT NULL, "
                    + "command TEXT NOT NULL, "
                    + "result LONGTEXT, "
                    + "execution_time DATETIME(3) NOT NULL, "
                    + "time_cost_ms BIGINT NOT NULL, "
                    + "command_type VARCHAR(64) DEFAULT 'unknown' NOT NULL, "
                    + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, "
                    + "INDEX idx_user_time (user_name, execution_time), "
                    + "INDEX idx_execution_time (execution_time))");

    public MysqlLogStore(LogBackendConfig config) {
        this(createDataSource(config));
    }

    /**
     * Uses an externally managed data source, which is left open by {@link #close()} unless it is a Hikari pool.
     */
    public MysqlLogStore(DataSource dataSource) {
        super(dataSource);
    }

    private static HikariDataSource createDataSource(LogBackendConfig config) {
        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setPoolName("execution-log-mysql");
        poolConfig.setDriverClassName("com.mysql.cj.jdbc.Driver");
        poolConfig.setJdbcUrl(config.mysqlJdbcUrl());
        poolConfig.setUsername(config.user());
        poolConfig.setPassword(config.password());
        poolConfig.setMaximumPoolSize(4);
        poolConfig.setAutoCommit(true);
        // An unreachable server must not fail construction; it surfaces from initialize() and each write
        poolConfig.setInitializationFailTimeout(-1);
        return new HikariDataSource(poolConfig);
    }

    @Override
    public LogBackendKind kind() {
        return LogBackendKind.CLIENT_SERVER;
    }

    @Override
    protected List<String> schemaStatements() {
        return SCHEMA;
    }

    @Override
    protected void bindTime(PreparedStatement prepStmt, int index, Instant time) throws SQLException {
        prepStmt.setObject(index, LocalDateTime.ofInstant(time, ZoneOffset.UTC));
    }

    @Override
    protected Instant readTime(ResultSet resultSet, String column) throws SQLException {
        LocalDateTime value = resultSet.getObject(column, LocalDateTime.class);
        return value == null ? null : value.toInstant(ZoneOffset.UTC);
    }

    @Override
    protected Instant readCreatedAt(ResultSet resultSet) throws SQLException {
        Timestamp createdAt = resultSet.getTimestamp("created_at");
        return createdAt == null ? null : createdAt.toInstant();
    }

    @Override
    public void close() {
        if (dataSource() instanceof HikariDataSource) {
            ((HikariDataSource) dataSource()).close();
        }
    }
}
