package com.skanga.sqlgate.exelog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Audit store over a relational {@code execution_logs} table. Subclasses supply the dialect
 * specific schema and the mapping of execution times to and from column values.
 */
public abstract class JdbcLogStore implements ExecutionLogStore {
    private static final Logger logger = LoggerFactory.getLogger(JdbcLogStore.class);

    public static final String TABLE_NAME = "execution_logs";

    private static final String INSERT_SQL = "INSERT INTO " + TABLE_NAME
            + " (user_name, command, result, execution_time, time_cost_ms, command_type) VALUES (?, ?, ?, ?, ?, ?)";
    private static final String SELECT_SQL = "SELECT id, user_name, command, result, execution_time, time_cost_ms, command_type, created_at FROM "
            + TABLE_NAME;

    private final DataSource dataSource;
    private volatile boolean initialized;

    protected JdbcLogStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @return DDL creating the table and its indexes; every statement must be idempotent
     */
    protected abstract List<String> schemaStatements();

    protected abstract void bindTime(PreparedStatement prepStmt, int index, Instant time) throws SQLException;

    protected abstract Instant readTime(ResultSet resultSet, String column) throws SQLException;

    protected abstract Instant readCreatedAt(ResultSet resultSet) throws SQLException;

    @Override
    public synchronized void initialize() throws LogStoreException {
        if (initialized) {
            return;
        }
        try (Connection dbConn = dataSource.getConnection();
             Statement stmt = dbConn.createStatement()) {
            for (String ddl : schemaStatements()) {
                stmt.execute(ddl);
            }
            commitIfNeeded(dbConn);
        } catch (SQLException e) {
            throw new LogStoreException("Failed to create " + TABLE_NAME + " table: " + e.getMessage(), e);
        }
        initialized = true;
        logger.debug("{} table ready for {} log store", TABLE_NAME, kind().configName());
    }

    @Override
    public void append(LogEntry entry) throws LogStoreException {
        initialize();
        try (Connection dbConn = dataSource.getConnection();
             PreparedStatement prepStmt = dbConn.prepareStatement(INSERT_SQL)) {
            prepStmt.setString(1, entry.user());
            prepStmt.setString(2, entry.command());
            prepStmt.setString(3, entry.result());
            bindTime(prepStmt, 4, entry.executionTime());
            prepStmt.setLong(5, entry.timeCostMs());
            prepStmt.setString(6, entry.commandType());
            prepStmt.executeUpdate();
            commitIfNeeded(dbConn);
        } catch (SQLException e) {
            throw new LogStoreException("Failed to insert execution log: " + e.getMessage(), e);
        }
    }

    @Override
    public List<LogEntry> query(LogQuery query) throws LogStoreException {
        initialize();
        List<String> conditions = new ArrayList<>();
        if (query.user() != null) {
            conditions.add("user_name = ?");
        }
        if (query.startTime() != null) {
            conditions.add("execution_time >= ?");
        }
        if (query.endTime() != null) {
            conditions.add("execution_time <= ?");
        }
        String whereClause = conditions.isEmpty() ? "1=1" : String.join(" AND ", conditions);
        String sql = SELECT_SQL + " WHERE " + whereClause + " ORDER BY execution_time DESC, id DESC LIMIT ?";

        try (Connection dbConn = dataSource.getConnection();
             PreparedStatement prepStmt = dbConn.prepareStatement(sql)) {
            int paramIndex = 1;
            if (query.user() != null) {
                prepStmt.setString(paramIndex++, query.user());
            }
            if (query.startTime() != null) {
                bindTime(prepStmt, paramIndex++, query.startTime());
            }
            if (query.endTime() != null) {
                bindTime(prepStmt, paramIndex++, query.endTime());
            }
            prepStmt.setInt(paramIndex, query.limit());

            List<LogEntry> entries = new ArrayList<>();
            try (ResultSet resultSet = prepStmt.executeQuery()) {
                while (resultSet.next()) {
                    entries.add(new LogEntry(
                            resultSet.getLong("id"),
                            resultSet.getString("user_name"),
                            resultSet.getString("command"),
                            resultSet.getString("result"),
                            readTime(resultSet, "execution_time"),
                            resultSet.getLong("time_cost_ms"),
                            resultSet.getString("command_type"),
                            readCreatedAt(resultSet)));
                }
            }
            commitIfNeeded(dbConn);
            return entries;
        } catch (SQLException e) {
            throw new LogStoreException("Failed to query execution logs: " + e.getMessage(), e);
        }
    }

    protected DataSource dataSource() {
        return dataSource;
    }

    private static void commitIfNeeded(Connection dbConn) throws SQLException {
        if (!dbConn.getAutoCommit()) {
            dbConn.commit();
        }
    }
}
