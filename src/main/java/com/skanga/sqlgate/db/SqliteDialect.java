package com.skanga.sqlgate.db;

import com.skanga.sqlgate.security.SqlStatementClassifier;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.temporal.TemporalAccessor;

/**
 * SQLite: no native date types, so temporal values are bound as ISO-8601 text; inserted row ids
 * come from {@code last_insert_rowid()} on the same connection.
 */
public class SqliteDialect implements EngineDialect {

    @Override
    public PreparedStatement prepare(Connection dbConn, String sql) throws SQLException {
        return dbConn.prepareStatement(sql);
    }

    @Override
    public Long lastInsertId(PreparedStatement prepStmt, String sql) throws SQLException {
        String normalized = SqlStatementClassifier.normalize(sql);
        if (!normalized.startsWith("insert") && !normalized.startsWith("replace")) {
            return null;
        }
        try (Statement stmt = prepStmt.getConnection().createStatement();
             ResultSet resultSet = stmt.executeQuery("SELECT last_insert_rowid()")) {
            return resultSet.next() ? resultSet.getLong(1) : null;
        }
    }

    @Override
    public void setOtherValue(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException {
        if (paramValue instanceof java.sql.Timestamp) {
            prepStmt.setString(paramIndex, ((java.sql.Timestamp) paramValue).toInstant().toString());
        } else if (paramValue instanceof java.sql.Date || paramValue instanceof java.sql.Time) {
            prepStmt.setString(paramIndex, paramValue.toString());
        } else if (paramValue instanceof java.util.Date) {
            prepStmt.setString(paramIndex, Instant.ofEpochMilli(((java.util.Date) paramValue).getTime()).toString());
        } else if (paramValue instanceof TemporalAccessor) {
            prepStmt.setString(paramIndex, paramValue.toString());
        } else {
            // For other types, convert to string and let the database handle it
            prepStmt.setString(paramIndex, paramValue.toString());
        }
    }
}
