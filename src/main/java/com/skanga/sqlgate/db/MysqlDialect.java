package com.skanga.sqlgate.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;

/**
 * MySQL: temporal values use the driver's native date and time binding; inserted ids come from
 * the generated keys of the statement.
 */
public class MysqlDialect implements EngineDialect {

    @Override
    public PreparedStatement prepare(Connection dbConn, String sql) throws SQLException {
        return dbConn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
    }

    @Override
    public Long lastInsertId(PreparedStatement prepStmt, String sql) throws SQLException {
        try (ResultSet keys = prepStmt.getGeneratedKeys()) {
            if (keys != null && keys.next()) {
                long id = keys.getLong(1);
                return keys.wasNull() ? null : id;
            }
        }
        return null;
    }

    @Override
    public void setOtherValue(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException {
        if (paramValue instanceof java.sql.Date) {
            prepStmt.setDate(paramIndex, (java.sql.Date) paramValue);
        } else if (paramValue instanceof java.sql.Time) {
            prepStmt.setTime(paramIndex, (java.sql.Time) paramValue);
        } else if (paramValue instanceof Timestamp) {
            prepStmt.setTimestamp(paramIndex, (Timestamp) paramValue);
        } else if (paramValue instanceof java.util.Date) {
            // Convert java.util.Date to java.sql.Timestamp
            prepStmt.setTimestamp(paramIndex, new Timestamp(((java.util.Date) paramValue).getTime()));
        } else if (paramValue instanceof Instant) {
            prepStmt.setTimestamp(paramIndex, Timestamp.from((Instant) paramValue));
        } else if (paramValue instanceof LocalDate || paramValue instanceof LocalDateTime
                || paramValue instanceof LocalTime || paramValue instanceof OffsetDateTime) {
            prepStmt.setObject(paramIndex, paramValue);
        } else {
            // For other types, convert to string and let the database handle it
            prepStmt.setString(paramIndex, paramValue.toString());
        }
    }
}
