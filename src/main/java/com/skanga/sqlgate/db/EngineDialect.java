package com.skanga.sqlgate.db;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;

/**
 * Engine specific parts of statement execution. Callers always write JDBC {@code ?} placeholders
 * and bind positionally, so statement text is never rewritten and literal question marks inside
 * quoted strings survive untouched.
 */
public interface EngineDialect {

    /**
     * Prepares a statement so that the identity of inserted rows can be read afterwards.
     */
    PreparedStatement prepare(Connection dbConn, String sql) throws SQLException;

    /**
     * Identity generated by the statement just executed, or null if there is none.
     */
    Long lastInsertId(PreparedStatement prepStmt, String sql) throws SQLException;

    /**
     * Binds positional parameters, 1-based in JDBC order.
     */
    default void bind(PreparedStatement prepStmt, List<?> params) throws SQLException {
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.size(); i++) {
            setParameterValue(prepStmt, i + 1, params.get(i));
        }
    }

    /**
     * Sets a parameter value on a PreparedStatement with appropriate type handling.
     */
    default void setParameterValue(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException {
        if (paramValue == null) {
            prepStmt.setNull(paramIndex, Types.NULL);
        } else if (paramValue instanceof String) {
            prepStmt.setString(paramIndex, (String) paramValue);
        } else if (paramValue instanceof Integer) {
            prepStmt.setInt(paramIndex, (Integer) paramValue);
        } else if (paramValue instanceof Long) {
            prepStmt.setLong(paramIndex, (Long) paramValue);
        } else if (paramValue instanceof Double) {
            prepStmt.setDouble(paramIndex, (Double) paramValue);
        } else if (paramValue instanceof Float) {
            prepStmt.setFloat(paramIndex, (Float) paramValue);
        } else if (paramValue instanceof Boolean) {
            prepStmt.setBoolean(paramIndex, (Boolean) paramValue);
        } else if (paramValue instanceof java.math.BigDecimal) {
            prepStmt.setBigDecimal(paramIndex, (java.math.BigDecimal) paramValue);
        } else if (paramValue instanceof byte[]) {
            prepStmt.setBytes(paramIndex, (byte[]) paramValue);
        } else {
            setOtherValue(prepStmt, paramIndex, paramValue);
        }
    }

    /**
     * Binds values outside the common scalar types, such as date and time values.
     */
    void setOtherValue(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException;
}
