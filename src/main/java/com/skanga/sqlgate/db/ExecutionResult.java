package com.skanga.sqlgate.db;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonValue;
import com.skanga.sqlgate.config.ResourceManager;
import com.skanga.sqlgate.config.ResourceManager.Messages;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Uniform outcome of a gateway operation. Failures are reported in-band with {@code success = false}.
 *
 * @param success   whether the operation completed
 * @param type      the shape of the outcome
 * @param data      rows as column to value maps, select outcomes only
 * @param rowCount  rows returned (select) or affected (modify)
 * @param columns   column labels in result order, select outcomes only
 * @param lastRowId identity generated by the last insert, where the engine reports one
 * @param error     engine error description, failures only
 * @param message   human readable summary
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"success", "type", "data", "row_count", "columns", "lastrowid", "error", "message"})
public record ExecutionResult(
        @JsonProperty("success") boolean success,
        @JsonProperty("type") Type type,
        @JsonProperty("data") List<Map<String, Object>> data,
        @JsonProperty("row_count") Integer rowCount,
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("lastrowid") Long lastRowId,
        @JsonProperty("error") String error,
        @JsonProperty("message") String message
) {
    public enum Type {
        SELECT, MODIFY, COMMIT, ROLLBACK, ERROR;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ExecutionResult {
        if (type == null) {
            throw new IllegalArgumentException("Result type cannot be null");
        }
        data = data == null ? null : Collections.unmodifiableList(new ArrayList<>(data));
        columns = columns == null ? null : List.copyOf(columns);
    }

    public static ExecutionResult select(List<Map<String, Object>> rows, List<String> columns) {
        return new ExecutionResult(true, Type.SELECT, rows, rows.size(), columns, null, null, null);
    }

    public static ExecutionResult modify(int affectedRows, Long lastRowId) {
        return new ExecutionResult(true, Type.MODIFY, null, affectedRows, null, lastRowId, null, null);
    }

    public static ExecutionResult commit() {
        return new ExecutionResult(true, Type.COMMIT, null, null, null, null, null,
                ResourceManager.getMessage(Messages.COMMITTED));
    }

    public static ExecutionResult rollback() {
        return new ExecutionResult(true, Type.ROLLBACK, null, null, null, null, null,
                ResourceManager.getMessage(Messages.ROLLED_BACK));
    }

    /**
     * Failure of an execute or executemany call.
     */
    public static ExecutionResult failure(String error) {
        return failure(error, ResourceManager.getMessage(Messages.OPERATION_FAILED, error));
    }

    public static ExecutionResult failure(String error, String message) {
        return new ExecutionResult(false, Type.ERROR, null, null, null, null, error, message);
    }

    /**
     * A statement refused before execution.
     */
    public static ExecutionResult rejected(String reason) {
        return failure(reason, reason);
    }
}
