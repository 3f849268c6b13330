package com.skanga.sqlgate.exelog;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * One audit record per executed statement.
 *
 * @param id            store-assigned identity, null until read back from a relational store
 * @param user          acting user at the time of execution
 * @param command       statement text, optionally annotated with a parameter preview
 * @param result        serialized outcome (rows, affected count, or error description), may be null
 * @param executionTime when the statement began executing, millisecond precision
 * @param timeCostMs    wall-clock duration in milliseconds
 * @param commandType   free-form classification tag such as "sql"
 * @param createdAt     store-assigned insertion time, null when the store has none
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LogEntry(
        @JsonProperty("id") Long id,
        @JsonProperty("user_name") String user,
        @JsonProperty("command") String command,
        @JsonProperty("result") String result,
        @JsonProperty("execution_time") Instant executionTime,
        @JsonProperty("time_cost_ms") long timeCostMs,
        @JsonProperty("command_type") String commandType,
        @JsonProperty("created_at") Instant createdAt
) {
    public static final String DEFAULT_USER = "system";
    public static final String DEFAULT_COMMAND_TYPE = "unknown";
    public static final String SQL_COMMAND_TYPE = "sql";

    public LogEntry {
        if (timeCostMs < 0) {
            throw new IllegalArgumentException("Time cost cannot be negative");
        }
        user = user == null || user.isBlank() ? DEFAULT_USER : user;
        command = command == null ? "" : command;
        executionTime = (executionTime == null ? Instant.now() : executionTime).truncatedTo(ChronoUnit.MILLIS);
        commandType = commandType == null || commandType.isBlank() ? DEFAULT_COMMAND_TYPE : commandType;
    }

    /**
     * Creates an entry that has not been persisted yet.
     */
    public static LogEntry of(String user, String command, String result, Instant executionTime,
                              long timeCostMs, String commandType) {
        return new LogEntry(null, user, command, result, executionTime, timeCostMs, commandType, null);
    }
}
