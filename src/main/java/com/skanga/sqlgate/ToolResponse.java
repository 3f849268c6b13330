package com.skanga.sqlgate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.skanga.sqlgate.exelog.LogEntry;

import java.util.List;
import java.util.Map;

/**
 * Response of one tool invocation: the drained output channel plus, when any statement ran,
 * the audit entries written during the request.
 *
 * @param statusCode    HTTP-equivalent status: 200, or 500 when the tool raised
 * @param status        false once any error was reported
 * @param output        titled messages in the order they were written
 * @param error         text of the last reported error, empty when none
 * @param executionLogs audit entries of the request, null when none were written
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"status", "output", "error", "execution_logs"})
public record ToolResponse(
        @JsonIgnore int statusCode,
        @JsonProperty("status") boolean status,
        @JsonProperty("output") List<Map<String, Object>> output,
        @JsonProperty("error") String error,
        @JsonProperty("execution_logs") List<LogEntry> executionLogs
) {
    public static final int OK = 200;
    public static final int INTERNAL_ERROR = 500;

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public ToolResponse {
        output = output == null ? List.of() : List.copyOf(output);
        error = error == null ? "" : error;
        executionLogs = executionLogs == null || executionLogs.isEmpty() ? null : List.copyOf(executionLogs);
    }

    /**
     * @return the response body as JSON
     * @throws JsonProcessingException if a message content cannot be serialized
     */
    public String toJson() throws JsonProcessingException {
        return objectMapper.writeValueAsString(this);
    }
}
