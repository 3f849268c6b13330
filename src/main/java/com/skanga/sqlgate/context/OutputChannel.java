package com.skanga.sqlgate.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request message buffer that the request handler drains into the response.
 * Any error message flips the overall status to failed and becomes the reported error.
 * Not thread-safe: owned by one {@link ExecutionContext}.
 */
public class OutputChannel {
    public static final String DEFAULT_INFO_TITLE = "Info";
    public static final String DEFAULT_WARNING_TITLE = "Warning";
    public static final String DEFAULT_ERROR_TITLE = "Error";

    private final List<OutputMessage> messages = new ArrayList<>();
    private boolean status = true;
    private String error = "";

    /**
     * Appends a message. Error messages set the status to false and replace the error text.
     */
    public void write(String title, OutputLevel level, Object content) {
        OutputMessage message = new OutputMessage(title, content, level);
        messages.add(message);
        if (level == OutputLevel.ERROR) {
            status = false;
            error = String.valueOf(message.content());
        }
    }

    public void showInfo(Object content) {
        showInfo(content, null);
    }

    public void showInfo(Object content, String title) {
        write(title != null ? title : DEFAULT_INFO_TITLE, OutputLevel.INFO, content);
    }

    public void showWarning(Object content) {
        showWarning(content, null);
    }

    public void showWarning(Object content, String title) {
        write(title != null ? title : DEFAULT_WARNING_TITLE, OutputLevel.WARNING, content);
    }

    public void showError(Object content) {
        showError(content, null);
    }

    public void showError(Object content, String title) {
        write(title != null ? title : DEFAULT_ERROR_TITLE, OutputLevel.ERROR, content);
    }

    /**
     * Snapshot of the channel in its response shape: {@code {status, output: [{Title, Content}], error}}.
     *
     * @return a new map, detached from the channel
     */
    public Map<String, Object> getResult() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", status);
        List<Map<String, Object>> output = new ArrayList<>(messages.size());
        for (OutputMessage message : messages) {
            output.add(message.toMap());
        }
        result.put("output", output);
        result.put("error", error);
        return result;
    }

    public List<OutputMessage> messages() {
        return Collections.unmodifiableList(new ArrayList<>(messages));
    }

    public boolean status() {
        return status;
    }

    public String error() {
        return error;
    }

    /**
     * Resets the channel to its initial state. Clearing an empty channel is a no-op.
     */
    public void clear() {
        messages.clear();
        status = true;
        error = "";
    }
}
