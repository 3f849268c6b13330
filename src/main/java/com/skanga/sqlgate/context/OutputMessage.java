package com.skanga.sqlgate.context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One titled message shown to the caller.
 *
 * @param title   short heading, never null
 * @param content message body: text, or a list or map that is rendered as JSON; never null
 * @param level   severity
 */
public record OutputMessage(String title, Object content, OutputLevel level) {

    public OutputMessage {
        if (level == null) {
            throw new IllegalArgumentException("Output level cannot be null");
        }
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }

    /**
     * @return the wire shape of a message, {@code {"Title": ..., "Content": ...}}
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("Title", title);
        map.put("Content", content);
        return map;
    }
}
