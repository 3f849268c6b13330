package com.skanga.sqlgate.exelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a statement outcome into the text stored in an audit entry.
 * Scalars are stored as their string form, structured values as indented JSON.
 */
public final class LogResultSerializer {
    private static final Logger logger = LoggerFactory.getLogger(LogResultSerializer.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private LogResultSerializer() {
    }

    public static String serialize(Object result) {
        if (result == null) {
            return null;
        }
        if (result instanceof CharSequence || result instanceof Number || result instanceof Boolean) {
            return String.valueOf(result);
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            logger.debug("Result of type {} is not JSON serializable, storing its string form: {}",
                    result.getClass().getName(), e.getMessage());
            return String.valueOf(result);
        }
    }
}
