package com.skanga.sqlgate.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads the user-facing message texts shown on the output channel from YAML resources.
 *
 * <p>Template formatting failures are propagated as {@link IllegalArgumentException}
 * so a broken message file is detected early rather than silently ignored.
 */
public class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    static final String MESSAGES_RESOURCE = "messages.yaml";

    // Loaded YAML resources, keyed by resource path
    static final ConcurrentHashMap<String, Map<String, String>> yamlCache = new ConcurrentHashMap<>();

    private ResourceManager() {
    }

    /**
     * Gets a message with parameters.
     *
     * @param messageKey The message template key
     * @param paramsList Parameters for template formatting
     * @return Formatted message, or a "not found" marker when the key is unknown
     * @throws IllegalArgumentException if template formatting fails
     */
    public static String getMessage(String messageKey, Object... paramsList) {
        if (messageKey == null) {
            return "Message not found: null";
        }

        Map<String, String> messages = yamlCache.computeIfAbsent(MESSAGES_RESOURCE, ResourceManager::loadYamlResource);
        String template = messages.get(messageKey);
        if (template == null) {
            return "Message not found: " + messageKey;
        }

        try {
            return MessageFormat.format(template, paramsList);
        } catch (IllegalArgumentException e) {
            String errorMsg = String.format("Failed to format message '%s' with %d parameters: %s",
                    messageKey, paramsList != null ? paramsList.length : 0, e.getMessage());
            logger.error(errorMsg, e);
            throw new IllegalArgumentException(errorMsg, e);
        }
    }

    /**
     * Loads a flat YAML resource file into a key to text map. Nested keys are not supported.
     */
    static Map<String, String> loadYamlResource(String resourcePath) {
        Map<String, String> yamlMap = new HashMap<>();
        try (InputStream inputStream = ResourceManager.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                logger.warn("YAML resource file not found: {}", resourcePath);
                return yamlMap;
            }
            JsonNode rootNode = yamlMapper.readTree(inputStream);
            if (rootNode != null) {
                rootNode.fields().forEachRemaining(entry -> yamlMap.put(entry.getKey(), entry.getValue().asText()));
            }
            logger.debug("Loaded YAML resource file: {} with {} entries", resourcePath, yamlMap.size());
        } catch (IOException e) {
            logger.error("Failed to load YAML resource file: {}", resourcePath, e);
        }
        return yamlMap;
    }

    /**
     * Output channel titles
     */
    public static class Titles {
        public static final String SECURITY_CHECK = "title.security_check";
        public static final String SQL_EXECUTION = "title.sql_execution";
        public static final String SQL_PARAMETERS = "title.sql_parameters";
        public static final String QUERY_RESULT = "title.query_result";
        public static final String QUERY_DATA = "title.query_data";
        public static final String EXECUTION_LOGS = "title.execution_logs";
        public static final String SQL_ERROR = "title.sql_error";
        public static final String LOGGER_INIT = "title.logger_init";
        public static final String LOGGER_INIT_ERROR = "title.logger_init_error";
        public static final String LOG_WRITE_ERROR = "title.log_write_error";
        public static final String LOG_QUERY_ERROR = "title.log_query_error";
        public static final String LOG_QUERY = "title.log_query";
        public static final String LOG_QUERY_RESULT = "title.log_query_result";
        public static final String LOG_STATISTICS = "title.log_statistics";
        public static final String SLOW_QUERY_ANALYSIS = "title.slow_query_analysis";
        public static final String USER_ACTIVITY = "title.user_activity";
        public static final String TOOL_ERROR = "title.tool_error";
    }

    /**
     * Message keys
     */
    public static class Messages {
        public static final String QUERY_ONLY = "sql.query_only";
        public static final String EXECUTING_QUERY = "sql.executing";
        public static final String PARAMETERS = "sql.parameters";
        public static final String QUERY_FOUND = "sql.query_found";
        public static final String QUERY_SUCCESS = "sql.query_success";
        public static final String EXECUTION_FAILED = "sql.execution_failed";
        public static final String OPERATION_FAILED = "db.operation_failed";
        public static final String COMMITTED = "db.committed";
        public static final String ROLLED_BACK = "db.rolled_back";
        public static final String COMMIT_FAILED = "db.commit_failed";
        public static final String ROLLBACK_FAILED = "db.rollback_failed";
        public static final String LOGGER_INITIALIZED = "log.initialized";
        public static final String LOGGER_INIT_FAILED = "log.init_failed";
        public static final String LOG_WRITE_FAILED = "log.write_failed";
        public static final String LOG_QUERY_FAILED = "log.query_failed";
        public static final String QUERYING_USER = "log.querying_user";
        public static final String QUERYING_RANGE = "log.querying_range";
        public static final String QUERYING_RECENT = "log.querying_recent";
        public static final String LOGS_FOUND = "log.found";
        public static final String LOGS_NOT_FOUND = "log.not_found";
        public static final String STATISTICS = "log.statistics";
        public static final String NO_STATISTICS = "log.no_statistics";
        public static final String SLOW_QUERY_SEARCH = "log.slow_query_search";
        public static final String SLOW_QUERIES = "log.slow_queries";
        public static final String NO_SLOW_QUERIES = "log.no_slow_queries";
        public static final String USER_ACTIVITY = "log.user_activity";
        public static final String NO_USER_ACTIVITY = "log.no_user_activity";
        public static final String TOOL_FAILED = "tool.failed";
    }
}
