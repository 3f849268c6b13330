package com.skanga.sqlgate.exelog;

import com.skanga.sqlgate.config.LogBackendConfig;
import com.skanga.sqlgate.config.ResourceManager;
import com.skanga.sqlgate.config.ResourceManager.Messages;
import com.skanga.sqlgate.config.ResourceManager.Titles;
import com.skanga.sqlgate.context.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Writes one audit entry per executed statement to the configured store and buffers the same
 * entry in the caller's {@link ExecutionContext}, so the response can show what was attempted
 * even when the store is unreachable.
 *
 * <p>One logger serves the whole process. A store that fails to initialize does not fail
 * construction: initialization is retried on use, and every write that cannot be persisted is
 * reported on the caller's output channel and answered with {@code false}. No method throws
 * because of a store failure.
 */
public class ExecutionLogger implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionLogger.class);

    private final LogBackendConfig config;
    private final ExecutionLogStore store;
    private volatile boolean initialized;
    private volatile String lastInitError;

    public ExecutionLogger(LogBackendConfig config) {
        this(config, createStore(config));
    }

    public ExecutionLogger(LogBackendConfig config, ExecutionLogStore store) {
        if (config == null || store == null) {
            throw new IllegalArgumentException("Log backend configuration and store are required");
        }
        this.config = config;
        this.store = store;
        tryInitialize();
    }

    /**
     * Builds the store for the configured backend kind.
     */
    public static ExecutionLogStore createStore(LogBackendConfig config) {
        return switch (config.kind()) {
            case APPEND_ONLY_FILE -> new JsonLinesLogStore(config.fileDirectory());
            case EMBEDDED_FILE -> new SqliteLogStore(config.sqliteFilePath());
            case CLIENT_SERVER -> new MysqlLogStore(config);
        };
    }

    private synchronized boolean tryInitialize() {
        if (initialized) {
            return true;
        }
        try {
            store.initialize();
            initialized = true;
            lastInitError = null;
            logger.info("Execution logger initialized with {} storage: {}", store.kind().configName(), config);
            return true;
        } catch (LogStoreException | RuntimeException e) {
            lastInitError = e.getMessage();
            logger.error("Failed to initialize execution logger with {} storage: {}", store.kind().configName(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Retries store initialization if an earlier attempt failed and reports the outcome on the
     * caller's output channel.
     *
     * @return true when the store is ready
     */
    public boolean ensureInitialized(ExecutionContext context) {
        if (initialized) {
            return true;
        }
        if (tryInitialize()) {
            context.output().showInfo(ResourceManager.getMessage(Messages.LOGGER_INITIALIZED, store.kind().configName()),
                    ResourceManager.getMessage(Titles.LOGGER_INIT));
            return true;
        }
        context.output().showWarning(ResourceManager.getMessage(Messages.LOGGER_INIT_FAILED, lastInitError),
                ResourceManager.getMessage(Titles.LOGGER_INIT_ERROR));
        return false;
    }

    /**
     * Records one executed command for the context's current user.
     * The entry is buffered in the context before the store write is attempted.
     *
     * @param context       caller's execution context
     * @param command       command text
     * @param result        outcome; structured values are stored as indented JSON
     * @param executionTime when the command began, or null for now
     * @param timeCostMs    duration in milliseconds
     * @param commandType   classification tag, or null for "unknown"
     * @return true if the store accepted the entry
     */
    public boolean writeLog(ExecutionContext context, String command, Object result, Instant executionTime,
                            long timeCostMs, String commandType) {
        LogEntry entry = LogEntry.of(context.currentUser(), command, LogResultSerializer.serialize(result),
                executionTime, Math.max(0, timeCostMs), commandType);
        context.recordLog(entry);

        ensureInitialized(context);
        try {
            store.append(entry);
            return true;
        } catch (LogStoreException | RuntimeException e) {
            logger.error("Failed to write execution log for user {}: {}", entry.user(), e.getMessage(), e);
            context.output().showWarning(ResourceManager.getMessage(Messages.LOG_WRITE_FAILED, e.getMessage()),
                    ResourceManager.getMessage(Titles.LOG_WRITE_ERROR));
            return false;
        }
    }

    /**
     * Records one executed SQL statement ({@code command_type = "sql"}).
     */
    public boolean writeSqlLog(ExecutionContext context, String sql, Object result, Instant executionTime, long timeCostMs) {
        return writeLog(context, sql, result, executionTime, timeCostMs, LogEntry.SQL_COMMAND_TYPE);
    }

    /**
     * Reads entries from the store. A failing store yields an empty list and an error on the output channel.
     */
    public List<LogEntry> queryLogs(ExecutionContext context, LogQuery query) {
        ensureInitialized(context);
        try {
            return store.query(query);
        } catch (LogStoreException | RuntimeException e) {
            logger.error("Failed to query execution logs: {}", e.getMessage(), e);
            context.output().showError(ResourceManager.getMessage(Messages.LOG_QUERY_FAILED, e.getMessage()),
                    ResourceManager.getMessage(Titles.LOG_QUERY_ERROR));
            return List.of();
        }
    }

    /**
     * @return the entries buffered in the context since it was last cleared
     */
    public List<LogEntry> getThreadLogs(ExecutionContext context) {
        return context.logBuffer();
    }

    public void clearThreadLogs(ExecutionContext context) {
        context.clearLogs();
    }

    public void setCurrentUser(ExecutionContext context, String user) {
        context.setCurrentUser(user);
    }

    public boolean isInitialized() {
        return initialized;
    }

    public ExecutionLogStore store() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }
}
