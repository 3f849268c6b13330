package com.skanga.sqlgate.context;

import com.skanga.sqlgate.exelog.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request-scoped state of one caller: the acting user, the connections borrowed for this
 * caller keyed by logical database name, the audit entries written on its behalf and its
 * output channel.
 *
 * <p>A context is created by the request entry point and passed into every gateway call.
 * It is confined to one thread at a time and is never shared between concurrent callers,
 * so it carries no locking. Closing it returns every cached connection to its pool.
 */
public class ExecutionContext implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ExecutionContext.class);

    /** User recorded when the entry point never set one. */
    public static final String DEFAULT_USER = "system";

    private final Map<String, Connection> connections = new LinkedHashMap<>();
    private final List<LogEntry> logBuffer = new ArrayList<>();
    private final OutputChannel output = new OutputChannel();
    private String currentUser = DEFAULT_USER;

    public ExecutionContext() {
    }

    public ExecutionContext(String currentUser) {
        setCurrentUser(currentUser);
    }

    public String currentUser() {
        return currentUser;
    }

    /**
     * Sets the user subsequent audit entries are attributed to. Blank values reset to {@link #DEFAULT_USER}.
     */
    public void setCurrentUser(String user) {
        this.currentUser = user == null || user.isBlank() ? DEFAULT_USER : user;
    }

    public OutputChannel output() {
        return output;
    }

    /**
     * Appends an audit entry to this caller's buffer, in execution order.
     */
    public void recordLog(LogEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("Log entry cannot be null");
        }
        logBuffer.add(entry);
    }

    /**
     * @return a copy of the entries buffered since the last {@link #clearLogs()}
     */
    public List<LogEntry> logBuffer() {
        return Collections.unmodifiableList(new ArrayList<>(logBuffer));
    }

    /**
     * Empties the audit buffer. Clearing an empty buffer is a no-op.
     */
    public void clearLogs() {
        logBuffer.clear();
    }

    /**
     * @return the connection cached for a logical database, or null when none was borrowed yet
     */
    public Connection cachedConnection(String databaseName) {
        return connections.get(databaseName);
    }

    public void cacheConnection(String databaseName, Connection connection) {
        if (databaseName == null || connection == null) {
            throw new IllegalArgumentException("Database name and connection are required");
        }
        connections.put(databaseName, connection);
    }

    /**
     * Drops a cached connection that turned out to be unusable. The caller owns closing it.
     */
    public void evictConnection(String databaseName) {
        connections.remove(databaseName);
    }

    public Set<String> connectionNames() {
        return Collections.unmodifiableSet(connections.keySet());
    }

    /**
     * @return the cached connections in the order they were first borrowed
     */
    public Map<String, Connection> connections() {
        return Collections.unmodifiableMap(connections);
    }

    /**
     * Returns every cached connection to its pool. Uncommitted work is rolled back by the pool.
     * Failures are logged and do not stop the remaining connections from being closed.
     */
    @Override
    public void close() {
        for (Map.Entry<String, Connection> entry : connections.entrySet()) {
            try {
                entry.getValue().close();
            } catch (SQLException e) {
                logger.warn("Error closing connection for database {}: {}", entry.getKey(), e.getMessage());
            }
        }
        connections.clear();
    }
}
