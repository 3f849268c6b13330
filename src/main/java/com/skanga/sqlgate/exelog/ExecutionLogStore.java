package com.skanga.sqlgate.exelog;

import com.skanga.sqlgate.config.LogBackendKind;

import java.util.List;

/**
 * Persistence of audit entries. Implementations are shared by every caller of the process and
 * rely on the backing engine to serialize concurrent writers.
 */
public interface ExecutionLogStore extends AutoCloseable {

    LogBackendKind kind();

    /**
     * Prepares the store (schema, directories). Idempotent; may be retried after a failure.
     */
    void initialize() throws LogStoreException;

    /**
     * Persists one entry.
     */
    void append(LogEntry entry) throws LogStoreException;

    /**
     * Returns the entries accepted by the query, newest first, at most {@code query.limit()} of them.
     */
    List<LogEntry> query(LogQuery query) throws LogStoreException;

    /**
     * Releases pooled resources. Never throws.
     */
    @Override
    void close();
}
