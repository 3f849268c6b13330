package com.skanga.sqlgate;

import com.skanga.sqlgate.config.ConfigParams;
import com.skanga.sqlgate.context.ExecutionContext;
import com.skanga.sqlgate.db.ConnectionRegistry;
import com.skanga.sqlgate.db.DataSourceRegistry;
import com.skanga.sqlgate.db.DatabaseNameResolver;
import com.skanga.sqlgate.db.DatabaseService;
import com.skanga.sqlgate.db.ExecutionResult;
import com.skanga.sqlgate.exelog.ExecutionLogReports;
import com.skanga.sqlgate.exelog.ExecutionLogger;
import com.skanga.sqlgate.exelog.LogEntry;
import com.skanga.sqlgate.exelog.LogQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Entry point into the gateway for request handlers and tool code. Built once per process from
 * an immutable {@link ConfigParams}; callers open one {@link ExecutionContext} per request and
 * pass it into every call.
 */
public class SqlGateway implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SqlGateway.class);

    private final ConfigParams configParams;
    private final DataSourceRegistry dataSourceRegistry;
    private final ExecutionLogger executionLogger;
    private final DatabaseService databaseService;
    private final ExecutionLogReports reports;

    public SqlGateway(ConfigParams configParams) {
        this(configParams, new ExecutionLogger(configParams.logBackend()));
    }

    public SqlGateway(ConfigParams configParams, ExecutionLogger executionLogger) {
        this.configParams = configParams;
        this.dataSourceRegistry = new DataSourceRegistry(configParams);
        this.executionLogger = executionLogger;
        this.databaseService = new DatabaseService(configParams, new ConnectionRegistry(dataSourceRegistry),
                new DatabaseNameResolver(configParams), executionLogger);
        this.reports = new ExecutionLogReports(executionLogger);
        logger.info("SQL gateway started: {}", configParams);
    }

    /**
     * Opens the context of one request. The caller closes it when the request is done.
     */
    public ExecutionContext openContext(String user) {
        return new ExecutionContext(user);
    }

    public ExecutionResult execute(ExecutionContext context, String sql, String databaseName, List<?> params) {
        return databaseService.execute(context, sql, databaseName, params);
    }

    public ExecutionResult executeMany(ExecutionContext context, String sql, List<? extends List<?>> paramsList,
                                       String databaseName) {
        return databaseService.executeMany(context, sql, paramsList, databaseName);
    }

    public ExecutionResult query(ExecutionContext context, String sql, String databaseName, List<?> params) {
        return databaseService.query(context, sql, databaseName, params);
    }

    public List<LogEntry> queryExecutionLogs(ExecutionContext context, String user, Instant startTime, Instant endTime,
                                             int limit) {
        return executionLogger.queryLogs(context, new LogQuery(user, startTime, endTime, limit));
    }

    public ConfigParams configParams() {
        return configParams;
    }

    public DataSourceRegistry dataSourceRegistry() {
        return dataSourceRegistry;
    }

    public DatabaseService databaseService() {
        return databaseService;
    }

    public ExecutionLogger executionLogger() {
        return executionLogger;
    }

    public ExecutionLogReports reports() {
        return reports;
    }

    /**
     * Closes every connection pool and the audit store.
     */
    @Override
    public void close() {
        logger.info("Shutting down SQL gateway...");
        dataSourceRegistry.close();
        executionLogger.close();
    }
}
