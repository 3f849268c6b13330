package com.skanga.sqlgate.db;

import com.skanga.sqlgate.config.ConfigParams;
import com.skanga.sqlgate.config.ResourceManager;
import com.skanga.sqlgate.config.ResourceManager.Messages;
import com.skanga.sqlgate.config.ResourceManager.Titles;
import com.skanga.sqlgate.context.ExecutionContext;
import com.skanga.sqlgate.context.OutputChannel;
import com.skanga.sqlgate.exelog.ExecutionLogger;
import com.skanga.sqlgate.security.SqlStatementClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Statement execution on behalf of a caller's {@link ExecutionContext}.
 *
 * <p>{@code execute} and {@code executeMany} are the unrestricted primitives used by tool code
 * that performs legitimate writes; {@code query} is the caller-facing entry point that only runs
 * read-only statements. Every execute or executeMany call writes exactly one audit entry, whether
 * it succeeds or fails, timed around statement execution only. No method of this class throws:
 * failures come back as an {@link ExecutionResult} with {@code success = false}.
 */
public class DatabaseService {
    private static final Logger logger = LoggerFactory.getLogger(DatabaseService.class);

    /** Database name that makes commit and rollback act on every connection of the context. */
    public static final String ALL_DATABASES = "all";

    static final int SQL_PREVIEW_LENGTH = 100;
    static final int LOGGED_SQL_LENGTH = 200;
    static final int PARAMS_PREVIEW_LENGTH = 200;
    static final int BATCH_PREVIEW_TUPLES = 3;

    private final ConfigParams configParams;
    private final ConnectionRegistry connectionRegistry;
    private final DatabaseNameResolver nameResolver;
    private final ExecutionLogger executionLogger;

    public DatabaseService(ConfigParams configParams, ConnectionRegistry connectionRegistry,
                           DatabaseNameResolver nameResolver, ExecutionLogger executionLogger) {
        this.configParams = configParams;
        this.connectionRegistry = connectionRegistry;
        this.nameResolver = nameResolver;
        this.executionLogger = executionLogger;
    }

    public ExecutionResult execute(ExecutionContext context, String sql) {
        return execute(context, sql, null, null);
    }

    public ExecutionResult execute(ExecutionContext context, String sql, String databaseName) {
        return execute(context, sql, databaseName, null);
    }

    /**
     * Executes one statement. Statements that produce rows are shaped into column to value maps
     * and their read transaction is ended; all others are committed and report the affected row
     * count and, for inserts, the new row id.
     *
     * @param context      the caller's context
     * @param sql          statement with {@code ?} placeholders
     * @param databaseName logical database, or null to resolve it from the statement
     * @param params       positional parameters, may be null
     * @return the outcome
     */
    public ExecutionResult execute(ExecutionContext context, String sql, String databaseName, List<?> params) {
        String command = hasParams(params)
                ? sql + " -- params: " + SqlStatementClassifier.truncateString(String.valueOf(params), PARAMS_PREVIEW_LENGTH)
                : sql;
        Instant executionTime = Instant.now();
        long timeCostMs = 0;
        ExecutionResult result;

        try {
            String resolvedName = nameResolver.resolve(sql, databaseName);
            Connection dbConn = connectionRegistry.getConnection(context, resolvedName);
            EngineDialect dialect = connectionRegistry.dialectFor(resolvedName);
            logger.debug("Executing on {}: {}", resolvedName, SqlStatementClassifier.truncateString(sql, LOGGED_SQL_LENGTH));

            try (PreparedStatement prepStmt = dialect.prepare(dbConn, sql)) {
                prepStmt.setMaxRows(configParams.maxRowsLimit());
                prepStmt.setQueryTimeout(configParams.queryTimeoutSeconds());
                dialect.bind(prepStmt, params);

                executionTime = Instant.now();
                long startNanos = System.nanoTime();
                try {
                    boolean isResultSet = prepStmt.execute();
                    if (isResultSet || startsWithSelect(sql)) {
                        result = fetchRows(prepStmt, isResultSet);
                        // Ends the read transaction so later statements see other contexts' commits
                        dbConn.commit();
                    } else {
                        int affectedRows = Math.max(prepStmt.getUpdateCount(), 0);
                        Long lastRowId = dialect.lastInsertId(prepStmt, sql);
                        dbConn.commit();
                        result = ExecutionResult.modify(affectedRows, lastRowId);
                    }
                } finally {
                    timeCostMs = (System.nanoTime() - startNanos) / 1_000_000;
                }
            }
        } catch (SQLException | RuntimeException e) {
            logger.error("Statement execution failed: {}", SqlStatementClassifier.truncateString(sql, LOGGED_SQL_LENGTH), e);
            result = ExecutionResult.failure(describe(e));
        }

        executionLogger.writeSqlLog(context, command, result, executionTime, timeCostMs);
        return result;
    }

    /**
     * Executes one statement once per parameter tuple as a batch and commits.
     *
     * @param context      the caller's context
     * @param sql          statement with {@code ?} placeholders
     * @param paramsList   one positional parameter list per execution
     * @param databaseName logical database, or null to resolve it from the statement
     * @return a modify outcome whose row count is the total over the batch
     */
    public ExecutionResult executeMany(ExecutionContext context, String sql, List<? extends List<?>> paramsList,
                                       String databaseName) {
        List<? extends List<?>> batch = paramsList == null ? List.of() : paramsList;
        String command = sql + " -- batch size: " + batch.size() + ", params preview: "
                + SqlStatementClassifier.truncateString(
                        String.valueOf(batch.subList(0, Math.min(BATCH_PREVIEW_TUPLES, batch.size()))), PARAMS_PREVIEW_LENGTH);
        Instant executionTime = Instant.now();
        long timeCostMs = 0;
        ExecutionResult result;

        try {
            String resolvedName = nameResolver.resolve(sql, databaseName);
            Connection dbConn = connectionRegistry.getConnection(context, resolvedName);
            EngineDialect dialect = connectionRegistry.dialectFor(resolvedName);

            try (PreparedStatement prepStmt = dbConn.prepareStatement(sql)) {
                prepStmt.setQueryTimeout(configParams.queryTimeoutSeconds());
                for (List<?> params : batch) {
                    dialect.bind(prepStmt, params);
                    prepStmt.addBatch();
                }

                executionTime = Instant.now();
                long startNanos = System.nanoTime();
                try {
                    int[] updateCounts = prepStmt.executeBatch();
                    dbConn.commit();
                    result = ExecutionResult.modify(totalUpdateCount(updateCounts), null);
                } finally {
                    timeCostMs = (System.nanoTime() - startNanos) / 1_000_000;
                }
            }
        } catch (SQLException | RuntimeException e) {
            logger.error("Batch execution failed: {}", SqlStatementClassifier.truncateString(sql, LOGGED_SQL_LENGTH), e);
            result = ExecutionResult.failure(describe(e));
        }

        executionLogger.writeSqlLog(context, command, result, executionTime, timeCostMs);
        return result;
    }

    /**
     * Commits the context's connection to one database, or all of them for {@link #ALL_DATABASES}.
     */
    public ExecutionResult commit(ExecutionContext context) {
        return commit(context, ALL_DATABASES);
    }

    public ExecutionResult commit(ExecutionContext context, String databaseName) {
        try {
            for (Connection dbConn : targetConnections(context, databaseName)) {
                dbConn.commit();
            }
            return ExecutionResult.commit();
        } catch (SQLException | RuntimeException e) {
            logger.error("Commit failed for database {}", databaseName, e);
            return ExecutionResult.failure(describe(e), ResourceManager.getMessage(Messages.COMMIT_FAILED, describe(e)));
        }
    }

    /**
     * Rolls back the context's connection to one database, or all of them for {@link #ALL_DATABASES}.
     */
    public ExecutionResult rollback(ExecutionContext context) {
        return rollback(context, ALL_DATABASES);
    }

    public ExecutionResult rollback(ExecutionContext context, String databaseName) {
        try {
            for (Connection dbConn : targetConnections(context, databaseName)) {
                dbConn.rollback();
            }
            return ExecutionResult.rollback();
        } catch (SQLException | RuntimeException e) {
            logger.error("Rollback failed for database {}", databaseName, e);
            return ExecutionResult.failure(describe(e), ResourceManager.getMessage(Messages.ROLLBACK_FAILED, describe(e)));
        }
    }

    public ExecutionResult query(ExecutionContext context, String sql) {
        return query(context, sql, null, null);
    }

    /**
     * Caller-facing entry point: runs the statement only if it is read-only and narrates the
     * outcome on the context's output channel. Rejected statements are not executed and not logged.
     */
    public ExecutionResult query(ExecutionContext context, String sql, String databaseName, List<?> params) {
        OutputChannel output = context.output();
        if (!SqlStatementClassifier.isQueryOnly(sql)) {
            String rejection = ResourceManager.getMessage(Messages.QUERY_ONLY);
            output.showError(rejection, ResourceManager.getMessage(Titles.SECURITY_CHECK));
            logger.warn("Rejected statement from user {}: {}", context.currentUser(),
                    SqlStatementClassifier.truncateString(sql, LOGGED_SQL_LENGTH));
            return ExecutionResult.rejected(rejection);
        }

        output.showInfo(ResourceManager.getMessage(Messages.EXECUTING_QUERY,
                SqlStatementClassifier.truncateString(sql, SQL_PREVIEW_LENGTH)), ResourceManager.getMessage(Titles.SQL_EXECUTION));
        if (hasParams(params)) {
            output.showInfo(ResourceManager.getMessage(Messages.PARAMETERS, String.valueOf(params)),
                    ResourceManager.getMessage(Titles.SQL_PARAMETERS));
        }

        ExecutionResult result = execute(context, sql, databaseName, params);

        if (result.success()) {
            if (result.data() != null && !result.data().isEmpty()) {
                output.showInfo(ResourceManager.getMessage(Messages.QUERY_FOUND, String.valueOf(result.data().size())),
                        ResourceManager.getMessage(Titles.QUERY_RESULT));
            } else {
                output.showInfo(ResourceManager.getMessage(Messages.QUERY_SUCCESS), ResourceManager.getMessage(Titles.QUERY_RESULT));
            }
        } else {
            output.showError(ResourceManager.getMessage(Messages.EXECUTION_FAILED, result.error()),
                    ResourceManager.getMessage(Titles.SQL_ERROR));
        }
        return result;
    }

    private ExecutionResult fetchRows(PreparedStatement prepStmt, boolean isResultSet) throws SQLException {
        List<String> resultColumns = new ArrayList<>();
        List<Map<String, Object>> resultRows = new ArrayList<>();
        if (!isResultSet) {
            return ExecutionResult.select(resultRows, resultColumns);
        }
        try (ResultSet resultSet = prepStmt.getResultSet()) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            int columnCount = metaData.getColumnCount();

            // Get column names
            for (int i = 1; i <= columnCount; i++) {
                resultColumns.add(metaData.getColumnLabel(i));
            }

            // Get data rows
            int maxRows = configParams.maxRowsLimit();
            while (resultSet.next() && resultRows.size() < maxRows) {
                Map<String, Object> currRow = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    currRow.put(resultColumns.get(i - 1), resultSet.getObject(i));
                }
                resultRows.add(currRow);
            }
        }
        return ExecutionResult.select(resultRows, resultColumns);
    }

    private List<Connection> targetConnections(ExecutionContext context, String databaseName) throws SQLException {
        if (databaseName == null || ALL_DATABASES.equals(databaseName)) {
            return new ArrayList<>(context.connections().values());
        }
        return List.of(connectionRegistry.getConnection(context, databaseName));
    }

    // SUCCESS_NO_INFO counts as one row
    private static int totalUpdateCount(int[] updateCounts) {
        int total = 0;
        for (int count : updateCounts) {
            if (count >= 0) {
                total += count;
            } else if (count == Statement.SUCCESS_NO_INFO) {
                total += 1;
            }
        }
        return total;
    }

    private static boolean startsWithSelect(String sql) {
        return SqlStatementClassifier.normalize(sql).startsWith("select");
    }

    private static boolean hasParams(List<?> params) {
        return params != null && !params.isEmpty();
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
