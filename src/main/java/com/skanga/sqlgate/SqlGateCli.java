package com.skanga.sqlgate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.skanga.sqlgate.config.CliUtils;
import com.skanga.sqlgate.config.ConfigParams;
import com.skanga.sqlgate.config.ConfigurationException;
import com.skanga.sqlgate.config.ResourceManager;
import com.skanga.sqlgate.config.ResourceManager.Titles;
import com.skanga.sqlgate.db.ExecutionResult;
import com.skanga.sqlgate.exelog.LogEntry;
import com.skanga.sqlgate.exelog.LogQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Command line front end: runs one read-only statement through the safe query path, or lists
 * execution log entries, and prints the tool response as JSON.
 *
 * <p>Exit codes: 0 success, 1 the statement or query failed, 2 configuration or usage error.
 */
public class SqlGateCli {
    private static final Logger logger = LoggerFactory.getLogger(SqlGateCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        // Handle help and version arguments first
        if (CliUtils.handleHelpAndVersion(args, out)) {
            return EXIT_OK;
        }

        ConfigParams configParams;
        try {
            configParams = CliUtils.loadConfiguration(args);
        } catch (IOException | ConfigurationException | IllegalArgumentException e) {
            logger.error("Configuration error: {}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        Map<String, String> cliArgs = CliUtils.parseArgs(args);
        String user = cliArgs.get("USER");
        String sql = cliArgs.get("SQL");
        boolean queryLogs = cliArgs.containsKey("QUERY_LOGS");
        if (!queryLogs && (sql == null || sql.isBlank())) {
            err.println("Nothing to do: pass --sql=<statement> or --query_logs (see --help)");
            return EXIT_CONFIG_ERROR;
        }

        ToolInvocationHandler.Tool tool;
        String toolName;
        try {
            if (queryLogs) {
                toolName = "query_execution_logs";
                tool = queryLogsTool(cliArgs);
            } else {
                toolName = "sql_query";
                tool = sqlQueryTool(sql, cliArgs.get("DB_NAME"));
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            err.println("Invalid argument: " + e.getMessage());
            return EXIT_CONFIG_ERROR;
        }

        try (SqlGateway gateway = new SqlGateway(configParams)) {
            ToolResponse response = new ToolInvocationHandler(gateway).invoke(toolName, user, tool);
            out.println(response.toJson());
            return response.statusCode() == ToolResponse.OK && response.status() ? EXIT_OK : EXIT_FAILED;
        } catch (JsonProcessingException e) {
            logger.error("Failed to render response", e);
            err.println("Failed to render response: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static ToolInvocationHandler.Tool sqlQueryTool(String sql, String databaseName) {
        return (context, gateway) -> {
            ExecutionResult result = gateway.query(context, sql, databaseName, null);
            if (result.success() && result.data() != null) {
                context.output().showInfo(result.data(), ResourceManager.getMessage(Titles.QUERY_DATA));
            }
        };
    }

    static ToolInvocationHandler.Tool queryLogsTool(Map<String, String> cliArgs) {
        int limit = cliArgs.containsKey("LIMIT") ? Integer.parseInt(cliArgs.get("LIMIT").trim()) : LogQuery.DEFAULT_LIMIT;
        LogQuery query = new LogQuery(cliArgs.get("LOG_USER"), parseInstant(cliArgs.get("START_TIME")),
                parseInstant(cliArgs.get("END_TIME")), limit);
        return (context, gateway) -> {
            List<LogEntry> logs = gateway.executionLogger().queryLogs(context, query);
            context.output().showInfo(logs, ResourceManager.getMessage(Titles.EXECUTION_LOGS));
        };
    }

    private static Instant parseInstant(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value.trim());
    }
}
