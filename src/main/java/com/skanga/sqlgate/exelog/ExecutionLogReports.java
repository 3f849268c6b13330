package com.skanga.sqlgate.exelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skanga.sqlgate.config.ResourceManager;
import com.skanga.sqlgate.config.ResourceManager.Messages;
import com.skanga.sqlgate.config.ResourceManager.Titles;
import com.skanga.sqlgate.context.ExecutionContext;
import com.skanga.sqlgate.context.OutputChannel;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Read-side reports over the execution log: filtered listings, window statistics, slow statements
 * and per-user activity. Every report narrates its progress on the caller's output channel.
 */
public class ExecutionLogReports {
    public static final int DEFAULT_USER_LIMIT = 50;
    public static final int DEFAULT_RANGE_LIMIT = 100;
    public static final int DEFAULT_HOURS = 24;
    public static final long DEFAULT_SLOW_THRESHOLD_MS = 1000;
    public static final int DEFAULT_SLOW_LIMIT = 20;
    public static final int DEFAULT_ACTIVITY_DAYS = 7;

    // Upper bound of entries scanned by the aggregating reports
    static final int AGGREGATE_SCAN_LIMIT = 10000;

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private final ExecutionLogger executionLogger;
    private final Clock clock;

    public ExecutionLogReports(ExecutionLogger executionLogger) {
        this(executionLogger, Clock.systemUTC());
    }

    public ExecutionLogReports(ExecutionLogger executionLogger, Clock clock) {
        this.executionLogger = executionLogger;
        this.clock = clock;
    }

    public List<LogEntry> logsByUser(ExecutionContext context, String user) {
        return logsByUser(context, user, DEFAULT_USER_LIMIT);
    }

    public List<LogEntry> logsByUser(ExecutionContext context, String user, int limit) {
        OutputChannel output = context.output();
        output.showInfo(ResourceManager.getMessage(Messages.QUERYING_USER, user), title(Titles.LOG_QUERY));
        List<LogEntry> logs = executionLogger.queryLogs(context, LogQuery.forUser(user, limit));
        reportCount(output, logs);
        return logs;
    }

    /**
     * @param end end of the range, or null for now
     */
    public List<LogEntry> logsByTimeRange(ExecutionContext context, Instant start, Instant end, int limit) {
        Instant effectiveEnd = end != null ? end : clock.instant();
        OutputChannel output = context.output();
        output.showInfo(ResourceManager.getMessage(Messages.QUERYING_RANGE, String.valueOf(start), effectiveEnd.toString()),
                title(Titles.LOG_QUERY));
        List<LogEntry> logs = executionLogger.queryLogs(context, new LogQuery(null, start, effectiveEnd, limit));
        reportCount(output, logs);
        return logs;
    }

    public List<LogEntry> recentLogs(ExecutionContext context) {
        return recentLogs(context, DEFAULT_HOURS, DEFAULT_RANGE_LIMIT);
    }

    public List<LogEntry> recentLogs(ExecutionContext context, int hours, int limit) {
        OutputChannel output = context.output();
        output.showInfo(ResourceManager.getMessage(Messages.QUERYING_RECENT, String.valueOf(hours)), title(Titles.LOG_QUERY));
        List<LogEntry> logs = executionLogger.queryLogs(context, new LogQuery(null, hoursAgo(hours), null, limit));
        reportCount(output, logs);
        return logs;
    }

    public LogStatistics statistics(ExecutionContext context) {
        return statistics(context, DEFAULT_HOURS);
    }

    public LogStatistics statistics(ExecutionContext context, int hours) {
        OutputChannel output = context.output();
        List<LogEntry> logs = executionLogger.queryLogs(context,
                new LogQuery(null, hoursAgo(hours), null, AGGREGATE_SCAN_LIMIT));
        if (logs.isEmpty()) {
            output.showWarning(ResourceManager.getMessage(Messages.NO_STATISTICS), title(Titles.LOG_STATISTICS));
            return LogStatistics.EMPTY;
        }

        Set<String> users = new HashSet<>();
        long totalTime = 0;
        int errorCount = 0;
        for (LogEntry entry : logs) {
            users.add(entry.user());
            totalTime += entry.timeCostMs();
            if (isError(entry.result())) {
                errorCount++;
            }
        }
        int total = logs.size();
        LogStatistics statistics = new LogStatistics(total, users.size(), round2((double) totalTime / total),
                errorCount, total - errorCount, round2(errorCount * 100.0 / total));

        output.showInfo(ResourceManager.getMessage(Messages.STATISTICS, String.valueOf(hours), String.valueOf(total),
                String.valueOf(users.size()), String.valueOf(statistics.errorRate())), title(Titles.LOG_STATISTICS));
        return statistics;
    }

    public List<LogEntry> slowQueries(ExecutionContext context) {
        return slowQueries(context, DEFAULT_SLOW_THRESHOLD_MS, DEFAULT_SLOW_LIMIT);
    }

    /**
     * Entries of the last 24 hours slower than the threshold, slowest first.
     */
    public List<LogEntry> slowQueries(ExecutionContext context, long thresholdMs, int limit) {
        OutputChannel output = context.output();
        output.showInfo(ResourceManager.getMessage(Messages.SLOW_QUERY_SEARCH, String.valueOf(thresholdMs)),
                title(Titles.SLOW_QUERY_ANALYSIS));
        List<LogEntry> slow = executionLogger.queryLogs(context,
                        new LogQuery(null, hoursAgo(DEFAULT_HOURS), null, AGGREGATE_SCAN_LIMIT)).stream()
                .filter(entry -> entry.timeCostMs() > thresholdMs)
                .sorted(Comparator.comparingLong(LogEntry::timeCostMs).reversed())
                .limit(limit)
                .collect(Collectors.toList());
        if (slow.isEmpty()) {
            output.showInfo(ResourceManager.getMessage(Messages.NO_SLOW_QUERIES), title(Titles.SLOW_QUERY_ANALYSIS));
        } else {
            output.showInfo(ResourceManager.getMessage(Messages.SLOW_QUERIES, String.valueOf(slow.size())),
                    title(Titles.SLOW_QUERY_ANALYSIS));
        }
        return slow;
    }

    public UserActivitySummary userActivity(ExecutionContext context, String user) {
        return userActivity(context, user, DEFAULT_ACTIVITY_DAYS);
    }

    public UserActivitySummary userActivity(ExecutionContext context, String user, int days) {
        OutputChannel output = context.output();
        List<LogEntry> logs = executionLogger.queryLogs(context,
                new LogQuery(user, clock.instant().minus(Duration.ofDays(days)), null, AGGREGATE_SCAN_LIMIT));
        if (logs.isEmpty()) {
            output.showWarning(ResourceManager.getMessage(Messages.NO_USER_ACTIVITY, user), title(Titles.USER_ACTIVITY));
            return new UserActivitySummary(0, 0, 0, List.of(), Map.of());
        }

        long totalTime = 0;
        int errorCount = 0;
        Map<String, Integer> commandUsage = new HashMap<>();
        Map<String, Integer> dailyActivity = new HashMap<>();
        for (LogEntry entry : logs) {
            totalTime += entry.timeCostMs();
            if (isError(entry.result())) {
                errorCount++;
            }
            String command = entry.command().trim();
            if (!command.isEmpty()) {
                String keyword = command.split("\\s+", 2)[0].toUpperCase(Locale.ROOT);
                commandUsage.merge(keyword, 1, Integer::sum);
            }
            String day = LocalDate.ofInstant(entry.executionTime(), ZoneOffset.UTC).toString();
            dailyActivity.merge(day, 1, Integer::sum);
        }

        List<Map.Entry<String, Integer>> mostUsed = new ArrayList<>();
        commandUsage.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .limit(5)
                .forEach(e -> mostUsed.add(Map.entry(e.getKey(), e.getValue())));

        int total = logs.size();
        double errorRate = round2(errorCount * 100.0 / total);
        output.showInfo(ResourceManager.getMessage(Messages.USER_ACTIVITY, String.valueOf(total), String.valueOf(errorRate)),
                title(Titles.USER_ACTIVITY));
        return new UserActivitySummary(total, round2((double) totalTime / total), errorRate, mostUsed, dailyActivity);
    }

    /**
     * A result describes a failure when it is a JSON object carrying an error or {@code "success": false},
     * or, for any other text, when it mentions "error".
     */
    static boolean isError(String result) {
        if (result == null || result.isEmpty()) {
            return false;
        }
        String trimmed = result.trim();
        if (trimmed.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(trimmed);
                JsonNode error = node.get("error");
                boolean hasError = error != null && !error.isNull() && !error.asText().isEmpty();
                JsonNode success = node.get("success");
                return hasError || (success != null && success.isBoolean() && !success.asBoolean());
            } catch (JsonProcessingException e) {
                // Not JSON after all, judge it as plain text
                return trimmed.toLowerCase(Locale.ROOT).contains("error");
            }
        }
        return trimmed.toLowerCase(Locale.ROOT).contains("error");
    }

    private Instant hoursAgo(int hours) {
        return clock.instant().minus(Duration.ofHours(hours));
    }

    private static void reportCount(OutputChannel output, List<LogEntry> logs) {
        if (logs.isEmpty()) {
            output.showWarning(ResourceManager.getMessage(Messages.LOGS_NOT_FOUND), title(Titles.LOG_QUERY_RESULT));
        } else {
            output.showInfo(ResourceManager.getMessage(Messages.LOGS_FOUND, String.valueOf(logs.size())),
                    title(Titles.LOG_QUERY_RESULT));
        }
    }

    private static String title(String key) {
        return ResourceManager.getMessage(key);
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
