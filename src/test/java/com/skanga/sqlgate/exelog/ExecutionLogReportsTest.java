package com.skanga.sqlgate.exelog;

import com.skanga.sqlgate.config.LogBackendConfig;
import com.skanga.sqlgate.context.ExecutionContext;
import com.skanga.sqlgate.context.OutputLevel;
import com.skanga.sqlgate.context.OutputMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionLogReportsTest {
    private static final Instant NOW = Instant.parse("2024-07-10T12:00:00Z");

    @TempDir
    Path tempDir;

    private ExecutionLogger executionLogger;
    private ExecutionLogReports reports;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        executionLogger = new ExecutionLogger(LogBackendConfig.appendOnlyFile(tempDir.resolve("logs")));
        reports = new ExecutionLogReports(executionLogger, Clock.fixed(NOW, ZoneOffset.UTC));

        ExecutionContext writer = new ExecutionContext("alice");
        executionLogger.writeSqlLog(writer, "SELECT * FROM a", "{\"success\":true}", hoursAgo(1), 50);
        executionLogger.writeSqlLog(writer, "select x", "{\"success\":false,\"error\":\"boom\"}", hoursAgo(2), 1500);
        writer.setCurrentUser("bob");
        executionLogger.writeSqlLog(writer, "INSERT INTO t VALUES (1)", "1", hoursAgo(3), 3000);
        executionLogger.writeSqlLog(writer, "SELECT old", "error: timeout", hoursAgo(30), 5000);

        context = new ExecutionContext("auditor");
    }

    @AfterEach
    void tearDown() {
        executionLogger.close();
    }

    private static Instant hoursAgo(int hours) {
        return NOW.minus(Duration.ofHours(hours));
    }

    @Test
    @DisplayName("Should list a user's entries and report the count")
    void shouldListLogsByUser() {
        List<LogEntry> logs = reports.logsByUser(context, "alice");

        assertThat(logs).extracting(LogEntry::command).containsExactly("SELECT * FROM a", "select x");
        assertThat(context.output().messages()).extracting(OutputMessage::content)
                .containsExactly("Querying logs for user: alice", "Found 2 execution logs");
    }

    @Test
    @DisplayName("Should warn when nothing matches")
    void shouldWarnWhenNothingMatches() {
        List<LogEntry> logs = reports.logsByUser(context, "nobody", 5);

        assertThat(logs).isEmpty();
        OutputMessage last = context.output().messages().get(1);
        assertThat(last.level()).isEqualTo(OutputLevel.WARNING);
        assertThat(last.content()).isEqualTo("No execution logs found");
    }

    @Test
    @DisplayName("Should default the end of a time range to now")
    void shouldListLogsByTimeRange() {
        assertThat(reports.logsByTimeRange(context, hoursAgo(4), null, 100)).hasSize(3);
        assertThat(reports.logsByTimeRange(context, hoursAgo(40), hoursAgo(10), 100))
                .extracting(LogEntry::command).containsExactly("SELECT old");
    }

    @Test
    @DisplayName("Should list recent entries")
    void shouldListRecentLogs() {
        assertThat(reports.recentLogs(context)).hasSize(3);
        assertThat(reports.recentLogs(context, 48, 2)).hasSize(2);
    }

    @Test
    @DisplayName("Should compute statistics over the window")
    void shouldComputeStatistics() {
        LogStatistics statistics = reports.statistics(context);

        assertThat(statistics.totalLogs()).isEqualTo(3);
        assertThat(statistics.uniqueUsers()).isEqualTo(2);
        assertThat(statistics.avgExecutionTime()).isEqualTo(1516.67);
        assertThat(statistics.errorCount()).isEqualTo(1);
        assertThat(statistics.successCount()).isEqualTo(2);
        assertThat(statistics.errorRate()).isEqualTo(33.33);
        assertThat(context.output().messages().get(0).content())
                .isEqualTo("Statistics for the last 24 hours: 3 logs from 2 users, error rate 33.33%");
    }

    @Test
    @DisplayName("Should return empty statistics when the window has no entries")
    void shouldReturnEmptyStatistics() {
        ExecutionLogger emptyLogger = new ExecutionLogger(LogBackendConfig.appendOnlyFile(tempDir.resolve("empty")));
        try {
            LogStatistics statistics = new ExecutionLogReports(emptyLogger).statistics(context, 1);

            assertThat(statistics).isEqualTo(LogStatistics.EMPTY);
            assertThat(context.output().messages().get(0).level()).isEqualTo(OutputLevel.WARNING);
        } finally {
            emptyLogger.close();
        }
    }

    @Test
    @DisplayName("Should list slow statements of the last day, slowest first")
    void shouldFindSlowQueries() {
        List<LogEntry> slow = reports.slowQueries(context);

        assertThat(slow).extracting(LogEntry::timeCostMs).containsExactly(3000L, 1500L);
        assertThat(reports.slowQueries(context, 2000, 20)).hasSize(1);
        assertThat(reports.slowQueries(context, 10000, 20)).isEmpty();
    }

    @Test
    @DisplayName("Should summarize a user's activity")
    void shouldSummarizeUserActivity() {
        UserActivitySummary bob = reports.userActivity(context, "bob");

        assertThat(bob.totalCommands()).isEqualTo(2);
        assertThat(bob.avgExecutionTime()).isEqualTo(4000.0);
        assertThat(bob.errorRate()).isEqualTo(50.0);
        assertThat(bob.mostUsedCommands()).containsExactly(Map.entry("INSERT", 1), Map.entry("SELECT", 1));
        assertThat(bob.activityByDay()).containsExactly(Map.entry("2024-07-09", 1), Map.entry("2024-07-10", 1));

        UserActivitySummary alice = reports.userActivity(context, "alice", 1);
        assertThat(alice.mostUsedCommands()).containsExactly(Map.entry("SELECT", 2));
    }

    @Test
    @DisplayName("Should warn when a user has no activity")
    void shouldWarnWithoutActivity() {
        UserActivitySummary summary = reports.userActivity(context, "carol");

        assertThat(summary.totalCommands()).isZero();
        assertThat(summary.mostUsedCommands()).isEmpty();
        assertThat(context.output().messages().get(0).content()).isEqualTo("No activity found for user carol");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"success\":true}|false",
            "{\"success\":false}|true",
            "{\"error\":\"boom\"}|true",
            "{\"error\":null,\"success\":true}|false",
            "Error: table missing|true",
            "3|false",
            "{broken json error|true"
    })
    void testIsError(String result, boolean expected) {
        assertThat(ExecutionLogReports.isError(result)).isEqualTo(expected);
    }
}
