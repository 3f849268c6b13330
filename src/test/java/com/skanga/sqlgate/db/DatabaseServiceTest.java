package com.skanga.sqlgate.db;

import com.skanga.sqlgate.SqlGateway;
import com.skanga.sqlgate.config.ConfigParams;
import com.skanga.sqlgate.config.DatabaseDescriptor;
import com.skanga.sqlgate.config.LogBackendConfig;
import com.skanga.sqlgate.context.ExecutionContext;
import com.skanga.sqlgate.context.OutputLevel;
import com.skanga.sqlgate.context.OutputMessage;
import com.skanga.sqlgate.exelog.LogEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests against real SQLite files (no mocking).
 */
class DatabaseServiceTest {
    @TempDir
    Path tempDir;

    private SqlGateway gateway;
    private DatabaseService databaseService;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        ConfigParams config = ConfigParams.defaultConfig(
                List.of(DatabaseDescriptor.embedded("cache", null), DatabaseDescriptor.embedded("scratch", "nested/scratch.db")),
                LogBackendConfig.appendOnlyFile(tempDir.resolve("logs")),
                tempDir.resolve("data"));
        gateway = new SqlGateway(config);
        databaseService = gateway.databaseService();
        context = gateway.openContext("alice");

        ExecutionResult created = databaseService.execute(context, "CREATE TABLE t (a INTEGER, label TEXT)");
        assertThat(created.success()).isTrue();
        context.clearLogs();
    }

    @AfterEach
    void tearDown() {
        context.close();
        gateway.close();
    }

    @Test
    @DisplayName("Should insert with parameters and read the row back")
    void shouldInsertWithParametersAndSelect() {
        // When
        ExecutionResult inserted = databaseService.execute(context, "INSERT INTO t (a) VALUES (?)", null, List.of(1));
        ExecutionResult selected = databaseService.execute(context, "SELECT a FROM t");

        // Then
        assertThat(inserted.success()).isTrue();
        assertThat(inserted.type()).isEqualTo(ExecutionResult.Type.MODIFY);
        assertThat(inserted.rowCount()).isEqualTo(1);
        assertThat(inserted.lastRowId()).isEqualTo(1L);

        assertThat(selected.success()).isTrue();
        assertThat(selected.type()).isEqualTo(ExecutionResult.Type.SELECT);
        assertThat(selected.columns()).containsExactly("a");
        assertThat(selected.data()).hasSize(1);
        assertThat(((Number) selected.data().get(0).get("a")).intValue()).isEqualTo(1);

        List<LogEntry> logs = context.logBuffer();
        assertThat(logs).hasSize(2);
        assertThat(logs).allSatisfy(entry -> {
            assertThat(entry.commandType()).isEqualTo("sql");
            assertThat(entry.user()).isEqualTo("alice");
        });
        assertThat(logs.get(0).command()).isEqualTo("INSERT INTO t (a) VALUES (?) -- params: [1]");
        assertThat(logs.get(1).command()).isEqualTo("SELECT a FROM t");
    }

    @Test
    @DisplayName("Should report no row id for updates")
    void shouldReportNoRowIdForUpdates() {
        databaseService.execute(context, "INSERT INTO t (a) VALUES (1), (2)");

        ExecutionResult updated = databaseService.execute(context, "UPDATE t SET label = ? WHERE a > ?", null, List.of("x", 0));

        assertThat(updated.success()).isTrue();
        assertThat(updated.rowCount()).isEqualTo(2);
        assertThat(updated.lastRowId()).isNull();
    }

    @Test
    @DisplayName("Should return rows for pragma and with statements")
    void shouldReturnRowsForNonSelectReads() {
        databaseService.execute(context, "INSERT INTO t (a, label) VALUES (7, 'seven')");

        ExecutionResult pragma = databaseService.execute(context, "PRAGMA table_info(t)");
        ExecutionResult with = databaseService.execute(context, "WITH x AS (SELECT a FROM t) SELECT a FROM x");

        assertThat(pragma.type()).isEqualTo(ExecutionResult.Type.SELECT);
        assertThat(pragma.data()).hasSize(2);
        assertThat(with.data()).hasSize(1);
    }

    @Test
    @DisplayName("Should run a batch and count every tuple")
    void shouldExecuteMany() {
        ExecutionResult result = databaseService.executeMany(context, "INSERT INTO t (a, label) VALUES (?, ?)",
                List.of(List.of(1, "one"), List.of(2, "two"), List.of(3, "three"), List.of(4, "four")), null);

        assertThat(result.success()).isTrue();
        assertThat(result.type()).isEqualTo(ExecutionResult.Type.MODIFY);
        assertThat(result.rowCount()).isEqualTo(4);
        assertThat(databaseService.execute(context, "SELECT * FROM t").data()).hasSize(4);

        LogEntry batchLog = context.logBuffer().get(0);
        assertThat(batchLog.command())
                .startsWith("INSERT INTO t (a, label) VALUES (?, ?) -- batch size: 4, params preview: ")
                .contains("[1, one]")
                .doesNotContain("four");
    }

    @Test
    @DisplayName("Should keep connections per database and commit or roll back all of them")
    void shouldCommitAndRollbackAll() {
        databaseService.execute(context, "CREATE TABLE s (b INTEGER)", "scratch", null);
        databaseService.execute(context, "SELECT * FROM t");

        assertThat(context.connectionNames()).containsExactly("cache", "scratch");

        ExecutionResult committed = databaseService.commit(context);
        ExecutionResult rolledBack = databaseService.rollback(context, "scratch");

        assertThat(committed.success()).isTrue();
        assertThat(committed.type()).isEqualTo(ExecutionResult.Type.COMMIT);
        assertThat(committed.message()).isEqualTo("Transaction committed successfully");
        assertThat(rolledBack.type()).isEqualTo(ExecutionResult.Type.ROLLBACK);
        assertThat(rolledBack.message()).isEqualTo("Transaction rolled back successfully");
        assertThat(tempDir.resolve("data/nested/scratch.db")).exists();
    }

    @Test
    @DisplayName("Should succeed when committing a context without connections")
    void shouldCommitEmptyContext() {
        try (ExecutionContext fresh = gateway.openContext("bob")) {
            assertThat(databaseService.commit(fresh, DatabaseService.ALL_DATABASES).success()).isTrue();
            assertThat(databaseService.rollback(fresh).success()).isTrue();
        }
    }

    @Test
    @DisplayName("Should return and log a failure instead of throwing")
    void shouldReturnAndLogFailure() {
        ExecutionResult result = databaseService.execute(context, "SELECT * FROM missing_table");

        assertThat(result.success()).isFalse();
        assertThat(result.type()).isEqualTo(ExecutionResult.Type.ERROR);
        assertThat(result.error()).contains("missing_table");
        assertThat(result.message()).startsWith("Database operation failed: ");

        List<LogEntry> logs = context.logBuffer();
        assertThat(logs).hasSize(1);
        assertThat(logs.get(0).result()).contains("\"success\" : false");
    }

    @Test
    @DisplayName("Should log a failure for an unknown database")
    void shouldFailForUnknownDatabase() {
        ExecutionResult result = databaseService.execute(context, "SELECT 1", "nope", null);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("nope");
        assertThat(context.logBuffer()).hasSize(1);
    }

    @Test
    @DisplayName("Should reject a mutating statement on the query path without running or logging it")
    void shouldRejectMutatingQuery() {
        ExecutionResult result = databaseService.query(context, "SELECT * FROM t; DROP TABLE t");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Only SELECT, WITH, EXPLAIN, and PRAGMA statements are allowed");
        assertThat(context.logBuffer()).isEmpty();
        assertThat(context.output().status()).isFalse();
        assertThat(context.output().error()).isEqualTo(result.error());
        assertThat(context.output().messages()).extracting(OutputMessage::title).containsExactly("SQL Security Check");
        assertThat(databaseService.execute(context, "SELECT * FROM t").success()).isTrue();
    }

    @Test
    @DisplayName("Should narrate a successful query on the output channel")
    void shouldNarrateQuery() {
        databaseService.execute(context, "INSERT INTO t (a) VALUES (1), (2), (3)");

        ExecutionResult result = databaseService.query(context, "SELECT a FROM t WHERE a > ?", null, List.of(1));

        assertThat(result.data()).hasSize(2);
        List<OutputMessage> messages = context.output().messages();
        assertThat(messages).extracting(OutputMessage::title)
                .containsExactly("SQL Execution", "SQL Parameters", "Query Result");
        assertThat(messages).extracting(OutputMessage::level).containsOnly(OutputLevel.INFO);
        assertThat(messages.get(2).content()).isEqualTo("Query executed successfully. Found 2 records");
        assertThat(context.output().status()).isTrue();
    }

    @Test
    @DisplayName("Should report an execution error on the query path")
    void shouldReportQueryError() {
        ExecutionResult result = databaseService.query(context, "SELECT * FROM missing_table");

        assertThat(result.success()).isFalse();
        assertThat(context.output().status()).isFalse();
        assertThat(context.output().error()).startsWith("SQL execution failed: ");
        assertThat(context.logBuffer()).hasSize(1);
    }

    @Test
    @DisplayName("Should cap selected rows at the configured limit")
    void shouldCapRows() {
        ConfigParams config = new ConfigParams(
                List.of(DatabaseDescriptor.embedded("cache", null)),
                LogBackendConfig.appendOnlyFile(tempDir.resolve("logs")),
                tempDir.resolve("data"), 2, 30000, 30, 2, 600000, 1800000, 0);
        try (SqlGateway capped = new SqlGateway(config);
             ExecutionContext ctx = capped.openContext("carol")) {
            capped.execute(ctx, "INSERT INTO t (a) VALUES (1), (2), (3)", null, null);

            ExecutionResult result = capped.execute(ctx, "SELECT a FROM t ORDER BY a", null, null);

            List<Integer> values = result.data().stream()
                    .map(row -> ((Number) row.get("a")).intValue())
                    .collect(Collectors.toList());
            assertThat(values).containsExactly(1, 2);
        }
    }

    @Test
    @DisplayName("Should isolate contexts from each other")
    void shouldIsolateContexts() {
        try (ExecutionContext other = gateway.openContext("bob")) {
            databaseService.execute(other, "SELECT * FROM t");

            assertThat(other.cachedConnection("cache")).isNotSameAs(context.cachedConnection("cache"));
            assertThat(other.logBuffer()).hasSize(1);
            assertThat(context.logBuffer()).isEmpty();
            assertThat(other.logBuffer().get(0).user()).isEqualTo("bob");
        }
    }

    @Test
    @DisplayName("Should see and write past commits of another context after a read")
    void shouldSeeOtherContextCommitsAfterRead() {
        // Given
        assertThat(databaseService.execute(context, "SELECT * FROM t").rowCount()).isZero();

        // When
        try (ExecutionContext other = gateway.openContext("bob")) {
            ExecutionResult otherInsert = databaseService.execute(other, "INSERT INTO t (a) VALUES (?)", null, List.of(9));
            assertThat(otherInsert.success()).isTrue();
        }
        ExecutionResult reread = databaseService.execute(context, "SELECT a FROM t");
        ExecutionResult ownInsert = databaseService.execute(context, "INSERT INTO t (a) VALUES (10)");

        // Then
        assertThat(reread.success()).isTrue();
        assertThat(reread.rowCount()).isEqualTo(1);
        assertThat(((Number) reread.data().get(0).get("a")).intValue()).isEqualTo(9);
        assertThat(ownInsert.success()).isTrue();
    }

    @Test
    void testResultRowsArePlainMaps() {
        databaseService.execute(context, "INSERT INTO t (a, label) VALUES (5, 'five')");

        Map<String, Object> row = databaseService.execute(context, "SELECT label, a FROM t").data().get(0);

        assertThat(row).containsKeys("label", "a");
        assertThat(row.keySet()).containsExactly("label", "a");
        assertThat(row.get("label")).isEqualTo("five");
    }
}
