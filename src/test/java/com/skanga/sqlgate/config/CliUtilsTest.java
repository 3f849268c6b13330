package com.skanga.sqlgate.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CliUtils class.
 * Tests command line argument parsing, help and version display, and configuration loading.
 */
class CliUtilsTest {
    @TempDir
    Path tempDir;

    @Test
    void testShortFormMapping() {
        Map<String, String> mapping = CliUtils.getShortFormMapping();

        assertThat(mapping).containsEntry("h", "help")
                .containsEntry("v", "version")
                .containsEntry("s", "sql")
                .containsEntry("d", "db_name")
                .containsEntry("u", "user")
                .containsEntry("t", "log_type");
        for (Map.Entry<String, String> entry : mapping.entrySet()) {
            assertThat(entry.getKey()).hasSize(1);
            assertThat(entry.getValue()).matches("[a-z_]+");
        }
    }

    @Test
    void testParseArgsLongAndShortForms() {
        String[] args = {"--sql=SELECT 1", "--db_name", "analytics", "-u", "alice", "-t=sqlite", "--query_logs"};

        Map<String, String> result = CliUtils.parseArgs(args);

        assertThat(result).containsEntry("SQL", "SELECT 1")
                .containsEntry("DB_NAME", "analytics")
                .containsEntry("USER", "alice")
                .containsEntry("LOG_TYPE", "sqlite")
                .containsEntry("QUERY_LOGS", "true");
    }

    @Test
    void testParseArgsIgnoresUnknownShortFormsAndPositionals() {
        Map<String, String> result = CliUtils.parseArgs(new String[]{"-z", "stray", "positional", "--limit=5"});

        assertThat(result).containsOnlyKeys("LIMIT");
    }

    @Test
    @DisplayName("Should print help and version to the given stream")
    void shouldPrintHelpAndVersion() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

        assertThat(CliUtils.handleHelpAndVersion(new String[]{"-h"}, out)).isTrue();
        assertThat(CliUtils.handleHelpAndVersion(new String[]{"--version"}, out)).isTrue();
        assertThat(CliUtils.handleHelpAndVersion(new String[]{"--sql=SELECT 1"}, out)).isFalse();

        String printed = buffer.toString(StandardCharsets.UTF_8);
        assertThat(printed).contains("Usage:", "--query_logs", "SQLGate v" + CliUtils.APP_VERSION, "Available JDBC Drivers:");
    }

    @Test
    @DisplayName("Should load databases and log backend from a config file")
    void shouldLoadConfigFile() throws IOException {
        // Given
        Path configFile = tempDir.resolve("sqlgate.json");
        Files.writeString(configFile, "{\n"
                + "  \"log_type\": \"sqlite\",\n"
                + "  \"sqlite_file_path\": \"audit/log.db\",\n"
                + "  \"max_connections\": 5,\n"
                + "  \"data_dir\": \"" + tempDir.resolve("data").toString().replace("\\", "\\\\") + "\",\n"
                + "  \"databases\": [\n"
                + "    {\"name\": \"cache\", \"path\": \"c.db\"},\n"
                + "    {\"name\": \"analytics\", \"engine\": \"mysql\", \"host\": \"db.local\", \"user\": \"app\", \"password\": \"secret\"}\n"
                + "  ]\n"
                + "}");

        // When
        ConfigParams config = CliUtils.loadConfiguration(new String[]{"--config_file=" + configFile});

        // Then
        assertThat(config.logBackend().kind()).isEqualTo(LogBackendKind.EMBEDDED_FILE);
        assertThat(config.logBackend().sqliteFilePath()).isEqualTo(Paths.get("audit/log.db"));
        assertThat(config.maxConnections()).isEqualTo(5);
        assertThat(config.dataDirectory()).isEqualTo(tempDir.resolve("data"));
        assertThat(config.databaseNames()).containsExactly("cache", "analytics");

        DatabaseDescriptor analytics = config.requireDatabase("analytics");
        assertThat(analytics.engine()).isEqualTo(DatabaseEngine.CLIENT_SERVER);
        assertThat(analytics.port()).isEqualTo(3306);
        assertThat(analytics.database()).isEqualTo("analytics");
        assertThat(config.requireDatabase("cache").filePath()).isEqualTo("c.db");
    }

    @Test
    @DisplayName("Should let command line arguments override the config file")
    void shouldPreferCliOverFile() throws IOException {
        Path configFile = tempDir.resolve("sqlgate.json");
        Files.writeString(configFile, "{\"max_connections\": 5, \"databases\": \"cache\", \"db_name\": \"audit_schema\"}");

        ConfigParams config = CliUtils.loadConfiguration(new String[]{
                "-c", configFile.toString(), "--max_connections=7", "--databases=main=main.db,scratch", "--db_name=main"});

        assertThat(config.maxConnections()).isEqualTo(7);
        assertThat(config.databaseNames()).containsExactly("main", "scratch");
        assertThat(config.requireDatabase("main").filePath()).isEqualTo("main.db");
        assertThat(config.requireDatabase("scratch").filePath()).isEqualTo("scratch.db");
        // --db_name routes statements; the log schema still comes from the file
        assertThat(config.logBackend().database()).isEqualTo("audit_schema");
    }

    @Test
    @DisplayName("Should reject a config file that is not a JSON object")
    void shouldRejectNonObjectConfigFile() throws IOException {
        Path configFile = tempDir.resolve("bad.json");
        Files.writeString(configFile, "[1, 2, 3]");

        assertThatThrownBy(() -> CliUtils.loadConfiguration(new String[]{"--config_file=" + configFile}))
                .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> CliUtils.loadConfiguration(new String[]{"--config_file=" + tempDir.resolve("missing.json")}))
                .isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> CliUtils.loadConfiguration(new String[]{"--log_type=mongo"}))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("mongo");
        assertThatThrownBy(() -> CliUtils.loadConfiguration(new String[]{"--max_connections=many"}))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("MAX_CONNECTIONS");
    }

    @Test
    void testParseInlineDatabases() {
        List<DatabaseDescriptor> databases = CliUtils.parseInlineDatabases(" cache , reports=/var/lib/reports.db,,");

        assertThat(databases).extracting(DatabaseDescriptor::name).containsExactly("cache", "reports");
        assertThat(databases.get(1).filePath()).isEqualTo("/var/lib/reports.db");
    }

    @Test
    void testGetConfigValuePriority() {
        Map<String, String> cli = Map.of("SOME_KEY", "cli");
        Map<String, String> file = Map.of("SOME_KEY", "file", "OTHER_KEY", "file");

        assertThat(CliUtils.getConfigValue("SOME_KEY", "default", cli, file)).isEqualTo("cli");
        assertThat(CliUtils.getConfigValue("OTHER_KEY", "default", cli, file)).isEqualTo("file");
        assertThat(CliUtils.getConfigValue("SQLGATE_UNSET_KEY", "default", cli, null)).isEqualTo("default");

        System.setProperty("sqlgate.prop.key", "property");
        try {
            assertThat(CliUtils.getConfigValue("SQLGATE_PROP_KEY", "default", cli, file)).isEqualTo("property");
        } finally {
            System.clearProperty("sqlgate.prop.key");
        }
    }
}
