package com.skanga.sqlgate.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Driver;
import java.sql.DriverManager;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for handling command line interface operations and configuration loading.
 * Provides argument parsing, help display, version information, and resolution of every
 * gateway setting from CLI arguments, a JSON configuration file, environment variables
 * and system properties.
 */
public class CliUtils {
    private static final Logger logger = LoggerFactory.getLogger(CliUtils.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String APP_NAME = "SQLGate";
    public static final String APP_VERSION = "1.0.0";
    public static final String APP_DESCRIPTION = "Safe SQL gateway with execution audit logging";

    private CliUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Maps short form arguments to their long form equivalents.
     *
     * @return Map of short form to long form argument names
     */
    public static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();

        // Help and version
        shortToLong.put("h", "help");
        shortToLong.put("v", "version");
        shortToLong.put("c", "config_file");

        // Statement execution
        shortToLong.put("s", "sql");
        shortToLong.put("d", "db_name");
        shortToLong.put("u", "user");

        // Audit log queries
        shortToLong.put("q", "query_logs");
        shortToLong.put("n", "limit");

        // Log backend
        shortToLong.put("t", "log_type");
        shortToLong.put("f", "log_file_dir");

        return shortToLong;
    }

    /**
     * Parses command line arguments into a key-value map.
     * Supports both short form (-h) and long form (--help) arguments.
     * Handles both key=value and key value formats for both forms.
     * Converts keys to uppercase for consistent lookup.
     *
     * @param args Command line arguments array
     * @return Map of uppercase keys to values
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String key = null;
            String value;

            if (currArg.startsWith("--")) {
                String argWithoutPrefix = currArg.substring(2);

                if (argWithoutPrefix.contains("=")) {
                    String[] argParts = argWithoutPrefix.split("=", 2);
                    key = argParts[0];
                    value = argParts[1];
                } else {
                    key = argWithoutPrefix;
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        value = args[i + 1];
                        i++;
                    } else {
                        value = "true"; // Flag without value
                    }
                }
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                String shortArg = currArg.substring(1);

                if (shortArg.contains("=")) {
                    String[] argParts = shortArg.split("=", 2);
                    key = shortToLong.get(argParts[0]);
                    value = argParts[1];
                } else {
                    key = shortToLong.get(shortArg);
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        value = args[i + 1];
                        i++;
                    } else {
                        value = "true";
                    }
                }
            } else {
                continue;
            }

            if (key != null) {
                argsMap.put(key.toUpperCase(), value);
            }
        }

        return argsMap;
    }

    public static boolean handleHelpAndVersion(String[] args) {
        return handleHelpAndVersion(args, System.out);
    }

    /**
     * Checks for help and version arguments and handles them.
     *
     * @param args Command line arguments
     * @param out Stream the help or version text is written to
     * @return true if help or version was displayed (caller should exit), false otherwise
     */
    public static boolean handleHelpAndVersion(String[] args, PrintStream out) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                displayHelp(out);
                return true;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                displayVersion(out);
                return true;
            }
        }
        return false;
    }

    /**
     * Displays help information for command line usage.
     */
    static void displayHelp(PrintStream out) {
        out.println(APP_NAME);
        out.println("Usage: java -jar sqlgate-" + APP_VERSION + ".jar [OPTIONS]");
        out.println();
        out.println("ARGUMENT FORMATS:");
        out.println("  -k=value  or  --key=value     -k value  or  --key value     -k  or  --key (flag)");
        out.println();
        out.println("OPTIONS:");
        out.println("  -h, --help                     Show this help message and exit");
        out.println("  -v, --version                  Show version information and exit");
        out.println("  -c, --config_file=<path>       Load configuration from a JSON file");
        out.println();
        out.println("STATEMENT EXECUTION (read-only statements only):");
        out.println("  -s, --sql=<statement>          Statement to run through the safe query gate");
        out.println("  -d, --db_name=<name>           Logical database (default: inferred from the statement)");
        out.println("  -u, --user=<name>              User the execution is attributed to (default: system)");
        out.println();
        out.println("AUDIT LOG:");
        out.println("  -q, --query_logs               Print execution log entries instead of running a statement");
        out.println("      --log_user=<name>          Only entries of this user");
        out.println("      --start_time=<iso instant> Only entries at or after this time");
        out.println("      --end_time=<iso instant>   Only entries at or before this time");
        out.println("  -n, --limit=<num>              Maximum entries returned (default: 100)");
        out.println();
        out.println("CONFIGURATION (also settable through environment variables of the same name in upper case):");
        out.println("  -t, --log_type=<file|sqlite|mysql>  Execution log backend (default: file)");
        out.println("  -f, --log_file_dir=<dir>       Directory of daily JSON-lines logs (default: ./execution_logs)");
        out.println("      --sqlite_file_path=<file>  SQLite log database (default: ./execution_logs.db)");
        out.println("      --db_ip, --db_port, --db_user, --db_password  MySQL log backend (mandatory for mysql)");
        out.println("      --db_name_log=<schema>     MySQL log schema (default: execution_logs)");
        out.println("      --data_dir=<dir>           Root of relative embedded database files (default: ./data)");
        out.println("      --databases=<list>         Embedded databases as name[=file],... (default: cache)");
        out.println();
        out.println("EXAMPLES:");
        out.println("  java -jar sqlgate-" + APP_VERSION + ".jar -s \"SELECT * FROM analytics.events\" -u alice");
        out.println("  java -jar sqlgate-" + APP_VERSION + ".jar --query_logs --log_user=alice --limit=20");
    }

    /**
     * Displays version information including available JDBC drivers.
     */
    static void displayVersion(PrintStream out) {
        out.println(APP_NAME + " v" + APP_VERSION);
        out.println(APP_DESCRIPTION);
        out.println("Java Version: " + System.getProperty("java.version"));
        out.println();
        out.println("Available JDBC Drivers:");
        List<String> drivers = new ArrayList<>();
        Enumeration<Driver> registered = DriverManager.getDrivers();
        while (registered.hasMoreElements()) {
            Driver driver = registered.nextElement();
            drivers.add(String.format("%s v%d.%d", driver.getClass().getName(),
                    driver.getMajorVersion(), driver.getMinorVersion()));
        }
        drivers.sort(String.CASE_INSENSITIVE_ORDER);
        for (String driverInfo : drivers) {
            out.println(" - " + driverInfo);
        }
    }

    /**
     * Loads configuration from command line arguments, config file, environment variables, and system properties.
     * Uses priority order: CLI args (--log_type) > config file > environment variables (LOG_TYPE)
     * > system properties (-Dlog.type=) > hard coded defaults.
     *
     * @param args Command line arguments
     * @return Configured ConfigParams instance
     * @throws IOException if the config file cannot be read or parsed
     * @throws ConfigurationException if a mandatory setting is missing or a value is invalid
     */
    public static ConfigParams loadConfiguration(String[] args) throws IOException {
        Map<String, String> cliArgs = parseArgs(args);

        JsonNode fileRoot = null;
        Map<String, String> fileConfig = null;
        String configFile = getConfigValue("CONFIG_FILE", null, cliArgs, null);
        if (configFile != null) {
            try {
                fileRoot = loadConfigFile(configFile);
                fileConfig = flattenConfig(fileRoot);
                logger.info("Configuration file loaded: {}", configFile);
            } catch (IOException e) {
                logger.error("Failed to load configuration file: {}", configFile, e);
                throw new IOException("Failed to load configuration file: " + configFile, e);
            }
        }

        LogBackendKind logKind = LogBackendKind.fromName(getConfigValue("LOG_TYPE", "file", cliArgs, fileConfig));
        LogBackendConfig logBackend = new LogBackendConfig(
                logKind,
                toPath(getConfigValue("LOG_FILE_DIR", null, cliArgs, fileConfig)),
                toPath(getConfigValue("SQLITE_FILE_PATH", null, cliArgs, fileConfig)),
                getConfigValue("DB_IP", null, cliArgs, fileConfig),
                parseOptionalInt("DB_PORT", getConfigValue("DB_PORT", null, cliArgs, fileConfig)),
                getConfigValue("DB_USER", null, cliArgs, fileConfig),
                getConfigValue("DB_PASSWORD", null, cliArgs, fileConfig),
                logDatabaseName(cliArgs, fileConfig),
                getConfigValue("DB_CHARSET", null, cliArgs, fileConfig));

        List<DatabaseDescriptor> databases = loadDatabases(cliArgs, fileRoot);

        return new ConfigParams(
                databases,
                logBackend,
                toPath(getConfigValue("DATA_DIR", null, cliArgs, fileConfig)),
                parseInt("MAX_CONNECTIONS", getConfigValue("MAX_CONNECTIONS", "10", cliArgs, fileConfig)),
                parseInt("CONNECTION_TIMEOUT_MS", getConfigValue("CONNECTION_TIMEOUT_MS", "30000", cliArgs, fileConfig)),
                parseInt("QUERY_TIMEOUT_SECONDS", getConfigValue("QUERY_TIMEOUT_SECONDS", "30", cliArgs, fileConfig)),
                parseInt("MAX_ROWS_LIMIT", getConfigValue("MAX_ROWS_LIMIT", "10000", cliArgs, fileConfig)),
                parseInt("IDLE_TIMEOUT_MS", getConfigValue("IDLE_TIMEOUT_MS", "600000", cliArgs, fileConfig)),
                parseInt("MAX_LIFETIME_MS", getConfigValue("MAX_LIFETIME_MS", "1800000", cliArgs, fileConfig)),
                parseInt("LEAK_DETECTION_THRESHOLD_MS", getConfigValue("LEAK_DETECTION_THRESHOLD_MS", "60000", cliArgs, fileConfig)));
    }

    /**
     * Resolves the logical databases. A "databases" array in the config file takes its entries
     * as objects; every other source uses the inline form {@code name[=file],...} of embedded databases.
     */
    static List<DatabaseDescriptor> loadDatabases(Map<String, String> cliArgs, JsonNode fileRoot) {
        String cliValue = cliArgs.get("DATABASES");
        if (cliValue != null) {
            return parseInlineDatabases(cliValue);
        }
        if (fileRoot != null && fileRoot.has("databases")) {
            JsonNode databasesNode = fileRoot.get("databases");
            if (databasesNode.isArray()) {
                List<DatabaseDescriptor> databases = new ArrayList<>();
                for (JsonNode databaseNode : databasesNode) {
                    databases.add(parseDatabaseNode(databaseNode));
                }
                return databases;
            }
            return parseInlineDatabases(databasesNode.asText());
        }
        String inline = getConfigValue("DATABASES", null, cliArgs, null);
        return inline != null ? parseInlineDatabases(inline) : List.of();
    }

    static DatabaseDescriptor parseDatabaseNode(JsonNode databaseNode) {
        if (!databaseNode.isObject()) {
            throw new ConfigurationException("Database entries must be JSON objects: " + databaseNode);
        }
        DatabaseEngine engine = DatabaseEngine.fromName(databaseNode.path("engine").asText("embedded-file"));
        return new DatabaseDescriptor(
                textOrNull(databaseNode, "name"),
                engine,
                textOrNull(databaseNode, "path"),
                textOrNull(databaseNode, "host"),
                databaseNode.path("port").asInt(0),
                textOrNull(databaseNode, "user"),
                textOrNull(databaseNode, "password"),
                textOrNull(databaseNode, "database"),
                textOrNull(databaseNode, "charset"));
    }

    static List<DatabaseDescriptor> parseInlineDatabases(String inline) {
        List<DatabaseDescriptor> databases = new ArrayList<>();
        for (String entry : inline.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split("=", 2);
            databases.add(DatabaseDescriptor.embedded(parts[0].trim(), parts.length > 1 ? parts[1].trim() : null));
        }
        return databases;
    }

    /**
     * Gets a configuration value using the priority order:
     * CLI args > config file > env vars > system properties > default.
     * Config file parameter is optional - if null, it's skipped in the priority chain.
     *
     * @param varName Config parameter name (uppercase)
     * @param defaultValue Default value if not found in any source
     * @param cliArgs Parsed command line arguments
     * @param fileConfig Configuration from file (can be null if no config file)
     * @return The configuration value from the highest priority source
     */
    public static String getConfigValue(String varName, String defaultValue, Map<String, String> cliArgs, Map<String, String> fileConfig) {
        // 1. CLI arguments (highest priority)
        String cliValue = cliArgs.get(varName.toUpperCase());
        if (cliValue != null) {
            return cliValue;
        }

        // 2. Config file (if provided)
        if (fileConfig != null) {
            String fileValue = fileConfig.get(varName.toUpperCase());
            if (fileValue != null) {
                return fileValue;
            }
        }

        // 3. Environment variable
        String envValue = System.getenv(varName);
        if (envValue != null) {
            return envValue;
        }

        // 4. System property (envVar.lower().replace('_', '.'))
        String propValue = System.getProperty(varName.toLowerCase().replace('_', '.'));
        if (propValue != null) {
            return propValue;
        }

        // 5. Default
        return defaultValue;
    }

    /**
     * Loads a JSON configuration file. The root must be an object.
     *
     * @param configFilePath Path to the configuration file
     * @return the parsed JSON object
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    static JsonNode loadConfigFile(String configFilePath) throws IOException {
        JsonNode rootNode = objectMapper.readTree(Files.readString(Paths.get(configFilePath)));
        if (rootNode == null || !rootNode.isObject()) {
            throw new IOException("Configuration file must contain a JSON object: " + configFilePath);
        }
        return rootNode;
    }

    /**
     * Collects the scalar top-level entries of a config file under upper-case keys.
     */
    static Map<String, String> flattenConfig(JsonNode rootNode) {
        Map<String, String> configMap = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = rootNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isValueNode() && !field.getValue().isNull()) {
                String paramKey = field.getKey().trim().toUpperCase();
                configMap.put(paramKey, field.getValue().asText());
                logger.debug("Loaded config: {} = {}", paramKey, paramKey.contains("PASSWORD") ? "***" : field.getValue().asText());
            }
        }
        return configMap;
    }

    // --db_name on the command line selects the routing target, so the log schema comes from
    // --db_name_log there and from DB_NAME everywhere else
    private static String logDatabaseName(Map<String, String> cliArgs, Map<String, String> fileConfig) {
        String cliValue = cliArgs.get("DB_NAME_LOG");
        if (cliValue != null) {
            return cliValue;
        }
        return getConfigValue("DB_NAME", null, Map.of(), fileConfig);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Path toPath(String value) {
        return value == null || value.isBlank() ? null : Paths.get(value);
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid integer for " + name + ": " + value, e);
        }
    }

    private static Integer parseOptionalInt(String name, String value) {
        return value == null || value.isBlank() ? null : parseInt(name, value);
    }
}
