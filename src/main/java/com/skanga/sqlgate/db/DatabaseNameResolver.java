package com.skanga.sqlgate.db;

import com.skanga.sqlgate.config.ConfigParams;
import com.skanga.sqlgate.config.ConfigurationException;
import com.skanga.sqlgate.config.DatabaseDescriptor;
import com.skanga.sqlgate.security.SqlStatementClassifier;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides which logical database a statement targets. An explicit name wins; otherwise the first
 * qualified table reference ({@code db.table}) after FROM, JOIN, UPDATE, INSERT INTO or DELETE FROM
 * names it; otherwise the first configured embedded-file database is used.
 */
public class DatabaseNameResolver {
    private static final Pattern QUALIFIED_REFERENCE = Pattern.compile(
            "\\b(?:from|join|update|insert\\s+into|delete\\s+from)\\s+[`\"']?(\\w+)[`\"']?\\.[`\"']?\\w+",
            Pattern.CASE_INSENSITIVE);

    private final ConfigParams configParams;

    public DatabaseNameResolver(ConfigParams configParams) {
        this.configParams = configParams;
    }

    /**
     * @param sql          statement text
     * @param explicitName caller supplied name, used verbatim when not blank
     * @return the logical database name
     * @throws ConfigurationException if nothing names a database and no embedded-file database is configured
     */
    public String resolve(String sql, String explicitName) {
        if (explicitName != null && !explicitName.isBlank()) {
            return explicitName;
        }
        Optional<String> qualifier = findQualifier(sql);
        if (qualifier.isPresent()) {
            return qualifier.get();
        }
        return configParams.defaultEmbeddedDatabase()
                .map(DatabaseDescriptor::name)
                .orElseThrow(() -> new ConfigurationException(
                        "Statement names no database and no embedded-file database is configured"));
    }

    /**
     * @return the database qualifier of the first qualified table reference, if any
     */
    public Optional<String> findQualifier(String sql) {
        if (sql == null) {
            return Optional.empty();
        }
        Matcher matcher = QUALIFIED_REFERENCE.matcher(SqlStatementClassifier.stripComments(sql));
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }
}
