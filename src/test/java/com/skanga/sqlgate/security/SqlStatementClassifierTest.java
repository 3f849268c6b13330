package com.skanga.sqlgate.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SqlStatementClassifierTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT * FROM users",
            "  select id from t where x = 1",
            "WITH recent AS (SELECT * FROM events) SELECT * FROM recent",
            "EXPLAIN SELECT * FROM users",
            "PRAGMA table_info(users)",
            "/* c */ -- c\nSELECT 1",
            "-- leading comment\n  SeLeCt name\nFROM users",
            "SELECT updated_at, created_by FROM audit"
    })
    @DisplayName("Should allow read-only statements")
    void shouldAllowReadOnlyStatements(String sql) {
        assertThat(SqlStatementClassifier.isQueryOnly(sql)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "INSERT INTO t VALUES (1)",
            "UPDATE t SET a = 1",
            "DELETE FROM t",
            "DROP TABLE t",
            "CREATE TABLE t (a INT)",
            "ALTER TABLE t ADD COLUMN b INT",
            "TRUNCATE TABLE t",
            "GRANT ALL ON t TO bob",
            "BEGIN",
            "COMMIT",
            "SET autocommit = 1",
            "CALL proc()",
            "SELECT * FROM t; DROP TABLE t",
            "WITH x AS (DELETE FROM t RETURNING *) SELECT * FROM x",
            "SHOW TABLES",
            "DESCRIBE users",
            "selectx FROM t"
    })
    @DisplayName("Should deny mutating or unrecognized statements")
    void shouldDenyMutatingOrUnrecognizedStatements(String sql) {
        assertThat(SqlStatementClassifier.isQueryOnly(sql)).isFalse();
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\n\t", "-- only a comment", "/* nothing */"})
    @DisplayName("Should deny empty input")
    void shouldDenyEmptyInput(String sql) {
        assertThat(SqlStatementClassifier.isQueryOnly(sql)).isFalse();
    }

    @Test
    @DisplayName("Should deny forbidden words even inside an otherwise harmless select")
    void shouldDenyForbiddenWordInsideSelect() {
        assertThat(SqlStatementClassifier.isQueryOnly("SELECT CASE WHEN a > 1 THEN 'x' END FROM t")).isFalse();
    }

    @Test
    @DisplayName("Should strip block comments across lines and line comments")
    void shouldStripComments() {
        String stripped = SqlStatementClassifier.stripComments("/* multi\nline */SELECT 1 -- trailing\nFROM t");

        assertThat(stripped).isEqualTo("SELECT 1 \nFROM t");
        assertThat(SqlStatementClassifier.stripComments(null)).isEmpty();
    }

    @Test
    @DisplayName("Should normalize whitespace and case")
    void shouldNormalize() {
        assertThat(SqlStatementClassifier.normalize("  SELECT\n\t*   FROM  Users ")).isEqualTo("select * from users");
    }

    @Test
    @DisplayName("Should report the first forbidden keyword")
    void shouldFindForbiddenKeyword() {
        assertThat(SqlStatementClassifier.findForbiddenKeyword("select * from t; drop table t")).contains("drop");
        assertThat(SqlStatementClassifier.findForbiddenKeyword("select updated_at from t")).isEmpty();
        assertThat(SqlStatementClassifier.findForbiddenKeyword(null)).isEmpty();
    }

    @Test
    void testTruncateString() {
        assertThat(SqlStatementClassifier.truncateString("abcdef", 3)).isEqualTo("abc...");
        assertThat(SqlStatementClassifier.truncateString("abc", 3)).isEqualTo("abc");
        assertThat(SqlStatementClassifier.truncateString(null, 3)).isNull();
        assertThat(SqlStatementClassifier.truncateString("abc", -1)).isEqualTo("...");
    }
}
