package com.skanga.sqlgate.security;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Allow/deny decision for caller-supplied SQL on the safe query path.
 *
 * <p>A statement is query-only when, after comments are stripped, whitespace is collapsed and
 * case is folded, it starts with {@code select}, {@code with}, {@code explain} or {@code pragma}
 * and contains none of the forbidden keywords as a whole word anywhere. Anything else, including
 * empty input and unrecognized statement shapes, is denied.
 *
 * <p>The check is pattern based and therefore best-effort: it does not tokenize string literals,
 * so a forbidden word inside a quoted value or a {@code CASE ... END} expression is also denied.
 * It is a policy layer for the safe query entry point only; the lower level execute primitives
 * are not gated.
 */
public final class SqlStatementClassifier {

    /** Leading keywords of statements that only read. */
    public static final List<String> ALLOWED_PREFIXES = List.of("select", "with", "explain", "pragma");

    /** Keywords that mark a mutating, transactional or administrative statement. */
    public static final List<String> FORBIDDEN_KEYWORDS = List.of(
            "insert", "update", "delete", "drop", "create", "alter", "truncate",
            "grant", "revoke", "commit", "rollback", "savepoint", "release",
            "exec", "execute", "call", "declare", "set", "begin", "end");

    // Pre-compiled regex patterns
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern LINE_COMMENT = Pattern.compile("--.*$", Pattern.MULTILINE);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern ALLOWED_PREFIX = Pattern.compile(
            "^(?:" + String.join("|", ALLOWED_PREFIXES) + ")\\b");
    private static final Pattern FORBIDDEN_KEYWORD = Pattern.compile(
            "\\b(" + FORBIDDEN_KEYWORDS.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")\\b");

    private SqlStatementClassifier() {
        // Utility class - prevent instantiation
    }

    /**
     * Decides whether a statement may run on the safe query path.
     *
     * @param sql statement text (may be null)
     * @return true only for read-only statements
     */
    public static boolean isQueryOnly(String sql) {
        String normalized = normalize(sql);
        if (normalized.isEmpty()) {
            return false;
        }
        // Checked before the prefix so "select ...; drop ..." is denied
        if (findForbiddenKeyword(normalized).isPresent()) {
            return false;
        }
        return ALLOWED_PREFIX.matcher(normalized).find();
    }

    /**
     * Removes block comments (which may span lines) and then line comments.
     *
     * @param sql statement text (may be null)
     * @return the text without comments, or an empty string for null input
     */
    public static String stripComments(String sql) {
        if (sql == null) {
            return "";
        }
        String withoutBlocks = BLOCK_COMMENT.matcher(sql).replaceAll("");
        return LINE_COMMENT.matcher(withoutBlocks).replaceAll("");
    }

    /**
     * Strips comments, collapses whitespace to single spaces, trims and lower-cases.
     */
    public static String normalize(String sql) {
        String stripped = stripComments(sql);
        return WHITESPACE.matcher(stripped).replaceAll(" ").trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Finds the first forbidden keyword in already normalized text.
     *
     * @param normalizedSql output of {@link #normalize(String)}
     * @return the keyword, if one occurs as a whole word
     */
    public static Optional<String> findForbiddenKeyword(String normalizedSql) {
        if (normalizedSql == null) {
            return Optional.empty();
        }
        Matcher matcher = FORBIDDEN_KEYWORD.matcher(normalizedSql);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Truncates a string to the specified maximum length, appending "..." when cut.
     *
     * @param inputString The string to truncate (can be null)
     * @param maxLength Maximum length allowed
     * @return Truncated string, or original if within limit
     */
    public static String truncateString(String inputString, int maxLength) {
        if (maxLength <= 0) {
            maxLength = 0;
        }
        if (inputString == null || inputString.length() <= maxLength) {
            return inputString;
        }
        return inputString.substring(0, maxLength) + "...";
    }
}
