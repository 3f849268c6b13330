package com.skanga.sqlgate.exelog;

import java.time.Instant;

/**
 * Conjunctive filter over audit entries. Null filters match everything.
 *
 * @param user      only entries of this user
 * @param startTime only entries executed at or after this instant
 * @param endTime   only entries executed at or before this instant
 * @param limit     maximum number of entries returned, newest first
 */
public record LogQuery(String user, Instant startTime, Instant endTime, int limit) {
    public static final int DEFAULT_LIMIT = 100;

    public LogQuery {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (user != null && user.isBlank()) {
            user = null;
        }
    }

    public static LogQuery all(int limit) {
        return new LogQuery(null, null, null, limit);
    }

    public static LogQuery forUser(String user, int limit) {
        return new LogQuery(user, null, null, limit);
    }

    /**
     * @return true when every supplied filter accepts the entry
     */
    public boolean matches(LogEntry entry) {
        if (user != null && !user.equals(entry.user())) {
            return false;
        }
        if (startTime != null && entry.executionTime().isBefore(startTime)) {
            return false;
        }
        return endTime == null || !entry.executionTime().isAfter(endTime);
    }
}
