package com.skanga.sqlgate.exelog;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate view of the audit entries of a time window.
 *
 * @param totalLogs        number of entries
 * @param uniqueUsers      number of distinct users
 * @param avgExecutionTime mean time cost in milliseconds, rounded to 2 decimals
 * @param errorCount       entries whose result describes a failure
 * @param successCount     all other entries
 * @param errorRate        errorCount as a percentage of totalLogs, rounded to 2 decimals
 */
public record LogStatistics(
        @JsonProperty("total_logs") int totalLogs,
        @JsonProperty("unique_users") int uniqueUsers,
        @JsonProperty("avg_execution_time") double avgExecutionTime,
        @JsonProperty("error_count") int errorCount,
        @JsonProperty("success_count") int successCount,
        @JsonProperty("error_rate") double errorRate
) {
    public static final LogStatistics EMPTY = new LogStatistics(0, 0, 0, 0, 0, 0);
}
