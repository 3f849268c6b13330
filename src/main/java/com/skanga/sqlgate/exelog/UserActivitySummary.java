package com.skanga.sqlgate.exelog;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Activity of one user over a number of days.
 *
 * @param totalCommands    number of entries
 * @param avgExecutionTime mean time cost in milliseconds, rounded to 2 decimals
 * @param errorRate        failed entries as a percentage, rounded to 2 decimals
 * @param mostUsedCommands up to five leading command keywords with their counts, most used first
 * @param activityByDay    entry count per UTC day ({@code yyyy-MM-dd}), in day order
 */
public record UserActivitySummary(
        @JsonProperty("total_commands") int totalCommands,
        @JsonProperty("avg_execution_time") double avgExecutionTime,
        @JsonProperty("error_rate") double errorRate,
        @JsonProperty("most_used_commands") List<Map.Entry<String, Integer>> mostUsedCommands,
        @JsonProperty("activity_by_day") Map<String, Integer> activityByDay
) {
    public UserActivitySummary {
        mostUsedCommands = List.copyOf(mostUsedCommands);
        activityByDay = Collections.unmodifiableMap(new TreeMap<>(activityByDay));
    }
}
