package com.openforge.actionmind.history;

import java.util.Map;

/**
 * Whole-log statistics, as shown on the learning dashboard.
 *
 * @param topSituations up to ten situations with their record counts, most frequent first
 */
public record HistoryStats(
        long              totalActions,
        long              successfulActions,
        long              uniqueSituations,
        long              uniqueActions,
        double            successRate,
        double            avgDurationMs,
        Map<String, Long> topSituations
) {}
