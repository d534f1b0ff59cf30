package com.openforge.actionmind.history;

/**
 * Outcome statistics of one (situation, action) pair.
 *
 * @param total         every recorded attempt
 * @param successes     attempts with outcome SUCCESS
 * @param successRate   successes / total, 0 when there are no attempts
 * @param avgDurationMs mean execution time of the successful attempts, 0 when none
 */
public record ActionStats(
        long   total,
        long   successes,
        double successRate,
        double avgDurationMs
) {

    public static ActionStats of(long total, long successes, Double avgDurationMs) {
        double rate = total > 0 ? (double) successes / total : 0.0;
        return new ActionStats(total, successes, rate, avgDurationMs == null ? 0.0 : avgDurationMs);
    }
}
