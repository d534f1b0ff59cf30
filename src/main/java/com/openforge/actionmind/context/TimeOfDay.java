package com.openforge.actionmind.context;

/**
 * Coarse time-of-day bucket used by the value-table fingerprint and by
 * context similarity.
 *
 *   MORNING   05:00 to 11:59
 *   AFTERNOON 12:00 to 16:59
 *   EVENING   17:00 to 20:59
 *   NIGHT     everything else
 */
public enum TimeOfDay {
    MORNING,
    AFTERNOON,
    EVENING,
    NIGHT;

    public static TimeOfDay ofHour(int hour) {
        if (hour >= 5 && hour < 12)  return MORNING;
        if (hour >= 12 && hour < 17) return AFTERNOON;
        if (hour >= 17 && hour < 21) return EVENING;
        return NIGHT;
    }

    /** Lower-case label as stored in the action_history.time_of_day column. */
    public String label() {
        return name().toLowerCase();
    }
}
