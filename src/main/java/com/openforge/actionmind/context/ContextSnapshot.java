package com.openforge.actionmind.context;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;

/**
 * Structured snapshot of time, device and recent-activity signals at the
 * moment a decision is requested.
 *
 * When {@code timestamp} is present it is authoritative: hour, minute, day,
 * weekend flag and time-of-day bucket are derived from it, whatever the host
 * sent. Device fields (battery, charging, active app) are nullable because
 * not every host can probe them.
 * The whole snapshot is serialized into action_history.context_json, so
 * unknown properties are ignored when older rows are read back.
 *
 * @param timestamp           local wall-clock time of the snapshot
 * @param hour                0 – 23
 * @param minute              0 – 59
 * @param dayOfWeek           lower-case English day name, e.g. "monday"
 * @param weekend             Saturday or Sunday
 * @param timeOfDay           derived bucket of {@code hour}
 * @param batteryPercent      0 – 100, null when unknown
 * @param charging            null when unknown
 * @param activeApp           foreground application, null when unknown
 * @param recentActions       most recent action identifiers, oldest first
 * @param situation           detected situation label, null before detection
 * @param detectionConfidence classifier confidence for {@code situation}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ContextSnapshot(
        LocalDateTime timestamp,
        int           hour,
        int           minute,
        String        dayOfWeek,
        boolean       weekend,
        TimeOfDay     timeOfDay,
        Integer       batteryPercent,
        Boolean       charging,
        String        activeApp,
        List<String>  recentActions,
        String        situation,
        Double        detectionConfidence
) {

    public ContextSnapshot {
        if (timestamp != null) {
            DayOfWeek dow = timestamp.getDayOfWeek();
            hour      = timestamp.getHour();
            minute    = timestamp.getMinute();
            dayOfWeek = dow.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
            weekend   = dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
            timeOfDay = TimeOfDay.ofHour(timestamp.getHour());
        } else if (timeOfDay == null) {
            timeOfDay = TimeOfDay.ofHour(hour);
        }
        recentActions = recentActions == null ? List.of() : List.copyOf(recentActions);
    }

    /** Build a snapshot whose temporal fields are derived from {@code time}. */
    public static ContextSnapshot at(LocalDateTime time) {
        return new ContextSnapshot(time, 0, 0, null, false, null,
                null, null, null, List.of(), null, null);
    }

    // ── Copy helpers ─────────────────────────────────────────────────────────

    public ContextSnapshot withSituation(String newSituation) {
        return new ContextSnapshot(timestamp, hour, minute, dayOfWeek, weekend, timeOfDay,
                batteryPercent, charging, activeApp, recentActions, newSituation, detectionConfidence);
    }

    public ContextSnapshot withDetection(String newSituation, Double confidence) {
        return new ContextSnapshot(timestamp, hour, minute, dayOfWeek, weekend, timeOfDay,
                batteryPercent, charging, activeApp, recentActions, newSituation, confidence);
    }

    public ContextSnapshot withBattery(Integer percent, Boolean isCharging) {
        return new ContextSnapshot(timestamp, hour, minute, dayOfWeek, weekend, timeOfDay,
                percent, isCharging, activeApp, recentActions, situation, detectionConfidence);
    }

    public ContextSnapshot withActivity(String app, List<String> recent) {
        return new ContextSnapshot(timestamp, hour, minute, dayOfWeek, weekend, timeOfDay,
                batteryPercent, charging, app, recent, situation, detectionConfidence);
    }
}
