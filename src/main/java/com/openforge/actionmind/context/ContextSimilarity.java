package com.openforge.actionmind.context;

import java.util.Objects;

/**
 * Weighted similarity between two context snapshots, in [0, 1].
 *
 * <pre>
 *   time-of-day match ........ 0.30  (else |hour diff| ≤ 2 → 0.15)
 *   day-of-week match ........ 0.20
 *   weekend flag match ....... 0.10
 *   battery closeness ........ 0.10 × (1 − |diff| / 100), both known only
 *   situation match .......... 0.30
 * </pre>
 *
 * The weights add up to 1.0 only when every feature matches; the sum is
 * capped at 1.0 regardless.
 */
public final class ContextSimilarity {

    private ContextSimilarity() {}

    public static double between(ContextSnapshot a, ContextSnapshot b) {
        if (a == null || b == null) return 0.0;
        double score = 0.0;

        if (a.timeOfDay() != null && a.timeOfDay() == b.timeOfDay()) {
            score += 0.3;
        } else if (Math.abs(a.hour() - b.hour()) <= 2) {
            score += 0.15;
        }

        if (a.dayOfWeek() != null && a.dayOfWeek().equals(b.dayOfWeek())) {
            score += 0.2;
        }

        if (a.weekend() == b.weekend()) {
            score += 0.1;
        }

        if (a.batteryPercent() != null && b.batteryPercent() != null) {
            int diff = Math.abs(a.batteryPercent() - b.batteryPercent());
            score += 0.1 * (1 - diff / 100.0);
        }

        if (Objects.equals(a.situation(), b.situation())) {
            score += 0.3;
        }

        return Math.min(score, 1.0);
    }
}
