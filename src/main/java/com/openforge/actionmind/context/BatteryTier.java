package com.openforge.actionmind.context;

/**
 * Battery level bucket for the state fingerprint.
 * An unknown battery level is treated as 50 %, i.e. MEDIUM.
 */
public enum BatteryTier {
    LOW,
    MEDIUM,
    HIGH;

    public static BatteryTier of(Integer batteryPercent) {
        int level = batteryPercent == null ? 50 : batteryPercent;
        if (level > 70) return HIGH;
        if (level < 30) return LOW;
        return MEDIUM;
    }

    public String label() {
        return name().toLowerCase();
    }
}
