package com.openforge.actionmind.domain;

/**
 * Result of one executed action, stored numerically in action_history.success.
 *
 *   SUCCESS  →  1   reward +1.0
 *   FAILURE  →  0   reward -0.5
 *   CANCELED → -1   reward -1.0  (user aborted the action)
 */
public enum Outcome {
    SUCCESS(1, 1.0),
    FAILURE(0, -0.5),
    CANCELED(-1, -1.0);

    private final int    code;
    private final double reward;

    Outcome(int code, double reward) {
        this.code   = code;
        this.reward = reward;
    }

    public int code() {
        return code;
    }

    /** Reinforcement signal used by the value-table update. */
    public double reward() {
        return reward;
    }

    public static Outcome fromCode(int code) {
        for (Outcome o : values()) {
            if (o.code == code) return o;
        }
        throw new IllegalArgumentException("Unknown outcome code: " + code);
    }
}
