package com.openforge.actionmind.learning;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock deadline for one decision cycle.
 *
 * Checked by the orchestrator before each strategy; a strategy that has
 * already started is not interrupted (the embedding call carries its own
 * timeout).
 */
public final class DecisionBudget {

    private final Clock   clock;
    private final Instant deadline;

    private DecisionBudget(Clock clock, Instant deadline) {
        this.clock    = clock;
        this.deadline = deadline;
    }

    public static DecisionBudget of(Duration total, Clock clock) {
        return new DecisionBudget(clock, clock.instant().plus(total));
    }

    public static DecisionBudget unbounded() {
        return new DecisionBudget(Clock.systemUTC(), Instant.MAX);
    }

    public Duration remaining() {
        if (deadline.equals(Instant.MAX)) return Duration.ofSeconds(Long.MAX_VALUE);
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean exhausted() {
        return remaining().isZero();
    }
}
