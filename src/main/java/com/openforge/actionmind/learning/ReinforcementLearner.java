package com.openforge.actionmind.learning;

import com.openforge.actionmind.context.BatteryTier;
import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.Outcome;
import com.openforge.actionmind.domain.QValue;
import com.openforge.actionmind.history.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.random.RandomGenerator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tabular Q-learning over (state, action) pairs.
 *
 * A state is a coarse fingerprint of the context: situation, time-of-day
 * bucket, weekday, charging flag and battery tier. Two contexts that agree on
 * those five values share every value-table cell.
 *
 * Selection is epsilon-greedy. Updates follow
 *
 *   Q(s,a) ← Q(s,a) + α · (r + γ · maxNext − Q(s,a))
 *
 * where maxNext is taken over the action just performed in the next state.
 * The table is cached in memory and hydrated from the event store on first
 * use; every update is written through.
 */
@Slf4j
@Service
public class ReinforcementLearner {

    private final EventStore             store;
    private final LearningProperties.Rl  config;
    private final RandomGenerator        random;

    private final Map<Cell, Double> table = new ConcurrentHashMap<>();
    private final Object            hydrationLock = new Object();
    private volatile boolean        hydrated;

    private final AtomicLong explorations  = new AtomicLong();
    private final AtomicLong exploitations = new AtomicLong();
    private final AtomicLong updates       = new AtomicLong();

    public ReinforcementLearner(EventStore store, LearningProperties properties, RandomGenerator explorationRandom) {
        this.store  = store;
        this.config = properties.rl();
        this.random = explorationRandom;
    }

    // ── Selection ────────────────────────────────────────────────────────────

    /**
     * Pick one of {@code candidates} for the given state.
     *
     * @return empty when there are no candidates; otherwise the chosen action
     *         with confidence min(|Q|, 1)
     */
    public Optional<Prediction> selectAction(ContextSnapshot context, String situation, List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();
        hydrate();

        String state = fingerprint(context, situation);
        String chosen;
        String mode;
        if (random.nextDouble() < config.epsilon()) {
            chosen = candidates.get(random.nextInt(candidates.size()));
            mode   = "explore";
            explorations.incrementAndGet();
        } else {
            chosen = candidates.get(0);
            double best = value(state, chosen);
            for (String candidate : candidates) {
                double q = value(state, candidate);
                if (q > best) {
                    best   = q;
                    chosen = candidate;
                }
            }
            mode = "exploit";
            exploitations.incrementAndGet();
        }

        double q = value(state, chosen);
        log.debug("[RL] {} picked {} for {} (Q={})", mode, chosen, situation, q);
        return Optional.of(Prediction.of(chosen, Math.min(Math.abs(q), 1.0),
                PredictionSource.REINFORCEMENT_LEARNING,
                String.format("Q-value: %.3f (%s)", q, mode)));
    }

    // ── Learning ─────────────────────────────────────────────────────────────

    /**
     * Apply one Q-learning step for an observed outcome.
     *
     * @param nextContext the context after the action; null means "same as before"
     * @return the new value of Q(state, action)
     */
    public double update(ContextSnapshot context,
                         String situation,
                         String action,
                         Outcome outcome,
                         @Nullable ContextSnapshot nextContext) {
        hydrate();

        String state     = fingerprint(context, situation);
        String nextState = fingerprint(nextContext != null ? nextContext : context, situation);

        double current = value(state, action);
        double maxNext = value(nextState, action);
        double target  = outcome.reward() + config.discount() * maxNext;
        double updated = current + config.learningRate() * (target - current);

        table.put(new Cell(state, action), updated);
        updates.incrementAndGet();
        if (!store.upsertValue(state, action, updated)) {
            log.warn("[RL] Q({}, {}) kept in memory only", state, action);
        }
        log.debug("[RL] Q({}, {}) {} → {} after {}", state, action, current, updated, outcome);
        return updated;
    }

    /** Current value of Q(state-of-context, action); 0 when never updated. */
    public double valueOf(ContextSnapshot context, String situation, String action) {
        hydrate();
        return value(fingerprint(context, situation), action);
    }

    /** Forget everything learned so far, in memory and in the store. */
    public void reset() {
        synchronized (hydrationLock) {
            table.clear();
            store.clearValueTable();
            explorations.set(0);
            exploitations.set(0);
            updates.set(0);
            hydrated = true;
        }
        log.info("[RL] Value table reset");
    }

    public RlStats stats() {
        EventStore.ValueTableStats persisted = store.valueTableStats();
        return new RlStats(persisted.totalValues(), explorations.get(), exploitations.get(),
                updates.get(), persisted.topActions());
    }

    public record RlStats(long totalValues,
                          long explorations,
                          long exploitations,
                          long totalUpdates,
                          Map<String, Double> topActions) {}

    // ── State fingerprint ────────────────────────────────────────────────────

    /**
     * Deterministic state key: first 16 hex chars of the MD5 digest of
     * {@code ["<situation>","<time of day>","<weekday>","charging|battery","<tier>"]}.
     */
    public static String fingerprint(ContextSnapshot context, String situation) {
        String power = Boolean.TRUE.equals(context.charging()) ? "charging" : "battery";
        String tier  = BatteryTier.of(context.batteryPercent()).label();
        String timeOfDay = context.timeOfDay() != null ? context.timeOfDay().label() : "";

        String canonical = Stream.of(situation, timeOfDay, context.dayOfWeek(), power, tier)
                .map(ReinforcementLearner::quote)
                .collect(Collectors.joining(",", "[", "]"));
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(canonical.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(32);
            for (byte b : digest) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
            }
            return hex.substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    private static String quote(String value) {
        if (value == null) return "null";
        return '"' + value.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private double value(String state, String action) {
        return table.getOrDefault(new Cell(state, action), 0.0);
    }

    private void hydrate() {
        if (hydrated) return;
        synchronized (hydrationLock) {
            if (hydrated) return;
            try {
                List<QValue> cells = store.loadValueTable();
                for (QValue cell : cells) {
                    table.put(new Cell(cell.getStateHash(), cell.getAction()), cell.getValue());
                }
                log.info("[RL] Loaded {} Q-values", cells.size());
            } catch (Exception e) {
                log.warn("[RL] Could not load value table, starting empty: {}", e.getMessage());
            }
            hydrated = true;
        }
    }

    private record Cell(String state, String action) {}
}
