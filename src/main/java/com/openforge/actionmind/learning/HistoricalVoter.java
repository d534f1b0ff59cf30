package com.openforge.actionmind.learning;

import com.openforge.actionmind.context.ContextSimilarity;
import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.ActionRecord;
import com.openforge.actionmind.history.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.AbstractMap;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * k-nearest-neighbour voting over past executions.
 *
 * Neighbours are the successful executions of the situation, pre-ranked by
 * the event store, and scored by context similarity × recency × outcome code.
 * The same history also drives workflow detection and parameter suggestions.
 */
@Slf4j
@Service
public class HistoricalVoter {

    private static final Duration SEQUENCE_GAP          = Duration.ofMinutes(10);
    private static final int      WORKFLOW_HISTORY      = 100;
    private static final int      MIN_SEQUENCE_LENGTH   = 3;
    private static final int      PARAMETER_HISTORY     = 20;
    private static final double   PARAMETER_SIMILARITY  = 0.6;

    private final EventStore               store;
    private final LearningProperties.Knn   config;
    private final Clock                    clock;

    public HistoricalVoter(EventStore store, LearningProperties properties, Clock clock) {
        this.store  = store;
        this.config = properties.knn();
        this.clock  = clock;
    }

    // ── Voting ───────────────────────────────────────────────────────────────

    /**
     * Vote among the k best-scoring past executions of {@code situation}.
     *
     * Confidence is the winner's summed score divided by k, capped at 1, so a
     * situation with fewer than k neighbours cannot reach full confidence.
     *
     * @return empty with fewer than {@code min-records} candidates, or when
     *         the winner's confidence is below {@code min-confidence}
     */
    public Optional<Prediction> predict(String situation, ContextSnapshot context) {
        int k = config.k();
        List<ActionRecord> candidates = store.querySimilar(context, situation, k * 2);
        if (candidates.size() < config.minRecords()) {
            log.debug("[kNN] Only {} record(s) for {}, abstaining", candidates.size(), situation);
            return Optional.empty();
        }

        ContextSnapshot current = context.withSituation(situation);
        LocalDateTime   now     = LocalDateTime.now(clock);

        List<Neighbour> scored = new ArrayList<>();
        for (ActionRecord row : candidates) {
            Optional<ContextSnapshot> past = store.contextOf(row);
            if (past.isEmpty()) continue;

            double similarity = ContextSimilarity.between(current, past.get());
            long   daysAgo    = Math.max(0, Duration.between(row.getTimestamp(), now).toDays());
            double recency    = 1.0 / (1.0 + daysAgo / 30.0);
            double score      = similarity * recency * row.getOutcome().code();
            scored.add(new Neighbour(row, score));
        }
        if (scored.isEmpty()) return Optional.empty();

        scored.sort(Comparator.comparingDouble(Neighbour::score).reversed());
        List<Neighbour> nearest = scored.subList(0, Math.min(k, scored.size()));

        Map<String, List<Neighbour>> votes = new LinkedHashMap<>();
        for (Neighbour n : nearest) {
            votes.computeIfAbsent(n.row().getAction(), a -> new ArrayList<>()).add(n);
        }

        String winner      = null;
        double winnerTotal = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, List<Neighbour>> entry : votes.entrySet()) {
            double total = entry.getValue().stream().mapToDouble(Neighbour::score).sum();
            if (total > winnerTotal) {
                winner      = entry.getKey();
                winnerTotal = total;
            }
        }

        double confidence = Math.min(winnerTotal / k, 1.0);
        if (confidence < config.minConfidence()) {
            log.debug("[kNN] {} for {} only at {}", winner, situation, confidence);
            return Optional.empty();
        }

        List<Neighbour> winning = votes.get(winner);
        Map<String, Object> params = modeByKey(winning.stream().map(n -> store.paramsOf(n.row())).toList());
        return Optional.of(Prediction.of(winner, confidence, PredictionSource.KNN,
                        String.format("You did this %d/%d times in similar contexts", winning.size(), k))
                .withParams(params));
    }

    // ── Workflow detection ───────────────────────────────────────────────────

    /**
     * Given the last actions taken, guess the next one from recurring
     * sequences in recent successful history. Sequences are split wherever
     * two consecutive actions are more than ten minutes apart.
     */
    public Optional<WorkflowSuggestion> detectWorkflow(List<String> recentActions) {
        if (recentActions == null || recentActions.size() < 2) return Optional.empty();
        List<String> pattern = List.copyOf(recentActions.subList(recentActions.size() - 2, recentActions.size()));

        List<String> followers = new ArrayList<>();
        for (List<String> sequence : sequences(store.latestSuccessful(WORKFLOW_HISTORY))) {
            for (int i = 0; i + 2 < sequence.size(); i++) {
                if (sequence.get(i).equals(pattern.get(0)) && sequence.get(i + 1).equals(pattern.get(1))) {
                    followers.add(sequence.get(i + 2));
                }
            }
        }
        if (followers.size() < config.workflowMinMatches()) return Optional.empty();

        Map.Entry<Object, Integer> top = mostCommon(new ArrayList<>(followers));
        String next = (String) top.getKey();
        log.debug("[kNN] Workflow {} → {} ({}/{})", pattern, next, top.getValue(), followers.size());
        return Optional.of(new WorkflowSuggestion(pattern, next,
                (double) top.getValue() / followers.size(), followers.size()));
    }

    /** Newest-first rows → chronological sequences of at least three actions. */
    private List<List<String>> sequences(List<ActionRecord> newestFirst) {
        List<List<String>> sequences = new ArrayList<>();
        List<String>       current   = new ArrayList<>();
        LocalDateTime      previous  = null;

        for (ActionRecord row : newestFirst) {
            if (previous != null && Duration.between(row.getTimestamp(), previous).compareTo(SEQUENCE_GAP) > 0) {
                closeSequence(current, sequences);
                current = new ArrayList<>();
            }
            current.add(row.getAction());
            previous = row.getTimestamp();
        }
        closeSequence(current, sequences);
        return sequences;
    }

    private static void closeSequence(List<String> newestFirst, List<List<String>> into) {
        if (newestFirst.size() < MIN_SEQUENCE_LENGTH) return;
        List<String> chronological = new ArrayList<>(newestFirst);
        Collections.reverse(chronological);
        into.add(chronological);
    }

    // ── Parameter suggestion ─────────────────────────────────────────────────

    /**
     * Parameters that were used most often for {@code action} in contexts
     * similar to {@code context}. Falls back to {@code defaults} when the
     * action has too little history.
     */
    public Map<String, Object> optimizeParameters(String action, ContextSnapshot context, Map<String, Object> defaults) {
        Map<String, Object> fallback = defaults == null ? Map.of() : defaults;
        List<ActionRecord> uses = store.latestSuccessfulUses(action, PARAMETER_HISTORY);
        if (uses.size() < 3) return fallback;

        List<Map<String, Object>> similarParams = new ArrayList<>();
        for (ActionRecord row : uses) {
            Optional<ContextSnapshot> past = store.contextOf(row);
            if (past.isPresent() && ContextSimilarity.between(context, past.get()) > PARAMETER_SIMILARITY) {
                similarParams.add(store.paramsOf(row));
            }
        }
        if (similarParams.isEmpty()) return fallback;

        Map<String, Object> mode = modeByKey(similarParams);
        return mode.isEmpty() ? fallback : mode;
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private record Neighbour(ActionRecord row, double score) {}

    /** Per-key most common value; ties go to the value seen first. */
    static Map<String, Object> modeByKey(List<Map<String, Object>> paramSets) {
        Map<String, List<Object>> valuesByKey = new LinkedHashMap<>();
        for (Map<String, Object> params : paramSets) {
            params.forEach((key, value) -> valuesByKey.computeIfAbsent(key, x -> new ArrayList<>()).add(value));
        }
        Map<String, Object> mode = new LinkedHashMap<>();
        valuesByKey.forEach((key, values) -> mode.put(key, mostCommon(values).getKey()));
        return mode;
    }

    private static Map.Entry<Object, Integer> mostCommon(Collection<Object> values) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        for (Object v : values) counts.merge(v, 1, Integer::sum);

        Map.Entry<Object, Integer> best = null;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (best == null || entry.getValue() > best.getValue()) best = entry;
        }
        return best != null ? best : new AbstractMap.SimpleEntry<>(null, 0);
    }
}
