package com.openforge.actionmind.learning;

import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.Outcome;
import com.openforge.actionmind.history.EventStore;
import com.openforge.actionmind.history.HistoryStats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point of the decision engine.
 *
 * Strategies run in a fixed priority order and the first one whose
 * confidence clears its gate wins outright, even if a later strategy would
 * have been more confident:
 *
 *   1. reinforcement learning   (gate 0.8)
 *   2. few-shot semantic match  (gate 0.75)
 *   3. meta-learning transfer   (gate 0.7)
 *   4. k-NN historical vote     (gate 0.7)
 *
 * If none clears its gate, the most confident sub-gate prediction is returned
 * and the active learner decides whether the host should ask the user first.
 * A failing strategy is logged and skipped; a strategy that has not started
 * when the decision budget runs out is skipped as well.
 */
@Slf4j
@Service
public class HybridIntelligence {

    private final ReinforcementLearner reinforcement;
    private final FewShotMatcher       fewShot;
    private final MetaLearner          meta;
    private final HistoricalVoter      voter;
    private final ActiveLearner        active;
    private final EventStore           store;
    private final LearningProperties   properties;
    private final Clock                clock;

    public HybridIntelligence(ReinforcementLearner reinforcement,
                              FewShotMatcher fewShot,
                              MetaLearner meta,
                              HistoricalVoter voter,
                              ActiveLearner active,
                              EventStore store,
                              LearningProperties properties,
                              Clock clock) {
        this.reinforcement = reinforcement;
        this.fewShot       = fewShot;
        this.meta          = meta;
        this.voter         = voter;
        this.active        = active;
        this.store         = store;
        this.properties    = properties;
        this.clock         = clock;
    }

    // ── Decision ─────────────────────────────────────────────────────────────

    /** {@link #selectAction(String, String, ContextSnapshot, List)} without request text. */
    public Optional<Prediction> selectAction(String situation, ContextSnapshot context, List<String> candidates) {
        return selectAction(null, situation, context, candidates);
    }

    /** Decide under the configured default budget. */
    public Optional<Prediction> selectAction(@Nullable String userText,
                                             String situation,
                                             ContextSnapshot context,
                                             List<String> candidates) {
        return selectAction(userText, situation, context, candidates,
                DecisionBudget.of(properties.decisionTimeout(), clock));
    }

    /**
     * Decide the next action.
     *
     * @param userText   the user's request, used for semantic matching; may be null
     * @param candidates actions the reinforcement learner may choose from; may be empty
     * @return empty when no strategy had an opinion or there is no context
     */
    public Optional<Prediction> selectAction(@Nullable String userText,
                                             String situation,
                                             ContextSnapshot context,
                                             List<String> candidates,
                                             DecisionBudget budget) {
        if (context == null) {
            log.warn("[Hybrid] No context for {}, abstaining", situation);
            return Optional.empty();
        }
        ContextSnapshot current = context.withSituation(situation);
        LearningProperties.Gates gates = properties.gates();

        List<Layer> layers = List.of(
                new Layer("RL",     gates.reinforcement(), () -> reinforcement.selectAction(current, situation, candidates)),
                new Layer("FewShot", gates.fewShot(),      () -> userText == null ? Optional.empty() : fewShot.predict(userText, situation)),
                new Layer("Meta",   gates.meta(),          () -> meta.bootstrap(situation)),
                new Layer("kNN",    gates.knn(),           () -> voter.predict(situation, current)));

        List<Prediction> belowGate = new ArrayList<>();
        for (Layer layer : layers) {
            if (budget.exhausted()) {
                log.warn("[Hybrid] Decision budget exhausted before {} for {}", layer.name(), situation);
                break;
            }
            Optional<Prediction> prediction;
            try {
                prediction = layer.strategy().get();
            } catch (Exception e) {
                log.warn("[Hybrid] {} failed for {}: {}", layer.name(), situation, e.getMessage());
                continue;
            }
            if (prediction.isEmpty()) continue;

            Prediction p = prediction.get();
            if (p.confidence() > layer.gate()) {
                log.info("[Hybrid] {} → {} via {} ({})", situation, p.action(), layer.name(),
                        String.format("%.2f", p.confidence()));
                return Optional.of(p);
            }
            belowGate.add(p);
        }

        if (belowGate.isEmpty()) {
            log.info("[Hybrid] No strategy had an opinion for {}", situation);
            return Optional.empty();
        }

        Prediction best = belowGate.stream().max(Comparator.comparingDouble(Prediction::confidence)).get();
        ActiveLearner.Uncertainty uncertainty = active.shouldAsk(belowGate);
        if (uncertainty.ask()) {
            log.info("[Hybrid] Unsure about {} (best {} at {}), asking user",
                    situation, best.action(), String.format("%.2f", best.confidence()));
            return Optional.of(best.askingUser(uncertainty.options()));
        }
        return Optional.of(best);
    }

    private record Layer(String name, double gate, Supplier<Optional<Prediction>> strategy) {}

    // ── Feedback ─────────────────────────────────────────────────────────────

    public void learnFromOutcome(@Nullable String userText, String situation, ContextSnapshot context,
                                 String action, Map<String, Object> params, Outcome outcome) {
        learnFromOutcome(userText, situation, context, action, params, outcome, 0L);
    }

    /**
     * Feed an executed action back into every learner: one history record,
     * one value-table update, and an exemplar when it succeeded. Each step is
     * independent; a failing step is logged and the rest still run.
     */
    public void learnFromOutcome(@Nullable String userText,
                                 String situation,
                                 ContextSnapshot context,
                                 String action,
                                 @Nullable Map<String, Object> params,
                                 Outcome outcome,
                                 long durationMs) {
        if (context == null) {
            log.warn("[Hybrid] No context for {} on {}, outcome dropped", action, situation);
            return;
        }
        ContextSnapshot current = context.withSituation(situation);

        try {
            store.record(current, action, params, outcome, durationMs);
        } catch (Exception e) {
            log.warn("[Hybrid] Could not record {} for {}: {}", action, situation, e.getMessage());
        }

        try {
            reinforcement.update(current, situation, action, outcome, null);
        } catch (Exception e) {
            log.warn("[Hybrid] Value update failed for {}: {}", action, e.getMessage());
        }

        if (outcome == Outcome.SUCCESS && userText != null && !userText.isBlank()) {
            try {
                fewShot.storeExample(userText, action, situation);
            } catch (Exception e) {
                log.warn("[Hybrid] Could not store exemplar for {}: {}", action, e.getMessage());
            }
        }
    }

    // ── User interaction ─────────────────────────────────────────────────────

    /** Disambiguation prompt for {@code options}; blank when there are none. */
    public String formatDisambiguationPrompt(String situation, List<Prediction> options) {
        return active.formatQuery(situation, options).orElse("");
    }

    public Optional<Prediction> applyUserChoice(String situation, ContextSnapshot context,
                                                List<Prediction> options, String choice) {
        return active.applyChoice(situation, context, options, choice);
    }

    public boolean teach(String situation, ContextSnapshot context, String action, Map<String, Object> params) {
        return active.teach(situation, context, action, params);
    }

    public Optional<WorkflowSuggestion> detectWorkflow(List<String> recentActions) {
        try {
            return voter.detectWorkflow(recentActions);
        } catch (Exception e) {
            log.warn("[Hybrid] Workflow detection failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Map<String, Object> optimizeParameters(String action, ContextSnapshot context, Map<String, Object> defaults) {
        try {
            return voter.optimizeParameters(action, context, defaults);
        } catch (Exception e) {
            log.warn("[Hybrid] Parameter lookup failed for {}: {}", action, e.getMessage());
            return defaults == null ? Map.of() : defaults;
        }
    }

    // ── Stats ────────────────────────────────────────────────────────────────

    /**
     * Snapshot of every subsystem. A section whose query fails is null rather
     * than failing the whole snapshot.
     */
    public CombinedStats combinedStats() {
        return new CombinedStats(
                section("RL",      reinforcement::stats),
                section("History", store::stats),
                section("Meta",    meta::stats),
                section("FewShot", fewShot::stats));
    }

    public record CombinedStats(ReinforcementLearner.RlStats reinforcement,
                                HistoryStats history,
                                EventStore.TransferStats meta,
                                EventStore.ExemplarStats fewShot) {}

    @Nullable
    private static <T> T section(String name, Supplier<T> stats) {
        try {
            return stats.get();
        } catch (Exception e) {
            log.warn("[Hybrid] {} stats unavailable: {}", name, e.getMessage());
            return null;
        }
    }
}
