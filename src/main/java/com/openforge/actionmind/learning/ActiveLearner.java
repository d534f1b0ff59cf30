package com.openforge.actionmind.learning;

import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.Outcome;
import com.openforge.actionmind.history.EventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Asks the user when the engine is unsure, and learns from the answer.
 *
 * Options are lettered A, B, C… and always followed by a "Something else"
 * escape. A valid answer is recorded as a successful execution, so every
 * other strategy learns from it on the next decision.
 */
@Slf4j
@Service
public class ActiveLearner {

    static final int    MAX_OPTIONS            = 3;
    static final double USER_TAUGHT_CONFIDENCE = 0.95;

    private final EventStore store;
    private final double     threshold;

    public ActiveLearner(EventStore store, LearningProperties properties) {
        this.store     = store;
        this.threshold = properties.active().uncertaintyThreshold();
    }

    public record Uncertainty(boolean ask, List<Prediction> options) {
        static final Uncertainty CONFIDENT = new Uncertainty(false, List.of());
    }

    /**
     * Ask when the best prediction's confidence is below the threshold.
     * The options are the (up to) three best predictions, best first.
     */
    public Uncertainty shouldAsk(List<Prediction> predictions) {
        if (predictions == null || predictions.isEmpty()) return Uncertainty.CONFIDENT;

        List<Prediction> ranked = predictions.stream()
                .sorted(Comparator.comparingDouble(Prediction::confidence).reversed())
                .limit(MAX_OPTIONS)
                .toList();
        if (ranked.get(0).confidence() >= threshold) return Uncertainty.CONFIDENT;
        return new Uncertainty(true, ranked);
    }

    /** The disambiguation prompt; empty when there is nothing to choose from. */
    public Optional<String> formatQuery(String situation, List<Prediction> options) {
        if (options == null || options.isEmpty()) return Optional.empty();

        StringBuilder prompt = new StringBuilder()
                .append("\nI'm not sure what to do for '").append(situation).append("'. Should I:\n");
        for (int i = 0; i < options.size(); i++) {
            Prediction option = options.get(i);
            prompt.append("  ").append(letter(i)).append(") ").append(option.action())
                  .append(String.format(" (confidence: %.0f%%)", option.confidence() * 100))
                  .append('\n');
        }
        prompt.append("  ").append(letter(options.size())).append(") Something else\n")
              .append("Your choice (A/B/C...):");
        return Optional.of(prompt.toString());
    }

    /**
     * Resolve a lettered answer. A valid letter records the chosen action as
     * a zero-duration success and returns it as user-taught.
     *
     * @return empty for the "Something else" letter, blanks, or anything out of range
     */
    public Optional<Prediction> applyChoice(String situation,
                                            ContextSnapshot context,
                                            List<Prediction> options,
                                            String choice) {
        if (choice == null || options == null || options.isEmpty()) return Optional.empty();
        String answer = choice.trim().toUpperCase(Locale.ROOT);
        if (answer.length() != 1) return Optional.empty();

        int index = answer.charAt(0) - 'A';
        if (index < 0 || index >= options.size()) return Optional.empty();

        Prediction chosen = options.get(index);
        if (context == null) {
            log.warn("[Active] No context for choice {} on {}, ignoring", answer, situation);
            return Optional.empty();
        }
        store.record(context.withSituation(situation), chosen.action(), chosen.params(), Outcome.SUCCESS, 0);
        log.info("[Active] User chose {} for {}", chosen.action(), situation);
        return Optional.of(new Prediction(chosen.action(), USER_TAUGHT_CONFIDENCE, chosen.params(),
                PredictionSource.USER_TAUGHT, "Taught by user", null, false, List.of()));
    }

    /** Record an explicit "in this situation, do this" instruction. */
    public boolean teach(String situation, ContextSnapshot context, String action, Map<String, Object> params) {
        if (context == null) {
            log.warn("[Active] No context to teach {} → {}", situation, action);
            return false;
        }
        boolean stored = store.record(context.withSituation(situation), action, params, Outcome.SUCCESS, 0).isPresent();
        if (stored) log.info("[Active] Learned: {} → {}", situation, action);
        return stored;
    }

    private static char letter(int index) {
        return (char) ('A' + index);
    }
}
