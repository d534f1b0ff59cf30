package com.openforge.actionmind.learning;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A proposed next action. Transient; never persisted.
 *
 * @param action     action identifier to execute
 * @param confidence always within [0, 1]; out-of-range input is clamped
 * @param params     suggested action parameters (open-ended key/value map)
 * @param source     strategy that produced it
 * @param reason     human-readable justification
 * @param similarity situation similarity for transferred predictions, else null
 * @param askUser    true when the host should show a disambiguation prompt first
 * @param options    ranked candidates for that prompt, empty unless askUser
 */
public record Prediction(
        String                action,
        double                confidence,
        Map<String, Object>   params,
        PredictionSource      source,
        String                reason,
        @Nullable Double      similarity,
        boolean               askUser,
        List<Prediction>      options
) {

    public Prediction {
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        params     = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        options    = options == null ? List.of() : List.copyOf(options);
    }

    public static Prediction of(String action, double confidence, PredictionSource source, String reason) {
        return new Prediction(action, confidence, Map.of(), source, reason, null, false, List.of());
    }

    public Prediction withParams(Map<String, Object> newParams) {
        return new Prediction(action, confidence, newParams, source, reason, similarity, askUser, options);
    }

    public Prediction withSimilarity(double newSimilarity) {
        return new Prediction(action, confidence, params, source, reason, newSimilarity, askUser, options);
    }

    /** Same prediction, flagged for disambiguation with the given candidates. */
    public Prediction askingUser(List<Prediction> candidates) {
        return new Prediction(action, confidence, params, source, reason, similarity, true, candidates);
    }
}
