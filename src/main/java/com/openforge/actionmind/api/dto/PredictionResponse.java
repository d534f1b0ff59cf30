package com.openforge.actionmind.api.dto;

import com.openforge.actionmind.learning.Prediction;

import java.util.List;
import java.util.Map;

/**
 * Wire form of a {@link Prediction}. When {@code askUser} is set, the host
 * should render {@code prompt} and post the answer to /api/decisions/choice
 * together with {@code options}.
 */
public record PredictionResponse(
        String                    action,
        double                    confidence,
        Map<String, Object>       params,
        String                    source,
        String                    reason,
        Double                    similarity,
        boolean                   askUser,
        List<PredictionResponse>  options,
        String                    prompt
) {

    public static PredictionResponse from(Prediction p) {
        return from(p, null);
    }

    public static PredictionResponse from(Prediction p, String prompt) {
        return new PredictionResponse(
                p.action(),
                p.confidence(),
                p.params(),
                p.source().tag(),
                p.reason(),
                p.similarity(),
                p.askUser(),
                p.options().stream().map(PredictionResponse::from).toList(),
                prompt
        );
    }
}
