package com.openforge.actionmind.learning;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Tuning knobs of the decision engine.
 *
 * actionmind:
 *   learning:
 *     decision-timeout: 5s
 *     gates:      { reinforcement: 0.8, few-shot: 0.75, meta: 0.7, knn: 0.7 }
 *     rl:         { epsilon: 0.2, learning-rate: 0.1, discount: 0.9 }
 *     few-shot:   { similarity-threshold: 0.75 }
 *     meta:       { similarity-threshold: 0.7, min-occurrences: 3 }
 *     knn:        { k: 10, min-confidence: 0.7, min-records: 3, workflow-min-matches: 5 }
 *     active:     { uncertainty-threshold: 0.6 }
 *
 * A strategy's prediction is accepted outright only when its confidence is
 * strictly above its gate.
 */
@ConfigurationProperties(prefix = "actionmind.learning")
public record LearningProperties(
        @DefaultValue("5s") Duration decisionTimeout,
        @DefaultValue Gates    gates,
        @DefaultValue Rl       rl,
        @DefaultValue FewShot  fewShot,
        @DefaultValue Meta     meta,
        @DefaultValue Knn      knn,
        @DefaultValue Active   active
) {

    public record Gates(
            @DefaultValue("0.8")  double reinforcement,
            @DefaultValue("0.75") double fewShot,
            @DefaultValue("0.7")  double meta,
            @DefaultValue("0.7")  double knn
    ) {}

    public record Rl(
            @DefaultValue("0.2") double epsilon,
            @DefaultValue("0.1") double learningRate,
            @DefaultValue("0.9") double discount
    ) {}

    public record FewShot(
            @DefaultValue("0.75") double similarityThreshold
    ) {}

    public record Meta(
            @DefaultValue("0.7") double similarityThreshold,
            @DefaultValue("3")   long   minOccurrences
    ) {}

    public record Knn(
            @DefaultValue("10")  int    k,
            @DefaultValue("0.7") double minConfidence,
            @DefaultValue("3")   int    minRecords,
            @DefaultValue("5")   int    workflowMinMatches
    ) {}

    public record Active(
            @DefaultValue("0.6") double uncertaintyThreshold
    ) {}

    /** The built-in defaults, for wiring the engine outside a Spring context. */
    public static LearningProperties defaults() {
        return new LearningProperties(
                Duration.ofSeconds(5),
                new Gates(0.8, 0.75, 0.7, 0.7),
                new Rl(0.2, 0.1, 0.9),
                new FewShot(0.75),
                new Meta(0.7, 3),
                new Knn(10, 0.7, 3, 5),
                new Active(0.6));
    }

    public LearningProperties withRl(Rl newRl) {
        return new LearningProperties(decisionTimeout, gates, newRl, fewShot, meta, knn, active);
    }

    public LearningProperties withKnn(Knn newKnn) {
        return new LearningProperties(decisionTimeout, gates, rl, fewShot, meta, newKnn, active);
    }
}
