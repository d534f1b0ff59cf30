package com.openforge.actionmind.learning;

import com.fasterxml.jackson.annotation.JsonValue;

/** Which strategy produced a {@link Prediction}. */
public enum PredictionSource {
    REINFORCEMENT_LEARNING("reinforcement_learning"),
    FEW_SHOT("few_shot"),
    META_LEARNING("meta_learning"),
    KNN("knn"),
    USER_TAUGHT("user_taught");

    private final String tag;

    PredictionSource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
