package com.openforge.actionmind.api.dto;

import com.openforge.actionmind.learning.Prediction;
import com.openforge.actionmind.learning.PredictionSource;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * One disambiguation option as the client received it from /select.
 */
public record OptionRequest(

        @NotBlank
        String action,

        @DecimalMin("0.0") @DecimalMax("1.0")
        double confidence,

        Map<String, Object> params
) {

    public Prediction toPrediction() {
        return Prediction.of(action, confidence, PredictionSource.USER_TAUGHT, "Offered to user")
                .withParams(params);
    }
}
