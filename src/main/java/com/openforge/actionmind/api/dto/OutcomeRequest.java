package com.openforge.actionmind.api.dto;

import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.Outcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Request body for POST /api/decisions/outcome: the result of executing an action.
 */
public record OutcomeRequest(

        @NotBlank(message = "situation must not be blank")
        @Size(max = 128)
        String situation,

        @Size(max = 4000)
        String userText,

        ContextSnapshot context,

        @NotBlank(message = "action must not be blank")
        @Size(max = 256)
        String action,

        Map<String, Object> params,

        @NotNull(message = "outcome is required")
        Outcome outcome,

        @PositiveOrZero
        Long durationMs
) {}
