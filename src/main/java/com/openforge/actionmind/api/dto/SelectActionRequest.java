package com.openforge.actionmind.api.dto;

import com.openforge.actionmind.context.ContextSnapshot;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request body for POST /api/decisions/select.
 *
 * @param situation     detected situation label
 * @param userText      the user's request, enables semantic matching; optional
 * @param context       decision context; the server builds one when absent
 * @param candidates    actions the value-based learner may pick from; optional
 * @param timeoutMillis overrides the default decision budget; optional
 */
public record SelectActionRequest(

        @NotBlank(message = "situation must not be blank")
        @Size(max = 128)
        String situation,

        @Size(max = 4000)
        String userText,

        ContextSnapshot context,

        List<String> candidates,

        @Positive
        Long timeoutMillis
) {}
