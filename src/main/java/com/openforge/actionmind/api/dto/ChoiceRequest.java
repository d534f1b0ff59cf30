package com.openforge.actionmind.api.dto;

import com.openforge.actionmind.context.ContextSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request body for POST /api/decisions/choice.
 *
 * @param choice the letter the user typed, e.g. "B"
 */
public record ChoiceRequest(

        @NotBlank String situation,

        ContextSnapshot context,

        @NotEmpty @Valid List<OptionRequest> options,

        @NotBlank(message = "choice must not be blank")
        String choice
) {}
