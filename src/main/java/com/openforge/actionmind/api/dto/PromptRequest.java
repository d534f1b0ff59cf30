package com.openforge.actionmind.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/** Request body for POST /api/decisions/prompt. */
public record PromptRequest(
        @NotBlank String situation,
        @NotEmpty @Valid List<OptionRequest> options
) {}
