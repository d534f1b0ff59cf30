package com.openforge.actionmind.api.dto;

import com.openforge.actionmind.context.ContextSnapshot;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

/** Request body for POST /api/learning/teach: "in this situation, do this". */
public record TeachRequest(
        @NotBlank @Size(max = 128) String situation,
        ContextSnapshot context,
        @NotBlank @Size(max = 256) String action,
        Map<String, Object> params
) {}
