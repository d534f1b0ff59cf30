package com.openforge.actionmind.api.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/** Request body for POST /api/learning/workflow; actions oldest first. */
public record WorkflowRequest(
        @NotEmpty List<String> recentActions
) {}
