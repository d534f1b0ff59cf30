package com.openforge.actionmind.api.dto;

public record PromptResponse(String prompt) {}
