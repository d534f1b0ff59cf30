package com.openforge.actionmind.learning;

import java.util.List;

/**
 * Predicted continuation of a recurring action sequence.
 *
 * @param pattern     the last two actions that were matched
 * @param nextAction  most frequent action that followed them historically
 * @param confidence  share of matches that continued with {@code nextAction}
 * @param occurrences how many historical matches were found
 */
public record WorkflowSuggestion(List<String> pattern, String nextAction, double confidence, int occurrences) {}
