package com.openforge.actionmind.context;

import java.util.List;

/**
 * Produces the context snapshot for the current decision cycle.
 * Hosts that can probe device state (battery, foreground window) supply
 * their own implementation; {@link SystemContextProvider} is the default.
 */
public interface ContextProvider {

    ContextSnapshot currentContext(String situation, Double detectionConfidence, List<String> recentActions);

    default ContextSnapshot currentContext() {
        return currentContext(null, null, List.of());
    }
}
