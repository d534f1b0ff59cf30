package com.openforge.actionmind.context;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Default context provider: temporal signals only.
 *
 * Battery and foreground-window probing are OS specific and belong to the
 * host; those fields stay null here and every consumer treats null as
 * "unknown". Hosts replace it by registering a {@code @Primary}
 * {@link ContextProvider} bean.
 */
@Component
@RequiredArgsConstructor
public class SystemContextProvider implements ContextProvider {

    private final Clock clock;

    @Override
    public ContextSnapshot currentContext(String situation, Double detectionConfidence, List<String> recentActions) {
        return ContextSnapshot.at(LocalDateTime.now(clock))
                .withActivity(null, recentActions)
                .withDetection(situation, detectionConfidence);
    }
}
