package com.openforge.actionmind.api;

import com.openforge.actionmind.api.dto.ChoiceRequest;
import com.openforge.actionmind.api.dto.OptionRequest;
import com.openforge.actionmind.api.dto.OutcomeRequest;
import com.openforge.actionmind.api.dto.PredictionResponse;
import com.openforge.actionmind.api.dto.PromptRequest;
import com.openforge.actionmind.api.dto.PromptResponse;
import com.openforge.actionmind.api.dto.SelectActionRequest;
import com.openforge.actionmind.context.ContextProvider;
import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.learning.DecisionBudget;
import com.openforge.actionmind.learning.HybridIntelligence;
import com.openforge.actionmind.learning.Prediction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Host-facing decision API.
 *
 * Endpoints:
 *   POST /api/decisions/select   pick the next action (204 when no strategy has an opinion)
 *   POST /api/decisions/outcome  report what happened after executing it
 *   POST /api/decisions/prompt   render the disambiguation prompt for a set of options
 *   POST /api/decisions/choice   resolve the user's lettered answer
 *
 * Requests without a context get one from the {@link ContextProvider}.
 */
@Slf4j
@RestController
@RequestMapping("/api/decisions")
@RequiredArgsConstructor
public class DecisionController {

    private final HybridIntelligence engine;
    private final ContextProvider    contextProvider;
    private final Clock              clock;

    // ── Select ───────────────────────────────────────────────────────────────

    @PostMapping("/select")
    public ResponseEntity<PredictionResponse> select(@Valid @RequestBody SelectActionRequest request) {
        ContextSnapshot context    = contextOf(request.context(), request.situation());
        List<String>    candidates = request.candidates() == null ? List.of() : request.candidates();

        Optional<Prediction> decision = request.timeoutMillis() != null
                ? engine.selectAction(request.userText(), request.situation(), context, candidates,
                        DecisionBudget.of(Duration.ofMillis(request.timeoutMillis()), clock))
                : engine.selectAction(request.userText(), request.situation(), context, candidates);

        return decision
                .map(p -> p.askUser()
                        ? PredictionResponse.from(p, engine.formatDisambiguationPrompt(request.situation(), p.options()))
                        : PredictionResponse.from(p))
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    // ── Outcome ──────────────────────────────────────────────────────────────

    @PostMapping("/outcome")
    public ResponseEntity<Void> outcome(@Valid @RequestBody OutcomeRequest request) {
        engine.learnFromOutcome(
                request.userText(),
                request.situation(),
                contextOf(request.context(), request.situation()),
                request.action(),
                request.params(),
                request.outcome(),
                request.durationMs() == null ? 0L : request.durationMs());
        return ResponseEntity.accepted().build();
    }

    // ── Disambiguation ───────────────────────────────────────────────────────

    @PostMapping("/prompt")
    public ResponseEntity<PromptResponse> prompt(@Valid @RequestBody PromptRequest request) {
        return ResponseEntity.ok(new PromptResponse(
                engine.formatDisambiguationPrompt(request.situation(), toPredictions(request.options()))));
    }

    @PostMapping("/choice")
    public ResponseEntity<PredictionResponse> choice(@Valid @RequestBody ChoiceRequest request) {
        Prediction chosen = engine.applyUserChoice(
                        request.situation(),
                        contextOf(request.context(), request.situation()),
                        toPredictions(request.options()),
                        request.choice())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                        "Choice '" + request.choice() + "' does not match any option"));
        return ResponseEntity.ok(PredictionResponse.from(chosen));
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private ContextSnapshot contextOf(ContextSnapshot supplied, String situation) {
        return supplied != null ? supplied : contextProvider.currentContext(situation, null, List.of());
    }

    private static List<Prediction> toPredictions(List<OptionRequest> options) {
        return options.stream().map(OptionRequest::toPrediction).toList();
    }
}
