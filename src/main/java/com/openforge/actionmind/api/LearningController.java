package com.openforge.actionmind.api;

import com.openforge.actionmind.api.dto.TeachRequest;
import com.openforge.actionmind.api.dto.WorkflowRequest;
import com.openforge.actionmind.context.ContextProvider;
import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.learning.HybridIntelligence;
import com.openforge.actionmind.learning.WorkflowSuggestion;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Training and inspection endpoints.
 *
 *   GET  /api/learning/stats     per-subsystem learning statistics
 *   POST /api/learning/teach     record an explicit situation → action instruction
 *   POST /api/learning/workflow  guess the next action of a recurring sequence
 */
@RestController
@RequestMapping("/api/learning")
@RequiredArgsConstructor
public class LearningController {

    private final HybridIntelligence engine;
    private final ContextProvider    contextProvider;

    @GetMapping("/stats")
    public ResponseEntity<HybridIntelligence.CombinedStats> stats() {
        return ResponseEntity.ok(engine.combinedStats());
    }

    @PostMapping("/teach")
    public ResponseEntity<Void> teach(@Valid @RequestBody TeachRequest request) {
        ContextSnapshot context = request.context() != null
                ? request.context()
                : contextProvider.currentContext(request.situation(), null, List.of());
        if (!engine.teach(request.situation(), context, request.action(), request.params())) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Could not store the instruction");
        }
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/workflow")
    public ResponseEntity<WorkflowSuggestion> workflow(@Valid @RequestBody WorkflowRequest request) {
        return engine.detectWorkflow(request.recentActions())
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
