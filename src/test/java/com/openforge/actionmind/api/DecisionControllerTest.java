package com.openforge.actionmind.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.actionmind.config.AppConfig;
import com.openforge.actionmind.context.ContextProvider;
import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.Outcome;
import com.openforge.actionmind.learning.HybridIntelligence;
import com.openforge.actionmind.learning.Prediction;
import com.openforge.actionmind.learning.PredictionSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {DecisionController.class, LearningController.class})
class DecisionControllerTest {

    private static final LocalDateTime   NOW   = LocalDateTime.of(2025, 3, 14, 23, 0);
    private static final ContextSnapshot NIGHT = ContextSnapshot.at(NOW);

    @TestConfiguration
    static class WireConfig {
        @Bean
        ObjectMapper objectMapper() {
            return new AppConfig().objectMapper();
        }

        @Bean
        Clock clock() {
            return Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        }
    }

    @Autowired MockMvc mvc;

    @MockitoBean HybridIntelligence engine;
    @MockitoBean ContextProvider    contextProvider;

    @BeforeEach
    void setUp() {
        when(contextProvider.currentContext(any(), any(), anyList())).thenReturn(NIGHT);
    }

    @Test
    void selectReturnsTheDecision() throws Exception {
        when(engine.selectAction(eq("I'm exhausted"), eq("tired"), any(), eq(List.of("dnd.on"))))
                .thenReturn(Optional.of(Prediction.of("dnd.on", 0.85, PredictionSource.REINFORCEMENT_LEARNING, "Q-value: 0.850 (exploit)")));

        mvc.perform(post("/api/decisions/select").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"situation": "tired", "user_text": "I'm exhausted", "candidates": ["dnd.on"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("dnd.on"))
                .andExpect(jsonPath("$.source").value("reinforcement_learning"))
                .andExpect(jsonPath("$.ask_user").value(false));
    }

    @Test
    void selectWithoutAnOpinionIsNoContent() throws Exception {
        when(engine.selectAction(any(), eq("jetlagged"), any(), anyList())).thenReturn(Optional.empty());

        mvc.perform(post("/api/decisions/select").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"situation\": \"jetlagged\"}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void uncertainDecisionCarriesThePrompt() throws Exception {
        List<Prediction> options = List.of(
                Prediction.of("dnd.on", 0.55, PredictionSource.KNN, "votes"),
                Prediction.of("lights.dim", 0.4, PredictionSource.META_LEARNING, "transfer"));
        when(engine.selectAction(any(), eq("tired"), any(), anyList()))
                .thenReturn(Optional.of(options.get(0).askingUser(options)));
        when(engine.formatDisambiguationPrompt(eq("tired"), anyList())).thenReturn("Should I: A) dnd.on");

        mvc.perform(post("/api/decisions/select").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"situation\": \"tired\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ask_user").value(true))
                .andExpect(jsonPath("$.options.length()").value(2))
                .andExpect(jsonPath("$.prompt").value("Should I: A) dnd.on"));
    }

    @Test
    void blankSituationIsRejected() throws Exception {
        mvc.perform(post("/api/decisions/select").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"situation\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Validation failed"));
    }

    @Test
    void outcomeIsAccepted() throws Exception {
        mvc.perform(post("/api/decisions/outcome").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"situation": "tired", "action": "dnd.on", "outcome": "SUCCESS",
                                 "params": {"duration": 60}, "duration_ms": 120}
                                """))
                .andExpect(status().isAccepted());

        verify(engine).learnFromOutcome(isNull(), eq("tired"), eq(NIGHT), eq("dnd.on"),
                eq(Map.of("duration", 60)), eq(Outcome.SUCCESS), eq(120L));
    }

    @Test
    void suppliedContextIsCompletedFromItsTimestamp() throws Exception {
        mvc.perform(post("/api/decisions/outcome").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"situation": "tired", "action": "dnd.on", "outcome": "SUCCESS",
                                 "context": {"timestamp": "2025-03-14T23:00:00", "battery_percent": 40}}
                                """))
                .andExpect(status().isAccepted());

        verify(engine).learnFromOutcome(isNull(), eq("tired"), eq(NIGHT.withBattery(40, null)), eq("dnd.on"),
                any(), eq(Outcome.SUCCESS), anyLong());
    }

    @Test
    void outcomeRequiresAnOutcome() throws Exception {
        mvc.perform(post("/api/decisions/outcome").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"situation\": \"tired\", \"action\": \"dnd.on\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void invalidChoiceIsUnprocessable() throws Exception {
        when(engine.applyUserChoice(eq("tired"), any(), anyList(), eq("Z"))).thenReturn(Optional.empty());

        mvc.perform(post("/api/decisions/choice").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"situation": "tired", "choice": "Z",
                                 "options": [{"action": "dnd.on", "confidence": 0.55}]}
                                """))
                .andExpect(status().isUnprocessableEntity());
    }

    @Test
    void validChoiceReturnsTheTaughtAction() throws Exception {
        when(engine.applyUserChoice(eq("tired"), any(), anyList(), eq("A")))
                .thenReturn(Optional.of(Prediction.of("dnd.on", 0.95, PredictionSource.USER_TAUGHT, "Taught by user")));

        mvc.perform(post("/api/decisions/choice").contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"situation": "tired", "choice": "A",
                                 "options": [{"action": "dnd.on", "confidence": 0.55}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("user_taught"))
                .andExpect(jsonPath("$.confidence").value(0.95));
    }

    @Test
    void workflowWithoutSuggestionIsNoContent() throws Exception {
        when(engine.detectWorkflow(anyList())).thenReturn(Optional.empty());

        mvc.perform(post("/api/learning/workflow").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recent_actions\": [\"email.open\", \"calendar.open\"]}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void statsAreExposed() throws Exception {
        when(engine.combinedStats()).thenReturn(new HybridIntelligence.CombinedStats(null, null, null, null));

        mvc.perform(get("/api/learning/stats")).andExpect(status().isOk());
    }

    @Test
    void teachIsAccepted() throws Exception {
        when(engine.teach(eq("gaming"), any(), eq("dnd.on"), any())).thenReturn(true);

        mvc.perform(post("/api/learning/teach").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"situation\": \"gaming\", \"action\": \"dnd.on\"}"))
                .andExpect(status().isAccepted());
    }
}
