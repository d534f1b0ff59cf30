package com.openforge.actionmind.learning;

import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.Outcome;
import com.openforge.actionmind.history.StoreBackedTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HistoricalVoterTest extends StoreBackedTest {

    private HistoricalVoter voter;

    @BeforeEach
    void setUp() {
        voter = new HistoricalVoter(store, LearningProperties.defaults(), CLOCK);
    }

    @Test
    void abstainsWithFewerThanThreeRecords() {
        recordAt(NOW.minusMinutes(30), "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusMinutes(20), "tired", "dnd.on", Outcome.SUCCESS);

        assertThat(voter.predict("tired", ContextSnapshot.at(NOW))).isEmpty();
    }

    private HistoricalVoter voterWithK(int k) {
        return new HistoricalVoter(store,
                LearningProperties.defaults().withKnn(new LearningProperties.Knn(k, 0.7, 3, 5)), CLOCK);
    }

    @Test
    void threeMatchingNightsAreEnoughWhenKIsThree() {
        HistoricalVoter voter = voterWithK(3);
        recordAt(NOW.minusMinutes(50), "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusMinutes(40), "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusMinutes(30), "tired", "dnd.on", Outcome.SUCCESS);

        Prediction p = voter.predict("tired", ContextSnapshot.at(NOW)).orElseThrow();

        assertThat(p.action()).isEqualTo("dnd.on");
        assertThat(p.source()).isEqualTo(PredictionSource.KNN);
        assertThat(p.confidence()).isGreaterThanOrEqualTo(0.7);
        assertThat(p.reason()).isEqualTo("You did this 3/3 times in similar contexts");
    }

    @Test
    void fewerNeighboursThanKCannotReachTheGate() {
        for (int minutes = 10; minutes <= 40; minutes += 10) {
            recordAt(NOW.minusMinutes(minutes), "tired", "dnd.on", Outcome.SUCCESS);
        }

        // four near-perfect votes over k = 10 stay well under 0.7
        assertThat(voter.predict("tired", ContextSnapshot.at(NOW))).isEmpty();
    }

    @Test
    void olderAndLessSimilarHistoryWeighsLess() {
        LocalDateTime tuesdayMorning = LocalDateTime.of(2025, 1, 14, 9, 0);
        for (int i = 0; i < 3; i++) recordAt(tuesdayMorning.plusMinutes(i), "tired", "lights.dim", Outcome.SUCCESS);

        // time 0 + weekday 0 + weekend 0.1 + situation 0.3, decayed over ~2 months
        assertThat(voter.predict("tired", ContextSnapshot.at(NOW))).isEmpty();
    }

    @Test
    void majorityWinsAndParamsFollowTheMode() {
        HistoricalVoter voter = voterWithK(5);
        recordAt(NOW.minusMinutes(50), "focus", "music.play", Map.of("volume", 30, "playlist", "lofi"));
        recordAt(NOW.minusMinutes(40), "focus", "music.play", Map.of("volume", 30, "playlist", "jazz"));
        recordAt(NOW.minusMinutes(35), "focus", "music.play", Map.of("volume", 50, "playlist", "lofi"));
        recordAt(NOW.minusMinutes(30), "focus", "music.play", Map.of("volume", 30));
        recordAt(NOW.minusMinutes(20), "focus", "dnd.on",     Map.of());

        Prediction p = voter.predict("focus", ContextSnapshot.at(NOW)).orElseThrow();

        assertThat(p.action()).isEqualTo("music.play");
        assertThat(p.confidence()).isCloseTo(0.72, within(1e-9));
        assertThat(p.reason()).isEqualTo("You did this 4/5 times in similar contexts");
        assertThat(p.params()).containsEntry("volume", 30).containsEntry("playlist", "lofi");
    }

    @Test
    void detectsARecurringWorkflow() {
        for (int day = 1; day <= 5; day++) {
            LocalDateTime start = NOW.minusDays(day).withHour(9);
            recordAt(start,                 "morning_routine", "email.open",    Outcome.SUCCESS);
            recordAt(start.plusMinutes(2),  "morning_routine", "calendar.open", Outcome.SUCCESS);
            recordAt(start.plusMinutes(4),  "morning_routine", "slack.open",    Outcome.SUCCESS);
        }

        WorkflowSuggestion suggestion = voter.detectWorkflow(List.of("email.open", "calendar.open")).orElseThrow();

        assertThat(suggestion.nextAction()).isEqualTo("slack.open");
        assertThat(suggestion.confidence()).isEqualTo(1.0);
        assertThat(suggestion.occurrences()).isEqualTo(5);
        assertThat(suggestion.pattern()).containsExactly("email.open", "calendar.open");
    }

    @Test
    void workflowNeedsFiveMatches() {
        for (int day = 1; day <= 4; day++) {
            LocalDateTime start = NOW.minusDays(day).withHour(9);
            recordAt(start,                 "morning_routine", "email.open",    Outcome.SUCCESS);
            recordAt(start.plusMinutes(2),  "morning_routine", "calendar.open", Outcome.SUCCESS);
            recordAt(start.plusMinutes(4),  "morning_routine", "slack.open",    Outcome.SUCCESS);
        }

        assertThat(voter.detectWorkflow(List.of("email.open", "calendar.open"))).isEmpty();
        assertThat(voter.detectWorkflow(List.of("email.open"))).isEmpty();
    }

    @Test
    void longGapsSplitSequences() {
        for (int day = 1; day <= 5; day++) {
            LocalDateTime start = NOW.minusDays(day).withHour(9);
            recordAt(start,                 "morning_routine", "email.open",    Outcome.SUCCESS);
            recordAt(start.plusMinutes(2),  "morning_routine", "calendar.open", Outcome.SUCCESS);
            recordAt(start.plusMinutes(30), "morning_routine", "slack.open",    Outcome.SUCCESS);
        }

        assertThat(voter.detectWorkflow(List.of("email.open", "calendar.open"))).isEmpty();
    }

    @Test
    void optimizeParametersUsesSimilarPastRuns() {
        recordAt(NOW.minusDays(7).withHour(22), "tired", "lights.dim", Map.of("level", 20));
        recordAt(NOW.minusDays(7).withHour(23), "tired", "lights.dim", Map.of("level", 20));
        recordAt(NOW.minusDays(14).withHour(22), "tired", "lights.dim", Map.of("level", 40));

        Map<String, Object> params = voter.optimizeParameters("lights.dim",
                ContextSnapshot.at(NOW).withSituation("tired"), Map.of("level", 80));

        assertThat(params).containsEntry("level", 20);
    }

    @Test
    void optimizeParametersFallsBackToDefaults() {
        recordAt(NOW.minusDays(1), "tired", "lights.dim", Map.of("level", 20));

        Map<String, Object> params = voter.optimizeParameters("lights.dim", ContextSnapshot.at(NOW), Map.of("level", 80));

        assertThat(params).containsEntry("level", 80);
    }
}
