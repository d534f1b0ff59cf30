package com.openforge.actionmind.learning;

import com.openforge.actionmind.domain.Outcome;
import com.openforge.actionmind.domain.PatternTransfer;
import com.openforge.actionmind.history.StoreBackedTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetaLearnerTest extends StoreBackedTest {

    private MetaLearner meta;

    @BeforeEach
    void setUp() {
        meta = new MetaLearner(store, LearningProperties.defaults());
    }

    @Test
    void unrelatedLabelsShareNothing() {
        times(5, "tired",    "dnd.on",     Outcome.SUCCESS);
        times(4, "stressed", "music.play", Outcome.SUCCESS);

        assertThat(meta.findSimilarSituations("jetlagged")).isEmpty();
        assertThat(meta.bootstrap("jetlagged")).isEmpty();
    }

    @Test
    void findsSituationsWithEnoughTokenOverlap() {
        times(3, "focus_mode_office", "dnd.on", Outcome.SUCCESS);
        times(3, "deep_work_evening", "dnd.on", Outcome.SUCCESS);

        List<MetaLearner.SimilarSituation> similar = meta.findSimilarSituations("focus_mode_office_quiet");

        assertThat(similar).extracting(MetaLearner.SimilarSituation::situation).containsExactly("focus_mode_office");
        assertThat(similar.get(0).similarity()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void rarelySeenSituationsAreNotSources() {
        times(2, "focus_mode_office", "dnd.on", Outcome.SUCCESS);

        assertThat(meta.findSimilarSituations("focus_mode_office_quiet")).isEmpty();
    }

    @Test
    void transfersOnlyReliableActionsAndCapsConfidence() {
        times(10, "focus_mode_office", "dnd.on", Outcome.SUCCESS);
        times(1,  "focus_mode_office", "music.play", Outcome.SUCCESS);
        times(2,  "focus_mode_office", "lights.dim", Outcome.SUCCESS);
        times(2,  "focus_mode_office", "lights.dim", Outcome.FAILURE);

        List<Prediction> transferred = meta.transfer("focus_mode_office", "focus_mode_office_quiet");

        assertThat(transferred).extracting(Prediction::action).containsExactly("dnd.on");
        Prediction p = transferred.get(0);
        assertThat(p.confidence()).isEqualTo(0.9);
        assertThat(p.source()).isEqualTo(PredictionSource.META_LEARNING);
        assertThat(p.reason()).isEqualTo("Transferred from similar situation: focus_mode_office");

        List<PatternTransfer> audit = store.transfersInto("focus_mode_office_quiet");
        assertThat(audit).hasSize(1);
        assertThat(audit.get(0).getSourceSituation()).isEqualTo("focus_mode_office");
        assertThat(audit.get(0).getPatternType()).isEqualTo(PatternTransfer.ACTION_TRANSFER);
    }

    @Test
    void confidenceBlendsRateAndFrequency() {
        times(3, "focus_mode_office", "lights.dim", Outcome.SUCCESS);
        times(1, "focus_mode_office", "lights.dim", Outcome.FAILURE);

        Prediction p = meta.transfer("focus_mode_office", "focus_mode_office_quiet").get(0);

        // 0.75 · 0.8 + min(4 / 10, 0.15)
        assertThat(p.confidence()).isCloseTo(0.75, within(1e-9));
    }

    @Test
    void transfersAtMostThreeActions() {
        for (String action : List.of("a1", "a2", "a3", "a4")) times(3, "focus_mode_office", action, Outcome.SUCCESS);

        assertThat(meta.transfer("focus_mode_office", "focus_mode_office_quiet")).hasSize(3);
    }

    @Test
    void bootstrapCarriesTheSourceSimilarity() {
        times(4, "focus_mode_office", "dnd.on", Outcome.SUCCESS);

        Prediction p = meta.bootstrap("focus_mode_office_quiet").orElseThrow();

        assertThat(p.action()).isEqualTo("dnd.on");
        assertThat(p.similarity()).isCloseTo(0.75, within(1e-9));
        assertThat(meta.stats().totalTransfers()).isEqualTo(1);
    }

    @Test
    void jaccardOverUnderscoreTokens() {
        assertThat(MetaLearner.tokens("Deep_Work__Morning")).isEqualTo(Set.of("deep", "work", "morning"));
        assertThat(MetaLearner.jaccard(MetaLearner.tokens("deep_work_morning"), MetaLearner.tokens("deep_work_evening")))
                .isEqualTo(0.5);
        assertThat(MetaLearner.jaccard(Set.of(), Set.of("a"))).isZero();
    }

    private void times(int n, String situation, String action, Outcome outcome) {
        for (int i = 0; i < n; i++) recordAt(NOW.minusHours(i + 1), situation, action, outcome);
    }
}
