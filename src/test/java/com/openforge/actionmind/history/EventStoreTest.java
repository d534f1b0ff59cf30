package com.openforge.actionmind.history;

import com.openforge.actionmind.context.ContextSnapshot;
import com.openforge.actionmind.domain.ActionRecord;
import com.openforge.actionmind.domain.Outcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class EventStoreTest extends StoreBackedTest {

    @Test
    void recordStoresContextAndParams() {
        ContextSnapshot context = contextAt(NOW.minusHours(1), "tired").withBattery(42, false);

        Optional<Long> id = store.record(context, "dnd.on", Map.of("duration", 60), Outcome.SUCCESS, 250);

        assertThat(id).isPresent();
        ActionRecord row = records.findById(id.get()).orElseThrow();
        assertThat(row.getSituation()).isEqualTo("tired");
        assertThat(row.getHour()).isEqualTo(22);
        assertThat(row.getDayOfWeek()).isEqualTo("friday");
        assertThat(row.getTimeOfDay()).isEqualTo("night");
        assertThat(row.getBatteryPercent()).isEqualTo(42);
        assertThat(row.getOutcome()).isEqualTo(Outcome.SUCCESS);
        assertThat(store.paramsOf(row)).containsEntry("duration", 60);
        assertThat(store.contextOf(row)).hasValueSatisfying(c -> {
            assertThat(c.situation()).isEqualTo("tired");
            assertThat(c.batteryPercent()).isEqualTo(42);
            assertThat(c.timestamp()).isEqualTo(NOW.minusHours(1));
        });
    }

    @Test
    void querySimilarPrefersSameTimeOfDayAndSkipsFailures() {
        recordAt(NOW.minusDays(1).withHour(9),  "focus", "music.play", Outcome.SUCCESS);   // morning
        recordAt(NOW.minusDays(2).withHour(22), "focus", "dnd.on",     Outcome.SUCCESS);   // night
        recordAt(NOW.minusDays(3).withHour(23), "focus", "lights.dim", Outcome.FAILURE);
        recordAt(NOW.minusDays(1).withHour(22), "other", "dnd.on",     Outcome.SUCCESS);

        List<ActionRecord> similar = store.querySimilar(ContextSnapshot.at(NOW), "focus", 10);

        assertThat(similar).extracting(ActionRecord::getAction).containsExactly("dnd.on", "music.play");
    }

    @Test
    void aggregateCountsAttemptsAndSuccesses() {
        recordAt(NOW.minusHours(3), "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusHours(2), "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusHours(1), "tired", "dnd.on", Outcome.CANCELED);

        ActionStats stats = store.aggregate("tired", "dnd.on");

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.successes()).isEqualTo(2);
        assertThat(stats.successRate()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(stats.avgDurationMs()).isEqualTo(100.0);
    }

    @Test
    void aggregateOfUnknownPairIsEmpty() {
        ActionStats stats = store.aggregate("nobody", "nothing");

        assertThat(stats.total()).isZero();
        assertThat(stats.successRate()).isZero();
    }

    @Test
    void patternFrequencyHonoursWindow() {
        recordAt(NOW.minusDays(2),  "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusDays(20), "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusDays(1),  "tired", "dnd.on", Outcome.FAILURE);

        assertThat(store.patternFrequency("tired", "dnd.on", 7)).isEqualTo(1);
        assertThat(store.patternFrequency("tired", "dnd.on", 30)).isEqualTo(2);
    }

    @Test
    void pruneDeletesOnlyExpiredRows() {
        recordAt(NOW.minusDays(120), "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusDays(5),   "tired", "dnd.on", Outcome.SUCCESS);

        int deleted = store.prune(90);

        assertThat(deleted).isEqualTo(1);
        assertThat(records.count()).isEqualTo(1);
    }

    @Test
    void actionSuccessRatesOrderedByRateThenFrequency() {
        for (int i = 0; i < 3; i++) recordAt(NOW.minusHours(i + 1), "focus", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusHours(5), "focus", "music.play", Outcome.SUCCESS);
        recordAt(NOW.minusHours(6), "focus", "lights.dim", Outcome.SUCCESS);
        recordAt(NOW.minusHours(7), "focus", "lights.dim", Outcome.FAILURE);

        List<ActionSuccessRate> rates = store.actionSuccessRates("focus");

        assertThat(rates).extracting(ActionSuccessRate::action)
                .containsExactly("dnd.on", "music.play", "lights.dim");
        assertThat(rates.get(2).successRate()).isEqualTo(0.5);
        assertThat(rates.get(2).frequency()).isEqualTo(2);
    }

    @Test
    void situationFrequenciesExcludeTargetAndRareSituations() {
        for (int i = 0; i < 3; i++) recordAt(NOW.minusHours(i + 1), "tired", "dnd.on", Outcome.SUCCESS);
        for (int i = 0; i < 2; i++) recordAt(NOW.minusHours(i + 1), "rare", "dnd.on", Outcome.SUCCESS);
        for (int i = 0; i < 4; i++) recordAt(NOW.minusHours(i + 1), "target", "dnd.on", Outcome.SUCCESS);

        assertThat(store.situationFrequencies("target", 3)).containsOnly(Map.entry("tired", 3L));
    }

    @Test
    void upsertValueInsertsThenOverwrites() {
        assertThat(store.upsertValue("abc", "dnd.on", 0.1)).isTrue();
        assertThat(store.upsertValue("abc", "dnd.on", 0.19)).isTrue();

        assertThat(store.findValue("abc", "dnd.on")).hasValueSatisfying(cell -> {
            assertThat(cell.getValue()).isEqualTo(0.19);
            assertThat(cell.getUpdateCount()).isEqualTo(2);
        });
        assertThat(store.valueTableStats().totalValues()).isEqualTo(1);
    }

    @Test
    void clearValueTableRemovesEverything() {
        store.upsertValue("abc", "dnd.on", 0.1);
        store.upsertValue("def", "lights.dim", 0.2);

        assertThat(store.clearValueTable()).isTrue();
        assertThat(store.loadValueTable()).isEmpty();
    }

    @Test
    void exemplarSuccessCountIncrements() {
        Long id = store.saveExemplar("turn on focus mode", new float[]{1f, 0f}, "dnd.on", "focus").orElseThrow();

        assertThat(store.incrementExemplar(id)).isTrue();

        assertThat(store.findExemplar("focus", "dnd.on"))
                .hasValueSatisfying(e -> assertThat(e.getSuccessCount()).isEqualTo(2));
        assertThat(store.exemplarStats().totalUses()).isEqualTo(2);
    }

    @Test
    void transfersAreLoggedPerTarget() {
        store.logTransfer("focus_mode_office", "focus_mode", "dnd.on", 0.9);
        store.logTransfer("focus_mode_office", "focus_mode", "music.play", 0.7);

        assertThat(store.transfersInto("focus_mode")).hasSize(2);
        EventStore.TransferStats stats = store.transferStats();
        assertThat(stats.totalTransfers()).isEqualTo(2);
        assertThat(stats.uniqueTargets()).isEqualTo(1);
        assertThat(stats.avgConfidence()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void statsSummariseHistory() {
        recordAt(NOW.minusHours(3), "tired", "dnd.on", Outcome.SUCCESS);
        recordAt(NOW.minusHours(2), "focus", "music.play", Outcome.FAILURE);

        HistoryStats stats = store.stats();

        assertThat(stats.totalActions()).isEqualTo(2);
        assertThat(stats.successfulActions()).isEqualTo(1);
        assertThat(stats.uniqueSituations()).isEqualTo(2);
        assertThat(stats.uniqueActions()).isEqualTo(2);
        assertThat(stats.successRate()).isEqualTo(0.5);
        assertThat(stats.topSituations()).containsKeys("tired", "focus");
    }
}
