package com.openforge.actionmind.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.actionmind.config.AppConfig;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextSnapshotTest {

    private final ObjectMapper mapper = new AppConfig().objectMapper();

    @Test
    void timestampOnlyBodyGetsItsCalendarFields() throws Exception {
        ContextSnapshot context = mapper.readValue(
                "{\"timestamp\":\"2025-03-14T23:00:00\",\"battery_percent\":40}", ContextSnapshot.class);

        assertThat(context.hour()).isEqualTo(23);
        assertThat(context.minute()).isZero();
        assertThat(context.dayOfWeek()).isEqualTo("friday");
        assertThat(context.weekend()).isFalse();
        assertThat(context.timeOfDay()).isEqualTo(TimeOfDay.NIGHT);
        assertThat(context.batteryPercent()).isEqualTo(40);
        assertThat(context).isEqualTo(ContextSnapshot.at(LocalDateTime.of(2025, 3, 14, 23, 0)).withBattery(40, null));
    }

    @Test
    void timestampOverridesContradictingFields() throws Exception {
        ContextSnapshot context = mapper.readValue("""
                {"timestamp": "2025-03-15T09:30:00", "hour": 2, "day_of_week": "monday",
                 "weekend": false, "time_of_day": "NIGHT"}
                """, ContextSnapshot.class);

        assertThat(context.hour()).isEqualTo(9);
        assertThat(context.minute()).isEqualTo(30);
        assertThat(context.dayOfWeek()).isEqualTo("saturday");
        assertThat(context.weekend()).isTrue();
        assertThat(context.timeOfDay()).isEqualTo(TimeOfDay.MORNING);
    }

    @Test
    void storedSnapshotReadsBackUnchanged() throws Exception {
        ContextSnapshot original = ContextSnapshot.at(LocalDateTime.of(2025, 3, 16, 18, 45))
                .withActivity("code", List.of("email.open"))
                .withSituation("focus");

        assertThat(mapper.readValue(mapper.writeValueAsString(original), ContextSnapshot.class)).isEqualTo(original);
    }

    @Test
    void withoutTimestampTheBucketFollowsTheHour() throws Exception {
        ContextSnapshot context = mapper.readValue("{\"hour\": 14}", ContextSnapshot.class);

        assertThat(context.timeOfDay()).isEqualTo(TimeOfDay.AFTERNOON);
        assertThat(context.recentActions()).isEmpty();
    }
}
