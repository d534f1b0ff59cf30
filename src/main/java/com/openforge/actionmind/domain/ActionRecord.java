package com.openforge.actionmind.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One executed action together with the context it ran in.
 *
 * Rows are append-only: written once by the Event Store after an action
 * completes, never updated, and removed only by the retention prune.
 *
 * The derived columns (hour_of_day, day_of_week, is_weekend, time_of_day,
 * battery_percent) duplicate parts of context_json so that similarity
 * queries can rank rows in SQL without deserializing every snapshot.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Table(
    name = "action_history",
    indexes = {
        @Index(name = "idx_situation", columnList = "situation"),
        @Index(name = "idx_hour",      columnList = "hour_of_day"),
        @Index(name = "idx_dow",       columnList = "day_of_week"),
        @Index(name = "idx_timestamp", columnList = "timestamp")
    }
)
public class ActionRecord extends BaseEntity {

    /** Wall-clock time of the snapshot the action ran under. */
    @Column(name = "timestamp", nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "hour_of_day")
    private Integer hour;

    /** Lower-case English day name, e.g. "friday". */
    @Column(name = "day_of_week", length = 16)
    private String dayOfWeek;

    @Column(name = "is_weekend", nullable = false)
    private boolean weekend;

    /** morning | afternoon | evening | night */
    @Column(name = "time_of_day", length = 16)
    private String timeOfDay;

    @Column(name = "battery_percent")
    private Integer batteryPercent;

    @Column(name = "situation", length = 128)
    private String situation;

    @Column(name = "action_taken", nullable = false, length = 256)
    private String action;

    /** JSON object of the action parameters; null when the action had none. */
    @Column(name = "action_params", columnDefinition = "TEXT")
    private String actionParams;

    @Column(name = "success", nullable = false)
    private Outcome outcome;

    @Column(name = "execution_time_ms")
    private Long executionTimeMs;

    /** Full serialized ContextSnapshot. */
    @Column(name = "context_json", columnDefinition = "TEXT")
    private String contextJson;
}
