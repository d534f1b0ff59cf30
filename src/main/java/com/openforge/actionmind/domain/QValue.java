package com.openforge.actionmind.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * One cell of the reinforcement learner's value table.
 *
 * Keyed by (state_hash, action). Upserted on every reward update; rows are
 * only ever deleted by a full reset of the learner.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Entity
@IdClass(QValueId.class)
@Table(name = "q_values")
public class QValue {

    /** 16-hex-char fingerprint of (situation, time bucket, day, power state, battery tier). */
    @Id
    @Column(name = "state_hash", length = 32)
    private String stateHash;

    @Id
    @Column(name = "action", length = 256)
    private String action;

    @Column(name = "q_value", nullable = false)
    private double value;

    @Column(name = "update_count", nullable = false)
    private int updateCount;

    @Column(name = "last_updated", nullable = false)
    private LocalDateTime lastUpdated;
}
