package com.openforge.actionmind.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Audit row for one knowledge transfer made by the meta learner:
 * "action X, learned under source situation S, was offered for target T
 * with confidence c". Append-only.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Entity
@Table(
    name = "pattern_transfers",
    indexes = @Index(name = "idx_target_sit", columnList = "target_situation")
)
public class PatternTransfer extends BaseEntity {

    public static final String ACTION_TRANSFER = "action_transfer";

    @Column(name = "source_situation", nullable = false, length = 128)
    private String sourceSituation;

    @Column(name = "target_situation", nullable = false, length = 128)
    private String targetSituation;

    @Column(name = "pattern_type", nullable = false, length = 32)
    private String patternType;

    @Column(name = "action", nullable = false, length = 256)
    private String action;

    /** Never above 0.9. */
    @Column(name = "confidence", nullable = false)
    private double confidence;
}
