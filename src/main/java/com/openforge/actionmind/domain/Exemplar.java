package com.openforge.actionmind.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * A remembered (utterance, action) pair with its embedding.
 *
 * There is at most one exemplar per (situation, action): a repeated success
 * bumps successCount instead of inserting a new row, so the stored text and
 * vector are those of the first successful utterance.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "embeddings",
    indexes = @Index(name = "idx_situation_emb", columnList = "situation")
)
public class Exemplar extends BaseEntity {

    @Column(name = "text", nullable = false, columnDefinition = "TEXT")
    private String text;

    /** Dense vector from the embedding provider, stored as a float32 blob. */
    @Convert(converter = FloatArrayConverter.class)
    @Column(name = "embedding", nullable = false, length = 65_536)
    private float[] embedding;

    @Column(name = "action", nullable = false, length = 256)
    private String action;

    @Column(name = "situation", length = 128)
    private String situation;

    /** ≥ 1, never decreases. */
    @Builder.Default
    @Column(name = "success_count", nullable = false)
    private int successCount = 1;
}
