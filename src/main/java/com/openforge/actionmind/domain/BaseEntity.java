package com.openforge.actionmind.domain;

import jakarta.persistence.*;
import lombok.Getter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Audit columns shared by the append-mostly learning tables.
 *
 * - id          : surrogate key, assigned by the database
 * - create_time : set once on INSERT, never touched again
 *
 * Rows in these tables are never updated except for the exemplar success
 * counter, so there is no update_time / optimistic-lock column here.
 */
@Getter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreatedDate
    @Column(name = "create_time", nullable = false, updatable = false)
    private LocalDateTime createTime;
}
