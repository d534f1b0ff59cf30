package com.openforge.actionmind.repository;

import com.openforge.actionmind.domain.ActionRecord;
import com.openforge.actionmind.domain.Outcome;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface ActionRecordRepository extends JpaRepository<ActionRecord, Long> {

    /**
     * Records of one situation with the given outcome, ranked by how closely
     * their time context matches: same time-of-day bucket first, then within
     * two hours, then same weekend flag; newest first inside each rank.
     */
    @Query("""
            SELECT r FROM ActionRecord r
            WHERE r.situation = :situation
              AND r.outcome = :outcome
            ORDER BY
              CASE
                WHEN r.timeOfDay = :timeOfDay THEN 3
                WHEN ABS(r.hour - :hour) <= 2 THEN 2
                WHEN r.weekend = :weekend THEN 1
                ELSE 0
              END DESC,
              r.timestamp DESC
            """)
    List<ActionRecord> findRankedByContext(@Param("situation") String situation,
                                           @Param("outcome") Outcome outcome,
                                           @Param("timeOfDay") String timeOfDay,
                                           @Param("hour") int hour,
                                           @Param("weekend") boolean weekend,
                                           Pageable page);

    long countBySituationAndAction(String situation, String action);

    long countBySituationAndActionAndOutcome(String situation, String action, Outcome outcome);

    long countBySituationAndActionAndOutcomeAndTimestampGreaterThanEqual(
            String situation, String action, Outcome outcome, LocalDateTime since);

    @Query("""
            SELECT AVG(r.executionTimeMs) FROM ActionRecord r
            WHERE r.situation = :situation AND r.action = :action AND r.outcome = :outcome
            """)
    Double averageDuration(@Param("situation") String situation,
                           @Param("action") String action,
                           @Param("outcome") Outcome outcome);

    List<ActionRecord> findAllByOrderByTimestampDesc(Pageable page);

    List<ActionRecord> findByOutcomeOrderByTimestampDesc(Outcome outcome, Pageable page);

    List<ActionRecord> findByActionAndOutcomeOrderByTimestampDesc(String action, Outcome outcome, Pageable page);

    /** Per-situation count of records with the given outcome, excluding one situation. */
    @Query("""
            SELECT r.situation AS situation, COUNT(r) AS frequency
            FROM ActionRecord r
            WHERE r.situation IS NOT NULL
              AND r.situation <> :exclude
              AND r.outcome = :outcome
            GROUP BY r.situation
            HAVING COUNT(r) >= :minCount
            """)
    List<SituationFrequency> situationFrequencies(@Param("exclude") String exclude,
                                                  @Param("outcome") Outcome outcome,
                                                  @Param("minCount") long minCount);

    /** Record counts of one situation broken down by (action, outcome). */
    @Query("""
            SELECT r.action AS action, r.outcome AS outcome, COUNT(r) AS count
            FROM ActionRecord r
            WHERE r.situation = :situation
            GROUP BY r.action, r.outcome
            """)
    List<ActionOutcomeCount> outcomeCounts(@Param("situation") String situation);

    // ── Statistics ───────────────────────────────────────────────────────────

    long countByOutcome(Outcome outcome);

    @Query("SELECT COUNT(DISTINCT r.situation) FROM ActionRecord r")
    long countDistinctSituations();

    @Query("SELECT COUNT(DISTINCT r.action) FROM ActionRecord r")
    long countDistinctActions();

    @Query("SELECT AVG(r.executionTimeMs) FROM ActionRecord r")
    Double averageDurationOverall();

    @Query("""
            SELECT r.situation AS situation, COUNT(r) AS frequency
            FROM ActionRecord r
            GROUP BY r.situation
            ORDER BY COUNT(r) DESC
            """)
    List<SituationFrequency> topSituations(Pageable page);

    // ── Retention ────────────────────────────────────────────────────────────

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ActionRecord r WHERE r.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);

    // ── Projections ──────────────────────────────────────────────────────────

    interface SituationFrequency {
        String getSituation();
        long getFrequency();
    }

    interface ActionOutcomeCount {
        String getAction();
        Outcome getOutcome();
        long getCount();
    }
}
