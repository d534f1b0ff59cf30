package com.openforge.actionmind.repository;

import com.openforge.actionmind.domain.Exemplar;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ExemplarRepository extends JpaRepository<Exemplar, Long> {

    List<Exemplar> findBySituation(String situation);

    Optional<Exemplar> findFirstBySituationAndActionOrderByIdAsc(String situation, String action);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Exemplar e SET e.successCount = e.successCount + 1 WHERE e.id = :id")
    int incrementSuccessCount(@Param("id") Long id);

    @Query("SELECT COUNT(DISTINCT e.situation) FROM Exemplar e")
    long countDistinctSituations();

    @Query("SELECT COALESCE(SUM(e.successCount), 0) FROM Exemplar e")
    long totalUses();
}
