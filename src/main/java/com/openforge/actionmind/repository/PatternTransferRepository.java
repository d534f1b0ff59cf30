package com.openforge.actionmind.repository;

import com.openforge.actionmind.domain.PatternTransfer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PatternTransferRepository extends JpaRepository<PatternTransfer, Long> {

    List<PatternTransfer> findByTargetSituationOrderByIdDesc(String targetSituation);

    @Query("SELECT COUNT(DISTINCT p.targetSituation) FROM PatternTransfer p")
    long countDistinctTargets();

    @Query("SELECT AVG(p.confidence) FROM PatternTransfer p")
    Double averageConfidence();
}
