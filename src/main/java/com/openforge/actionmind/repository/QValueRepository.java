package com.openforge.actionmind.repository;

import com.openforge.actionmind.domain.QValue;
import com.openforge.actionmind.domain.QValueId;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface QValueRepository extends JpaRepository<QValue, QValueId> {

    /** Actions ranked by their mean value across all states. */
    @Query("""
            SELECT q.action AS action, AVG(q.value) AS averageValue
            FROM QValue q
            GROUP BY q.action
            ORDER BY AVG(q.value) DESC
            """)
    List<ActionValue> topActions(Pageable page);

    interface ActionValue {
        String getAction();
        double getAverageValue();
    }
}
