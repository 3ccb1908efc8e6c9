package com.flagship.bridge_ledger.pipeline.tracking;

import com.flagship.bridge_ledger.pipeline.ProcessingOutcome;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface TrackedEventRepository extends JpaRepository<TrackedEventEntity, String> {

    /**
     * Events that were received but never stamped, oldest first.
     */
    @Query("""
        SELECT e FROM TrackedEventEntity e
        WHERE e.completedAt IS NULL
        AND e.receivedAt < :before
        ORDER BY e.receivedAt ASC
        """)
    List<TrackedEventEntity> findUnstampedReceivedBefore(@Param("before") Instant before);

    long countByOutcome(ProcessingOutcome outcome);

    List<TrackedEventEntity> findByCustIdOrderByReceivedAtAsc(String custId);
}
