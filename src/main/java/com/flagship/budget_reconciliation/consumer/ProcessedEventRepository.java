package com.flagship.budget_reconciliation.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    /**
     * Primary deduplication check.
     */
    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    List<ProcessedEventEntity> findByKindAndNaturalKeyOrderByProcessedAtAsc(String kind, String naturalKey);

    @Query("""
        SELECT COUNT(e) FROM ProcessedEventEntity e
        WHERE e.consumerGroup = :consumerGroup
        AND e.processingResult = com.flagship.budget_reconciliation.consumer.ProcessedEvent.ProcessingResult.FAILED
        """)
    long countFailedByConsumerGroup(@Param("consumerGroup") String consumerGroup);
}
