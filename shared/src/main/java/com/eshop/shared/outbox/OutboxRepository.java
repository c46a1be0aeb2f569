package com.eshop.shared.outbox;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * Outbox JPA Repository
 *
 * Every delivery-state change is a conditional UPDATE that only succeeds when the
 * row is still in the expected state, so two relay instances can never both own
 * the same record and late acknowledgements cannot resurrect a terminal row.
 */
public interface OutboxRepository extends JpaRepository<OutboxRecord, String> {

    /**
     * Records eligible for relay, oldest first.
     * A record is only eligible while no older record of the same aggregate is
     * still unpublished; this keeps per-aggregate delivery order under retries.
     */
    @Query("""
        SELECT o FROM OutboxRecord o
        WHERE (o.status = com.eshop.shared.outbox.OutboxStatus.CREATED
               OR (o.status = com.eshop.shared.outbox.OutboxStatus.IN_PROGRESS AND o.leaseExpiresAt < :now)
               OR (o.status = com.eshop.shared.outbox.OutboxStatus.FAILED
                   AND o.attempts < :maxAttempts AND o.nextRetryAt <= :now))
          AND NOT EXISTS (
               SELECT p.id FROM OutboxRecord p
               WHERE p.aggregateType = o.aggregateType
                 AND p.aggregateId = o.aggregateId
                 AND p.sequence < o.sequence
                 AND p.status <> com.eshop.shared.outbox.OutboxStatus.PUBLISHED)
        ORDER BY o.createdAt ASC, o.sequence ASC
        """)
    List<OutboxRecord> findClaimCandidates(@Param("now") Instant now,
                                           @Param("maxAttempts") int maxAttempts,
                                           Pageable page);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OutboxRecord o
        SET o.status = com.eshop.shared.outbox.OutboxStatus.IN_PROGRESS,
            o.claimedBy = :owner,
            o.leaseExpiresAt = :leaseUntil,
            o.updatedAt = :now
        WHERE o.id = :id
          AND (o.status = com.eshop.shared.outbox.OutboxStatus.CREATED
               OR (o.status = com.eshop.shared.outbox.OutboxStatus.IN_PROGRESS AND o.leaseExpiresAt < :now)
               OR (o.status = com.eshop.shared.outbox.OutboxStatus.FAILED
                   AND o.attempts < :maxAttempts AND o.nextRetryAt <= :now))
        """)
    int claim(@Param("id") String id,
              @Param("owner") String owner,
              @Param("leaseUntil") Instant leaseUntil,
              @Param("now") Instant now,
              @Param("maxAttempts") int maxAttempts);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OutboxRecord o
        SET o.status = com.eshop.shared.outbox.OutboxStatus.PUBLISHED,
            o.publishedAt = :now,
            o.leaseExpiresAt = NULL,
            o.updatedAt = :now
        WHERE o.id = :id
          AND o.status = com.eshop.shared.outbox.OutboxStatus.IN_PROGRESS
        """)
    int markPublished(@Param("id") String id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OutboxRecord o
        SET o.status = com.eshop.shared.outbox.OutboxStatus.FAILED,
            o.attempts = :attempts,
            o.lastError = :error,
            o.nextRetryAt = :nextRetryAt,
            o.leaseExpiresAt = NULL,
            o.updatedAt = :now
        WHERE o.id = :id
          AND o.status = com.eshop.shared.outbox.OutboxStatus.IN_PROGRESS
          AND o.attempts = :previousAttempts
        """)
    int markFailed(@Param("id") String id,
                   @Param("previousAttempts") int previousAttempts,
                   @Param("attempts") int attempts,
                   @Param("error") String error,
                   @Param("nextRetryAt") Instant nextRetryAt,
                   @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OutboxRecord o
        SET o.status = com.eshop.shared.outbox.OutboxStatus.CREATED,
            o.claimedBy = NULL,
            o.leaseExpiresAt = NULL,
            o.updatedAt = :now
        WHERE o.id = :id
          AND o.status = com.eshop.shared.outbox.OutboxStatus.IN_PROGRESS
        """)
    int release(@Param("id") String id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE OutboxRecord o
        SET o.status = com.eshop.shared.outbox.OutboxStatus.CREATED,
            o.attempts = 0,
            o.nextRetryAt = NULL,
            o.claimedBy = NULL,
            o.updatedAt = :now
        WHERE o.id = :id
          AND o.status = com.eshop.shared.outbox.OutboxStatus.FAILED
          AND o.attempts >= :maxAttempts
        """)
    int requeue(@Param("id") String id, @Param("now") Instant now, @Param("maxAttempts") int maxAttempts);

    @Query("""
        SELECT COALESCE(MAX(o.sequence), 0) FROM OutboxRecord o
        WHERE o.aggregateType = :aggregateType AND o.aggregateId = :aggregateId
        """)
    long findMaxSequence(@Param("aggregateType") String aggregateType,
                         @Param("aggregateId") String aggregateId);

    List<OutboxRecord> findByAggregateTypeAndAggregateIdOrderBySequenceAsc(String aggregateType,
                                                                           String aggregateId);

    long countByStatusIn(List<OutboxStatus> statuses);

    @Query("""
        SELECT COUNT(o) FROM OutboxRecord o
        WHERE o.status = com.eshop.shared.outbox.OutboxStatus.FAILED AND o.attempts >= :maxAttempts
        """)
    long countExhausted(@Param("maxAttempts") int maxAttempts);
}
