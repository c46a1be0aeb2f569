package com.eshop.shared.outbox;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Outbox record: persisted alongside domain state in the same transaction.
 *
 * The Transactional Outbox Pattern:
 *   1. BEGIN TRANSACTION
 *      UPDATE domain_table (...)        -- your business state
 *      INSERT INTO outbox (event...)    -- event record
 *   2. COMMIT
 *   3. Background relay claims rows, publishes to Kafka, marks them published
 *
 * Routing data and payload are written once and never updated; only the
 * delivery columns change afterwards, and only through conditional updates
 * in {@link OutboxRepository}.
 */
@Entity
@Table(name = "outbox",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_outbox_aggregate_sequence",
                          columnNames = {"aggregate_type", "aggregate_id", "sequence_number"})
    },
    indexes = {
        @Index(name = "idx_outbox_claimable", columnList = "status, created_at"),
        @Index(name = "idx_outbox_aggregate", columnList = "aggregate_id, sequence_number")
    })
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class OutboxRecord {

    /** Same UUID as the integration event ID */
    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "aggregate_type", nullable = false, updatable = false, length = 50)
    private String aggregateType;

    @Column(name = "aggregate_id", nullable = false, updatable = false, length = 100)
    private String aggregateId;

    /** Monotonically increasing within an aggregate */
    @Column(name = "sequence_number", nullable = false, updatable = false)
    private long sequence;

    @Column(name = "event_type", nullable = false, updatable = false, length = 100)
    private String eventType;

    @Column(name = "topic", nullable = false, updatable = false, length = 200)
    private String topic;

    /** Full serialized event JSON */
    @Column(name = "payload", nullable = false, updatable = false, length = 16000)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OutboxStatus status;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    /** Exponential backoff: relay skips FAILED records where nextRetryAt > NOW() */
    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Column(name = "claimed_by", length = 100)
    private String claimedBy;

    /** IN_PROGRESS records past this instant may be reclaimed by any relay */
    @Column(name = "lease_expires_at")
    private Instant leaseExpiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isPublished() {
        return status == OutboxStatus.PUBLISHED;
    }

    public boolean isExhausted(int maxAttempts) {
        return status == OutboxStatus.FAILED && attempts >= maxAttempts;
    }
}
