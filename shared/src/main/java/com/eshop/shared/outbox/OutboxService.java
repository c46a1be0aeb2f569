package com.eshop.shared.outbox;

import com.eshop.shared.events.IntegrationEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Outbox Store
 *
 * Write path: {@link #append} is called inside a command's transaction so the
 * event record commits or rolls back together with the state change.
 *
 * Relay path: {@link #claimPending}, {@link #markPublished}, {@link #markFailed}
 * and {@link #release} each run in their own short transaction. A relay that dies
 * between claim and acknowledgement leaves its rows IN_PROGRESS until the lease
 * expires; any relay may then claim them again (at-least-once delivery).
 */
@Slf4j
@Service
public class OutboxService {

    private static final int MAX_ERROR_LENGTH = 2000;

    public enum FailureOutcome {
        /** Row was not IN_PROGRESS any more; nothing changed */
        IGNORED,
        RETRY_SCHEDULED,
        EXHAUSTED
    }

    private final OutboxRepository outboxRepository;
    private final ObjectMapper objectMapper;
    private final OutboxProperties properties;
    private final Clock clock;
    private final String owner;

    public OutboxService(OutboxRepository outboxRepository,
                         ObjectMapper objectMapper,
                         OutboxProperties properties,
                         Clock clock) {
        this.outboxRepository = outboxRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.owner = properties.getInstanceId() != null && !properties.getInstanceId().isBlank()
                ? properties.getInstanceId()
                : "relay-" + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Append an event to the outbox within the current transaction.
     * Fails fast when no transaction is active.
     *
     * @param aggregateType Domain aggregate type (e.g., "Order")
     * @param event         The integration event to publish
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxRecord append(String aggregateType, IntegrationEvent event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new OutboxSerializationException("Cannot serialize event to JSON: " + event.type(), e);
        }

        long sequence = outboxRepository.findMaxSequence(aggregateType, event.aggregateId()) + 1;
        Instant now = clock.instant();

        OutboxRecord record = OutboxRecord.builder()
                .id(event.eventId())         // outbox ID == event ID for traceability
                .aggregateType(aggregateType)
                .aggregateId(event.aggregateId())
                .sequence(sequence)
                .eventType(event.type())
                .topic(event.topic())
                .payload(payload)
                .status(OutboxStatus.CREATED)
                .attempts(0)
                .createdAt(now)
                .updatedAt(now)
                .build();

        outboxRepository.save(record);

        log.debug("Outbox record appended: eventId={}, type={}, aggregateId={}, sequence={}",
                event.eventId(), event.type(), event.aggregateId(), sequence);
        return record;
    }

    /**
     * Claim up to {@code batchSize} records for this relay instance, oldest first.
     * Each claim is an atomic conditional update; a record another instance
     * claimed in the meantime is silently skipped.
     */
    @Transactional
    public List<OutboxRecord> claimPending(int batchSize) {
        Instant now = clock.instant();
        Instant leaseUntil = now.plus(properties.getLeaseTimeout());

        List<OutboxRecord> candidates = outboxRepository.findClaimCandidates(
                now, properties.getMaxAttempts(), PageRequest.of(0, batchSize));
        if (candidates.isEmpty()) {
            return List.of();
        }

        List<String> claimedIds = new ArrayList<>(candidates.size());
        for (OutboxRecord candidate : candidates) {
            if (outboxRepository.claim(candidate.getId(), owner, leaseUntil, now, properties.getMaxAttempts()) == 1) {
                claimedIds.add(candidate.getId());
            }
        }

        Map<String, OutboxRecord> claimed = outboxRepository.findAllById(claimedIds).stream()
                .collect(Collectors.toMap(OutboxRecord::getId, Function.identity()));
        List<OutboxRecord> ordered = claimedIds.stream().map(claimed::get).toList();

        log.debug("Outbox claim: owner={}, candidates={}, claimed={}", owner, candidates.size(), ordered.size());
        return ordered;
    }

    /** Idempotent: a row that is no longer IN_PROGRESS is left alone. */
    @Transactional
    public boolean markPublished(String id) {
        boolean updated = outboxRepository.markPublished(id, clock.instant()) == 1;
        if (!updated) {
            log.debug("markPublished ignored, record not in progress: id={}", id);
        }
        return updated;
    }

    /**
     * Record a failed publish attempt and schedule an exponential-backoff retry.
     * Idempotent: a row that is no longer IN_PROGRESS is left alone.
     */
    @Transactional
    public FailureOutcome markFailed(String id, String reason) {
        Optional<OutboxRecord> current = outboxRepository.findById(id)
                .filter(r -> r.getStatus() == OutboxStatus.IN_PROGRESS);
        if (current.isEmpty()) {
            log.debug("markFailed ignored, record not in progress: id={}", id);
            return FailureOutcome.IGNORED;
        }

        Instant now = clock.instant();
        int previousAttempts = current.get().getAttempts();
        int attempts = previousAttempts + 1;
        boolean exhausted = attempts >= properties.getMaxAttempts();
        Instant nextRetryAt = exhausted ? null : now.plus(properties.backoffFor(attempts));

        int updated = outboxRepository.markFailed(id, previousAttempts, attempts, truncate(reason), nextRetryAt, now);
        if (updated != 1) {
            return FailureOutcome.IGNORED;
        }
        return exhausted ? FailureOutcome.EXHAUSTED : FailureOutcome.RETRY_SCHEDULED;
    }

    /** Hand a claimed record back without spending an attempt. */
    @Transactional
    public boolean release(String id) {
        return outboxRepository.release(id, clock.instant()) == 1;
    }

    /** Operator action: put an exhausted record back in the queue with a fresh retry budget. */
    @Transactional
    public boolean requeue(String id) {
        boolean requeued = outboxRepository.requeue(id, clock.instant(), properties.getMaxAttempts()) == 1;
        if (requeued) {
            log.info("Outbox record requeued: id={}", id);
        }
        return requeued;
    }

    @Transactional(readOnly = true)
    public List<OutboxRecord> history(String aggregateType, String aggregateId) {
        return outboxRepository.findByAggregateTypeAndAggregateIdOrderBySequenceAsc(aggregateType, aggregateId);
    }

    @Transactional(readOnly = true)
    public Optional<OutboxRecord> find(String id) {
        return outboxRepository.findById(id);
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return outboxRepository.countByStatusIn(
                List.of(OutboxStatus.CREATED, OutboxStatus.IN_PROGRESS, OutboxStatus.FAILED))
                - outboxRepository.countExhausted(properties.getMaxAttempts());
    }

    @Transactional(readOnly = true)
    public long countExhausted() {
        return outboxRepository.countExhausted(properties.getMaxAttempts());
    }

    public String getOwner() {
        return owner;
    }

    private static String truncate(String reason) {
        if (reason == null) {
            return "unknown error";
        }
        return reason.length() <= MAX_ERROR_LENGTH ? reason : reason.substring(0, MAX_ERROR_LENGTH);
    }
}
