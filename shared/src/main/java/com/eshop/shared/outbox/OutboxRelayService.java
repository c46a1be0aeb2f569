package com.eshop.shared.outbox;

import com.eshop.shared.events.EventTypes;
import com.eshop.shared.kafka.EventPublisher;
import com.eshop.shared.kafka.EventPublisher.EventPublishTimeoutException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outbox Relay: claims outbox records and publishes them to Kafka.
 *
 * Runs one second after the previous run completed. Each cycle:
 *   1. claim a batch (oldest first, at most one record per aggregate)
 *   2. publish each record in claim order, waiting for the broker ack
 *   3. ack     → PUBLISHED
 *      error   → FAILED, retried with exponential backoff until the budget is spent
 *      timeout → left IN_PROGRESS; the lease expires and the record is reclaimed
 *
 * Nothing here blocks command handling: a broker outage only grows the backlog.
 */
@Slf4j
@Service
public class OutboxRelayService {

    private final OutboxService outboxService;
    private final EventPublisher eventPublisher;
    private final OutboxProperties properties;
    private final CircuitBreaker circuitBreaker;

    private final Counter relayedCounter;
    private final Counter relayErrorCounter;
    private final Counter exhaustedCounter;
    private final AtomicLong pendingRecords = new AtomicLong();
    private final AtomicLong exhaustedRecords = new AtomicLong();

    public OutboxRelayService(OutboxService outboxService,
                              EventPublisher eventPublisher,
                              OutboxProperties properties,
                              @Qualifier("outboxCircuitBreaker") CircuitBreaker circuitBreaker,
                              MeterRegistry meterRegistry) {
        this.outboxService = outboxService;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.circuitBreaker = circuitBreaker;

        this.relayedCounter = Counter.builder("outbox.records.relayed")
                .description("Outbox records successfully relayed to Kafka")
                .register(meterRegistry);
        this.relayErrorCounter = Counter.builder("outbox.relay.errors")
                .description("Errors during outbox relay")
                .register(meterRegistry);
        this.exhaustedCounter = Counter.builder("outbox.records.exhausted.total")
                .description("Outbox records that used up their retry budget")
                .register(meterRegistry);
        Gauge.builder("outbox.records.pending", pendingRecords, AtomicLong::get)
                .description("Outbox records waiting for delivery")
                .register(meterRegistry);
        Gauge.builder("outbox.records.exhausted", exhaustedRecords, AtomicLong::get)
                .description("Outbox records held for operator intervention")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${outbox.poll-interval-ms:1000}")
    public void scheduledRelay() {
        if (!properties.isRelayEnabled()) {
            return;
        }
        try {
            relay();
        } catch (RuntimeException ex) {
            // Store unavailable; the next cycle tries again
            log.error("Outbox relay cycle failed: error={}", ex.getMessage(), ex);
        }
    }

    /**
     * Run one relay cycle.
     *
     * @return number of records published in this cycle
     */
    public int relay() {
        if (circuitBreaker.getState() == CircuitBreaker.State.OPEN) {
            log.debug("Outbox relay skipped, transport circuit open");
            refreshGauges();
            return 0;
        }

        List<OutboxRecord> records = outboxService.claimPending(properties.getBatchSize());
        if (records.isEmpty()) {
            refreshGauges();
            return 0;
        }

        log.debug("Outbox relay: processing {} records", records.size());

        int published = 0;
        for (int i = 0; i < records.size(); i++) {
            OutboxRecord record = records.get(i);
            try {
                circuitBreaker.executeRunnable(() -> publishRecord(record));
                if (outboxService.markPublished(record.getId())) {
                    relayedCounter.increment();
                    published++;
                }
            } catch (CallNotPermittedException ex) {
                log.warn("Transport circuit opened mid-batch, releasing {} records", records.size() - i);
                records.subList(i, records.size()).forEach(r -> outboxService.release(r.getId()));
                break;
            } catch (EventPublishTimeoutException ex) {
                relayErrorCounter.increment();
                log.warn("Publish not acknowledged in time, leaving record for lease reclaim: id={}, eventType={}",
                        record.getId(), record.getEventType());
            } catch (Exception ex) {
                relayErrorCounter.increment();
                handleFailure(record, ex);
            }
        }

        refreshGauges();
        return published;
    }

    private void publishRecord(OutboxRecord record) {
        Map<String, String> headers = Map.of(
                EventTypes.HEADER_EVENT_ID, record.getId(),
                EventTypes.HEADER_EVENT_TYPE, record.getEventType(),
                EventTypes.HEADER_AGGREGATE_ID, record.getAggregateId(),
                EventTypes.HEADER_SEQUENCE, String.valueOf(record.getSequence()));

        eventPublisher.publishAndWait(record.getTopic(), record.getAggregateId(), record.getPayload(),
                headers, properties.getPublishTimeout());
    }

    private void handleFailure(OutboxRecord record, Exception ex) {
        OutboxService.FailureOutcome outcome = outboxService.markFailed(record.getId(), ex.getMessage());
        switch (outcome) {
            case EXHAUSTED -> {
                exhaustedCounter.increment();
                log.error("Outbox record exhausted its retry budget, operator action required: id={}, eventType={}, aggregateId={}, attempts={}",
                        record.getId(), record.getEventType(), record.getAggregateId(), properties.getMaxAttempts(), ex);
            }
            case RETRY_SCHEDULED -> log.warn("Failed to relay outbox record, retry scheduled: id={}, eventType={}, attempt={}, error={}",
                    record.getId(), record.getEventType(), record.getAttempts() + 1, ex.getMessage());
            case IGNORED -> log.debug("Failure not recorded, record no longer in progress: id={}", record.getId());
        }
    }

    private void refreshGauges() {
        pendingRecords.set(outboxService.countPending());
        exhaustedRecords.set(outboxService.countExhausted());
    }
}
