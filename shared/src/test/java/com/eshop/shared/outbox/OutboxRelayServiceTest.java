package com.eshop.shared.outbox;

import com.eshop.shared.events.EventTypes;
import com.eshop.shared.kafka.EventPublisher;
import com.eshop.shared.kafka.EventPublisher.EventPublishException;
import com.eshop.shared.kafka.EventPublisher.EventPublishTimeoutException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit Tests: OutboxRelayService
 *
 * Store and transport are mocked; the circuit breaker is real.
 */
@ExtendWith(MockitoExtension.class)
class OutboxRelayServiceTest {

    @Mock OutboxService outboxService;
    @Mock EventPublisher eventPublisher;

    OutboxProperties properties;
    SimpleMeterRegistry meterRegistry;
    CircuitBreaker circuitBreaker;
    OutboxRelayService relay;

    @BeforeEach
    void setUp() {
        properties = new OutboxProperties();
        meterRegistry = new SimpleMeterRegistry();
        circuitBreaker = CircuitBreaker.ofDefaults("outbox-test");
        relay = new OutboxRelayService(outboxService, eventPublisher, properties, circuitBreaker, meterRegistry);
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private OutboxRecord claimedRecord(String id, String aggregateId, long sequence) {
        return OutboxRecord.builder()
                .id(id)
                .aggregateType("Order")
                .aggregateId(aggregateId)
                .sequence(sequence)
                .eventType(EventTypes.ORDER_PAID)
                .topic(EventTypes.TOPIC_ORDERS_PAID)
                .payload("{\"orderId\":\"" + aggregateId + "\"}")
                .status(OutboxStatus.IN_PROGRESS)
                .attempts(0)
                .build();
    }

    private void failEveryPublish() {
        doThrow(new EventPublishException("broker unavailable", null))
                .when(eventPublisher).publishAndWait(any(), any(), any(), any(), any());
    }

    // ─── relay Tests ──────────────────────────────────────────────────────────

    @Test
    @DisplayName("relay — publishes claimed records in order and marks them published")
    @SuppressWarnings("unchecked")
    void relay_shouldPublishAndMarkPublished() {
        OutboxRecord first = claimedRecord("evt-1", "ord_a", 1);
        OutboxRecord second = claimedRecord("evt-2", "ord_b", 1);
        when(outboxService.claimPending(properties.getBatchSize())).thenReturn(List.of(first, second));
        when(outboxService.markPublished(anyString())).thenReturn(true);

        int published = relay.relay();

        assertThat(published).isEqualTo(2);
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(eventPublisher).publishAndWait(eq(EventTypes.TOPIC_ORDERS_PAID), eq("ord_a"),
                eq("{\"orderId\":\"ord_a\"}"), headers.capture(), eq(properties.getPublishTimeout()));
        assertThat(headers.getValue())
                .containsEntry(EventTypes.HEADER_EVENT_ID, "evt-1")
                .containsEntry(EventTypes.HEADER_EVENT_TYPE, EventTypes.ORDER_PAID)
                .containsEntry(EventTypes.HEADER_AGGREGATE_ID, "ord_a")
                .containsEntry(EventTypes.HEADER_SEQUENCE, "1");
        verify(outboxService).markPublished("evt-1");
        verify(outboxService).markPublished("evt-2");
        assertThat(meterRegistry.get("outbox.records.relayed").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("relay — publish error marks the record failed, never published")
    void relay_publishError_shouldMarkFailed() {
        when(outboxService.claimPending(properties.getBatchSize()))
                .thenReturn(List.of(claimedRecord("evt-1", "ord_a", 1)));
        when(outboxService.markFailed(eq("evt-1"), anyString()))
                .thenReturn(OutboxService.FailureOutcome.RETRY_SCHEDULED);
        failEveryPublish();

        int published = relay.relay();

        assertThat(published).isZero();
        verify(outboxService).markFailed("evt-1", "broker unavailable");
        verify(outboxService, never()).markPublished(any());
        assertThat(meterRegistry.get("outbox.relay.errors").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("relay — unacknowledged publish leaves the record in progress for lease reclaim")
    void relay_publishTimeout_shouldLeaveRecordInProgress() {
        when(outboxService.claimPending(properties.getBatchSize()))
                .thenReturn(List.of(claimedRecord("evt-1", "ord_a", 1)));
        doThrow(new EventPublishTimeoutException("no ack", null))
                .when(eventPublisher).publishAndWait(any(), any(), any(), any(), any());

        int published = relay.relay();

        assertThat(published).isZero();
        verify(outboxService, never()).markPublished(any());
        verify(outboxService, never()).markFailed(any(), any());
        verify(outboxService, never()).release(any());
    }

    @Test
    @DisplayName("relay — exhausted record increments the exhausted counter")
    void relay_exhaustedRecord_shouldCountExhaustion() {
        when(outboxService.claimPending(properties.getBatchSize()))
                .thenReturn(List.of(claimedRecord("evt-1", "ord_a", 1)));
        when(outboxService.markFailed(eq("evt-1"), anyString()))
                .thenReturn(OutboxService.FailureOutcome.EXHAUSTED);
        when(outboxService.countExhausted()).thenReturn(1L);
        failEveryPublish();

        relay.relay();

        assertThat(meterRegistry.get("outbox.records.exhausted.total").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("outbox.records.exhausted").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("relay — already-terminal record is not counted as relayed")
    void relay_recordNoLongerInProgress_shouldNotCount() {
        when(outboxService.claimPending(properties.getBatchSize()))
                .thenReturn(List.of(claimedRecord("evt-1", "ord_a", 1)));
        when(outboxService.markPublished("evt-1")).thenReturn(false);

        assertThat(relay.relay()).isZero();
        assertThat(meterRegistry.get("outbox.records.relayed").counter().count()).isZero();
    }

    @Test
    @DisplayName("relay — open circuit skips claiming entirely")
    void relay_circuitOpen_shouldNotClaim() {
        circuitBreaker.transitionToOpenState();

        int published = relay.relay();

        assertThat(published).isZero();
        verify(outboxService, never()).claimPending(anyInt());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("relay — circuit opening mid-batch releases the remaining records")
    void relay_circuitOpensMidBatch_shouldReleaseRemaining() {
        circuitBreaker = CircuitBreaker.of("outbox-test-strict", CircuitBreakerConfig.custom()
                .slidingWindowSize(1)
                .minimumNumberOfCalls(1)
                .failureRateThreshold(50)
                .build());
        relay = new OutboxRelayService(outboxService, eventPublisher, properties, circuitBreaker,
                new SimpleMeterRegistry());

        when(outboxService.claimPending(properties.getBatchSize())).thenReturn(List.of(
                claimedRecord("evt-1", "ord_a", 1),
                claimedRecord("evt-2", "ord_b", 1),
                claimedRecord("evt-3", "ord_c", 1)));
        when(outboxService.markFailed(eq("evt-1"), anyString()))
                .thenReturn(OutboxService.FailureOutcome.RETRY_SCHEDULED);
        failEveryPublish();

        relay.relay();

        verify(outboxService).markFailed(eq("evt-1"), anyString());
        verify(outboxService).release("evt-2");
        verify(outboxService).release("evt-3");
        verify(outboxService, never()).markFailed(eq("evt-2"), anyString());
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }

    @Test
    @DisplayName("relay — refreshes pending and exhausted gauges")
    void relay_shouldRefreshGauges() {
        when(outboxService.claimPending(properties.getBatchSize())).thenReturn(List.of());
        when(outboxService.countPending()).thenReturn(7L);
        when(outboxService.countExhausted()).thenReturn(2L);

        relay.relay();

        assertThat(meterRegistry.get("outbox.records.pending").gauge().value()).isEqualTo(7.0);
        assertThat(meterRegistry.get("outbox.records.exhausted").gauge().value()).isEqualTo(2.0);
    }

    // ─── scheduledRelay Tests ─────────────────────────────────────────────────

    @Test
    @DisplayName("scheduledRelay — does nothing when the relay is disabled")
    void scheduledRelay_disabled_shouldDoNothing() {
        properties.setRelayEnabled(false);

        relay.scheduledRelay();

        verifyNoInteractions(outboxService, eventPublisher);
    }

    @Test
    @DisplayName("scheduledRelay — store failure is logged and the next cycle runs normally")
    void scheduledRelay_storeFailure_shouldNotPropagate() {
        when(outboxService.claimPending(properties.getBatchSize()))
                .thenThrow(new IllegalStateException("connection refused"));

        assertThatCode(relay::scheduledRelay).doesNotThrowAnyException();
    }
}
