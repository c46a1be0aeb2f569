package com.eshop.ordering.api;

import com.eshop.shared.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operator endpoints for outbox rows that ran out of delivery attempts.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/outbox")
@RequiredArgsConstructor
public class OutboxAdminController {

    private final OutboxService outboxService;

    /**
     * POST /api/admin/outbox/{eventId}/requeue
     * Puts an exhausted row back in the queue with a fresh attempt budget.
     */
    @PostMapping("/{eventId}/requeue")
    public ResponseEntity<Object> requeue(@PathVariable String eventId) {
        if (outboxService.requeue(eventId)) {
            log.info("Outbox record requeued by operator: eventId={}", eventId);
            return ResponseEntity.ok(Map.of("eventId", eventId, "status", "CREATED"));
        }
        return outboxService.find(eventId)
                .<ResponseEntity<Object>>map(record -> ResponseEntity.status(HttpStatus.CONFLICT).body(
                        ErrorResponse.of("OUT409", "NOT_EXHAUSTED",
                                "Outbox record " + eventId + " is " + record.getStatus()
                                        + " with " + record.getAttempts() + " attempts, only exhausted records can be requeued")))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                        ErrorResponse.of("OUT404", "NOT_FOUND", "Outbox record not found: " + eventId)));
    }
}
