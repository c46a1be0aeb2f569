package com.eshop.shared.outbox;

/**
 * Delivery state of an outbox record.
 *
 *   CREATED ──claim──▶ IN_PROGRESS ──ack──▶ PUBLISHED
 *      ▲                 │    │
 *      │   lease expiry  │    └──error──▶ FAILED ──backoff due──▶ (claimable again)
 *      └──── release ────┘
 *
 * A FAILED record whose attempts reached the retry budget is exhausted: it stays
 * FAILED until an operator requeues it.
 */
public enum OutboxStatus {
    CREATED,
    IN_PROGRESS,
    PUBLISHED,
    FAILED
}
