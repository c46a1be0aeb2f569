package com.eshop.shared.outbox;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Relay tuning, bound from the {@code outbox.*} properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "outbox")
public class OutboxProperties {

    /** Master switch for the scheduled relay; tests drive the relay by hand */
    private boolean relayEnabled = true;

    private int batchSize = 50;

    private long pollIntervalMs = 1000;

    /** How long a claimed record belongs to the relay that claimed it */
    private Duration leaseTimeout = Duration.ofSeconds(30);

    private Duration publishTimeout = Duration.ofSeconds(10);

    /** Retry budget; a record failing this many times is held for an operator */
    private int maxAttempts = 5;

    private Duration backoffBase = Duration.ofSeconds(5);

    /** Claim owner written to claimed rows; generated when blank */
    private String instanceId;

    /** Backoff: 5s, 10s, 20s, 40s, 80s with the defaults */
    public Duration backoffFor(int attempts) {
        int exponent = Math.max(0, attempts - 1);
        return backoffBase.multipliedBy(1L << Math.min(exponent, 20));
    }
}
