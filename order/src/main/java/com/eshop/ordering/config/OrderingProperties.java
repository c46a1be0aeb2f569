package com.eshop.ordering.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Ordering service settings, bound from the {@code ordering.*} namespace.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "ordering")
public class OrderingProperties {

    private final Commands commands = new Commands();
    private final GracePeriod gracePeriod = new GracePeriod();
    private final ReadModel readModel = new ReadModel();

    @Getter
    @Setter
    public static class Commands {
        /** Attempts per command when it loses a concurrency race */
        private int maxAttempts = 5;
        private Duration initialBackoff = Duration.ofMillis(50);
    }

    @Getter
    @Setter
    public static class GracePeriod {
        private boolean enabled = true;
        /** How long a buyer may still change a submitted order before stock validation starts */
        private Duration period = Duration.ofMinutes(1);
        private long pollIntervalMs = 10_000;
        private int batchSize = 100;
    }

    @Getter
    @Setter
    public static class ReadModel {
        private String keyPrefix = "order:";
        private Duration ttl = Duration.ofHours(24);
    }
}
