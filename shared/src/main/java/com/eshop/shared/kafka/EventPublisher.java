package com.eshop.shared.kafka;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Platform-level Kafka Producer.
 *
 * Publishes already-serialized payloads (the outbox stores JSON, so nothing is
 * serialized twice) and wraps Spring's KafkaTemplate with:
 *  - Metadata propagation via Kafka headers
 *  - Metrics (publish rate, latency, error rate)
 *  - Structured logging with event metadata
 *
 * The underlying KafkaTemplate is configured as an idempotent producer
 * (enable.idempotence=true, acks=all), so a returned acknowledgement means the
 * broker durably accepted the record.
 */
@Slf4j
@Component
public class EventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final Counter publishSuccessCounter;
    private final Counter publishErrorCounter;
    private final Timer publishTimer;

    public EventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                          MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.publishSuccessCounter = Counter.builder("kafka.messages.published")
                .tag("status", "success")
                .description("Total Kafka messages published successfully")
                .register(meterRegistry);
        this.publishErrorCounter = Counter.builder("kafka.messages.published")
                .tag("status", "error")
                .description("Total Kafka message publish failures")
                .register(meterRegistry);
        this.publishTimer = Timer.builder("kafka.publish.duration")
                .description("Time to publish a message to Kafka")
                .register(meterRegistry);
    }

    /**
     * Publish a payload to the specified Kafka topic.
     * The key decides the partition, so all records of one aggregate stay ordered.
     *
     * @return CompletableFuture that completes when the broker acknowledges
     */
    public CompletableFuture<SendResult<String, String>> publish(String topic, String key, String payload,
                                                                 Map<String, String> headers) {
        Timer.Sample sample = Timer.start();

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        headers.forEach((name, value) -> {
            if (value != null) {
                record.headers().add(new RecordHeader(name, value.getBytes(StandardCharsets.UTF_8)));
            }
        });

        CompletableFuture<SendResult<String, String>> future;
        try {
            future = kafkaTemplate.send(record);
        } catch (RuntimeException ex) {
            // KafkaTemplate throws synchronously when metadata cannot be fetched
            sample.stop(publishTimer);
            publishErrorCounter.increment();
            log.error("Failed to hand record to producer: topic={}, key={}, error={}", topic, key, ex.getMessage());
            return CompletableFuture.failedFuture(ex);
        }

        return future.whenComplete((result, ex) -> {
            sample.stop(publishTimer);
            if (ex == null) {
                publishSuccessCounter.increment();
                log.debug("Record published: topic={}, key={}, partition={}, offset={}",
                        topic, key,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset());
            } else {
                publishErrorCounter.increment();
                log.error("Failed to publish record: topic={}, key={}, error={}",
                        topic, key, ex.getMessage());
            }
        });
    }

    /**
     * Synchronous publish. Blocks until the broker acknowledges or the timeout elapses.
     *
     * @throws EventPublishTimeoutException when no acknowledgement arrived in time; the
     *         outcome is unknown and the record may or may not have reached the broker
     * @throws EventPublishException        when the broker or producer reported an error
     */
    public void publishAndWait(String topic, String key, String payload,
                               Map<String, String> headers, Duration timeout) {
        CompletableFuture<SendResult<String, String>> future = publish(topic, key, payload, headers);
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new EventPublishTimeoutException(
                    "No acknowledgement within " + timeout.toMillis() + "ms: topic=" + topic + ", key=" + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventPublishException("Interrupted while publishing: topic=" + topic, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EventPublishException("Failed to publish: topic=" + topic + ", error=" + cause.getMessage(), cause);
        }
    }

    public static class EventPublishException extends RuntimeException {
        public EventPublishException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static class EventPublishTimeoutException extends EventPublishException {
        public EventPublishTimeoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
