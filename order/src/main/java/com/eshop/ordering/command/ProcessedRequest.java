package com.eshop.ordering.command;

import com.eshop.ordering.domain.OrderStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Request log row. Written in the same transaction as the mutation it guards, so a
 * token is recorded if and only if its command committed.
 *
 * Key format: {@code <command name>:<client token>}
 *
 * Always inserted, never merged: a concurrent twin holding the same key must fail
 * on the primary key instead of overwriting the row.
 */
@Entity
@Table(name = "processed_requests")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedRequest implements Persistable<String> {

    @Id
    @Column(name = "request_key", length = 255)
    private String requestKey;

    @Column(name = "command_name", nullable = false, length = 50)
    private String commandName;

    @Column(name = "order_id", nullable = false, length = 20)
    private String orderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "result_status", nullable = false, length = 30)
    private OrderStatus resultStatus;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Getter(AccessLevel.NONE)
    @Transient
    private boolean stored;

    public ProcessedRequest(String requestKey, String commandName, String orderId, OrderStatus resultStatus,
                            Instant processedAt) {
        this.requestKey = requestKey;
        this.commandName = commandName;
        this.orderId = orderId;
        this.resultStatus = resultStatus;
        this.processedAt = processedAt;
    }

    @Override
    public String getId() {
        return requestKey;
    }

    @Override
    public boolean isNew() {
        return !stored;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        stored = true;
    }
}
