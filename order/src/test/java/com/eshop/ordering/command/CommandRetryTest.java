package com.eshop.ordering.command;

import com.eshop.ordering.config.OrderingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandRetryTest {

    private CommandRetry retry;

    @BeforeEach
    void setUp() {
        OrderingProperties properties = new OrderingProperties();
        properties.getCommands().setMaxAttempts(3);
        properties.getCommands().setInitialBackoff(Duration.ofMillis(1));
        retry = new CommandRetry(properties);
    }

    @Test
    @DisplayName("execute — returns the first successful result")
    void returnsResult() {
        assertThat(retry.execute("MarkPaid", "ord_1", () -> "ok")).isEqualTo("ok");
    }

    @Test
    @DisplayName("execute — retries lost races until the operation succeeds")
    void retriesLostRaces() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.execute("MarkPaid", "ord_1", () -> {
            int call = calls.incrementAndGet();
            if (call == 1) throw new ObjectOptimisticLockingFailureException("Order", "ord_1");
            if (call == 2) throw new DataIntegrityViolationException("duplicate request key",
                    new SQLException("unique constraint violated", "23505"));
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("execute — gives up after the configured attempts")
    void givesUp() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("MarkPaid", "ord_1", () -> {
            calls.incrementAndGet();
            throw new PessimisticLockingFailureException("lock timeout");
        }))
                .isInstanceOf(ConcurrencyConflictException.class)
                .hasCauseInstanceOf(PessimisticLockingFailureException.class);
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("execute — other failures are not retried")
    void otherFailuresPropagate() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retry.execute("MarkPaid", "ord_1", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("execute — a value too long for its column fails on the first attempt")
    void valueTooLongIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        DataIntegrityViolationException tooLong = new DataIntegrityViolationException("could not execute statement",
                new SQLException("value too long for type character varying(50)", "22001"));

        assertThatThrownBy(() -> retry.execute("CreateOrder", null, () -> {
            calls.incrementAndGet();
            throw tooLong;
        })).isSameAs(tooLong);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("isDuplicateKey — recognises unique violations only")
    void recognisesDuplicateKeys() {
        assertThat(CommandRetry.isDuplicateKey(new DuplicateKeyException("dup"))).isTrue();
        assertThat(CommandRetry.isDuplicateKey(new DataIntegrityViolationException("dup",
                new SQLException("unique", "23505")))).isTrue();
        assertThat(CommandRetry.isDuplicateKey(new DataIntegrityViolationException("not null",
                new SQLException("null value", "23502")))).isFalse();
        assertThat(CommandRetry.isDuplicateKey(new DataIntegrityViolationException("no cause"))).isFalse();
    }
}
