package com.eshop.ordering.command;

import com.eshop.ordering.config.OrderingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.function.Supplier;

/**
 * Re-runs a whole command transaction when it loses a race:
 *  - optimistic version conflict on the order row
 *  - row lock timeout
 *  - duplicate request-log key inserted by a concurrent twin (the retry then replays it)
 *
 * Other integrity violations (e.g. a value too long for its column) are not races
 * and propagate on the first attempt.
 *
 * Backoff: initial, 2x, 4x ... up to {@code ordering.commands.max-attempts} attempts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRetry {

    private static final String UNIQUE_VIOLATION = "23505";

    private final OrderingProperties properties;

    public <T> T execute(String commandName, String orderId, Supplier<T> operation) {
        int maxAttempts = Math.max(1, properties.getCommands().getMaxAttempts());
        long initialBackoffMs = properties.getCommands().getInitialBackoff().toMillis();
        int attempt = 0;

        while (true) {
            try {
                return operation.get();
            } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
                if (e instanceof DataIntegrityViolationException integrity && !isDuplicateKey(integrity)) {
                    throw integrity;
                }
                attempt++;
                if (attempt >= maxAttempts) {
                    log.error("Command gave up after concurrent updates: command={}, orderId={}, attempts={}",
                            commandName, orderId, attempt, e);
                    throw new ConcurrencyConflictException(
                            commandName + " on order " + orderId + " conflicted " + attempt + " times", e);
                }

                long delayMs = initialBackoffMs * (1L << Math.min(attempt - 1, 10));
                log.warn("Concurrent update, retrying: command={}, orderId={}, attempt={}/{}, delayMs={}, cause={}",
                        commandName, orderId, attempt, maxAttempts, delayMs, e.getClass().getSimpleName());
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ConcurrencyConflictException("Interrupted while retrying " + commandName, ie);
                }
            }
        }
    }

    /** SQLState 23505 is unique_violation in both PostgreSQL and H2. */
    static boolean isDuplicateKey(DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }
        return e.getMostSpecificCause() instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState());
    }
}
