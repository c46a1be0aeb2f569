package com.eshop.ordering;

import com.eshop.ordering.command.CreateOrderCommand;
import com.eshop.ordering.command.ProcessedRequestRepository;
import com.eshop.ordering.domain.OrderRepository;
import com.eshop.shared.kafka.EventPublisher;
import com.eshop.shared.outbox.OutboxRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Full application context on H2 (PostgreSQL mode). Kafka transport and the Redis
 * read model are mocked; relay, grace-period job and listeners are switched off
 * so tests drive them by hand.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(AbstractOrderingIntegrationTest.TestClockConfig.class)
public abstract class AbstractOrderingIntegrationTest {

    @TestConfiguration
    static class TestClockConfig {

        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        }
    }

    @MockBean protected EventPublisher eventPublisher;
    @MockBean protected StringRedisTemplate redis;

    @Autowired protected OrderRepository orderRepository;
    @Autowired protected OutboxRepository outboxRepository;
    @Autowired protected ProcessedRequestRepository processedRequestRepository;
    @Autowired protected MutableClock clock;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void stubReadModel() {
        when(redis.opsForValue()).thenReturn(mock(ValueOperations.class));
    }

    @AfterEach
    void cleanUp() {
        processedRequestRepository.deleteAll();
        outboxRepository.deleteAll();
        orderRepository.deleteAll();
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    /** Two lines: product 1 at 2 × 10.00 and product 2 at 1 × 15.00, total 35.00. */
    protected static CreateOrderCommand createOrderCommand(String requestId) {
        return new CreateOrderCommand(
                "buyer-1",
                "Alice Buyer",
                new CreateOrderCommand.ShippingAddress("1 Main St", "Seattle", "WA", "US", "98101"),
                new CreateOrderCommand.Card("Visa", "4111 1111 1111 4242", "Alice Buyer", YearMonth.of(2030, 12)),
                List.of(
                        new CreateOrderCommand.Item(1L, "Mug", new BigDecimal("10.00"), BigDecimal.ZERO, null, 2),
                        new CreateOrderCommand.Item(2L, "T-Shirt", new BigDecimal("15.00"), BigDecimal.ZERO, null, 1)),
                requestId);
    }
}
