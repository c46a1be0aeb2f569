package com.eshop.ordering.query;

import com.eshop.ordering.config.OrderingProperties;
import com.eshop.ordering.domain.Order;
import com.eshop.ordering.domain.OrderRepository;
import com.eshop.shared.outbox.OutboxService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Order Query Service: Read Side
 *
 * Single orders are served from the Redis read model first and fall back to
 * the database on a miss (cold cache, expired TTL, Redis down). Command
 * handlers evict an order's entry after every commit; the next read rebuilds it.
 *
 * Redis is never required: every cache failure is logged and ignored.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderQueryService {

    private final OrderRepository orderRepository;
    private final OutboxService outboxService;
    private final ObjectMapper objectMapper;
    private final StringRedisTemplate redis;
    private final OrderingProperties properties;

    @Transactional(readOnly = true)
    public Optional<OrderView> getOrder(String orderId) {
        // ── Read Model (Redis) ────────────────────────────────────────────────
        OrderView cached = readCache(orderId);
        if (cached != null) {
            return Optional.of(cached);
        }

        // ── Database Fallback ─────────────────────────────────────────────────
        Optional<OrderView> view = orderRepository.findById(orderId).map(OrderView::from);
        view.ifPresent(this::writeCache);
        return view;
    }

    @Transactional(readOnly = true)
    public List<OrderView> getOrdersByBuyer(String buyerId) {
        return orderRepository.findByBuyerIdOrderByOrderDateDesc(buyerId).stream()
                .map(OrderView::from)
                .toList();
    }

    /** Every event the order produced, in sequence order, with delivery state. */
    public List<OrderEventView> getEventHistory(String orderId) {
        return outboxService.history(Order.AGGREGATE_TYPE, orderId).stream()
                .map(OrderEventView::from)
                .toList();
    }

    public void evict(String orderId) {
        try {
            redis.delete(key(orderId));
        } catch (RuntimeException e) {
            log.warn("Failed to evict read model: orderId={}, error={}", orderId, e.getMessage());
        }
    }

    private OrderView readCache(String orderId) {
        try {
            String cached = redis.opsForValue().get(key(orderId));
            if (cached == null) {
                return null;
            }
            return objectMapper.readValue(cached, OrderView.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse cached order, falling back to database: orderId={}", orderId);
            return null;
        } catch (RuntimeException e) {
            log.warn("Read model unavailable, falling back to database: orderId={}, error={}",
                    orderId, e.getMessage());
            return null;
        }
    }

    private void writeCache(OrderView view) {
        try {
            redis.opsForValue().set(key(view.orderId()), objectMapper.writeValueAsString(view),
                    properties.getReadModel().getTtl());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("Failed to update read model: orderId={}, error={}", view.orderId(), e.getMessage());
        }
    }

    private String key(String orderId) {
        return properties.getReadModel().getKeyPrefix() + orderId;
    }
}
