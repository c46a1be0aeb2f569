package com.eshop.ordering.domain;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /** Row-locks the order for the rest of the transaction; concurrent commands on it queue here. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000"))
    Optional<Order> findWithLockById(String id);

    List<Order> findByBuyerIdOrderByOrderDateDesc(String buyerId);

    List<Order> findByStatusAndOrderDateBeforeOrderByOrderDateAsc(OrderStatus status, Instant cutoff, Pageable pageable);
}
