package com.eshop.ordering.command;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ProcessedRequestRepository extends JpaRepository<ProcessedRequest, String> {
}
