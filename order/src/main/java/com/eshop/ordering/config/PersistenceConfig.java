package com.eshop.ordering.config;

import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Entities and repositories live in this service and in the shared outbox module.
 */
@Configuration
@EntityScan(basePackages = {"com.eshop.ordering", "com.eshop.shared"})
@EnableJpaRepositories(basePackages = {"com.eshop.ordering", "com.eshop.shared"})
public class PersistenceConfig {
}
