package com.eshop.ordering;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Ordering Service: Entry Point
 *
 * Order aggregate owner and transactional outbox publisher.
 *
 * Port: 8081 (see application.yml)
 */
@SpringBootApplication(scanBasePackages = {"com.eshop.ordering", "com.eshop.shared"})
@EnableKafka
@ConfigurationPropertiesScan(basePackages = {"com.eshop.ordering", "com.eshop.shared"})
public class OrderingServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderingServiceApplication.class, args);
    }
}
