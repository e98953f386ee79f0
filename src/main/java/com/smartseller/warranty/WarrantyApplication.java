package com.smartseller.warranty;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the SmartSeller warranty service.
 *
 * System Overview:
 * - Batch issuance of unique warranty barcodes with collision detection
 * - Warranty activation (binding a barcode to a customer)
 * - Multi-actor claim workflow: customer submission, agent validation, technician repair
 * - Repair tickets with quality-check and customer-approval gates
 * - Claim attachments gated by an asynchronous malware scan
 * - Public, anonymous barcode validation and coverage checks
 *
 * Architecture:
 * - API Layer: REST controllers with validation
 * - Service Layer: batch engine, activation, claim state machine, repair tickets
 * - Data Access Layer: JPA repositories with optimistic versioning and pessimistic row locks
 * - Infrastructure Layer: Redis cache and locks, Kafka messaging, CloudWatch metrics
 *
 * @author Warranty Platform Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
@EnableKafka
@EnableScheduling
public class WarrantyApplication {

    public static void main(String[] args) {
        SpringApplication.run(WarrantyApplication.class, args);
    }
}
