package com.smartseller.warranty.infrastructure.messaging;

import com.smartseller.warranty.infrastructure.messaging.events.NotificationMessage;
import com.smartseller.warranty.infrastructure.messaging.events.ScanRequestMessage;
import com.smartseller.warranty.infrastructure.messaging.events.WarrantyEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Kafka producer for everything the warranty service sends out: notifications,
 * attachment scan requests and domain events.
 *
 * Topic partitioning strategy:
 * - Notifications keyed by recipient
 * - Scan requests keyed by attachment id
 * - Domain events keyed by aggregate id (per-aggregate ordering)
 *
 * All sends are fire-and-forget. Failures are logged from the send callback and never
 * propagate to the caller, so a committed transition is never undone by a broker outage.
 *
 * @author Warranty Platform Team
 */
@Service
public class KafkaProducerService implements NotificationSink, AttachmentScanner {

    private static final Logger logger = LoggerFactory.getLogger(KafkaProducerService.class);

    static final String NOTIFICATION_TOPIC = "warranty-notifications";
    static final String EVENT_TOPIC = "warranty-events";
    static final String SCAN_REQUEST_TOPIC = "attachment-scan-requests";

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    public KafkaProducerService(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void notify(String recipient, String templateId, Map<String, Object> payload) {
        try {
            String body = objectMapper.writeValueAsString(new NotificationMessage(recipient, templateId, payload));
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(NOTIFICATION_TOPIC, recipient, body);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Queued notification {} for recipient {}", templateId, recipient);
                } else {
                    logger.error("Failed to queue notification {} for recipient {}", templateId, recipient, ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing notification {} for recipient {}", templateId, recipient, e);
        } catch (RuntimeException e) {
            logger.error("Notification {} for recipient {} could not be sent", templateId, recipient, e);
        }
    }

    @Override
    public boolean requestScan(String attachmentId, String storageRef, String mimeType) {
        try {
            String body = objectMapper.writeValueAsString(new ScanRequestMessage(attachmentId, storageRef, mimeType));
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(SCAN_REQUEST_TOPIC, attachmentId, body);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Requested scan for attachment {}, partition: {}",
                            attachmentId, result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to request scan for attachment {}", attachmentId, ex);
                }
            });
            return true;
        } catch (JsonProcessingException e) {
            logger.error("Error serializing scan request for attachment {}", attachmentId, e);
            return false;
        } catch (RuntimeException e) {
            logger.error("Scan request for attachment {} could not be sent", attachmentId, e);
            return false;
        }
    }

    /**
     * Publish a domain event.
     *
     * @param event Warranty event
     */
    public void publishEvent(WarrantyEvent event) {
        try {
            String payload = objectMapper.writeValueAsString(event);
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(EVENT_TOPIC, event.getAggregateId(), payload);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Published {} event for {} {}",
                            event.getEventType(), event.getAggregateType(), event.getAggregateId());
                } else {
                    logger.error("Failed to publish {} event for {} {}",
                            event.getEventType(), event.getAggregateType(), event.getAggregateId(), ex);
                }
            });
        } catch (JsonProcessingException e) {
            logger.error("Error serializing {} event for {}", event.getEventType(), event.getAggregateId(), e);
        } catch (RuntimeException e) {
            logger.error("{} event for {} could not be sent", event.getEventType(), event.getAggregateId(), e);
        }
    }
}
