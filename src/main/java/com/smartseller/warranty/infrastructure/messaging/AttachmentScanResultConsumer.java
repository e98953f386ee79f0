package com.smartseller.warranty.infrastructure.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.messaging.events.ScanResultMessage;
import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.service.ClaimAttachmentService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Consumes malware-scan verdicts from the external scanner and records them on attachments.
 *
 * Verdicts are idempotent (the first one wins), so a redelivered batch is harmless. Malformed
 * messages and verdicts for unknown attachments are logged and skipped; anything else leaves
 * the batch unacknowledged for redelivery.
 *
 * @author Warranty Platform Team
 */
@Service
public class AttachmentScanResultConsumer {

    private static final Logger logger = LoggerFactory.getLogger(AttachmentScanResultConsumer.class);

    static final String SCAN_RESULTS_TOPIC = "attachment-scan-results";

    private final ClaimAttachmentService attachmentService;
    private final WarrantyMetricsService metricsService;
    private final ObjectMapper objectMapper;

    public AttachmentScanResultConsumer(
            ClaimAttachmentService attachmentService,
            WarrantyMetricsService metricsService,
            ObjectMapper objectMapper
    ) {
        this.attachmentService = attachmentService;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
    }

    /**
     * @param records Batch of consumer records
     * @param acknowledgment Manual acknowledgment
     */
    @KafkaListener(
            topics = SCAN_RESULTS_TOPIC,
            groupId = "${spring.kafka.consumer.group-id:warranty-service}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeScanResults(List<ConsumerRecord<String, String>> records, Acknowledgment acknowledgment) {
        if (records == null || records.isEmpty()) {
            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
            return;
        }

        int applied = 0;
        try {
            for (ScanResultMessage result : parseMessages(records)) {
                try {
                    attachmentService.recordScanResult(result.getAttachmentId(), result.isPassed(), result.getDetail());
                    applied++;
                } catch (ResourceNotFoundException e) {
                    logger.warn("Scan result for unknown attachment {}, skipping", result.getAttachmentId());
                    metricsService.recordError("UNKNOWN_ATTACHMENT", "consumeScanResults");
                }
            }

            if (acknowledgment != null) {
                acknowledgment.acknowledge();
            }
            logger.info("Applied {} of {} scan results", applied, records.size());

        } catch (RuntimeException e) {
            logger.error("Error applying scan results from partition {}", records.get(0).partition(), e);
            metricsService.recordError("SCAN_RESULT_ERROR", "consumeScanResults");
            // Not acknowledged: Kafka redelivers the batch
            throw e;
        }
    }

    private List<ScanResultMessage> parseMessages(List<ConsumerRecord<String, String>> records) {
        List<ScanResultMessage> messages = new ArrayList<>(records.size());
        for (ConsumerRecord<String, String> record : records) {
            try {
                ScanResultMessage message = objectMapper.readValue(record.value(), ScanResultMessage.class);
                if (message.getAttachmentId() == null) {
                    logger.warn("Scan result without attachment id at partition {}, offset {}",
                            record.partition(), record.offset());
                    continue;
                }
                messages.add(message);
            } catch (JsonProcessingException e) {
                logger.error("Failed to parse scan result from partition {}, offset {}",
                        record.partition(), record.offset(), e);
                metricsService.recordError("MESSAGE_PARSE_ERROR", "parseMessages");
            }
        }
        return messages;
    }
}
