package com.smartseller.warranty.infrastructure.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartseller.warranty.infrastructure.cache.RedisCacheService;
import com.smartseller.warranty.infrastructure.lock.RedisDistributedLock;
import com.smartseller.warranty.infrastructure.messaging.events.ScanResultMessage;
import com.smartseller.warranty.service.ClaimAttachmentService;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.test.EmbeddedKafkaBroker;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.kafka.test.utils.KafkaTestUtils;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * Messaging tests for the attachment scanner bridge against an embedded Kafka broker:
 * scan requests go out keyed by attachment id, scan verdicts come back through the listener.
 */
@SpringBootTest(properties = {
        "spring.kafka.bootstrap-servers=${spring.embedded.kafka.brokers}",
        "warranty.kafka.listener.auto-startup=true",
        "warranty.kafka.listener.concurrency=1"
})
@EmbeddedKafka(partitions = 1, topics = {
        KafkaProducerService.SCAN_REQUEST_TOPIC,
        AttachmentScanResultConsumer.SCAN_RESULTS_TOPIC
})
@DisplayName("Attachment Scan Messaging Tests")
class AttachmentScanMessagingTest {

    @Autowired
    private KafkaProducerService kafkaProducerService;

    @Autowired
    private KafkaTemplate<String, String> kafkaTemplate;

    @Autowired
    private EmbeddedKafkaBroker embeddedKafka;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ClaimAttachmentService attachmentService;

    @MockBean
    private RedisCacheService redisCacheService;

    @MockBean
    private RedisDistributedLock distributedLock;

    private Consumer<String, String> testConsumer;

    @AfterEach
    void tearDown() {
        if (testConsumer != null) {
            testConsumer.close();
        }
    }

    // ========================================
    // Scan request Tests
    // ========================================

    @Test
    @DisplayName("requestScan - Request lands on the scan topic keyed by attachment id")
    void requestScan_PublishesRequest() throws Exception {
        // Given
        Map<String, Object> consumerProps = KafkaTestUtils.consumerProps("scan-request-test", "true", embeddedKafka);
        testConsumer = new DefaultKafkaConsumerFactory<String, String>(consumerProps).createConsumer();
        embeddedKafka.consumeFromAnEmbeddedTopic(testConsumer, KafkaProducerService.SCAN_REQUEST_TOPIC);

        // When
        boolean accepted = kafkaProducerService.requestScan("att-42", "s3://claims/claim-7/photo.png", "image/png");

        // Then
        assertThat(accepted).isTrue();
        ConsumerRecord<String, String> record =
                KafkaTestUtils.getSingleRecord(testConsumer, KafkaProducerService.SCAN_REQUEST_TOPIC);
        assertThat(record.key()).isEqualTo("att-42");
        JsonNode body = objectMapper.readTree(record.value());
        assertThat(body.get("storageRef").asText()).isEqualTo("s3://claims/claim-7/photo.png");
        assertThat(body.get("mimeType").asText()).isEqualTo("image/png");
    }

    // ========================================
    // Scan result Tests
    // ========================================

    @Test
    @DisplayName("consumeScanResults - Verdict published by the scanner is recorded")
    void scanResult_RecordedOnAttachment() throws Exception {
        // Given
        String verdict = objectMapper.writeValueAsString(new ScanResultMessage("att-77", false, "EICAR-Test-File"));

        // When
        kafkaTemplate.send(AttachmentScanResultConsumer.SCAN_RESULTS_TOPIC, "att-77", verdict);

        // Then
        verify(attachmentService, timeout(15000)).recordScanResult("att-77", false, "EICAR-Test-File");
    }
}
