package com.smartseller.warranty.infrastructure.messaging;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smartseller.warranty.infrastructure.messaging.events.WarrantyEvent;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for KafkaProducerService.
 */
@ExtendWith(MockitoExtension.class)
class KafkaProducerServiceTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private KafkaProducerService producerService;

    @BeforeEach
    void setUp() {
        producerService = new KafkaProducerService(kafkaTemplate, objectMapper);
    }

    @Test
    @DisplayName("notify - Keyed by recipient on the notification topic")
    void notify_KeyedByRecipient() throws Exception {
        // Arrange
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(new CompletableFuture<>());

        // Act
        producerService.notify("admin-1", "batch_completed", Map.of("batchNumber", "BATCH-2024-000001"));

        // Assert
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(KafkaProducerService.NOTIFICATION_TOPIC), eq("admin-1"), body.capture());
        JsonNode json = objectMapper.readTree(body.getValue());
        assertThat(json.get("templateId").asText()).isEqualTo("batch_completed");
        assertThat(json.get("payload").get("batchNumber").asText()).isEqualTo("BATCH-2024-000001");
    }

    @Test
    @DisplayName("requestScan - Returns true once the send is handed to the producer")
    void requestScan_Accepted() {
        // Arrange
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(new CompletableFuture<>());

        // Act
        boolean accepted = producerService.requestScan("att-1", "s3://claims/claim-1/receipt.jpg", "image/jpeg");

        // Assert
        assertThat(accepted).isTrue();
        verify(kafkaTemplate).send(eq(KafkaProducerService.SCAN_REQUEST_TOPIC), eq("att-1"), contains("receipt.jpg"));
    }

    @Test
    @DisplayName("requestScan - Producer failure reported as not accepted")
    void requestScan_ProducerFailure() {
        // Arrange
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenThrow(new KafkaException("broker down"));

        // Act / Assert
        assertThat(producerService.requestScan("att-1", "s3://claims/claim-1/receipt.jpg", "image/jpeg")).isFalse();
    }

    @Test
    @DisplayName("publishEvent - Keyed by aggregate id; a failed send does not propagate")
    void publishEvent_FailedSendSwallowed() {
        // Arrange
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("timeout")));
        WarrantyEvent event = new WarrantyEvent(WarrantyEvent.EventType.BARCODE_ACTIVATED, "WarrantyBarcode",
                "barcode-1", "cust-001", Instant.parse("2024-06-01T12:00:00Z"))
                .with("barcodeNumber", "WB-2024-0K3J9Z2QXA");

        // Act / Assert
        assertDoesNotThrow(() -> producerService.publishEvent(event));
        verify(kafkaTemplate).send(eq(KafkaProducerService.EVENT_TOPIC), eq("barcode-1"),
                contains("BARCODE_ACTIVATED"));
    }
}
