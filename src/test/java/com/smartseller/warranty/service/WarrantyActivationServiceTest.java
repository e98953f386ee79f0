package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;
import com.smartseller.warranty.exception.ConflictException;
import com.smartseller.warranty.exception.DependencyFailureException;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidStateException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.cache.RedisCacheService;
import com.smartseller.warranty.infrastructure.catalog.CustomerContact;
import com.smartseller.warranty.infrastructure.catalog.CustomerDirectory;
import com.smartseller.warranty.infrastructure.messaging.KafkaProducerService;
import com.smartseller.warranty.infrastructure.messaging.NotificationSink;
import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.repository.WarrantyBarcodeRepository;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.security.Role;
import com.smartseller.warranty.service.WarrantyActivationService.ActivateCommand;
import com.smartseller.warranty.testutil.WarrantyTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WarrantyActivationService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("WarrantyActivationService Unit Tests")
class WarrantyActivationServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");
    private static final String BARCODE = "WB-2024-0K3J9Z2QXA";
    private static final Actor CUSTOMER = Actor.of(WarrantyTestData.CUSTOMER_ID, Role.CUSTOMER);
    private static final Actor AGENT = Actor.of("agent-1", Role.AGENT);

    @Mock
    private WarrantyRecordStore recordStore;

    @Mock
    private WarrantyBarcodeRepository barcodeRepository;

    @Mock
    private CustomerDirectory customerDirectory;

    @Mock
    private RedisCacheService cacheService;

    @Mock
    private KafkaProducerService kafkaProducerService;

    @Mock
    private NotificationSink notificationSink;

    @Mock
    private WarrantyMetricsService metricsService;

    private WarrantyActivationService activationService;
    private WarrantyBarcode generated;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        activationService = new WarrantyActivationService(recordStore, barcodeRepository, customerDirectory,
                cacheService, kafkaProducerService, notificationSink, metricsService, clock);
        generated = WarrantyTestData.generatedBarcode(BARCODE);
    }

    private ActivateCommand.ActivateCommandBuilder command() {
        return ActivateCommand.builder()
                .barcodeNumber(BARCODE)
                .customerId(WarrantyTestData.CUSTOMER_ID)
                .retailer("ElectroMart")
                .invoiceNumber("INV-1001")
                .serialNumber("SN-778812")
                .purchaseDate(LocalDate.of(2024, 3, 10))
                .purchasePrice(new BigDecimal("499.00"));
    }

    private WarrantyBarcode activatedCopy() {
        WarrantyBarcode activated = WarrantyTestData.activeBarcode(BARCODE, NOW, 12);
        activated.setBarcodeId(generated.getBarcodeId());
        return activated;
    }

    // ========================================
    // activate() Tests
    // ========================================

    @Test
    @DisplayName("activate - Customer activates own barcode, expiry from activation time")
    void activate_Success() {
        // Given
        when(recordStore.getByString(BARCODE)).thenReturn(Optional.of(generated));
        when(customerDirectory.lookupContact(WarrantyTestData.CUSTOMER_ID)).thenReturn(Optional.of(
                new CustomerContact(WarrantyTestData.CUSTOMER_ID, "Jane Doe", WarrantyTestData.CUSTOMER_EMAIL, null, null)));
        when(recordStore.activate(eq(generated.getBarcodeId()), any())).thenReturn(true);
        when(recordStore.getById(generated.getBarcodeId())).thenReturn(activatedCopy());

        // When
        WarrantyBarcode result = activationService.activate(command().build(), CUSTOMER);

        // Then
        ArgumentCaptor<ActivationRecord> captor = ArgumentCaptor.forClass(ActivationRecord.class);
        verify(recordStore).activate(eq(generated.getBarcodeId()), captor.capture());
        ActivationRecord record = captor.getValue();
        assertThat(record.getActivatedAt()).isEqualTo(NOW);
        assertThat(record.getPeriodMonths()).isEqualTo(12);
        assertThat(record.getCustomerEmail()).isEqualTo(WarrantyTestData.CUSTOMER_EMAIL);
        assertThat(record.getSerialNumber()).isEqualTo("SN-778812");

        assertThat(result.getStatus()).isEqualTo(BarcodeStatus.ACTIVE);
        verify(cacheService).evictValidation(BARCODE);
        verify(kafkaProducerService).publishEvent(any());
        verify(notificationSink).notify(eq(WarrantyTestData.CUSTOMER_EMAIL), eq("warranty-activated"), anyMap());
        verify(metricsService).recordActivation("success");
    }

    @Test
    @DisplayName("activate - Losing the status race reports already_activated")
    void activate_LostRace_Conflict() {
        // Given
        when(recordStore.getByString(BARCODE)).thenReturn(Optional.of(generated));
        when(customerDirectory.lookupContact(anyString())).thenReturn(Optional.empty());
        when(recordStore.activate(anyString(), any())).thenReturn(false);

        // When / Then
        assertThatThrownBy(() -> activationService.activate(command().build(), CUSTOMER))
                .isInstanceOf(ConflictException.class)
                .extracting(e -> ((ConflictException) e).getReason())
                .isEqualTo("already_activated");
        verify(kafkaProducerService, never()).publishEvent(any());
        verify(metricsService).recordActivation("conflict");
    }

    @Test
    @DisplayName("activate - Already active barcode conflicts without touching the store")
    void activate_AlreadyActive_Conflict() {
        // Given
        when(recordStore.getByString(BARCODE)).thenReturn(Optional.of(activatedCopy()));

        // When / Then
        assertThatThrownBy(() -> activationService.activate(command().build(), CUSTOMER))
                .isInstanceOf(ConflictException.class);
        verify(recordStore, never()).activate(anyString(), any());
    }

    @Test
    @DisplayName("activate - Revoked barcode reports invalid state")
    void activate_Revoked_InvalidState() {
        // Given
        generated.setStatus(BarcodeStatus.REVOKED);
        when(recordStore.getByString(BARCODE)).thenReturn(Optional.of(generated));

        // When / Then
        assertThatThrownBy(() -> activationService.activate(command().build(), CUSTOMER))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    @DisplayName("activate - Customer cannot activate for another customer")
    void activate_ForOtherCustomer_Forbidden() {
        // When / Then
        assertThatThrownBy(() -> activationService.activate(command().customerId("cust-999").build(), CUSTOMER))
                .isInstanceOf(ForbiddenException.class);
        verify(recordStore, never()).getByString(anyString());
    }

    @Test
    @DisplayName("activate - Agent activates on behalf of a customer found by e-mail")
    void activate_AgentByEmail() {
        // Given
        when(customerDirectory.lookupCustomerByEmail(WarrantyTestData.CUSTOMER_EMAIL))
                .thenReturn(Optional.of(WarrantyTestData.CUSTOMER_ID));
        when(customerDirectory.lookupContact(WarrantyTestData.CUSTOMER_ID))
                .thenThrow(new DependencyFailureException("customer-directory", "down", null));
        when(recordStore.getByString(BARCODE)).thenReturn(Optional.of(generated));
        when(recordStore.activate(anyString(), any())).thenReturn(true);
        when(recordStore.getById(generated.getBarcodeId())).thenReturn(activatedCopy());

        // When
        activationService.activate(command().customerId(null).customerEmail(WarrantyTestData.CUSTOMER_EMAIL).build(),
                AGENT);

        // Then
        ArgumentCaptor<ActivationRecord> captor = ArgumentCaptor.forClass(ActivationRecord.class);
        verify(recordStore).activate(anyString(), captor.capture());
        assertThat(captor.getValue().getCustomerId()).isEqualTo(WarrantyTestData.CUSTOMER_ID);
        assertThat(captor.getValue().getCustomerEmail()).isEqualTo(WarrantyTestData.CUSTOMER_EMAIL);
    }

    @Test
    @DisplayName("activate - Unknown barcode is not found")
    void activate_UnknownBarcode_NotFound() {
        // Given
        when(recordStore.getByString(BARCODE)).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> activationService.activate(command().build(), CUSTOMER))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("activate - Malformed input reported field by field")
    void activate_InvalidInput() {
        // Given
        ActivateCommand invalid = command()
                .barcodeNumber("not-a-barcode")
                .purchaseDate(LocalDate.of(2024, 4, 1))
                .purchasePrice(new BigDecimal("-1"))
                .build();

        // When / Then
        assertThatThrownBy(() -> activationService.activate(invalid, CUSTOMER))
                .isInstanceOf(InvalidArgumentException.class)
                .satisfies(e -> assertThat(((InvalidArgumentException) e).getViolations())
                        .extracting(InvalidArgumentException.FieldViolation::getField)
                        .containsExactlyInAnyOrder("barcodeNumber", "purchaseDate", "purchasePrice"));
        verifyNoInteractions(recordStore);
    }

    // ========================================
    // getWarranty() / revoke() Tests
    // ========================================

    @Test
    @DisplayName("getWarranty - Other customers are forbidden")
    void getWarranty_OtherCustomer_Forbidden() {
        // Given
        when(recordStore.getByString(BARCODE)).thenReturn(Optional.of(activatedCopy()));

        // When / Then
        assertThatThrownBy(() -> activationService.getWarranty(BARCODE, Actor.of("cust-999", Role.CUSTOMER)))
                .isInstanceOf(ForbiddenException.class);
        assertThat(activationService.getWarranty(BARCODE, CUSTOMER).getBarcodeNumber()).isEqualTo(BARCODE);
    }

    @Test
    @DisplayName("revoke - Evicts the public cache entry and publishes an event")
    void revoke_EvictsCache() {
        // Given
        Actor admin = Actor.of("admin-1", Role.ADMIN);
        WarrantyBarcode revoked = activatedCopy();
        revoked.setStatus(BarcodeStatus.REVOKED);
        when(recordStore.getByString(BARCODE)).thenReturn(Optional.of(activatedCopy()));
        when(recordStore.revoke(generated.getBarcodeId(), "Fraud", admin)).thenReturn(revoked);

        // When
        WarrantyBarcode result = activationService.revoke(BARCODE, "Fraud", admin);

        // Then
        assertThat(result.getStatus()).isEqualTo(BarcodeStatus.REVOKED);
        verify(cacheService).evictValidation(BARCODE);
        verify(kafkaProducerService).publishEvent(any());
    }
}
