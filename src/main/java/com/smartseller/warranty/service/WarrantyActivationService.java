package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;
import com.smartseller.warranty.exception.ConflictException;
import com.smartseller.warranty.exception.DependencyFailureException;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidArgumentException.FieldViolation;
import com.smartseller.warranty.exception.InvalidStateException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.cache.RedisCacheService;
import com.smartseller.warranty.infrastructure.catalog.CustomerContact;
import com.smartseller.warranty.infrastructure.catalog.CustomerDirectory;
import com.smartseller.warranty.infrastructure.messaging.KafkaProducerService;
import com.smartseller.warranty.infrastructure.messaging.NotificationSink;
import com.smartseller.warranty.infrastructure.messaging.events.WarrantyEvent;
import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.repository.WarrantyBarcodeRepository;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.security.Role;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Warranty activation: binds a GENERATED barcode to a customer and starts the warranty clock.
 *
 * Activation is serialized per barcode by the compare-and-set on status = GENERATED; of two
 * concurrent activations exactly one succeeds and the other gets a conflict.
 *
 * @author Warranty Platform Team
 */
@Service
public class WarrantyActivationService {

    private static final Logger logger = LoggerFactory.getLogger(WarrantyActivationService.class);

    static final int MAX_RETAILER_LENGTH = 255;

    private final WarrantyRecordStore recordStore;
    private final WarrantyBarcodeRepository barcodeRepository;
    private final CustomerDirectory customerDirectory;
    private final RedisCacheService cacheService;
    private final KafkaProducerService kafkaProducerService;
    private final NotificationSink notificationSink;
    private final WarrantyMetricsService metricsService;
    private final Clock clock;

    public WarrantyActivationService(
            WarrantyRecordStore recordStore,
            WarrantyBarcodeRepository barcodeRepository,
            CustomerDirectory customerDirectory,
            RedisCacheService cacheService,
            KafkaProducerService kafkaProducerService,
            NotificationSink notificationSink,
            WarrantyMetricsService metricsService,
            Clock clock
    ) {
        this.recordStore = recordStore;
        this.barcodeRepository = barcodeRepository;
        this.customerDirectory = customerDirectory;
        this.cacheService = cacheService;
        this.kafkaProducerService = kafkaProducerService;
        this.notificationSink = notificationSink;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Activate a barcode for a customer.
     *
     * @throws InvalidArgumentException on malformed input
     * @throws ForbiddenException if a customer activates for someone else
     * @throws ResourceNotFoundException if the barcode is unknown
     * @throws ConflictException if the barcode was already activated
     */
    public WarrantyBarcode activate(ActivateCommand command, Actor actor) {
        Instant now = clock.instant();
        validate(command, now);

        String customerId = resolveCustomer(command);
        if (!actor.isStaff() && !customerId.equals(actor.getActorId())) {
            metricsService.recordActivation("rejected");
            throw new ForbiddenException("Customers can only activate warranties for themselves");
        }
        if (!actor.isStaff() && !actor.hasRole(Role.CUSTOMER)) {
            throw new ForbiddenException("Caller cannot activate warranties");
        }

        WarrantyBarcode barcode = recordStore.getByString(command.barcodeNumber)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyBarcode", command.barcodeNumber));
        checkActivatable(barcode);

        String email = snapshotEmail(customerId, command.customerEmail);
        ActivationRecord record = ActivationRecord.builder()
                .activatedAt(now)
                .periodMonths(barcode.getWarrantyPeriodMonths())
                .customerId(customerId)
                .customerEmail(email)
                .purchaseDate(command.purchaseDate)
                .retailer(command.retailer)
                .invoiceNumber(command.invoiceNumber)
                .serialNumber(command.serialNumber)
                .purchasePrice(command.purchasePrice)
                .build();

        if (!recordStore.activate(barcode.getBarcodeId(), record)) {
            metricsService.recordActivation("conflict");
            logger.warn("Concurrent activation lost for barcode {}", command.barcodeNumber);
            throw new ConflictException("already_activated", "Barcode " + command.barcodeNumber + " is already activated");
        }

        WarrantyBarcode activated = recordStore.getById(barcode.getBarcodeId());
        cacheService.evictValidation(activated.getBarcodeNumber());
        metricsService.recordActivation("success");
        publishActivated(activated, actor);
        notifyCustomer(activated);

        logger.info("Activated barcode {} for customer {} until {}",
                activated.getBarcodeNumber(), customerId, activated.getExpiryDate());
        return activated;
    }

    /**
     * Full warranty detail. Readable by the bound customer and by staff.
     */
    public WarrantyBarcode getWarranty(String barcodeNumber, Actor actor) {
        WarrantyBarcode barcode = recordStore.getByString(barcodeNumber)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyBarcode", barcodeNumber));
        if (!actor.isStaff() && !actor.getActorId().equals(barcode.getCustomerId())) {
            throw new ForbiddenException("Warranty belongs to another customer");
        }
        return barcode;
    }

    /**
     * Warranties bound to a customer, newest activation first.
     */
    public List<WarrantyBarcode> listCustomerWarranties(String customerId, Actor actor) {
        if (!actor.isStaff() && !actor.getActorId().equals(customerId)) {
            throw new ForbiddenException("Cannot list another customer's warranties");
        }
        return barcodeRepository.findByCustomerIdOrderByActivatedAtDesc(customerId);
    }

    /**
     * Revoke a barcode and drop its public cache entry.
     */
    public WarrantyBarcode revoke(String barcodeNumber, String reason, Actor actor) {
        WarrantyBarcode barcode = recordStore.getByString(barcodeNumber)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyBarcode", barcodeNumber));
        WarrantyBarcode revoked = recordStore.revoke(barcode.getBarcodeId(), reason, actor);
        cacheService.evictValidation(barcodeNumber);
        kafkaProducerService.publishEvent(new WarrantyEvent(WarrantyEvent.EventType.BARCODE_REVOKED,
                "WarrantyBarcode", revoked.getBarcodeId(), actor.getActorId(), clock.instant())
                .with("barcodeNumber", barcodeNumber)
                .with("reason", reason));
        return revoked;
    }

    private void validate(ActivateCommand command, Instant now) {
        List<FieldViolation> violations = new ArrayList<>();
        if (!BarcodeFormat.isValid(command.barcodeNumber)) {
            violations.add(new FieldViolation("barcodeNumber", "Malformed barcode", command.barcodeNumber));
        }
        if (isBlank(command.customerId) && isBlank(command.customerEmail)) {
            violations.add(new FieldViolation("customerId", "Customer reference or e-mail is required", null));
        }
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        if (command.purchaseDate != null && command.purchaseDate.isAfter(today)) {
            violations.add(new FieldViolation("purchaseDate", "Purchase date cannot be in the future", command.purchaseDate));
        }
        if (command.purchasePrice != null && command.purchasePrice.signum() < 0) {
            violations.add(new FieldViolation("purchasePrice", "Purchase price cannot be negative", command.purchasePrice));
        }
        if (command.retailer != null && command.retailer.length() > MAX_RETAILER_LENGTH) {
            violations.add(new FieldViolation("retailer", "Retailer must be at most " + MAX_RETAILER_LENGTH + " characters",
                    command.retailer));
        }
        if (!violations.isEmpty()) {
            throw new InvalidArgumentException(violations);
        }
    }

    private String resolveCustomer(ActivateCommand command) {
        if (!isBlank(command.customerId)) {
            return command.customerId;
        }
        return customerDirectory.lookupCustomerByEmail(command.customerEmail)
                .orElseThrow(() -> new InvalidArgumentException("customerEmail", "Unknown customer", command.customerEmail));
    }

    private void checkActivatable(WarrantyBarcode barcode) {
        BarcodeStatus status = barcode.getStatus();
        if (status == BarcodeStatus.GENERATED) {
            return;
        }
        metricsService.recordActivation("conflict");
        if (status == BarcodeStatus.REVOKED) {
            throw new InvalidStateException("WarrantyBarcode", barcode.getBarcodeId(), status.name(), List.of(),
                    "Barcode " + barcode.getBarcodeNumber() + " has been revoked");
        }
        throw new ConflictException("already_activated", "Barcode " + barcode.getBarcodeNumber() + " is already activated");
    }

    private String snapshotEmail(String customerId, String providedEmail) {
        try {
            return customerDirectory.lookupContact(customerId)
                    .map(CustomerContact::getEmail)
                    .orElse(providedEmail);
        } catch (DependencyFailureException e) {
            logger.warn("Customer directory unavailable, activating {} without e-mail snapshot", customerId);
            return providedEmail;
        }
    }

    private void publishActivated(WarrantyBarcode barcode, Actor actor) {
        kafkaProducerService.publishEvent(new WarrantyEvent(WarrantyEvent.EventType.BARCODE_ACTIVATED,
                "WarrantyBarcode", barcode.getBarcodeId(), actor.getActorId(), barcode.getActivatedAt())
                .with("barcodeNumber", barcode.getBarcodeNumber())
                .with("productId", barcode.getProductId())
                .with("customerId", barcode.getCustomerId())
                .with("expiryDate", barcode.getExpiryDate()));
    }

    private void notifyCustomer(WarrantyBarcode barcode) {
        if (barcode.getCustomerEmail() == null) {
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("barcodeNumber", barcode.getBarcodeNumber());
        payload.put("warrantyPeriod", barcode.warrantyPeriodLabel());
        payload.put("expiryDate", barcode.getExpiryDate());
        notificationSink.notify(barcode.getCustomerEmail(), "warranty-activated", payload);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Input of activation.
     */
    @Builder
    public static class ActivateCommand {
        private final String barcodeNumber;
        private final String customerId;
        private final String customerEmail;
        private final String retailer;
        private final String invoiceNumber;
        private final String serialNumber;
        private final LocalDate purchaseDate;
        private final BigDecimal purchasePrice;
    }
}
