package com.smartseller.warranty.api.controller;

import com.smartseller.warranty.api.dto.ActivateWarrantyRequest;
import com.smartseller.warranty.api.dto.ReasonRequest;
import com.smartseller.warranty.api.dto.WarrantyResponse;
import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.security.SecurityUtils;
import com.smartseller.warranty.service.WarrantyActivationService;
import com.smartseller.warranty.service.WarrantyActivationService.ActivateCommand;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for authenticated warranty operations: activation, detail and revocation.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1/warranties")
public class WarrantyController {

    private static final Logger logger = LoggerFactory.getLogger(WarrantyController.class);

    private final WarrantyActivationService activationService;
    private final Clock clock;

    public WarrantyController(WarrantyActivationService activationService, Clock clock) {
        this.activationService = activationService;
        this.clock = clock;
    }

    /**
     * Activate a barcode. Customers activate for themselves; agents name the customer by id or
     * e-mail. With neither given the caller is the customer.
     */
    @PostMapping("/{barcodeNumber}/activate")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<WarrantyResponse> activate(
            @PathVariable String barcodeNumber,
            @Valid @RequestBody ActivateWarrantyRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        String customerId = request.getCustomerId();
        if (customerId == null && request.getCustomerEmail() == null) {
            customerId = actor.getActorId();
        }
        logger.info("Activating barcode {} for customer {}", barcodeNumber, customerId);

        ActivateCommand command = ActivateCommand.builder()
                .barcodeNumber(barcodeNumber)
                .customerId(customerId)
                .customerEmail(request.getCustomerEmail())
                .retailer(request.getRetailer())
                .invoiceNumber(request.getInvoiceNumber())
                .serialNumber(request.getSerialNumber())
                .purchaseDate(request.getPurchaseDate())
                .purchasePrice(request.getPurchasePrice())
                .build();
        WarrantyBarcode barcode = activationService.activate(command, actor);

        return ResponseEntity.ok(WarrantyResponse.fromEntity(barcode, clock.instant()));
    }

    @GetMapping("/{barcodeNumber}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<WarrantyResponse> getWarranty(@PathVariable String barcodeNumber) {
        WarrantyBarcode barcode = activationService.getWarranty(barcodeNumber, SecurityUtils.currentActor());
        return ResponseEntity.ok(WarrantyResponse.fromEntity(barcode, clock.instant()));
    }

    /**
     * Warranties of the caller, or of the named customer for agents.
     */
    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<WarrantyResponse>> listWarranties(
            @RequestParam(required = false) String customerId
    ) {
        Actor actor = SecurityUtils.currentActor();
        String target = customerId != null ? customerId : actor.getActorId();
        Instant now = clock.instant();
        List<WarrantyResponse> warranties = activationService.listCustomerWarranties(target, actor).stream()
                .map(barcode -> WarrantyResponse.fromEntity(barcode, now))
                .collect(Collectors.toList());
        return ResponseEntity.ok(warranties);
    }

    @PostMapping("/{barcodeNumber}/revoke")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<WarrantyResponse> revoke(
            @PathVariable String barcodeNumber,
            @Valid @RequestBody ReasonRequest request
    ) {
        WarrantyBarcode barcode = activationService.revoke(barcodeNumber, request.getReason(),
                SecurityUtils.currentActor());
        return ResponseEntity.ok(WarrantyResponse.fromEntity(barcode, clock.instant()));
    }
}
