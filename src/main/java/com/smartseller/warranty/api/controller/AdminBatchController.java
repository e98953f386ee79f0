package com.smartseller.warranty.api.controller;

import com.smartseller.warranty.api.dto.BatchResponse;
import com.smartseller.warranty.api.dto.CancelBatchRequest;
import com.smartseller.warranty.api.dto.CollisionResponse;
import com.smartseller.warranty.api.dto.CreateBatchRequest;
import com.smartseller.warranty.api.dto.PageResponse;
import com.smartseller.warranty.api.dto.WarrantyResponse;
import com.smartseller.warranty.domain.model.BarcodeBatch;
import com.smartseller.warranty.domain.model.BarcodeBatch.BatchStatus;
import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.security.SecurityUtils;
import com.smartseller.warranty.service.BatchGenerationService;
import com.smartseller.warranty.service.BatchGenerationService.BatchFilter;
import com.smartseller.warranty.service.BatchGenerationService.BatchProgress;
import com.smartseller.warranty.service.BatchGenerationService.CreateBatchCommand;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
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

/**
 * REST controller for barcode batch administration.
 * Creating, starting and cancelling batches is admin-only; agents may read.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1/admin/batches")
public class AdminBatchController {

    private static final Logger logger = LoggerFactory.getLogger(AdminBatchController.class);

    private final BatchGenerationService batchService;
    private final Clock clock;

    public AdminBatchController(BatchGenerationService batchService, Clock clock) {
        this.batchService = batchService;
        this.clock = clock;
    }

    /**
     * Create a batch in PENDING. Generation begins with a separate start call.
     */
    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<BatchResponse> createBatch(@Valid @RequestBody CreateBatchRequest request) {
        logger.info("Creating batch - product: {}, quantity: {}, prefix: {}",
                request.getProductId(), request.getQuantity(), request.getPrefix());

        CreateBatchCommand command = CreateBatchCommand.builder()
                .productId(request.getProductId())
                .storefrontId(request.getStorefrontId())
                .quantity(request.getQuantity())
                .prefix(request.getPrefix())
                .expiryMonths(request.getExpiryMonths())
                .priority(request.getPriority())
                .maxRetries(request.getMaxRetries())
                .description(request.getDescription())
                .tags(request.getTags())
                .notes(request.getNotes())
                .notifyOnComplete(request.getNotifyOnComplete())
                .build();
        BarcodeBatch batch = batchService.createBatch(command, SecurityUtils.currentActor());

        return ResponseEntity.status(HttpStatus.CREATED).body(BatchResponse.fromEntity(batch));
    }

    /**
     * Start generation. Returns 202: the batch runs in the background.
     */
    @PostMapping("/{batchId}/start")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<BatchResponse> startBatch(@PathVariable String batchId) {
        BarcodeBatch batch = batchService.startBatch(batchId, SecurityUtils.currentActor());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(BatchResponse.fromEntity(batch));
    }

    @PostMapping("/{batchId}/cancel")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<BatchResponse> cancelBatch(
            @PathVariable String batchId,
            @Valid @RequestBody(required = false) CancelBatchRequest request
    ) {
        String reason = request != null ? request.getReason() : null;
        boolean force = request != null && request.isForce();
        BarcodeBatch batch = batchService.cancelBatch(batchId, reason, force, SecurityUtils.currentActor());
        return ResponseEntity.ok(BatchResponse.fromEntity(batch));
    }

    @GetMapping("/{batchId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<BatchResponse> getBatch(@PathVariable String batchId) {
        return ResponseEntity.ok(BatchResponse.fromEntity(batchService.getBatch(batchId)));
    }

    /**
     * Progress snapshot with generation rate and estimated completion.
     */
    @GetMapping("/{batchId}/progress")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<BatchResponse> getProgress(@PathVariable String batchId) {
        BatchProgress progress = batchService.getProgress(batchId);
        BatchResponse response = BatchResponse.fromEntity(progress.getBatch());
        response.setGenerationRate(progress.getGenerationRate());
        response.setEstimatedCompletion(progress.getEstimatedCompletion());
        return ResponseEntity.ok(response);
    }

    @GetMapping
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<PageResponse<BatchResponse>> listBatches(
            @RequestParam(required = false) BatchStatus status,
            @RequestParam(required = false) Priority priority,
            @RequestParam(required = false) String productId,
            @RequestParam(required = false) String storefrontId,
            @RequestParam(required = false) String createdBy,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdTo,
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        BatchFilter filter = BatchFilter.builder()
                .status(status)
                .priority(priority)
                .productId(productId)
                .storefrontId(storefrontId)
                .createdBy(createdBy)
                .createdFrom(createdFrom)
                .createdTo(createdTo)
                .build();
        return ResponseEntity.ok(PageResponse.from(batchService.listBatches(filter, pageable), BatchResponse::fromEntity));
    }

    @GetMapping("/{batchId}/collisions")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<PageResponse<CollisionResponse>> listCollisions(
            @PathVariable String batchId,
            @PageableDefault(size = 50) Pageable pageable
    ) {
        return ResponseEntity.ok(PageResponse.from(batchService.listCollisions(batchId, pageable),
                CollisionResponse::fromEntity));
    }

    @GetMapping("/{batchId}/barcodes")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<PageResponse<WarrantyResponse>> listBarcodes(
            @PathVariable String batchId,
            @PageableDefault(size = 100) Pageable pageable
    ) {
        Instant now = clock.instant();
        return ResponseEntity.ok(PageResponse.from(batchService.listBarcodes(batchId, pageable),
                barcode -> WarrantyResponse.fromEntity(barcode, now)));
    }
}
