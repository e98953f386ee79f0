package com.smartseller.warranty.api.controller;

import com.smartseller.warranty.api.dto.BulkStatusUpdateRequest;
import com.smartseller.warranty.api.dto.BulkUpdateResponse;
import com.smartseller.warranty.api.dto.ClaimResponse;
import com.smartseller.warranty.api.dto.ClaimTransitionRequest;
import com.smartseller.warranty.api.dto.CostUpdateRequest;
import com.smartseller.warranty.api.dto.FeedbackRequest;
import com.smartseller.warranty.api.dto.NoteRequest;
import com.smartseller.warranty.api.dto.PageResponse;
import com.smartseller.warranty.api.dto.StatusUpdateRequest;
import com.smartseller.warranty.api.dto.SubmitClaimRequest;
import com.smartseller.warranty.api.dto.TimelineEventResponse;
import com.smartseller.warranty.domain.model.ActorType;
import com.smartseller.warranty.domain.model.ClaimAttachment;
import com.smartseller.warranty.domain.model.ClaimStatus;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent;
import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.domain.model.Severity;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.security.SecurityUtils;
import com.smartseller.warranty.service.ClaimAttachmentService;
import com.smartseller.warranty.service.WarrantyClaimService;
import com.smartseller.warranty.service.WarrantyClaimService.BulkItemResult;
import com.smartseller.warranty.service.WarrantyClaimService.ClaimFilter;
import com.smartseller.warranty.service.WarrantyClaimService.CostUpdate;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for the warranty claim workflow.
 *
 * Each transition has its own endpoint; PUT /status takes the action in the body and
 * /bulk-status applies one action to many claims. Authorization beyond authentication
 * is decided by the service from the caller's roles and the claim's bindings.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1/claims")
public class ClaimController {

    private static final Logger logger = LoggerFactory.getLogger(ClaimController.class);

    private final WarrantyClaimService claimService;
    private final ClaimAttachmentService attachmentService;

    public ClaimController(WarrantyClaimService claimService, ClaimAttachmentService attachmentService) {
        this.claimService = claimService;
        this.attachmentService = attachmentService;
    }

    /**
     * Submit a claim against an active warranty.
     *
     * @param request Claim details
     * @return The created claim in PENDING
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ClaimResponse> submitClaim(@Valid @RequestBody SubmitClaimRequest request) {
        Actor actor = SecurityUtils.currentActor();
        logger.info("Submitting claim - barcode: {}, actor: {}", request.getBarcodeNumber(), actor.getActorId());

        WarrantyClaim claim = claimService.submit(request.toCommand(), actor);

        logger.info("Claim {} submitted for barcode {}", claim.getClaimNumber(), claim.getBarcodeNumber());
        return ResponseEntity.status(HttpStatus.CREATED).body(detail(claim, actor));
    }

    @GetMapping("/{claimId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ClaimResponse> getClaim(@PathVariable String claimId) {
        Actor actor = SecurityUtils.currentActor();
        return ResponseEntity.ok(detail(claimService.getClaim(claimId, actor), actor));
    }

    /**
     * Claim list. Technicians see their assignments, customers their own claims.
     */
    @GetMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PageResponse<ClaimResponse>> listClaims(
            @RequestParam(required = false) ClaimStatus status,
            @RequestParam(required = false) Priority priority,
            @RequestParam(required = false) Severity severity,
            @RequestParam(required = false) String customerId,
            @RequestParam(required = false) String technicianId,
            @RequestParam(required = false) String storefrontId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant claimFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant claimTo,
            @PageableDefault(size = 20, sort = "claimDate", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        Actor actor = SecurityUtils.currentActor();
        ClaimFilter filter = ClaimFilter.builder()
                .status(status)
                .priority(priority)
                .severity(severity)
                .customerId(customerId)
                .technicianId(technicianId)
                .storefrontId(storefrontId)
                .claimFrom(claimFrom)
                .claimTo(claimTo)
                .build();
        return ResponseEntity.ok(PageResponse.from(claimService.listClaims(filter, pageable, actor),
                claim -> view(claim, actor)));
    }

    @GetMapping("/my")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<PageResponse<ClaimResponse>> listMyClaims(
            @PageableDefault(size = 20, sort = "claimDate", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        Actor actor = SecurityUtils.currentActor();
        return ResponseEntity.ok(PageResponse.from(claimService.listMyClaims(actor, pageable),
                claim -> view(claim, actor)));
    }

    /**
     * Timeline in sequence order; customers only get the entries visible to them.
     */
    @GetMapping("/{claimId}/timeline")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<TimelineEventResponse>> getTimeline(@PathVariable String claimId) {
        List<ClaimTimelineEvent> events = claimService.getTimeline(claimId, SecurityUtils.currentActor());
        return ResponseEntity.ok(events.stream().map(TimelineEventResponse::fromEntity).collect(Collectors.toList()));
    }

    // ========================================
    // Transitions
    // ========================================

    @PostMapping("/{claimId}/validate")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<ClaimResponse> validateClaim(
            @PathVariable String claimId,
            @Valid @RequestBody(required = false) ClaimTransitionRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        WarrantyClaim claim = claimService.validateClaim(claimId, ClaimTransitionRequest.toCommand(request), actor);
        return ResponseEntity.ok(view(claim, actor));
    }

    @PostMapping("/{claimId}/reject")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<ClaimResponse> rejectClaim(
            @PathVariable String claimId,
            @Valid @RequestBody ClaimTransitionRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        return ResponseEntity.ok(view(claimService.reject(claimId, request.toCommand(), actor), actor));
    }

    @PostMapping("/{claimId}/assign")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<ClaimResponse> assignTechnician(
            @PathVariable String claimId,
            @Valid @RequestBody ClaimTransitionRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        logger.info("Assigning technician {} to claim {}", request.getTechnicianId(), claimId);
        return ResponseEntity.ok(view(claimService.assignTechnician(claimId, request.toCommand(), actor), actor));
    }

    /**
     * Generic transition endpoint; the action travels in the body.
     */
    @PutMapping("/{claimId}/status")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ClaimResponse> updateStatus(
            @PathVariable String claimId,
            @Valid @RequestBody StatusUpdateRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        WarrantyClaim claim = claimService.updateStatus(claimId, request.getAction(), request.toCommand(), actor);
        return ResponseEntity.ok(view(claim, actor));
    }

    @PostMapping("/{claimId}/complete")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<ClaimResponse> completeClaim(
            @PathVariable String claimId,
            @Valid @RequestBody ClaimTransitionRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        return ResponseEntity.ok(view(claimService.complete(claimId, request.toCommand(), actor), actor));
    }

    @PostMapping("/{claimId}/dispute")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ClaimResponse> disputeClaim(
            @PathVariable String claimId,
            @Valid @RequestBody(required = false) ClaimTransitionRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        WarrantyClaim claim = claimService.dispute(claimId, ClaimTransitionRequest.toCommand(request), actor);
        return ResponseEntity.ok(view(claim, actor));
    }

    @PostMapping("/{claimId}/resolve")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<ClaimResponse> resolveDispute(
            @PathVariable String claimId,
            @Valid @RequestBody ClaimTransitionRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        return ResponseEntity.ok(view(claimService.resolveDispute(claimId, request.toCommand(), actor), actor));
    }

    @PostMapping("/{claimId}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ClaimResponse> cancelClaim(
            @PathVariable String claimId,
            @Valid @RequestBody(required = false) ClaimTransitionRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        WarrantyClaim claim = claimService.cancel(claimId, ClaimTransitionRequest.toCommand(request), actor);
        return ResponseEntity.ok(view(claim, actor));
    }

    /**
     * Apply one action to up to 100 claims. Each claim succeeds or fails on its own.
     */
    @PostMapping("/bulk-status")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<BulkUpdateResponse> bulkUpdateStatus(@Valid @RequestBody BulkStatusUpdateRequest request) {
        logger.info("Bulk {} over {} claims", request.getAction(), request.getClaimIds().size());
        List<BulkItemResult> results = claimService.bulkUpdate(request.getClaimIds(), request.getAction(),
                request.toCommand(), SecurityUtils.currentActor());
        return ResponseEntity.ok(BulkUpdateResponse.from(results));
    }

    // ========================================
    // Notes, costs, feedback
    // ========================================

    @PostMapping("/{claimId}/request-info")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<TimelineEventResponse> requestInfo(
            @PathVariable String claimId,
            @Valid @RequestBody NoteRequest request
    ) {
        ClaimTimelineEvent event = claimService.requestInfo(claimId, request.getMessage(), SecurityUtils.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(TimelineEventResponse.fromEntity(event));
    }

    @PostMapping("/{claimId}/notes")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<TimelineEventResponse> addNote(
            @PathVariable String claimId,
            @Valid @RequestBody NoteRequest request
    ) {
        ClaimTimelineEvent event = claimService.addNote(claimId, request.getMessage(), request.isVisibleToCustomer(),
                SecurityUtils.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(TimelineEventResponse.fromEntity(event));
    }

    @PutMapping("/{claimId}/costs")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<ClaimResponse> updateCosts(
            @PathVariable String claimId,
            @Valid @RequestBody CostUpdateRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        CostUpdate costs = CostUpdate.builder()
                .repairCost(request.getRepairCost())
                .shippingCost(request.getShippingCost())
                .replacementCost(request.getReplacementCost())
                .build();
        return ResponseEntity.ok(view(claimService.updateCosts(claimId, costs, actor), actor));
    }

    @PostMapping("/{claimId}/feedback")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ClaimResponse> submitFeedback(
            @PathVariable String claimId,
            @Valid @RequestBody FeedbackRequest request
    ) {
        Actor actor = SecurityUtils.currentActor();
        WarrantyClaim claim = claimService.submitFeedback(claimId, request.getRating(), request.getFeedback(), actor);
        return ResponseEntity.ok(view(claim, actor));
    }

    private ClaimResponse detail(WarrantyClaim claim, Actor actor) {
        List<ClaimAttachment> attachments = attachmentService.listAttachments(claim.getClaimId(), actor);
        return ClaimResponse.fromEntity(claim, attachments, actor.getActorType() != ActorType.CUSTOMER);
    }

    private static ClaimResponse view(WarrantyClaim claim, Actor actor) {
        return ClaimResponse.fromEntity(claim, actor.getActorType() != ActorType.CUSTOMER);
    }
}
