package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.ActorType;
import com.smartseller.warranty.domain.model.ClaimAction;
import com.smartseller.warranty.domain.model.ClaimStatus;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent.EventType;
import com.smartseller.warranty.domain.model.IssueCategory;
import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.domain.model.RepairTicket;
import com.smartseller.warranty.domain.model.ResolutionType;
import com.smartseller.warranty.domain.model.Severity;
import com.smartseller.warranty.domain.model.WarrantyBarcode;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import com.smartseller.warranty.exception.ConflictException;
import com.smartseller.warranty.exception.DependencyFailureException;
import com.smartseller.warranty.exception.ErrorKind;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidArgumentException.FieldViolation;
import com.smartseller.warranty.exception.InvalidStateException;
import com.smartseller.warranty.exception.PayloadTooLargeException;
import com.smartseller.warranty.exception.PreconditionFailedException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.cache.RedisCacheService;
import com.smartseller.warranty.infrastructure.catalog.CustomerContact;
import com.smartseller.warranty.infrastructure.catalog.CustomerDirectory;
import com.smartseller.warranty.infrastructure.messaging.KafkaProducerService;
import com.smartseller.warranty.infrastructure.messaging.NotificationSink;
import com.smartseller.warranty.infrastructure.messaging.events.WarrantyEvent;
import com.smartseller.warranty.infrastructure.metrics.WarrantyMetricsService;
import com.smartseller.warranty.repository.ClaimTimelineEventRepository;
import com.smartseller.warranty.repository.WarrantyClaimRepository;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.service.ClaimAttachmentService.UploadCommand;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Warranty claim service: submission, the agent-driven transition workflow, notes, costs and
 * customer feedback.
 *
 * Every transition runs through {@link ClaimWorkflow}; concurrent writers on the same claim are
 * resolved by its version column and the loser gets a conflict. Notifications go out after commit.
 *
 * @author Warranty Platform Team
 */
@Service
public class WarrantyClaimService {

    private static final Logger logger = LoggerFactory.getLogger(WarrantyClaimService.class);

    static final int MIN_DESCRIPTION_LENGTH = 10;
    static final int MAX_TEXT_LENGTH = 2000;
    static final int MAX_BULK_SIZE = 100;
    static final int MAX_SUBMIT_ATTACHMENTS = 10;

    private static final Set<ClaimStatus> TERMINAL_STATUSES =
            EnumSet.of(ClaimStatus.REJECTED, ClaimStatus.COMPLETED, ClaimStatus.CANCELLED);

    private final WarrantyClaimRepository claimRepository;
    private final ClaimTimelineEventRepository timelineRepository;
    private final ClaimWorkflow workflow;
    private final RepairTicketService repairTicketService;
    private final ClaimAttachmentService attachmentService;
    private final WarrantyRecordStore recordStore;
    private final NumberSequenceService sequenceService;
    private final CustomerDirectory customerDirectory;
    private final RedisCacheService cacheService;
    private final KafkaProducerService kafkaProducerService;
    private final NotificationSink notificationSink;
    private final WarrantyMetricsService metricsService;
    private final TransactionTemplate itemTransaction;
    private final Clock clock;

    public WarrantyClaimService(
            WarrantyClaimRepository claimRepository,
            ClaimTimelineEventRepository timelineRepository,
            ClaimWorkflow workflow,
            RepairTicketService repairTicketService,
            ClaimAttachmentService attachmentService,
            WarrantyRecordStore recordStore,
            NumberSequenceService sequenceService,
            CustomerDirectory customerDirectory,
            RedisCacheService cacheService,
            KafkaProducerService kafkaProducerService,
            NotificationSink notificationSink,
            WarrantyMetricsService metricsService,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.claimRepository = claimRepository;
        this.timelineRepository = timelineRepository;
        this.workflow = workflow;
        this.repairTicketService = repairTicketService;
        this.attachmentService = attachmentService;
        this.recordStore = recordStore;
        this.sequenceService = sequenceService;
        this.customerDirectory = customerDirectory;
        this.cacheService = cacheService;
        this.kafkaProducerService = kafkaProducerService;
        this.notificationSink = notificationSink;
        this.metricsService = metricsService;
        this.itemTransaction = new TransactionTemplate(transactionManager);
        this.itemTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    // ==================== Submission ====================

    /**
     * Submit a claim against an activated barcode.
     *
     * @throws ResourceNotFoundException if the barcode is unknown
     * @throws ForbiddenException if the caller is not the bound customer
     * @throws PreconditionFailedException if the warranty is expired, inactive or already claimed
     * @throws ConflictException if an open claim already exists for the barcode
     * @throws PayloadTooLargeException if an attached file exceeds the size limit
     */
    @Transactional
    public WarrantyClaim submit(SubmitClaimCommand command, Actor actor) {
        Instant now = clock.instant();
        validate(command);

        // Row lock held until commit: concurrent submits on one barcode see each other's claim.
        WarrantyBarcode barcode = recordStore.lockForClaim(command.barcodeNumber)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyBarcode", command.barcodeNumber));
        if (barcode.getCustomerId() != null && !barcode.getCustomerId().equals(actor.getActorId())) {
            throw new ForbiddenException("Warranty " + command.barcodeNumber + " belongs to another customer");
        }
        checkClaimable(barcode, now);
        if (claimRepository.existsByBarcodeIdAndStatusNotIn(barcode.getBarcodeId(), TERMINAL_STATUSES)) {
            throw new ConflictException("claim_exists",
                    "Barcode " + command.barcodeNumber + " already has an open claim");
        }

        CustomerContact contact = lookupContact(barcode.getCustomerId());
        WarrantyClaim claim = WarrantyClaim.builder()
                .claimId(UUID.randomUUID().toString())
                .claimNumber(sequenceService.next(NumberSequenceService.CLAIM))
                .barcodeId(barcode.getBarcodeId())
                .barcodeNumber(barcode.getBarcodeNumber())
                .customerId(barcode.getCustomerId())
                .productId(barcode.getProductId())
                .storefrontId(barcode.getStorefrontId())
                .issueCategory(command.issueCategory)
                .issueDescription(command.issueDescription.trim())
                .issueDate(command.issueDate)
                .severity(command.severity)
                .status(ClaimStatus.PENDING)
                .statusUpdatedAt(now)
                .statusUpdatedBy(actor.getActorId())
                .claimDate(now)
                .createdAt(now)
                .customerName(firstNonBlank(command.customerName, contact == null ? null : contact.getName()))
                .customerEmail(firstNonBlank(command.customerEmail,
                        contact == null ? null : contact.getEmail(), barcode.getCustomerEmail()))
                .customerPhone(firstNonBlank(command.customerPhone, contact == null ? null : contact.getPhone()))
                .pickupAddress(firstNonBlank(command.pickupAddress, contact == null ? null : contact.getAddress()))
                .customerNotes(command.customerNotes)
                .tags(command.tags)
                .build();

        WarrantyClaim saved = claimRepository.save(claim);
        workflow.append(saved.getClaimId(), EventType.SUBMITTED,
                "Claim submitted: " + command.issueCategory.name().toLowerCase() + " issue",
                actor, true, null, ClaimStatus.PENDING);
        // Each file starts with a pending scan; a rejected one rolls back the whole submission.
        for (UploadCommand attachment : command.attachments()) {
            attachmentService.upload(saved.getClaimId(), attachment, actor);
        }
        metricsService.recordClaimSubmitted(command.issueCategory.name());

        logger.info("Claim {} submitted for barcode {} by customer {}",
                saved.getClaimNumber(), saved.getBarcodeNumber(), actor.getActorId());

        WarrantyEvent event = new WarrantyEvent(WarrantyEvent.EventType.CLAIM_SUBMITTED, "WarrantyClaim",
                saved.getClaimId(), actor.getActorId(), now)
                .with("claimNumber", saved.getClaimNumber())
                .with("barcodeNumber", saved.getBarcodeNumber())
                .with("severity", saved.getSeverity());
        String recipient = saved.getCustomerEmail();
        Map<String, Object> payload = new HashMap<>();
        payload.put("claimNumber", saved.getClaimNumber());
        payload.put("status", saved.getStatus());
        AfterCommit.run(() -> {
            kafkaProducerService.publishEvent(event);
            if (recipient != null) {
                notificationSink.notify(recipient, "claim-submitted", payload);
            }
        });
        return saved;
    }

    // ==================== Transitions ====================

    @Transactional
    public WarrantyClaim validateClaim(String claimId, ClaimTransitionCommand command, Actor actor) {
        return execute(claimId, ClaimAction.VALIDATE, command, actor);
    }

    @Transactional
    public WarrantyClaim reject(String claimId, ClaimTransitionCommand command, Actor actor) {
        return execute(claimId, ClaimAction.REJECT, command, actor);
    }

    @Transactional
    public WarrantyClaim assignTechnician(String claimId, ClaimTransitionCommand command, Actor actor) {
        return execute(claimId, ClaimAction.ASSIGN, command, actor);
    }

    /**
     * Apply any action of the transition table with its accompanying data.
     */
    @Transactional
    public WarrantyClaim updateStatus(String claimId, ClaimAction action, ClaimTransitionCommand command, Actor actor) {
        return execute(claimId, action, command, actor);
    }

    @Transactional
    public WarrantyClaim complete(String claimId, ClaimTransitionCommand command, Actor actor) {
        return execute(claimId, ClaimAction.COMPLETE, command, actor);
    }

    @Transactional
    public WarrantyClaim dispute(String claimId, ClaimTransitionCommand command, Actor actor) {
        return execute(claimId, ClaimAction.DISPUTE, command, actor);
    }

    @Transactional
    public WarrantyClaim resolveDispute(String claimId, ClaimTransitionCommand command, Actor actor) {
        return execute(claimId, ClaimAction.RESOLVE, command, actor);
    }

    @Transactional
    public WarrantyClaim cancel(String claimId, ClaimTransitionCommand command, Actor actor) {
        return execute(claimId, ClaimAction.CANCEL, command, actor);
    }

    /**
     * Apply one action to many claims. Each claim runs in its own transaction, so one failure
     * neither blocks nor rolls back the others.
     */
    public List<BulkItemResult> bulkUpdate(List<String> claimIds, ClaimAction action,
                                           ClaimTransitionCommand command, Actor actor) {
        if (claimIds == null || claimIds.isEmpty() || claimIds.size() > MAX_BULK_SIZE) {
            throw new InvalidArgumentException("claimIds",
                    "Between 1 and " + MAX_BULK_SIZE + " claims are required", claimIds == null ? 0 : claimIds.size());
        }
        if (action == null) {
            throw new InvalidArgumentException("action", "Action is required", null);
        }

        List<BulkItemResult> results = new ArrayList<>(claimIds.size());
        for (String claimId : claimIds) {
            ClaimTransitionCommand itemCommand = command.forItem(claimId);
            try {
                WarrantyClaim updated = itemTransaction.execute(status -> execute(claimId, action, itemCommand, actor));
                results.add(BulkItemResult.success(claimId, updated.getStatus()));
            } catch (RuntimeException e) {
                ErrorKind kind = ErrorKind.of(e);
                if (kind == ErrorKind.INTERNAL) {
                    logger.error("Bulk {} failed for claim {}", action, claimId, e);
                    results.add(BulkItemResult.failure(claimId, kind, "Internal error"));
                } else {
                    logger.warn("Bulk {} rejected for claim {}: {}", action, claimId, e.getMessage());
                    results.add(BulkItemResult.failure(claimId, kind, e.getMessage()));
                }
            }
        }
        logger.info("Bulk {} by {}: {} of {} succeeded", action, actor,
                results.stream().filter(BulkItemResult::isSuccess).count(), claimIds.size());
        return results;
    }

    private WarrantyClaim execute(String claimId, ClaimAction action, ClaimTransitionCommand command, Actor actor) {
        WarrantyClaim claim = loadClaim(claimId);
        authorize(claim, action, actor);
        if (workflow.isReplay(command.requestKey, claimId, action)) {
            return claim;
        }
        if (action == ClaimAction.CANCEL && !actor.isStaff() && claim.getStatus() != ClaimStatus.PENDING) {
            metricsService.recordClaimTransitionRejected(action.name());
            throw new ForbiddenException("Customers can only cancel pending claims");
        }
        if (action == ClaimAction.COMPLETE && claim.getStatus() != ClaimStatus.DELIVERED) {
            throw new InvalidStateException("WarrantyClaim", claimId, claim.getStatus().name(),
                    actionNames(claim.getStatus()), "Only delivered claims can be completed");
        }
        workflow.requireAllowed(claim, action);

        ClaimStatus from = claim.getStatus();
        ClaimStatus target = null;
        Instant now = clock.instant();
        String description;

        switch (action) {
            case VALIDATE:
                claim.setValidatedAt(now);
                claim.setValidatedBy(actor.getActorId());
                claim.setPriority(ClaimWorkflow.priorityFor(claim.getSeverity(), claim.getIssueCategory()));
                description = "Claim validated with " + claim.getPriority().name().toLowerCase() + " priority";
                break;
            case REJECT:
                String reason = firstNonBlank(command.reason, command.notes);
                if (reason == null) {
                    throw new InvalidArgumentException("reason", "Rejection reason is required", null);
                }
                claim.setRejectionReason(reason);
                description = "Claim rejected: " + reason;
                break;
            case CANCEL:
                description = "Claim cancelled" + suffix(firstNonBlank(command.reason, command.notes));
                break;
            case ASSIGN:
                applyAssignment(claim, command);
                description = "Assigned to technician " + claim.getAssignedTechnicianId();
                break;
            case START:
                RepairTicket ticket = repairTicketService.startForClaim(claim);
                description = "Repair started under ticket " + ticket.getTicketNumber();
                break;
            case REPAIR:
            case REPLACE:
                if (action == ClaimAction.REPLACE && isBlank(command.replacementProductId)) {
                    throw new InvalidArgumentException("replacementProductId",
                            "Replacement product is required", null);
                }
                requireResolvableTicket(claim);
                if (action == ClaimAction.REPLACE) {
                    claim.setReplacementProductId(command.replacementProductId);
                    description = "Replacement approved with product " + command.replacementProductId;
                } else {
                    description = "Repair completed";
                }
                if (!isBlank(command.repairNotes)) {
                    claim.setInternalNotes(command.repairNotes);
                }
                break;
            case SHIP:
                claim.setShippingProvider(command.shippingProvider);
                claim.setTrackingNumber(command.trackingNumber);
                claim.setShippedAt(now);
                description = "Shipped" + (command.shippingProvider == null ? "" : " via " + command.shippingProvider)
                        + (command.trackingNumber == null ? "" : " (tracking " + command.trackingNumber + ")");
                break;
            case DELIVER:
                claim.setDeliveredAt(now);
                description = "Delivered to customer";
                break;
            case COMPLETE:
                requireResolution(command);
                claim.recordResolution(command.resolutionType, command.resolutionNotes, now);
                description = "Claim completed with " + command.resolutionType.name().toLowerCase() + " resolution";
                break;
            case DISPUTE:
                claim.setStatusBeforeDispute(from);
                description = "Claim disputed" + suffix(firstNonBlank(command.reason, command.notes));
                break;
            case RESOLVE:
                if (command.resolveToCompleted) {
                    requireResolution(command);
                    claim.recordResolution(command.resolutionType, command.resolutionNotes, now);
                    target = ClaimStatus.COMPLETED;
                } else {
                    target = claim.getStatusBeforeDispute();
                    if (target == null) {
                        throw new InvalidStateException("WarrantyClaim", claimId, from.name(),
                                actionNames(from), "Dispute has no prior status to return to");
                    }
                }
                claim.setStatusBeforeDispute(null);
                description = "Dispute resolved, claim returned to " + target.name().toLowerCase();
                break;
            default:
                throw new InvalidArgumentException("action", "Unsupported action", action);
        }

        if (actor.isStaff() && !isBlank(command.notes)) {
            claim.setAdminNotes(command.notes);
        }

        if (!isBlank(command.notes) && !description.endsWith(command.notes)) {
            description = description + suffix(command.notes);
        }
        WarrantyClaim saved = workflow.transition(claim, action, target, actor, description);
        workflow.remember(command.requestKey, saved, action, actor);

        if (saved.getStatus() == ClaimStatus.COMPLETED && saved.getResolutionType() == ResolutionType.REPLACE) {
            consumeBarcode(saved, actor);
        }
        publishStatusChange(saved, from, action, actor);
        return saved;
    }

    private void authorize(WarrantyClaim claim, ClaimAction action, Actor actor) {
        if (actor.isStaff()) {
            return;
        }
        boolean owner = actor.getActorId().equals(claim.getCustomerId());
        if (owner && (action == ClaimAction.DISPUTE || action == ClaimAction.CANCEL)) {
            return;
        }
        metricsService.recordClaimTransitionRejected(action.name());
        throw new ForbiddenException("Caller cannot " + action.name().toLowerCase() + " claim " + claim.getClaimNumber());
    }

    private void applyAssignment(WarrantyClaim claim, ClaimTransitionCommand command) {
        if (isBlank(command.technicianId)) {
            throw new InvalidArgumentException("technicianId", "Technician is required", null);
        }
        if (command.estimatedCompletionDate != null && command.estimatedCompletionDate.isBefore(LocalDate.now(clock))) {
            throw new InvalidArgumentException("estimatedCompletionDate",
                    "Estimated completion date cannot be in the past", command.estimatedCompletionDate);
        }
        claim.setAssignedTechnicianId(command.technicianId);
        claim.setEstimatedCompletionDate(command.estimatedCompletionDate);
        if (command.priority != null) {
            claim.setPriority(command.priority);
        }
    }

    private void requireResolvableTicket(WarrantyClaim claim) {
        boolean resolvable = repairTicketService.findLiveTicket(claim.getClaimId())
                .map(RepairTicket::isResolvable)
                .orElse(false);
        if (!resolvable) {
            throw new PreconditionFailedException("repair_ticket_not_resolved",
                    "Claim " + claim.getClaimNumber() + " needs a completed, approved repair ticket");
        }
    }

    private static void requireResolution(ClaimTransitionCommand command) {
        List<FieldViolation> violations = new ArrayList<>();
        if (command.resolutionType == null) {
            violations.add(new FieldViolation("resolutionType", "Resolution type is required", null));
        }
        if (isBlank(command.resolutionNotes)) {
            violations.add(new FieldViolation("resolutionNotes", "Resolution notes are required", null));
        }
        if (!violations.isEmpty()) {
            throw new InvalidArgumentException(violations);
        }
    }

    /**
     * A replacement consumes the warranty: the barcode moves to CLAIMED.
     */
    private void consumeBarcode(WarrantyClaim claim, Actor actor) {
        // The status CAS clears the persistence context; pending claim changes must reach the database first.
        claimRepository.flush();
        try {
            recordStore.updateStatus(claim.getBarcodeId(), BarcodeStatus.ACTIVE, BarcodeStatus.CLAIMED);
        } catch (ConflictException | InvalidStateException e) {
            logger.warn("Barcode {} of claim {} could not be marked claimed: {}",
                    claim.getBarcodeNumber(), claim.getClaimNumber(), e.getMessage());
            return;
        }
        String barcodeNumber = claim.getBarcodeNumber();
        WarrantyEvent event = new WarrantyEvent(WarrantyEvent.EventType.BARCODE_CLAIMED, "WarrantyBarcode",
                claim.getBarcodeId(), actor.getActorId(), clock.instant())
                .with("barcodeNumber", barcodeNumber)
                .with("claimNumber", claim.getClaimNumber());
        AfterCommit.run(() -> {
            cacheService.evictValidation(barcodeNumber);
            kafkaProducerService.publishEvent(event);
        });
    }

    private void publishStatusChange(WarrantyClaim claim, ClaimStatus from, ClaimAction action, Actor actor) {
        WarrantyEvent event = new WarrantyEvent(WarrantyEvent.EventType.CLAIM_STATUS_CHANGED, "WarrantyClaim",
                claim.getClaimId(), actor.getActorId(), claim.getStatusUpdatedAt())
                .with("claimNumber", claim.getClaimNumber())
                .with("action", action)
                .with("fromStatus", from)
                .with("toStatus", claim.getStatus());
        String recipient = claim.getCustomerEmail();
        Map<String, Object> payload = new HashMap<>();
        payload.put("claimNumber", claim.getClaimNumber());
        payload.put("status", claim.getStatus());
        payload.put("previousStatus", from);
        payload.put("nextSteps", claim.getStatus().nextActionHints());
        AfterCommit.run(() -> {
            kafkaProducerService.publishEvent(event);
            if (recipient != null) {
                notificationSink.notify(recipient, "claim-status-updated", payload);
            }
        });
    }

    // ==================== Notes, costs, feedback ====================

    /**
     * Ask the customer for more information. The claim stays pending.
     */
    @Transactional
    public ClaimTimelineEvent requestInfo(String claimId, String message, Actor actor) {
        requireStaff(actor, "request information");
        if (isBlank(message)) {
            throw new InvalidArgumentException("message", "Message is required", null);
        }
        WarrantyClaim claim = loadClaim(claimId);
        if (claim.getStatus() != ClaimStatus.PENDING) {
            throw new InvalidStateException("WarrantyClaim", claimId, claim.getStatus().name(),
                    actionNames(claim.getStatus()), "Information can only be requested for pending claims");
        }
        ClaimTimelineEvent event = workflow.append(claimId, EventType.STATUS_UPDATED,
                "Additional information requested: " + message, actor, true, ClaimStatus.PENDING, ClaimStatus.PENDING);

        String recipient = claim.getCustomerEmail();
        if (recipient != null) {
            Map<String, Object> payload = new HashMap<>();
            payload.put("claimNumber", claim.getClaimNumber());
            payload.put("message", message);
            AfterCommit.run(() -> notificationSink.notify(recipient, "claim-info-requested", payload));
        }
        return event;
    }

    /**
     * Append a note. Customer notes are always visible to the customer.
     */
    @Transactional
    public ClaimTimelineEvent addNote(String claimId, String note, boolean visibleToCustomer, Actor actor) {
        if (isBlank(note) || note.length() > MAX_TEXT_LENGTH) {
            throw new InvalidArgumentException("note", "Note must be 1.." + MAX_TEXT_LENGTH + " characters", null);
        }
        WarrantyClaim claim = loadClaim(claimId);
        requireReader(claim, actor);
        boolean visible = actor.getActorType() == ActorType.CUSTOMER || visibleToCustomer;
        return workflow.append(claimId, EventType.NOTE_ADDED, note, actor, visible, claim.getStatus(), claim.getStatus());
    }

    /**
     * Set cost components. Null leaves a component unchanged; the total is always their sum.
     */
    @Transactional
    public WarrantyClaim updateCosts(String claimId, CostUpdate costs, Actor actor) {
        requireStaff(actor, "update claim costs");
        List<FieldViolation> violations = new ArrayList<>();
        checkNonNegative(violations, "repairCost", costs.repairCost);
        checkNonNegative(violations, "shippingCost", costs.shippingCost);
        checkNonNegative(violations, "replacementCost", costs.replacementCost);
        if (!violations.isEmpty()) {
            throw new InvalidArgumentException(violations);
        }

        WarrantyClaim claim = loadClaim(claimId);
        if (costs.repairCost != null) {
            claim.setRepairCost(costs.repairCost);
        }
        if (costs.shippingCost != null) {
            claim.setShippingCost(costs.shippingCost);
        }
        if (costs.replacementCost != null) {
            claim.setReplacementCost(costs.replacementCost);
        }
        WarrantyClaim saved = claimRepository.save(claim);
        logger.info("Claim {} costs updated, total {}", saved.getClaimNumber(), saved.getTotalCost());
        return saved;
    }

    /**
     * Customer rating of a completed claim. Accepted once.
     */
    @Transactional
    public WarrantyClaim submitFeedback(String claimId, int rating, String feedback, Actor actor) {
        WarrantyClaim claim = loadClaim(claimId);
        if (!actor.getActorId().equals(claim.getCustomerId())) {
            throw new ForbiddenException("Only the claim owner can leave feedback");
        }
        if (claim.getStatus() != ClaimStatus.COMPLETED) {
            throw new InvalidStateException("WarrantyClaim", claimId, claim.getStatus().name(),
                    actionNames(claim.getStatus()), "Feedback is only accepted for completed claims");
        }
        if (rating < 1 || rating > 5) {
            throw new InvalidArgumentException("rating", "Rating must be between 1 and 5", rating);
        }
        if (feedback != null && feedback.length() > MAX_TEXT_LENGTH) {
            throw new InvalidArgumentException("feedback", "Feedback must be at most " + MAX_TEXT_LENGTH + " characters", null);
        }
        if (claim.getCustomerRating() != null) {
            throw new ConflictException("feedback_exists", "Feedback was already submitted for claim " + claim.getClaimNumber());
        }
        claim.setCustomerRating(rating);
        claim.setCustomerFeedback(feedback);
        return claimRepository.save(claim);
    }

    // ==================== Reads ====================

    @Transactional(readOnly = true)
    public WarrantyClaim getClaim(String claimId, Actor actor) {
        WarrantyClaim claim = loadClaim(claimId);
        requireReader(claim, actor);
        return claim;
    }

    /**
     * Timeline in sequence order. Customers only see the events flagged visible to them.
     */
    @Transactional(readOnly = true)
    public List<ClaimTimelineEvent> getTimeline(String claimId, Actor actor) {
        WarrantyClaim claim = loadClaim(claimId);
        requireReader(claim, actor);
        if (actor.getActorType() == ActorType.CUSTOMER) {
            return timelineRepository.findByClaimIdAndVisibleToCustomerTrueOrderBySequenceAsc(claimId);
        }
        return timelineRepository.findByClaimIdOrderBySequenceAsc(claimId);
    }

    /**
     * Filtered listing. Technicians are narrowed to their own claims and customers to theirs.
     */
    @Transactional(readOnly = true)
    public Page<WarrantyClaim> listClaims(ClaimFilter filter, Pageable pageable, Actor actor) {
        String customerId = filter.customerId;
        String technicianId = filter.technicianId;
        if (!actor.isStaff()) {
            if (actor.getActorType() == ActorType.TECHNICIAN) {
                technicianId = actor.getActorId();
            } else {
                customerId = actor.getActorId();
            }
        }
        return claimRepository.search(filter.status, filter.priority, filter.severity, customerId, technicianId,
                filter.storefrontId, filter.claimFrom, filter.claimTo, pageable);
    }

    @Transactional(readOnly = true)
    public Page<WarrantyClaim> listMyClaims(Actor actor, Pageable pageable) {
        return claimRepository.findByCustomerIdOrderByClaimDateDesc(actor.getActorId(), pageable);
    }

    private void requireReader(WarrantyClaim claim, Actor actor) {
        if (actor.isStaff()
                || actor.getActorId().equals(claim.getCustomerId())
                || actor.getActorId().equals(claim.getAssignedTechnicianId())) {
            return;
        }
        throw new ForbiddenException("Claim " + claim.getClaimNumber() + " belongs to another customer");
    }

    // ==================== Helpers ====================

    private void validate(SubmitClaimCommand command) {
        List<FieldViolation> violations = new ArrayList<>();
        if (isBlank(command.barcodeNumber)) {
            violations.add(new FieldViolation("barcodeNumber", "Barcode is required", null));
        }
        if (command.issueCategory == null) {
            violations.add(new FieldViolation("issueCategory", "Issue category is required", null));
        }
        if (command.severity == null) {
            violations.add(new FieldViolation("severity", "Severity is required", null));
        }
        String description = command.issueDescription == null ? "" : command.issueDescription.trim();
        if (description.length() < MIN_DESCRIPTION_LENGTH || description.length() > MAX_TEXT_LENGTH) {
            violations.add(new FieldViolation("issueDescription",
                    "Description must be " + MIN_DESCRIPTION_LENGTH + ".." + MAX_TEXT_LENGTH + " characters",
                    description.length()));
        }
        if (command.issueDate != null && command.issueDate.isAfter(LocalDate.now(clock))) {
            violations.add(new FieldViolation("issueDate", "Issue date cannot be in the future", command.issueDate));
        }
        if (command.attachments().size() > MAX_SUBMIT_ATTACHMENTS) {
            violations.add(new FieldViolation("attachments",
                    "At most " + MAX_SUBMIT_ATTACHMENTS + " attachments per submission", command.attachments().size()));
        }
        if (!violations.isEmpty()) {
            throw new InvalidArgumentException(violations);
        }
    }

    private void checkClaimable(WarrantyBarcode barcode, Instant now) {
        BarcodeStatus status = barcode.getStatus();
        if (status == BarcodeStatus.CLAIMED) {
            throw new PreconditionFailedException("already_claimed",
                    "Warranty " + barcode.getBarcodeNumber() + " has already been claimed");
        }
        if (status != BarcodeStatus.ACTIVE) {
            throw new PreconditionFailedException("warranty_inactive",
                    "Warranty " + barcode.getBarcodeNumber() + " is not active");
        }
        if (barcode.isExpiredAt(now)) {
            throw new PreconditionFailedException("warranty_expired",
                    "Warranty " + barcode.getBarcodeNumber() + " expired on " + barcode.getExpiryDate());
        }
    }

    private CustomerContact lookupContact(String customerId) {
        try {
            return customerDirectory.lookupContact(customerId).orElse(null);
        } catch (DependencyFailureException e) {
            logger.warn("Customer directory unavailable, submitting claim without contact snapshot for {}", customerId);
            return null;
        }
    }

    private void requireStaff(Actor actor, String operation) {
        if (!actor.isStaff()) {
            throw new ForbiddenException("Only agents can " + operation);
        }
    }

    private WarrantyClaim loadClaim(String claimId) {
        return claimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyClaim", claimId));
    }

    private static void checkNonNegative(List<FieldViolation> violations, String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            violations.add(new FieldViolation(field, "Cost cannot be negative", value));
        }
    }

    private static List<String> actionNames(ClaimStatus status) {
        List<String> names = new ArrayList<>();
        status.allowedActions().forEach(action -> names.add(action.name()));
        return names;
    }

    private static String suffix(String text) {
        return isBlank(text) ? "" : ": " + text;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (!isBlank(value)) {
                return value;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Input of claim submission.
     */
    @Builder
    public static class SubmitClaimCommand {
        private final String barcodeNumber;
        private final IssueCategory issueCategory;
        private final String issueDescription;
        private final LocalDate issueDate;
        private final Severity severity;
        private final String customerName;
        private final String customerEmail;
        private final String customerPhone;
        private final String pickupAddress;
        private final String customerNotes;
        private final String tags;
        private final List<UploadCommand> attachments;

        List<UploadCommand> attachments() {
            return attachments == null ? List.of() : attachments;
        }
    }

    /**
     * Data accompanying a transition. Each action reads the fields it needs.
     */
    @Builder(toBuilder = true)
    public static class ClaimTransitionCommand {
        private final String notes;
        private final String reason;
        private final String repairNotes;
        private final String technicianId;
        private final LocalDate estimatedCompletionDate;
        private final Priority priority;
        private final String replacementProductId;
        private final String shippingProvider;
        private final String trackingNumber;
        private final ResolutionType resolutionType;
        private final String resolutionNotes;
        private final boolean resolveToCompleted;
        private final String requestKey;

        public static ClaimTransitionCommand empty() {
            return ClaimTransitionCommand.builder().build();
        }

        ClaimTransitionCommand forItem(String claimId) {
            if (requestKey == null || requestKey.isBlank()) {
                return this;
            }
            return toBuilder().requestKey(requestKey + ":" + claimId).build();
        }
    }

    /**
     * Claim list filter; null fields do not narrow.
     */
    @Builder
    public static class ClaimFilter {
        private final ClaimStatus status;
        private final Priority priority;
        private final Severity severity;
        private final String customerId;
        private final String technicianId;
        private final String storefrontId;
        private final Instant claimFrom;
        private final Instant claimTo;
    }

    @Builder
    public static class CostUpdate {
        private final BigDecimal repairCost;
        private final BigDecimal shippingCost;
        private final BigDecimal replacementCost;
    }

    /**
     * Outcome of one claim in a bulk update.
     */
    public static class BulkItemResult {
        private final String claimId;
        private final boolean success;
        private final ClaimStatus status;
        private final ErrorKind errorKind;
        private final String message;

        private BulkItemResult(String claimId, boolean success, ClaimStatus status, ErrorKind errorKind, String message) {
            this.claimId = claimId;
            this.success = success;
            this.status = status;
            this.errorKind = errorKind;
            this.message = message;
        }

        static BulkItemResult success(String claimId, ClaimStatus status) {
            return new BulkItemResult(claimId, true, status, null, null);
        }

        static BulkItemResult failure(String claimId, ErrorKind errorKind, String message) {
            return new BulkItemResult(claimId, false, null, errorKind, message);
        }

        public String getClaimId() { return claimId; }
        public boolean isSuccess() { return success; }
        public ClaimStatus getStatus() { return status; }
        public ErrorKind getErrorKind() { return errorKind; }
        public String getMessage() { return message; }
    }
}
