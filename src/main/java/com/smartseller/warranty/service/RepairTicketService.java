package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.ClaimAction;
import com.smartseller.warranty.domain.model.ClaimStatus;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent.EventType;
import com.smartseller.warranty.domain.model.Priority;
import com.smartseller.warranty.domain.model.RepairTicket;
import com.smartseller.warranty.domain.model.RepairTicket.CustomerApprovalStatus;
import com.smartseller.warranty.domain.model.RepairTicket.QualityCheckStatus;
import com.smartseller.warranty.domain.model.RepairTicket.TicketStatus;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import com.smartseller.warranty.exception.ConflictException;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidArgumentException.FieldViolation;
import com.smartseller.warranty.exception.InvalidStateException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.messaging.NotificationSink;
import com.smartseller.warranty.repository.RepairTicketRepository;
import com.smartseller.warranty.repository.WarrantyClaimRepository;
import com.smartseller.warranty.security.Actor;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repair ticket engine: the technician-side workflow of a claim.
 *
 * A ticket gates its claim: the claim may only move to repaired or replaced once the ticket is
 * completed, quality-approved and, where required, approved by the customer. Completing a ticket
 * never drives the claim; starting one does.
 *
 * @author Warranty Platform Team
 */
@Service
public class RepairTicketService {

    private static final Logger logger = LoggerFactory.getLogger(RepairTicketService.class);

    static final int MIN_DESCRIPTION_LENGTH = 10;
    static final int MAX_TEXT_LENGTH = 2000;
    static final BigDecimal MIN_ESTIMATED_HOURS = new BigDecimal("0.1");
    static final BigDecimal MAX_ESTIMATED_HOURS = new BigDecimal("1000");

    private final RepairTicketRepository ticketRepository;
    private final WarrantyClaimRepository claimRepository;
    private final ClaimWorkflow workflow;
    private final NumberSequenceService sequenceService;
    private final NotificationSink notificationSink;
    private final Clock clock;

    @Value("${warranty.repair.customer-approval-threshold:500.00}")
    private BigDecimal customerApprovalThreshold;

    public RepairTicketService(
            RepairTicketRepository ticketRepository,
            WarrantyClaimRepository claimRepository,
            ClaimWorkflow workflow,
            NumberSequenceService sequenceService,
            NotificationSink notificationSink,
            Clock clock
    ) {
        this.ticketRepository = ticketRepository;
        this.claimRepository = claimRepository;
        this.workflow = workflow;
        this.sequenceService = sequenceService;
        this.notificationSink = notificationSink;
        this.clock = clock;
    }

    /**
     * Open a ticket for an assigned claim.
     *
     * @throws InvalidStateException if the claim is not assigned
     * @throws ConflictException if the claim already has a live ticket
     */
    @Transactional
    public RepairTicket createTicket(String claimId, CreateTicketCommand command, Actor actor) {
        requireStaff(actor, "create repair tickets");
        WarrantyClaim claim = loadClaim(claimId);
        if (claim.getStatus() != ClaimStatus.ASSIGNED) {
            throw new InvalidStateException("WarrantyClaim", claimId, claim.getStatus().name(),
                    actionNames(claim), "Repair tickets can only be opened for assigned claims");
        }
        if (findLiveTicket(claimId).isPresent()) {
            throw new ConflictException("ticket_exists", "Claim " + claim.getClaimNumber() + " already has a live repair ticket");
        }
        validate(command);

        boolean approvalRequired = Boolean.TRUE.equals(command.customerApprovalRequired);
        RepairTicket ticket = newTicket(claim, command.description,
                command.priority != null ? command.priority : claim.getPriority());
        ticket.setEstimatedHours(command.estimatedHours);
        ticket.setEstimatedCompletionDate(command.estimatedCompletionDate != null
                ? command.estimatedCompletionDate : claim.getEstimatedCompletionDate());
        ticket.setRequiredParts(command.requiredParts);
        ticket.setSpecialInstructions(command.specialInstructions);
        ticket.setCustomerApprovalRequired(approvalRequired);
        ticket.setCustomerApprovalStatus(approvalRequired
                ? CustomerApprovalStatus.PENDING : CustomerApprovalStatus.NOT_REQUIRED);

        RepairTicket saved = ticketRepository.save(ticket);
        logger.info("Opened repair ticket {} for claim {}", saved.getTicketNumber(), claim.getClaimNumber());
        notifyTechnician(saved, "repair-ticket-assigned");
        return saved;
    }

    /**
     * Assign or reassign the technician of a ticket. The claim follows.
     */
    @Transactional
    public RepairTicket assign(String ticketId, String technicianId, LocalDate estimatedCompletionDate, Actor actor) {
        requireStaff(actor, "assign repair tickets");
        if (isBlank(technicianId)) {
            throw new InvalidArgumentException("technicianId", "Technician is required", technicianId);
        }
        RepairTicket ticket = loadTicket(ticketId);
        if (ticket.getStatus() == TicketStatus.COMPLETED || ticket.getStatus() == TicketStatus.CANCELLED) {
            throw new InvalidStateException("RepairTicket", ticketId, ticket.getStatus().name(), List.of(),
                    "Ticket " + ticket.getTicketNumber() + " can no longer be reassigned");
        }

        ticket.setTechnicianId(technicianId);
        ticket.setAssignedAt(clock.instant());
        if (estimatedCompletionDate != null) {
            ticket.setEstimatedCompletionDate(estimatedCompletionDate);
        }
        if (ticket.getStatus() == TicketStatus.PENDING) {
            ticket.setStatus(TicketStatus.ASSIGNED);
        }

        WarrantyClaim claim = loadClaim(ticket.getClaimId());
        claim.setAssignedTechnicianId(technicianId);
        claimRepository.save(claim);

        RepairTicket saved = ticketRepository.save(ticket);
        logger.info("Ticket {} assigned to technician {}", saved.getTicketNumber(), technicianId);
        notifyTechnician(saved, "repair-ticket-assigned");
        return saved;
    }

    /**
     * Start work on a ticket. Drives the claim from assigned to in_repair.
     */
    @Transactional
    public RepairTicket start(String ticketId, Actor actor) {
        RepairTicket ticket = loadTicket(ticketId);
        requireWorker(ticket, actor);
        if (ticket.getStatus() != TicketStatus.ASSIGNED) {
            throw new InvalidStateException("RepairTicket", ticketId, ticket.getStatus().name(), List.of(),
                    "Only assigned tickets can be started");
        }

        WarrantyClaim claim = loadClaim(ticket.getClaimId());
        if (claim.getStatus() != ClaimStatus.IN_REPAIR) {
            workflow.transition(claim, ClaimAction.START, null, actor,
                    "Repair started under ticket " + ticket.getTicketNumber());
        }

        ticket.setStatus(TicketStatus.IN_PROGRESS);
        ticket.setStartedAt(clock.instant());
        return ticketRepository.save(ticket);
    }

    /**
     * Put the claim's live ticket in progress, opening a default one when the claim has none.
     * Used when an agent starts the repair from the claim side; the caller moves the claim.
     */
    RepairTicket startForClaim(WarrantyClaim claim) {
        RepairTicket ticket = findLiveTicket(claim.getClaimId()).orElseGet(() -> {
            RepairTicket created = newTicket(claim, "Repair for claim " + claim.getClaimNumber()
                    + ": " + truncate(claim.getIssueDescription(), 1900), claim.getPriority());
            created.setEstimatedCompletionDate(claim.getEstimatedCompletionDate());
            logger.info("Opened default repair ticket {} for claim {}", created.getTicketNumber(), claim.getClaimNumber());
            return created;
        });
        if (ticket.getStatus() == TicketStatus.PENDING || ticket.getStatus() == TicketStatus.ASSIGNED) {
            ticket.setStatus(TicketStatus.IN_PROGRESS);
            ticket.setStartedAt(clock.instant());
        }
        return ticketRepository.save(ticket);
    }

    /**
     * Record the end of a repair round. The total is written once per round; a total above the
     * configured threshold makes customer approval required.
     */
    @Transactional
    public RepairTicket complete(String ticketId, CompleteTicketCommand command, Actor actor) {
        RepairTicket ticket = loadTicket(ticketId);
        requireWorker(ticket, actor);
        if (ticket.getStatus() != TicketStatus.IN_PROGRESS) {
            throw new InvalidStateException("RepairTicket", ticketId, ticket.getStatus().name(), List.of(),
                    "Only tickets in progress can be completed");
        }
        validate(command);

        ticket.setActualHours(command.actualHours);
        ticket.setUsedParts(command.usedParts);
        ticket.setRepairNotes(command.repairNotes);
        ticket.setTestResults(command.testResults);
        ticket.recordCompletion(command.laborCost, command.partsCost, clock.instant());

        boolean approvalRequested = false;
        if (ticket.getTotalCost().compareTo(customerApprovalThreshold) > 0
                && ticket.getCustomerApprovalStatus() == CustomerApprovalStatus.NOT_REQUIRED) {
            ticket.setCustomerApprovalRequired(true);
            ticket.setCustomerApprovalStatus(CustomerApprovalStatus.PENDING);
            approvalRequested = true;
        }

        WarrantyClaim claim = loadClaim(ticket.getClaimId());
        claim.setRepairCost(ticket.getTotalCost());
        claimRepository.save(claim);

        RepairTicket saved = ticketRepository.save(ticket);
        logger.info("Ticket {} completed, total cost {}", saved.getTicketNumber(), saved.getTotalCost());

        if (approvalRequested && claim.getCustomerEmail() != null) {
            Map<String, Object> payload = new HashMap<>();
            payload.put("claimNumber", claim.getClaimNumber());
            payload.put("ticketNumber", saved.getTicketNumber());
            payload.put("totalCost", saved.getTotalCost());
            String recipient = claim.getCustomerEmail();
            AfterCommit.run(() -> notificationSink.notify(recipient, "repair-approval-required", payload));
        }
        return saved;
    }

    /**
     * Quality check of a completed round. Rejection reopens the same ticket for another round.
     */
    @Transactional
    public RepairTicket qualityCheck(String ticketId, boolean approved, String notes, Actor actor) {
        requireStaff(actor, "perform quality checks");
        RepairTicket ticket = loadTicket(ticketId);
        if (ticket.getStatus() != TicketStatus.COMPLETED
                || ticket.getQualityCheckStatus() != QualityCheckStatus.PENDING) {
            throw new InvalidStateException("RepairTicket", ticketId, ticket.getStatus().name(), List.of(),
                    "Ticket " + ticket.getTicketNumber() + " is not awaiting a quality check");
        }

        ticket.setQualityCheckedBy(actor.getActorId());
        ticket.setQualityCheckedAt(clock.instant());
        ticket.setQualityNotes(notes);

        if (approved) {
            ticket.setQualityCheckStatus(QualityCheckStatus.APPROVED);
            logger.info("Ticket {} passed quality check", ticket.getTicketNumber());
        } else {
            ticket.reopen();
            WarrantyClaim claim = loadClaim(ticket.getClaimId());
            workflow.append(claim.getClaimId(), EventType.QUALITY_REJECTED,
                    "Quality check failed for ticket " + ticket.getTicketNumber()
                            + (isBlank(notes) ? "" : ": " + notes),
                    actor, false, claim.getStatus(), claim.getStatus());
            logger.info("Ticket {} failed quality check and was reopened", ticket.getTicketNumber());
        }
        return ticketRepository.save(ticket);
    }

    /**
     * The bound customer approves or declines a ticket awaiting their approval.
     */
    @Transactional
    public RepairTicket customerApproval(String ticketId, boolean approved, String notes, Actor actor) {
        RepairTicket ticket = loadTicket(ticketId);
        WarrantyClaim claim = loadClaim(ticket.getClaimId());
        if (!actor.getActorId().equals(claim.getCustomerId())) {
            throw new ForbiddenException("Only the claim owner can approve the repair");
        }
        if (ticket.getCustomerApprovalStatus() != CustomerApprovalStatus.PENDING) {
            throw new InvalidStateException("RepairTicket", ticketId, ticket.getCustomerApprovalStatus().name(),
                    List.of(), "Ticket " + ticket.getTicketNumber() + " is not awaiting customer approval");
        }

        ticket.setCustomerApprovedAt(clock.instant());
        ticket.setCustomerApprovalNotes(notes);
        if (approved) {
            ticket.setCustomerApprovalStatus(CustomerApprovalStatus.APPROVED);
            workflow.append(claim.getClaimId(), EventType.CUSTOMER_APPROVED,
                    "Customer approved repair ticket " + ticket.getTicketNumber(),
                    actor, true, claim.getStatus(), claim.getStatus());
        } else {
            ticket.setCustomerApprovalStatus(CustomerApprovalStatus.REJECTED);
            workflow.append(claim.getClaimId(), EventType.STATUS_UPDATED,
                    "Customer declined repair ticket " + ticket.getTicketNumber(),
                    actor, true, claim.getStatus(), claim.getStatus());
        }
        logger.info("Customer {} {} ticket {}", actor.getActorId(), approved ? "approved" : "declined",
                ticket.getTicketNumber());
        return ticketRepository.save(ticket);
    }

    @Transactional(readOnly = true)
    public RepairTicket getTicket(String ticketId, Actor actor) {
        RepairTicket ticket = loadTicket(ticketId);
        if (!actor.isStaff() && !actor.getActorId().equals(ticket.getTechnicianId())) {
            WarrantyClaim claim = loadClaim(ticket.getClaimId());
            if (!actor.getActorId().equals(claim.getCustomerId())) {
                throw new ForbiddenException("Ticket belongs to another claim");
            }
        }
        return ticket;
    }

    @Transactional(readOnly = true)
    public List<RepairTicket> listByClaim(String claimId, Actor actor) {
        WarrantyClaim claim = loadClaim(claimId);
        if (!actor.isStaff()
                && !actor.getActorId().equals(claim.getCustomerId())
                && !actor.getActorId().equals(claim.getAssignedTechnicianId())) {
            throw new ForbiddenException("Claim belongs to another customer");
        }
        return ticketRepository.findByClaimIdOrderByCreatedAtDesc(claimId);
    }

    @Transactional(readOnly = true)
    public Page<RepairTicket> listByTechnician(String technicianId, Pageable pageable, Actor actor) {
        if (!actor.isStaff() && !actor.getActorId().equals(technicianId)) {
            throw new ForbiddenException("Technicians can only list their own tickets");
        }
        return ticketRepository.findByTechnicianIdOrderByCreatedAtDesc(technicianId, pageable);
    }

    /**
     * The live (non-cancelled) ticket of a claim, if any.
     */
    public Optional<RepairTicket> findLiveTicket(String claimId) {
        return ticketRepository.findFirstByClaimIdAndStatusNotOrderByCreatedAtDesc(claimId, TicketStatus.CANCELLED);
    }

    private RepairTicket newTicket(WarrantyClaim claim, String description, Priority priority) {
        String technicianId = claim.getAssignedTechnicianId();
        return RepairTicket.builder()
                .ticketNumber(sequenceService.next(NumberSequenceService.REPAIR_TICKET))
                .claimId(claim.getClaimId())
                .status(technicianId != null ? TicketStatus.ASSIGNED : TicketStatus.PENDING)
                .priority(priority)
                .technicianId(technicianId)
                .assignedAt(technicianId != null ? clock.instant() : null)
                .description(description)
                .build();
    }

    private void validate(CreateTicketCommand command) {
        List<FieldViolation> violations = new ArrayList<>();
        if (command.description == null || command.description.trim().length() < MIN_DESCRIPTION_LENGTH
                || command.description.length() > MAX_TEXT_LENGTH) {
            violations.add(new FieldViolation("description",
                    "Description must be " + MIN_DESCRIPTION_LENGTH + ".." + MAX_TEXT_LENGTH + " characters", null));
        }
        if (command.estimatedHours != null
                && (command.estimatedHours.compareTo(MIN_ESTIMATED_HOURS) < 0
                    || command.estimatedHours.compareTo(MAX_ESTIMATED_HOURS) > 0)) {
            violations.add(new FieldViolation("estimatedHours",
                    "Estimated hours must be between 0.1 and 1000", command.estimatedHours));
        }
        if (command.estimatedCompletionDate != null
                && command.estimatedCompletionDate.isBefore(LocalDate.now(clock))) {
            violations.add(new FieldViolation("estimatedCompletionDate",
                    "Estimated completion date cannot be in the past", command.estimatedCompletionDate));
        }
        if (!violations.isEmpty()) {
            throw new InvalidArgumentException(violations);
        }
    }

    private void validate(CompleteTicketCommand command) {
        List<FieldViolation> violations = new ArrayList<>();
        if (command.laborCost == null || command.laborCost.signum() < 0) {
            violations.add(new FieldViolation("laborCost", "Labor cost is required and cannot be negative", command.laborCost));
        }
        if (command.partsCost == null || command.partsCost.signum() < 0) {
            violations.add(new FieldViolation("partsCost", "Parts cost is required and cannot be negative", command.partsCost));
        }
        if (command.actualHours != null && command.actualHours.signum() < 0) {
            violations.add(new FieldViolation("actualHours", "Actual hours cannot be negative", command.actualHours));
        }
        if (!violations.isEmpty()) {
            throw new InvalidArgumentException(violations);
        }
    }

    private void requireStaff(Actor actor, String operation) {
        if (!actor.isStaff()) {
            throw new ForbiddenException("Only agents can " + operation);
        }
    }

    private void requireWorker(RepairTicket ticket, Actor actor) {
        if (!actor.isStaff() && !actor.getActorId().equals(ticket.getTechnicianId())) {
            throw new ForbiddenException("Ticket " + ticket.getTicketNumber() + " is assigned to another technician");
        }
    }

    private void notifyTechnician(RepairTicket ticket, String templateId) {
        if (ticket.getTechnicianId() == null) {
            return;
        }
        Map<String, Object> payload = new HashMap<>();
        payload.put("ticketNumber", ticket.getTicketNumber());
        payload.put("priority", ticket.getPriority());
        payload.put("estimatedCompletionDate", ticket.getEstimatedCompletionDate());
        String recipient = ticket.getTechnicianId();
        AfterCommit.run(() -> notificationSink.notify(recipient, templateId, payload));
    }

    private RepairTicket loadTicket(String ticketId) {
        return ticketRepository.findById(ticketId)
                .orElseThrow(() -> new ResourceNotFoundException("RepairTicket", ticketId));
    }

    private WarrantyClaim loadClaim(String claimId) {
        return claimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyClaim", claimId));
    }

    private static List<String> actionNames(WarrantyClaim claim) {
        List<String> names = new ArrayList<>();
        claim.getStatus().allowedActions().forEach(action -> names.add(action.name()));
        return names;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Input of ticket creation.
     */
    @Builder
    public static class CreateTicketCommand {
        private final Priority priority;
        private final BigDecimal estimatedHours;
        private final LocalDate estimatedCompletionDate;
        private final String description;
        private final String requiredParts;
        private final String specialInstructions;
        private final Boolean customerApprovalRequired;
    }

    /**
     * Input of ticket completion.
     */
    @Builder
    public static class CompleteTicketCommand {
        private final BigDecimal actualHours;
        private final String usedParts;
        private final String repairNotes;
        private final String testResults;
        private final BigDecimal laborCost;
        private final BigDecimal partsCost;
    }
}
