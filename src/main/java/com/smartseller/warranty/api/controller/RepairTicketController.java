package com.smartseller.warranty.api.controller;

import com.smartseller.warranty.api.dto.AssignTicketRequest;
import com.smartseller.warranty.api.dto.CompleteTicketRequest;
import com.smartseller.warranty.api.dto.CreateTicketRequest;
import com.smartseller.warranty.api.dto.DecisionRequest;
import com.smartseller.warranty.api.dto.PageResponse;
import com.smartseller.warranty.api.dto.TicketResponse;
import com.smartseller.warranty.domain.model.RepairTicket;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.security.SecurityUtils;
import com.smartseller.warranty.service.RepairTicketService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.web.PageableDefault;
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

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for repair tickets.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1")
public class RepairTicketController {

    private static final Logger logger = LoggerFactory.getLogger(RepairTicketController.class);

    private final RepairTicketService ticketService;

    public RepairTicketController(RepairTicketService ticketService) {
        this.ticketService = ticketService;
    }

    @PostMapping("/claims/{claimId}/tickets")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<TicketResponse> createTicket(
            @PathVariable String claimId,
            @Valid @RequestBody CreateTicketRequest request
    ) {
        RepairTicket ticket = ticketService.createTicket(claimId, request.toCommand(), SecurityUtils.currentActor());
        logger.info("Ticket {} opened for claim {}", ticket.getTicketNumber(), claimId);
        return ResponseEntity.status(HttpStatus.CREATED).body(TicketResponse.fromEntity(ticket));
    }

    @GetMapping("/claims/{claimId}/tickets")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<TicketResponse>> listClaimTickets(@PathVariable String claimId) {
        List<RepairTicket> tickets = ticketService.listByClaim(claimId, SecurityUtils.currentActor());
        return ResponseEntity.ok(tickets.stream().map(TicketResponse::fromEntity).collect(Collectors.toList()));
    }

    @GetMapping("/tickets/{ticketId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<TicketResponse> getTicket(@PathVariable String ticketId) {
        return ResponseEntity.ok(TicketResponse.fromEntity(ticketService.getTicket(ticketId, SecurityUtils.currentActor())));
    }

    /**
     * Tickets of a technician; technicians default to their own.
     */
    @GetMapping("/tickets")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT', 'TECHNICIAN')")
    public ResponseEntity<PageResponse<TicketResponse>> listTechnicianTickets(
            @RequestParam(required = false) String technicianId,
            @PageableDefault(size = 20, sort = "createdAt", direction = Sort.Direction.DESC) Pageable pageable
    ) {
        Actor actor = SecurityUtils.currentActor();
        String target = technicianId != null ? technicianId : actor.getActorId();
        return ResponseEntity.ok(PageResponse.from(ticketService.listByTechnician(target, pageable, actor),
                TicketResponse::fromEntity));
    }

    @PostMapping("/tickets/{ticketId}/assign")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<TicketResponse> assignTicket(
            @PathVariable String ticketId,
            @Valid @RequestBody AssignTicketRequest request
    ) {
        RepairTicket ticket = ticketService.assign(ticketId, request.getTechnicianId(),
                request.getEstimatedCompletionDate(), SecurityUtils.currentActor());
        return ResponseEntity.ok(TicketResponse.fromEntity(ticket));
    }

    @PostMapping("/tickets/{ticketId}/start")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT', 'TECHNICIAN')")
    public ResponseEntity<TicketResponse> startTicket(@PathVariable String ticketId) {
        return ResponseEntity.ok(TicketResponse.fromEntity(ticketService.start(ticketId, SecurityUtils.currentActor())));
    }

    @PostMapping("/tickets/{ticketId}/complete")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT', 'TECHNICIAN')")
    public ResponseEntity<TicketResponse> completeTicket(
            @PathVariable String ticketId,
            @Valid @RequestBody CompleteTicketRequest request
    ) {
        RepairTicket ticket = ticketService.complete(ticketId, request.toCommand(), SecurityUtils.currentActor());
        return ResponseEntity.ok(TicketResponse.fromEntity(ticket));
    }

    @PostMapping("/tickets/{ticketId}/quality-check")
    @PreAuthorize("hasAnyRole('ADMIN', 'AGENT')")
    public ResponseEntity<TicketResponse> qualityCheck(
            @PathVariable String ticketId,
            @Valid @RequestBody DecisionRequest request
    ) {
        RepairTicket ticket = ticketService.qualityCheck(ticketId, request.getApproved(), request.getNotes(),
                SecurityUtils.currentActor());
        return ResponseEntity.ok(TicketResponse.fromEntity(ticket));
    }

    @PostMapping("/tickets/{ticketId}/customer-approval")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<TicketResponse> customerApproval(
            @PathVariable String ticketId,
            @Valid @RequestBody DecisionRequest request
    ) {
        RepairTicket ticket = ticketService.customerApproval(ticketId, request.getApproved(), request.getNotes(),
                SecurityUtils.currentActor());
        return ResponseEntity.ok(TicketResponse.fromEntity(ticket));
    }
}
