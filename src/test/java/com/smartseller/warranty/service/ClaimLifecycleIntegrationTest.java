package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.ClaimAction;
import com.smartseller.warranty.domain.model.ClaimAttachment.AttachmentType;
import com.smartseller.warranty.domain.model.ClaimAttachment.ScanStatus;
import com.smartseller.warranty.domain.model.ClaimStatus;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent.EventType;
import com.smartseller.warranty.domain.model.IssueCategory;
import com.smartseller.warranty.domain.model.RepairTicket;
import com.smartseller.warranty.domain.model.RepairTicket.CustomerApprovalStatus;
import com.smartseller.warranty.domain.model.RepairTicket.QualityCheckStatus;
import com.smartseller.warranty.domain.model.RepairTicket.TicketStatus;
import com.smartseller.warranty.domain.model.ResolutionType;
import com.smartseller.warranty.domain.model.Severity;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import com.smartseller.warranty.domain.model.WarrantyBarcode.BarcodeStatus;
import com.smartseller.warranty.exception.ConflictException;
import com.smartseller.warranty.exception.ErrorKind;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidStateException;
import com.smartseller.warranty.exception.InvalidTransitionException;
import com.smartseller.warranty.exception.PreconditionFailedException;
import com.smartseller.warranty.infrastructure.cache.RedisCacheService;
import com.smartseller.warranty.infrastructure.lock.RedisDistributedLock;
import com.smartseller.warranty.infrastructure.messaging.KafkaProducerService;
import com.smartseller.warranty.repository.ClaimAttachmentRepository;
import com.smartseller.warranty.repository.ClaimRequestKeyRepository;
import com.smartseller.warranty.repository.ClaimTimelineEventRepository;
import com.smartseller.warranty.repository.CustomerProfileRepository;
import com.smartseller.warranty.repository.RepairTicketRepository;
import com.smartseller.warranty.repository.WarrantyBarcodeRepository;
import com.smartseller.warranty.repository.WarrantyClaimRepository;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.security.Role;
import com.smartseller.warranty.service.ClaimAttachmentService.UploadCommand;
import com.smartseller.warranty.service.RepairTicketService.CompleteTicketCommand;
import com.smartseller.warranty.service.RepairTicketService.CreateTicketCommand;
import com.smartseller.warranty.service.WarrantyClaimService.BulkItemResult;
import com.smartseller.warranty.service.WarrantyClaimService.ClaimTransitionCommand;
import com.smartseller.warranty.service.WarrantyClaimService.SubmitClaimCommand;
import com.smartseller.warranty.testutil.WarrantyTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Claim and repair ticket workflows end to end against H2.
 */
@SpringBootTest
@DisplayName("Claim Lifecycle Integration Tests")
class ClaimLifecycleIntegrationTest {

    private static final Actor CUSTOMER = Actor.of(WarrantyTestData.CUSTOMER_ID, Role.CUSTOMER);
    private static final Actor OTHER_CUSTOMER = Actor.of("cust-999", Role.CUSTOMER);
    private static final Actor AGENT = Actor.of("agent-1", Role.AGENT);
    private static final Actor TECHNICIAN = Actor.of("tech-1", Role.TECHNICIAN);

    @Autowired
    private WarrantyClaimService claimService;

    @Autowired
    private RepairTicketService ticketService;

    @Autowired
    private ClaimAttachmentService attachmentService;

    @Autowired
    private WarrantyClaimRepository claimRepository;

    @Autowired
    private ClaimTimelineEventRepository timelineRepository;

    @Autowired
    private ClaimRequestKeyRepository requestKeyRepository;

    @Autowired
    private RepairTicketRepository ticketRepository;

    @Autowired
    private ClaimAttachmentRepository attachmentRepository;

    @Autowired
    private WarrantyBarcodeRepository barcodeRepository;

    @Autowired
    private CustomerProfileRepository customerRepository;

    @MockBean
    private KafkaProducerService kafkaProducerService;

    @MockBean
    private RedisCacheService redisCacheService;

    @MockBean
    private RedisDistributedLock distributedLock;

    @BeforeEach
    void setUp() {
        timelineRepository.deleteAll();
        requestKeyRepository.deleteAll();
        attachmentRepository.deleteAll();
        ticketRepository.deleteAll();
        claimRepository.deleteAll();
        barcodeRepository.deleteAll();
        customerRepository.deleteAll();
        customerRepository.save(WarrantyTestData.customer());
    }

    private String activeBarcode(String barcodeNumber) {
        barcodeRepository.save(WarrantyTestData.activeBarcode(barcodeNumber,
                Instant.now().minus(30, ChronoUnit.DAYS), 12));
        return barcodeNumber;
    }

    private WarrantyClaim submit(String barcodeNumber) {
        return claimService.submit(SubmitClaimCommand.builder()
                .barcodeNumber(barcodeNumber)
                .issueCategory(IssueCategory.HARDWARE)
                .issueDescription("Screen flickers constantly after two weeks of use")
                .severity(Severity.MEDIUM)
                .build(), CUSTOMER);
    }

    private UploadCommand photo(String filename, String mimeType) {
        return UploadCommand.builder()
                .filename(filename)
                .storageRef("s3://claims/" + filename)
                .fileSize(2048)
                .mimeType(mimeType)
                .attachmentType(AttachmentType.PHOTO)
                .build();
    }

    private ClaimTransitionCommand notes(String notes) {
        return ClaimTransitionCommand.builder().notes(notes).build();
    }

    private WarrantyClaim assigned(String barcodeNumber) {
        WarrantyClaim claim = submit(activeBarcode(barcodeNumber));
        claimService.validateClaim(claim.getClaimId(), ClaimTransitionCommand.empty(), AGENT);
        return claimService.assignTechnician(claim.getClaimId(),
                ClaimTransitionCommand.builder().technicianId("tech-1").build(), AGENT);
    }

    private RepairTicket startedTicket(WarrantyClaim claim) {
        RepairTicket ticket = ticketService.createTicket(claim.getClaimId(), CreateTicketCommand.builder()
                .description("Replace the display assembly and retest")
                .estimatedHours(new BigDecimal("2.5"))
                .build(), AGENT);
        return ticketService.start(ticket.getTicketId(), TECHNICIAN);
    }

    private RepairTicket completeTicket(RepairTicket ticket, String labor, String parts) {
        return ticketService.complete(ticket.getTicketId(), CompleteTicketCommand.builder()
                .laborCost(new BigDecimal(labor))
                .partsCost(new BigDecimal(parts))
                .actualHours(new BigDecimal("2"))
                .repairNotes("Display replaced")
                .build(), TECHNICIAN);
    }

    // ========================================
    // Submission Tests
    // ========================================

    @Test
    @DisplayName("submit - Active warranty produces a pending claim with a SUBMITTED event")
    void submit_ActiveWarranty() {
        // When
        WarrantyClaim claim = submit(activeBarcode("WB-2025-SUBMIT001"));

        // Then
        assertThat(claim.getStatus()).isEqualTo(ClaimStatus.PENDING);
        assertThat(claim.getClaimNumber()).matches("WAR-\\d{4}-\\d{6}");
        assertThat(claim.getCustomerId()).isEqualTo(WarrantyTestData.CUSTOMER_ID);
        assertThat(claim.getCustomerName()).isEqualTo("Jane Doe");
        assertThat(claim.getCustomerEmail()).isEqualTo(WarrantyTestData.CUSTOMER_EMAIL);
        assertThat(timelineRepository.findByClaimIdOrderBySequenceAsc(claim.getClaimId()))
                .extracting(ClaimTimelineEvent::getEventType)
                .containsExactly(EventType.SUBMITTED);
    }

    @Test
    @DisplayName("submit - Expired warranty blocked with warranty_expired")
    void submit_ExpiredWarranty_PreconditionFailed() {
        // Given
        barcodeRepository.save(WarrantyTestData.expiredBarcode("WB-2024-EXPIRED01"));

        // When / Then
        assertThatThrownBy(() -> submit("WB-2024-EXPIRED01"))
                .isInstanceOf(PreconditionFailedException.class)
                .extracting(e -> ((PreconditionFailedException) e).getReason())
                .isEqualTo("warranty_expired");
        assertThat(claimRepository.count()).isZero();
    }

    @Test
    @DisplayName("submit - Barcode never activated blocked with warranty_inactive")
    void submit_GeneratedBarcode_PreconditionFailed() {
        // Given
        barcodeRepository.save(WarrantyTestData.generatedBarcode("WB-2025-FRESH0001"));

        // When / Then
        assertThatThrownBy(() -> submit("WB-2025-FRESH0001"))
                .isInstanceOf(PreconditionFailedException.class)
                .extracting(e -> ((PreconditionFailedException) e).getReason())
                .isEqualTo("warranty_inactive");
    }

    @Test
    @DisplayName("submit - Second open claim on the same barcode conflicts")
    void submit_OpenClaimExists_Conflict() {
        // Given
        String barcode = activeBarcode("WB-2025-TWICE0001");
        submit(barcode);

        // When / Then
        assertThatThrownBy(() -> submit(barcode))
                .isInstanceOf(ConflictException.class)
                .extracting(e -> ((ConflictException) e).getReason())
                .isEqualTo("claim_exists");
        assertThat(claimRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("submit - Concurrent submits on one barcode leave exactly one open claim")
    void submit_Concurrent_OneOpenClaim() throws Exception {
        // Given
        String barcode = activeBarcode("WB-2025-RACE00001");
        int callers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<WarrantyClaim>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            Callable<WarrantyClaim> call = () -> {
                start.await();
                return submit(barcode);
            };
            futures.add(executor.submit(call));
        }

        // When
        start.countDown();
        int accepted = 0;
        int conflicts = 0;
        for (Future<WarrantyClaim> future : futures) {
            try {
                future.get(20, TimeUnit.SECONDS);
                accepted++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(ConflictException.class);
                assertThat(((ConflictException) e.getCause()).getReason()).isEqualTo("claim_exists");
                conflicts++;
            }
        }
        executor.shutdown();

        // Then
        assertThat(accepted).isEqualTo(1);
        assertThat(conflicts).isEqualTo(callers - 1);
        assertThat(claimRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("submit - Attachments recorded with a pending scan and hidden from the customer")
    void submit_WithAttachments_PendingScan() {
        // Given
        String barcode = activeBarcode("WB-2025-FILES0001");

        // When
        WarrantyClaim claim = claimService.submit(SubmitClaimCommand.builder()
                .barcodeNumber(barcode)
                .issueCategory(IssueCategory.HARDWARE)
                .issueDescription("Screen cracked along the left edge")
                .severity(Severity.HIGH)
                .attachments(List.of(
                        photo("crack.png", "image/png"),
                        photo("receipt.pdf", "application/pdf")))
                .build(), CUSTOMER);

        // Then
        assertThat(attachmentRepository.findByClaimIdOrderByUploadedAtAsc(claim.getClaimId()))
                .hasSize(2)
                .allMatch(attachment -> attachment.getScanStatus() == ScanStatus.PENDING);
        assertThat(attachmentService.listAttachments(claim.getClaimId(), CUSTOMER)).isEmpty();
        assertThat(attachmentService.listAttachments(claim.getClaimId(), AGENT)).hasSize(2);
        assertThat(timelineRepository.findByClaimIdOrderBySequenceAsc(claim.getClaimId()))
                .extracting(ClaimTimelineEvent::getEventType)
                .containsExactly(EventType.SUBMITTED, EventType.ATTACHMENT_UPLOADED, EventType.ATTACHMENT_UPLOADED);
    }

    @Test
    @DisplayName("submit - Disallowed attachment rejects the whole submission")
    void submit_DisallowedAttachment_NothingStored() {
        // Given
        String barcode = activeBarcode("WB-2025-FILES0002");

        // When / Then
        assertThatThrownBy(() -> claimService.submit(SubmitClaimCommand.builder()
                .barcodeNumber(barcode)
                .issueCategory(IssueCategory.HARDWARE)
                .issueDescription("Screen cracked along the left edge")
                .severity(Severity.HIGH)
                .attachments(List.of(photo("setup.exe", "application/x-msdownload")))
                .build(), CUSTOMER))
                .isInstanceOf(InvalidArgumentException.class);
        assertThat(claimRepository.count()).isZero();
        assertThat(attachmentRepository.count()).isZero();
    }

    @Test
    @DisplayName("submit - Another customer's warranty is forbidden")
    void submit_OtherCustomer_Forbidden() {
        // Given
        String barcode = activeBarcode("WB-2025-OTHER0001");

        // When / Then
        assertThatThrownBy(() -> claimService.submit(SubmitClaimCommand.builder()
                .barcodeNumber(barcode)
                .issueCategory(IssueCategory.DEFECT)
                .issueDescription("Battery swells when charging overnight")
                .severity(Severity.HIGH)
                .build(), OTHER_CUSTOMER))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    @DisplayName("submit - Short description rejected")
    void submit_ShortDescription_InvalidArgument() {
        // Given
        String barcode = activeBarcode("WB-2025-SHORT0001");

        // When / Then
        assertThatThrownBy(() -> claimService.submit(SubmitClaimCommand.builder()
                .barcodeNumber(barcode)
                .issueCategory(IssueCategory.DEFECT)
                .issueDescription("Broken")
                .severity(Severity.LOW)
                .build(), CUSTOMER))
                .isInstanceOf(InvalidArgumentException.class);
    }

    // ========================================
    // Workflow Tests
    // ========================================

    @Test
    @DisplayName("Customer claim happy path - 8 timeline events, total cost 100, completed once")
    void customerClaim_HappyPath() {
        // Given
        WarrantyClaim claim = assigned("WB-2025-HAPPY0001");
        String claimId = claim.getClaimId();

        // When
        RepairTicket ticket = startedTicket(claim);
        completeTicket(ticket, "60.00", "40.00");
        ticketService.qualityCheck(ticket.getTicketId(), true, "All tests pass", AGENT);
        claimService.updateStatus(claimId, ClaimAction.REPAIR,
                ClaimTransitionCommand.builder().repairNotes("Display replaced").build(), AGENT);
        claimService.updateStatus(claimId, ClaimAction.SHIP, ClaimTransitionCommand.builder()
                .shippingProvider("DHL").trackingNumber("TRK123").build(), AGENT);
        claimService.updateStatus(claimId, ClaimAction.DELIVER, ClaimTransitionCommand.empty(), AGENT);
        WarrantyClaim completed = claimService.complete(claimId, ClaimTransitionCommand.builder()
                .resolutionType(ResolutionType.REPAIR)
                .resolutionNotes("Repaired under warranty")
                .build(), AGENT);

        // Then
        assertThat(completed.getStatus()).isEqualTo(ClaimStatus.COMPLETED);
        assertThat(completed.getResolutionType()).isEqualTo(ResolutionType.REPAIR);
        assertThat(completed.getTotalCost()).isEqualByComparingTo("100");
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(completed.getTrackingNumber()).isEqualTo("TRK123");

        List<ClaimTimelineEvent> timeline = timelineRepository.findByClaimIdOrderBySequenceAsc(claimId);
        assertThat(timeline).extracting(ClaimTimelineEvent::getEventType).containsExactly(
                EventType.SUBMITTED, EventType.VALIDATED, EventType.ASSIGNED, EventType.REPAIR_STARTED,
                EventType.REPAIR_COMPLETED, EventType.STATUS_UPDATED, EventType.STATUS_UPDATED, EventType.COMPLETED);
        assertThat(timeline).extracting(ClaimTimelineEvent::getSequence)
                .containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L, 8L);
        for (int i = 1; i < timeline.size(); i++) {
            assertThat(timeline.get(i).getOccurredAt()).isAfterOrEqualTo(timeline.get(i - 1).getOccurredAt());
        }

        Instant completedAt = completed.getCompletedAt();
        assertThatThrownBy(() -> claimService.complete(claimId, ClaimTransitionCommand.builder()
                .resolutionType(ResolutionType.REFUND).resolutionNotes("again").build(), AGENT))
                .isInstanceOf(InvalidStateException.class);
        WarrantyClaim reloaded = claimRepository.findById(claimId).orElseThrow();
        assertThat(reloaded.getCompletedAt()).isEqualTo(completedAt);
        assertThat(reloaded.getResolutionType()).isEqualTo(ResolutionType.REPAIR);
    }

    @Test
    @DisplayName("updateStatus - Ship from pending rejected, state unchanged")
    void updateStatus_InvalidTransition() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-SHIP00001"));

        // When / Then
        assertThatThrownBy(() -> claimService.updateStatus(claim.getClaimId(), ClaimAction.SHIP,
                ClaimTransitionCommand.empty(), AGENT))
                .isInstanceOf(InvalidTransitionException.class)
                .satisfies(e -> assertThat(ErrorKind.of(e)).isEqualTo(ErrorKind.INVALID_TRANSITION));

        assertThat(claimRepository.findById(claim.getClaimId()).orElseThrow().getStatus())
                .isEqualTo(ClaimStatus.PENDING);
        assertThat(timelineRepository.findByClaimIdOrderBySequenceAsc(claim.getClaimId())).hasSize(1);
    }

    @Test
    @DisplayName("validate - Priority derived from severity and category")
    void validate_SetsPriority() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-PRIO00001"));

        // When
        WarrantyClaim validated = claimService.validateClaim(claim.getClaimId(), notes("Looks genuine"), AGENT);

        // Then
        assertThat(validated.getStatus()).isEqualTo(ClaimStatus.VALIDATED);
        assertThat(validated.getValidatedBy()).isEqualTo("agent-1");
        assertThat(validated.getPriority()).isNotNull();
        assertThat(validated.getAdminNotes()).isEqualTo("Looks genuine");
    }

    @Test
    @DisplayName("reject - Reason is required")
    void reject_RequiresReason() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-REJECT001"));

        // When / Then
        assertThatThrownBy(() -> claimService.reject(claim.getClaimId(), ClaimTransitionCommand.empty(), AGENT))
                .isInstanceOf(InvalidArgumentException.class);

        WarrantyClaim rejected = claimService.reject(claim.getClaimId(),
                ClaimTransitionCommand.builder().reason("Physical damage is not covered").build(), AGENT);
        assertThat(rejected.getStatus()).isEqualTo(ClaimStatus.REJECTED);
        assertThat(rejected.getRejectionReason()).isEqualTo("Physical damage is not covered");
    }

    @Test
    @DisplayName("cancel - Owner may cancel a pending claim but not validate it")
    void cancel_ByOwner() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-CANCEL001"));

        // When / Then
        assertThatThrownBy(() -> claimService.validateClaim(claim.getClaimId(), ClaimTransitionCommand.empty(), CUSTOMER))
                .isInstanceOf(ForbiddenException.class);
        WarrantyClaim cancelled = claimService.cancel(claim.getClaimId(), notes("Fixed it myself"), CUSTOMER);
        assertThat(cancelled.getStatus()).isEqualTo(ClaimStatus.CANCELLED);

        // A terminal claim no longer blocks a new submission
        WarrantyClaim second = submit(claim.getBarcodeNumber());
        assertThat(second.getStatus()).isEqualTo(ClaimStatus.PENDING);
    }

    @Test
    @DisplayName("dispute - Resolve returns the claim to its prior status")
    void dispute_ResolveToPrior() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-DISPUTE01"));
        claimService.validateClaim(claim.getClaimId(), ClaimTransitionCommand.empty(), AGENT);

        // When
        WarrantyClaim disputed = claimService.dispute(claim.getClaimId(), notes("Taking too long"), CUSTOMER);
        WarrantyClaim resolved = claimService.resolveDispute(claim.getClaimId(), ClaimTransitionCommand.empty(), AGENT);

        // Then
        assertThat(disputed.getStatus()).isEqualTo(ClaimStatus.DISPUTED);
        assertThat(resolved.getStatus()).isEqualTo(ClaimStatus.VALIDATED);
        assertThat(resolved.getStatusBeforeDispute()).isNull();
    }

    // ========================================
    // Idempotency & Bulk Tests
    // ========================================

    @Test
    @DisplayName("requestKey - Replay returns the stored outcome without a second event")
    void requestKey_Replay() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-REPLAY001"));
        ClaimTransitionCommand command = ClaimTransitionCommand.builder().requestKey("req-1").build();

        // When
        claimService.validateClaim(claim.getClaimId(), command, AGENT);
        WarrantyClaim replayed = claimService.validateClaim(claim.getClaimId(), command, AGENT);

        // Then
        assertThat(replayed.getStatus()).isEqualTo(ClaimStatus.VALIDATED);
        assertThat(timelineRepository.findByClaimIdOrderBySequenceAsc(claim.getClaimId()))
                .extracting(ClaimTimelineEvent::getEventType)
                .containsExactly(EventType.SUBMITTED, EventType.VALIDATED);
        assertThatThrownBy(() -> claimService.reject(claim.getClaimId(),
                ClaimTransitionCommand.builder().requestKey("req-1").reason("x").build(), AGENT))
                .isInstanceOf(ConflictException.class)
                .extracting(e -> ((ConflictException) e).getReason())
                .isEqualTo("request_key_reused");
    }

    @Test
    @DisplayName("requestKey - Used key does not bypass the caller check")
    void requestKey_OtherCustomer_Forbidden() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-REPLAY002"));
        ClaimTransitionCommand command = ClaimTransitionCommand.builder().requestKey("req-cancel").build();
        claimService.cancel(claim.getClaimId(), command, CUSTOMER);

        // When / Then
        assertThatThrownBy(() -> claimService.cancel(claim.getClaimId(), command, OTHER_CUSTOMER))
                .isInstanceOf(ForbiddenException.class);
        assertThat(claimService.cancel(claim.getClaimId(), command, CUSTOMER).getStatus())
                .isEqualTo(ClaimStatus.CANCELLED);
    }

    @Test
    @DisplayName("bulkUpdate - Each claim succeeds or fails on its own")
    void bulkUpdate_PartialSuccess() {
        // Given
        WarrantyClaim first = submit(activeBarcode("WB-2025-BULK00001"));
        WarrantyClaim second = submit(activeBarcode("WB-2025-BULK00002"));
        WarrantyClaim third = submit(activeBarcode("WB-2025-BULK00003"));
        claimService.validateClaim(second.getClaimId(), ClaimTransitionCommand.empty(), AGENT);

        // When
        List<BulkItemResult> results = claimService.bulkUpdate(
                List.of(first.getClaimId(), second.getClaimId(), third.getClaimId(), "missing-claim"),
                ClaimAction.VALIDATE, ClaimTransitionCommand.empty(), AGENT);

        // Then
        assertThat(results).hasSize(4);
        assertThat(results.get(0).isSuccess()).isTrue();
        assertThat(results.get(0).getStatus()).isEqualTo(ClaimStatus.VALIDATED);
        assertThat(results.get(1).isSuccess()).isFalse();
        assertThat(results.get(1).getErrorKind()).isEqualTo(ErrorKind.INVALID_TRANSITION);
        assertThat(results.get(2).isSuccess()).isTrue();
        assertThat(results.get(3).getErrorKind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(claimRepository.findById(third.getClaimId()).orElseThrow().getStatus())
                .isEqualTo(ClaimStatus.VALIDATED);
    }

    @Test
    @DisplayName("bulkUpdate - More than 100 claims rejected")
    void bulkUpdate_TooMany() {
        // Given
        List<String> ids = IntStream.range(0, 101).mapToObj(i -> "c-" + i).collect(Collectors.toList());

        // When / Then

        assertThatThrownBy(() -> claimService.bulkUpdate(ids, ClaimAction.VALIDATE,
                ClaimTransitionCommand.empty(), AGENT))
                .isInstanceOf(InvalidArgumentException.class);
    }

    // ========================================
    // Repair Ticket Tests
    // ========================================

    @Test
    @DisplayName("Repair - Claim cannot leave in_repair before the ticket passes QA")
    void repair_BlockedUntilQualityApproved() {
        // Given
        WarrantyClaim claim = assigned("WB-2025-QAGATE001");
        RepairTicket ticket = startedTicket(claim);
        completeTicket(ticket, "30.00", "20.00");

        // When / Then
        assertThatThrownBy(() -> claimService.updateStatus(claim.getClaimId(), ClaimAction.REPAIR,
                ClaimTransitionCommand.empty(), AGENT))
                .isInstanceOf(PreconditionFailedException.class)
                .extracting(e -> ((PreconditionFailedException) e).getReason())
                .isEqualTo("repair_ticket_not_resolved");
        assertThat(claimRepository.findById(claim.getClaimId()).orElseThrow().getStatus())
                .isEqualTo(ClaimStatus.IN_REPAIR);
    }

    @Test
    @DisplayName("qualityCheck - Rejection reopens the same ticket for another round")
    void qualityCheck_RejectReopens() {
        // Given
        WarrantyClaim claim = assigned("WB-2025-QAREJ0001");
        RepairTicket ticket = startedTicket(claim);
        completeTicket(ticket, "30.00", "20.00");

        // When
        RepairTicket reopened = ticketService.qualityCheck(ticket.getTicketId(), false, "Dead pixels remain", AGENT);

        // Then
        assertThat(reopened.getStatus()).isEqualTo(TicketStatus.IN_PROGRESS);
        assertThat(reopened.getQualityCheckStatus()).isEqualTo(QualityCheckStatus.PENDING);
        assertThat(reopened.getTotalCost()).isNull();
        assertThat(ticketRepository.findByClaimIdOrderByCreatedAtDesc(claim.getClaimId())).hasSize(1);

        ClaimTimelineEvent qaEvent = timelineRepository.findFirstByClaimIdOrderBySequenceDesc(claim.getClaimId())
                .orElseThrow();
        assertThat(qaEvent.getEventType()).isEqualTo(EventType.QUALITY_REJECTED);
        assertThat(qaEvent.getVisibleToCustomer()).isFalse();
        assertThat(claimService.getTimeline(claim.getClaimId(), CUSTOMER))
                .extracting(ClaimTimelineEvent::getEventType)
                .doesNotContain(EventType.QUALITY_REJECTED);

        // Second round
        RepairTicket second = completeTicket(reopened, "45.00", "20.00");
        assertThat(second.getTotalCost()).isEqualByComparingTo("65.00");
        assertThat(claimRepository.findById(claim.getClaimId()).orElseThrow().getRepairCost())
                .isEqualByComparingTo("65.00");
    }

    @Test
    @DisplayName("complete - Total above threshold requires customer approval")
    void complete_AboveThreshold_RequiresCustomerApproval() {
        // Given
        WarrantyClaim claim = assigned("WB-2025-COSTLY001");
        RepairTicket ticket = startedTicket(claim);

        // When
        RepairTicket completed = completeTicket(ticket, "400.00", "200.00");
        ticketService.qualityCheck(ticket.getTicketId(), true, null, AGENT);

        // Then
        assertThat(completed.getCustomerApprovalRequired()).isTrue();
        assertThat(completed.getCustomerApprovalStatus()).isEqualTo(CustomerApprovalStatus.PENDING);
        assertThatThrownBy(() -> claimService.updateStatus(claim.getClaimId(), ClaimAction.REPAIR,
                ClaimTransitionCommand.empty(), AGENT))
                .isInstanceOf(PreconditionFailedException.class);
        assertThatThrownBy(() -> ticketService.customerApproval(ticket.getTicketId(), true, null, OTHER_CUSTOMER))
                .isInstanceOf(ForbiddenException.class);

        RepairTicket approved = ticketService.customerApproval(ticket.getTicketId(), true, "Go ahead", CUSTOMER);
        assertThat(approved.getCustomerApprovalStatus()).isEqualTo(CustomerApprovalStatus.APPROVED);
        WarrantyClaim repaired = claimService.updateStatus(claim.getClaimId(), ClaimAction.REPAIR,
                ClaimTransitionCommand.empty(), AGENT);
        assertThat(repaired.getStatus()).isEqualTo(ClaimStatus.REPAIRED);
    }

    @Test
    @DisplayName("createTicket - Only one live ticket per claim")
    void createTicket_SecondLiveTicket_Conflict() {
        // Given
        WarrantyClaim claim = assigned("WB-2025-ONETKT001");
        ticketService.createTicket(claim.getClaimId(), CreateTicketCommand.builder()
                .description("Diagnose the charging port").build(), AGENT);

        // When / Then
        assertThatThrownBy(() -> ticketService.createTicket(claim.getClaimId(), CreateTicketCommand.builder()
                .description("Second ticket for the same claim").build(), AGENT))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    @DisplayName("Replacement completion consumes the warranty")
    void replace_CompletionMarksBarcodeClaimed() {
        // Given
        WarrantyClaim claim = assigned("WB-2025-REPLACE01");
        RepairTicket ticket = startedTicket(claim);
        completeTicket(ticket, "0.00", "0.00");
        ticketService.qualityCheck(ticket.getTicketId(), true, null, AGENT);

        // When
        claimService.updateStatus(claim.getClaimId(), ClaimAction.REPLACE,
                ClaimTransitionCommand.builder().replacementProductId("prod-0002").build(), AGENT);
        claimService.updateStatus(claim.getClaimId(), ClaimAction.SHIP, ClaimTransitionCommand.empty(), AGENT);
        claimService.updateStatus(claim.getClaimId(), ClaimAction.DELIVER, ClaimTransitionCommand.empty(), AGENT);
        claimService.complete(claim.getClaimId(), ClaimTransitionCommand.builder()
                .resolutionType(ResolutionType.REPLACE).resolutionNotes("New unit shipped").build(), AGENT);

        // Then
        assertThat(barcodeRepository.findByBarcodeNumber("WB-2025-REPLACE01").orElseThrow().getStatus())
                .isEqualTo(BarcodeStatus.CLAIMED);
        assertThatThrownBy(() -> submit("WB-2025-REPLACE01"))
                .isInstanceOf(PreconditionFailedException.class)
                .extracting(e -> ((PreconditionFailedException) e).getReason())
                .isEqualTo("already_claimed");
    }

    // ========================================
    // Notes & Feedback Tests
    // ========================================

    @Test
    @DisplayName("addNote - Internal agent notes hidden from the customer timeline")
    void addNote_Visibility() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-NOTES0001"));

        // When
        claimService.addNote(claim.getClaimId(), "Suspected water damage", false, AGENT);
        claimService.addNote(claim.getClaimId(), "Photos attached below", false, CUSTOMER);

        // Then
        assertThat(claimService.getTimeline(claim.getClaimId(), AGENT)).hasSize(3);
        assertThat(claimService.getTimeline(claim.getClaimId(), CUSTOMER))
                .extracting(ClaimTimelineEvent::getDescription)
                .doesNotContain("Suspected water damage")
                .contains("Photos attached below");
    }

    @Test
    @DisplayName("submitFeedback - Only on completed claims")
    void submitFeedback_RequiresCompleted() {
        // Given
        WarrantyClaim claim = submit(activeBarcode("WB-2025-FEEDBK001"));

        // When / Then
        assertThatThrownBy(() -> claimService.submitFeedback(claim.getClaimId(), 5, "Great", CUSTOMER))
                .isInstanceOf(InvalidStateException.class);
    }
}
