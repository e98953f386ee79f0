package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.ClaimAttachment;
import com.smartseller.warranty.domain.model.ClaimAttachment.AttachmentType;
import com.smartseller.warranty.domain.model.ClaimAttachment.ScanStatus;
import com.smartseller.warranty.domain.model.ClaimStatus;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent.EventType;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.PayloadTooLargeException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.messaging.AttachmentScanner;
import com.smartseller.warranty.repository.ClaimAttachmentRepository;
import com.smartseller.warranty.repository.WarrantyClaimRepository;
import com.smartseller.warranty.security.Actor;
import com.smartseller.warranty.security.Role;
import com.smartseller.warranty.service.ClaimAttachmentService.UploadCommand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ClaimAttachmentService.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ClaimAttachmentService Unit Tests")
class ClaimAttachmentServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-02T08:30:00Z");
    private static final String CLAIM_ID = "claim-1";
    private static final Actor CUSTOMER = Actor.of("cust-001", Role.CUSTOMER);
    private static final Actor AGENT = Actor.of("agent-1", Role.AGENT);

    @Mock
    private ClaimAttachmentRepository attachmentRepository;

    @Mock
    private WarrantyClaimRepository claimRepository;

    @Mock
    private ClaimWorkflow workflow;

    @Mock
    private AttachmentScanner attachmentScanner;

    private ClaimAttachmentService attachmentService;
    private WarrantyClaim claim;

    @BeforeEach
    void setUp() {
        attachmentService = new ClaimAttachmentService(attachmentRepository, claimRepository, workflow,
                attachmentScanner, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(attachmentService, "maxSizeBytes", 1024L);
        ReflectionTestUtils.setField(attachmentService, "allowedMimeTypes", Set.of("image/jpeg", "application/pdf"));

        claim = WarrantyClaim.builder()
                .claimId(CLAIM_ID)
                .claimNumber("WAR-2024-000001")
                .customerId("cust-001")
                .status(ClaimStatus.PENDING)
                .build();
    }

    private UploadCommand.UploadCommandBuilder upload() {
        return UploadCommand.builder()
                .filename(" receipt.jpg ")
                .storageRef("s3://claims/claim-1/receipt.jpg")
                .fileSize(512)
                .mimeType("IMAGE/JPEG")
                .attachmentType(AttachmentType.RECEIPT);
    }

    private ClaimAttachment attachment(String id, ScanStatus scanStatus) {
        return ClaimAttachment.builder()
                .attachmentId(id)
                .claimId(CLAIM_ID)
                .filename("photo.jpg")
                .storageRef("s3://claims/" + id)
                .fileSize(100L)
                .mimeType("image/jpeg")
                .scanStatus(scanStatus)
                .uploadedBy("cust-001")
                .uploadedAt(NOW)
                .build();
    }

    // ========================================
    // upload() Tests
    // ========================================

    @Test
    @DisplayName("upload - Stored pending, timeline entry appended, scan requested")
    void upload_Success() {
        // Given
        when(claimRepository.findById(CLAIM_ID)).thenReturn(Optional.of(claim));
        when(attachmentRepository.save(any(ClaimAttachment.class))).thenAnswer(invocation -> {
            ClaimAttachment saved = invocation.getArgument(0);
            saved.setAttachmentId("att-1");
            return saved;
        });
        when(attachmentScanner.requestScan(anyString(), anyString(), anyString())).thenReturn(true);

        // When
        ClaimAttachment result = attachmentService.upload(CLAIM_ID, upload().build(), CUSTOMER);

        // Then
        assertThat(result.getScanStatus()).isEqualTo(ScanStatus.PENDING);
        assertThat(result.getFilename()).isEqualTo("receipt.jpg");
        assertThat(result.getMimeType()).isEqualTo("image/jpeg");
        assertThat(result.getUploadedAt()).isEqualTo(NOW);
        verify(workflow).append(eq(CLAIM_ID), eq(EventType.ATTACHMENT_UPLOADED), contains("receipt.jpg"),
                eq(CUSTOMER), eq(true), eq(ClaimStatus.PENDING), eq(ClaimStatus.PENDING));
        verify(attachmentScanner).requestScan("att-1", "s3://claims/claim-1/receipt.jpg", "image/jpeg");
    }

    @Test
    @DisplayName("upload - Scanner unavailable does not fail the upload")
    void upload_ScannerDown_StillStored() {
        // Given
        when(claimRepository.findById(CLAIM_ID)).thenReturn(Optional.of(claim));
        when(attachmentRepository.save(any(ClaimAttachment.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(attachmentScanner.requestScan(any(), anyString(), anyString())).thenReturn(false);

        // When
        ClaimAttachment result = attachmentService.upload(CLAIM_ID, upload().build(), CUSTOMER);

        // Then
        assertThat(result.getScanStatus()).isEqualTo(ScanStatus.PENDING);
    }

    @Test
    @DisplayName("upload - Oversized file rejected before anything is stored")
    void upload_TooLarge() {
        // Given
        when(claimRepository.findById(CLAIM_ID)).thenReturn(Optional.of(claim));

        // When / Then
        assertThatThrownBy(() -> attachmentService.upload(CLAIM_ID, upload().fileSize(4096).build(), CUSTOMER))
                .isInstanceOf(PayloadTooLargeException.class)
                .satisfies(e -> assertThat(((PayloadTooLargeException) e).getMaxBytes()).isEqualTo(1024L));
        verify(attachmentRepository, never()).save(any());
        verifyNoInteractions(attachmentScanner);
    }

    @Test
    @DisplayName("upload - Disallowed mime type and blank filename reported")
    void upload_InvalidMetadata() {
        // Given
        when(claimRepository.findById(CLAIM_ID)).thenReturn(Optional.of(claim));

        // When / Then
        assertThatThrownBy(() -> attachmentService.upload(CLAIM_ID,
                upload().filename(" ").mimeType("application/x-msdownload").build(), CUSTOMER))
                .isInstanceOf(InvalidArgumentException.class)
                .satisfies(e -> assertThat(((InvalidArgumentException) e).getViolations())
                        .extracting(InvalidArgumentException.FieldViolation::getField)
                        .containsExactlyInAnyOrder("filename", "mimeType"));
        verify(attachmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("upload - Unrelated customer is forbidden")
    void upload_OtherCustomer_Forbidden() {
        // Given
        when(claimRepository.findById(CLAIM_ID)).thenReturn(Optional.of(claim));

        // When / Then
        assertThatThrownBy(() -> attachmentService.upload(CLAIM_ID, upload().build(),
                Actor.of("cust-999", Role.CUSTOMER)))
                .isInstanceOf(ForbiddenException.class);
    }

    // ========================================
    // recordScanResult() Tests
    // ========================================

    @Test
    @DisplayName("recordScanResult - First verdict recorded with scan time")
    void recordScanResult_Failed() {
        // Given
        ClaimAttachment pending = attachment("att-1", ScanStatus.PENDING);
        when(attachmentRepository.findById("att-1")).thenReturn(Optional.of(pending));
        when(attachmentRepository.save(pending)).thenReturn(pending);

        // When
        ClaimAttachment result = attachmentService.recordScanResult("att-1", false, "EICAR test signature");

        // Then
        assertThat(result.getScanStatus()).isEqualTo(ScanStatus.FAILED);
        assertThat(result.getScanDetail()).isEqualTo("EICAR test signature");
        assertThat(result.getScannedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("recordScanResult - Later verdicts are ignored")
    void recordScanResult_Duplicate_Ignored() {
        // Given
        ClaimAttachment passed = attachment("att-1", ScanStatus.PASSED);
        when(attachmentRepository.findById("att-1")).thenReturn(Optional.of(passed));

        // When
        ClaimAttachment result = attachmentService.recordScanResult("att-1", false, "late verdict");

        // Then
        assertThat(result.getScanStatus()).isEqualTo(ScanStatus.PASSED);
        verify(attachmentRepository, never()).save(any());
    }

    @Test
    @DisplayName("recordScanResult - Unknown attachment is not found")
    void recordScanResult_Unknown() {
        // Given
        when(attachmentRepository.findById("att-x")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> attachmentService.recordScanResult("att-x", true, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    // ========================================
    // listAttachments() / getAttachment() Tests
    // ========================================

    @Test
    @DisplayName("listAttachments - Customer sees only scanned-clean files")
    void listAttachments_Customer_PassedOnly() {
        // Given
        when(claimRepository.findById(CLAIM_ID)).thenReturn(Optional.of(claim));
        when(attachmentRepository.findByClaimIdAndScanStatusOrderByUploadedAtAsc(CLAIM_ID, ScanStatus.PASSED))
                .thenReturn(List.of(attachment("att-1", ScanStatus.PASSED)));

        // When
        List<ClaimAttachment> result = attachmentService.listAttachments(CLAIM_ID, CUSTOMER);

        // Then
        assertThat(result).extracting(ClaimAttachment::getAttachmentId).containsExactly("att-1");
        verify(attachmentRepository, never()).findByClaimIdOrderByUploadedAtAsc(anyString());
    }

    @Test
    @DisplayName("listAttachments - Staff see every file including failed scans")
    void listAttachments_Staff_All() {
        // Given
        when(claimRepository.findById(CLAIM_ID)).thenReturn(Optional.of(claim));
        when(attachmentRepository.findByClaimIdOrderByUploadedAtAsc(CLAIM_ID)).thenReturn(List.of(
                attachment("att-1", ScanStatus.PASSED),
                attachment("att-2", ScanStatus.FAILED),
                attachment("att-3", ScanStatus.PENDING)));

        // When
        List<ClaimAttachment> result = attachmentService.listAttachments(CLAIM_ID, AGENT);

        // Then
        assertThat(result).hasSize(3);
    }

    @Test
    @DisplayName("getAttachment - Customer cannot fetch an unscanned file")
    void getAttachment_Customer_Pending_NotFound() {
        // Given
        when(attachmentRepository.findById("att-2")).thenReturn(Optional.of(attachment("att-2", ScanStatus.PENDING)));

        // When / Then
        assertThatThrownBy(() -> attachmentService.getAttachment("att-2", CUSTOMER))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(claimRepository);
    }

    @Test
    @DisplayName("getAttachment - Owner fetches a clean file")
    void getAttachment_Customer_Passed() {
        // Given
        when(attachmentRepository.findById("att-1")).thenReturn(Optional.of(attachment("att-1", ScanStatus.PASSED)));
        when(claimRepository.findById(CLAIM_ID)).thenReturn(Optional.of(claim));

        // When
        ClaimAttachment result = attachmentService.getAttachment("att-1", CUSTOMER);

        // Then
        assertThat(result.getAttachmentId()).isEqualTo("att-1");
    }
}
