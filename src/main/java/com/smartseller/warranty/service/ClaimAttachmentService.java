package com.smartseller.warranty.service;

import com.smartseller.warranty.domain.model.ActorType;
import com.smartseller.warranty.domain.model.ClaimAttachment;
import com.smartseller.warranty.domain.model.ClaimAttachment.AttachmentType;
import com.smartseller.warranty.domain.model.ClaimAttachment.ScanStatus;
import com.smartseller.warranty.domain.model.ClaimTimelineEvent.EventType;
import com.smartseller.warranty.domain.model.WarrantyClaim;
import com.smartseller.warranty.exception.ForbiddenException;
import com.smartseller.warranty.exception.InvalidArgumentException;
import com.smartseller.warranty.exception.InvalidArgumentException.FieldViolation;
import com.smartseller.warranty.exception.PayloadTooLargeException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.infrastructure.messaging.AttachmentScanner;
import com.smartseller.warranty.repository.ClaimAttachmentRepository;
import com.smartseller.warranty.repository.WarrantyClaimRepository;
import com.smartseller.warranty.security.Actor;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Claim attachments. The file itself lives in external storage; this service records the
 * reference, hands it to the malware scanner and keeps unscanned or infected files out of
 * customer views.
 *
 * @author Warranty Platform Team
 */
@Service
public class ClaimAttachmentService {

    private static final Logger logger = LoggerFactory.getLogger(ClaimAttachmentService.class);

    static final int MAX_FILENAME_LENGTH = 255;

    private final ClaimAttachmentRepository attachmentRepository;
    private final WarrantyClaimRepository claimRepository;
    private final ClaimWorkflow workflow;
    private final AttachmentScanner attachmentScanner;
    private final Clock clock;

    @Value("${warranty.attachments.max-size-bytes:10485760}")
    private long maxSizeBytes;

    @Value("${warranty.attachments.allowed-mime-types:image/jpeg,image/png,image/webp,application/pdf,video/mp4}")
    private Set<String> allowedMimeTypes;

    public ClaimAttachmentService(
            ClaimAttachmentRepository attachmentRepository,
            WarrantyClaimRepository claimRepository,
            ClaimWorkflow workflow,
            AttachmentScanner attachmentScanner,
            Clock clock
    ) {
        this.attachmentRepository = attachmentRepository;
        this.claimRepository = claimRepository;
        this.workflow = workflow;
        this.attachmentScanner = attachmentScanner;
        this.clock = clock;
    }

    /**
     * Register an uploaded file. The attachment starts with a pending scan and is requested for
     * scanning after commit; a failed scan request does not fail the upload.
     *
     * @throws PayloadTooLargeException if the file exceeds the configured size
     * @throws InvalidArgumentException on a missing filename or a disallowed mime type
     */
    @Transactional
    public ClaimAttachment upload(String claimId, UploadCommand command, Actor actor) {
        WarrantyClaim claim = claimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyClaim", claimId));
        if (!actor.isStaff()
                && !actor.getActorId().equals(claim.getCustomerId())
                && !actor.getActorId().equals(claim.getAssignedTechnicianId())) {
            throw new ForbiddenException("Cannot attach files to claim " + claim.getClaimNumber());
        }
        if (command.fileSize > maxSizeBytes) {
            throw new PayloadTooLargeException(maxSizeBytes, command.fileSize);
        }
        validate(command);

        ClaimAttachment attachment = ClaimAttachment.builder()
                .claimId(claimId)
                .filename(command.filename.trim())
                .storageRef(command.storageRef)
                .fileSize(command.fileSize)
                .mimeType(command.mimeType.toLowerCase(Locale.ROOT))
                .attachmentType(command.attachmentType != null ? command.attachmentType : AttachmentType.OTHER)
                .description(command.description)
                .scanStatus(ScanStatus.PENDING)
                .uploadedBy(actor.getActorId())
                .uploadedAt(clock.instant())
                .build();
        ClaimAttachment saved = attachmentRepository.save(attachment);

        workflow.append(claimId, EventType.ATTACHMENT_UPLOADED, "Attachment uploaded: " + saved.getFilename(),
                actor, true, claim.getStatus(), claim.getStatus());
        logger.info("Attachment {} ({} bytes) uploaded to claim {}",
                saved.getAttachmentId(), saved.getFileSize(), claim.getClaimNumber());

        String attachmentId = saved.getAttachmentId();
        String storageRef = saved.getStorageRef();
        String mimeType = saved.getMimeType();
        AfterCommit.run(() -> {
            if (!attachmentScanner.requestScan(attachmentId, storageRef, mimeType)) {
                logger.warn("Scan request for attachment {} was not sent; it stays pending", attachmentId);
            }
        });
        return saved;
    }

    /**
     * Record the scanner verdict. The verdict is written once; later duplicates are ignored.
     */
    @Transactional
    public ClaimAttachment recordScanResult(String attachmentId, boolean passed, String detail) {
        ClaimAttachment attachment = attachmentRepository.findById(attachmentId)
                .orElseThrow(() -> new ResourceNotFoundException("ClaimAttachment", attachmentId));
        if (attachment.getScanStatus() != ScanStatus.PENDING) {
            logger.info("Ignoring duplicate scan result for attachment {} (already {})",
                    attachmentId, attachment.getScanStatus());
            return attachment;
        }
        attachment.setScanStatus(passed ? ScanStatus.PASSED : ScanStatus.FAILED);
        attachment.setScanDetail(detail);
        attachment.setScannedAt(clock.instant());
        if (!passed) {
            logger.warn("Attachment {} failed malware scan: {}", attachmentId, detail);
        }
        return attachmentRepository.save(attachment);
    }

    /**
     * Attachments of a claim in upload order. Customers only see files that passed the scan.
     */
    @Transactional(readOnly = true)
    public List<ClaimAttachment> listAttachments(String claimId, Actor actor) {
        WarrantyClaim claim = claimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyClaim", claimId));
        if (actor.isStaff() || actor.getActorId().equals(claim.getAssignedTechnicianId())) {
            return attachmentRepository.findByClaimIdOrderByUploadedAtAsc(claimId);
        }
        if (!actor.getActorId().equals(claim.getCustomerId())) {
            throw new ForbiddenException("Claim " + claim.getClaimNumber() + " belongs to another customer");
        }
        return attachmentRepository.findByClaimIdAndScanStatusOrderByUploadedAtAsc(claimId, ScanStatus.PASSED);
    }

    @Transactional(readOnly = true)
    public ClaimAttachment getAttachment(String attachmentId, Actor actor) {
        ClaimAttachment attachment = attachmentRepository.findById(attachmentId)
                .orElseThrow(() -> new ResourceNotFoundException("ClaimAttachment", attachmentId));
        if (actor.getActorType() == ActorType.CUSTOMER && attachment.getScanStatus() != ScanStatus.PASSED) {
            throw new ResourceNotFoundException("ClaimAttachment", attachmentId);
        }
        listAttachmentsAccess(attachment.getClaimId(), actor);
        return attachment;
    }

    private void listAttachmentsAccess(String claimId, Actor actor) {
        if (actor.isStaff()) {
            return;
        }
        WarrantyClaim claim = claimRepository.findById(claimId)
                .orElseThrow(() -> new ResourceNotFoundException("WarrantyClaim", claimId));
        if (!actor.getActorId().equals(claim.getCustomerId())
                && !actor.getActorId().equals(claim.getAssignedTechnicianId())) {
            throw new ForbiddenException("Claim " + claim.getClaimNumber() + " belongs to another customer");
        }
    }

    private void validate(UploadCommand command) {
        List<FieldViolation> violations = new ArrayList<>();
        if (command.filename == null || command.filename.isBlank() || command.filename.length() > MAX_FILENAME_LENGTH) {
            violations.add(new FieldViolation("filename", "Filename must be 1.." + MAX_FILENAME_LENGTH + " characters",
                    command.filename));
        }
        if (command.storageRef == null || command.storageRef.isBlank()) {
            violations.add(new FieldViolation("storageRef", "Storage reference is required", null));
        }
        if (command.mimeType == null || !allowedMimeTypes.contains(command.mimeType.toLowerCase(Locale.ROOT))) {
            violations.add(new FieldViolation("mimeType", "Unsupported file type", command.mimeType));
        }
        if (command.fileSize <= 0) {
            violations.add(new FieldViolation("fileSize", "File is empty", command.fileSize));
        }
        if (!violations.isEmpty()) {
            throw new InvalidArgumentException(violations);
        }
    }

    /**
     * Metadata of an uploaded file.
     */
    @Builder
    public static class UploadCommand {
        private final String filename;
        private final String storageRef;
        private final long fileSize;
        private final String mimeType;
        private final AttachmentType attachmentType;
        private final String description;
    }
}
