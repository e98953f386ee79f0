package com.smartseller.warranty.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * File attached to a claim. The payload itself lives in external storage; this row holds
 * its reference and the malware-scan verdict. Only PASSED attachments reach customer views,
 * FAILED ones stay for audit.
 *
 * @author Warranty Platform Team
 */
@Entity
@Table(name = "claim_attachments", indexes = {
    @Index(name = "idx_attachment_claim", columnList = "claim_id, uploaded_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClaimAttachment {

    @Id
    @Column(name = "attachment_id", nullable = false, length = 36)
    private String attachmentId;

    @Column(name = "claim_id", nullable = false, length = 36)
    private String claimId;

    @Column(name = "filename", nullable = false, length = 255)
    private String filename;

    /**
     * Path or URL in the external file store.
     */
    @Column(name = "storage_ref", nullable = false, length = 1000)
    private String storageRef;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "mime_type", nullable = false, length = 100)
    private String mimeType;

    @Enumerated(EnumType.STRING)
    @Column(name = "attachment_type", nullable = false, length = 20)
    private AttachmentType attachmentType;

    @Column(name = "description", length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "scan_status", nullable = false, length = 20)
    private ScanStatus scanStatus;

    @Column(name = "scan_detail", length = 1000)
    private String scanDetail;

    @Column(name = "scanned_at")
    private Instant scannedAt;

    @Column(name = "uploaded_by", nullable = false, length = 36)
    private String uploadedBy;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    @PrePersist
    protected void onCreate() {
        if (attachmentId == null) {
            attachmentId = UUID.randomUUID().toString();
        }
        if (uploadedAt == null) {
            uploadedAt = Instant.now();
        }
        if (scanStatus == null) {
            scanStatus = ScanStatus.PENDING;
        }
    }

    public enum AttachmentType {
        RECEIPT,
        PHOTO,
        VIDEO,
        INVOICE,
        DOCUMENT,
        OTHER
    }

    public enum ScanStatus {
        PENDING,
        PASSED,
        FAILED
    }
}
