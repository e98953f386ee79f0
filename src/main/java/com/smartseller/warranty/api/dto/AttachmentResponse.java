package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.ClaimAttachment;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response DTO for claim attachments.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class AttachmentResponse {

    private String attachmentId;
    private String claimId;
    private String filename;
    private String storageRef;
    private Long fileSize;
    private String mimeType;
    private String attachmentType;
    private String description;
    private String scanStatus;
    private Instant scannedAt;
    private String uploadedBy;
    private Instant uploadedAt;

    public static AttachmentResponse fromEntity(ClaimAttachment attachment) {
        AttachmentResponse response = new AttachmentResponse();
        response.setAttachmentId(attachment.getAttachmentId());
        response.setClaimId(attachment.getClaimId());
        response.setFilename(attachment.getFilename());
        response.setStorageRef(attachment.getStorageRef());
        response.setFileSize(attachment.getFileSize());
        response.setMimeType(attachment.getMimeType());
        response.setAttachmentType(attachment.getAttachmentType().name().toLowerCase());
        response.setDescription(attachment.getDescription());
        response.setScanStatus(attachment.getScanStatus().name().toLowerCase());
        response.setScannedAt(attachment.getScannedAt());
        response.setUploadedBy(attachment.getUploadedBy());
        response.setUploadedAt(attachment.getUploadedAt());
        return response;
    }
}
