package com.smartseller.warranty.api.controller;

import com.smartseller.warranty.api.dto.AttachmentResponse;
import com.smartseller.warranty.api.dto.ScanResultRequest;
import com.smartseller.warranty.api.dto.UploadAttachmentRequest;
import com.smartseller.warranty.domain.model.ClaimAttachment;
import com.smartseller.warranty.security.SecurityUtils;
import com.smartseller.warranty.service.ClaimAttachmentService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for claim attachments.
 *
 * @author Warranty Platform Team
 */
@RestController
@RequestMapping("/api/v1")
public class ClaimAttachmentController {

    private final ClaimAttachmentService attachmentService;

    public ClaimAttachmentController(ClaimAttachmentService attachmentService) {
        this.attachmentService = attachmentService;
    }

    @PostMapping("/claims/{claimId}/attachments")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AttachmentResponse> upload(
            @PathVariable String claimId,
            @Valid @RequestBody UploadAttachmentRequest request
    ) {
        ClaimAttachment attachment = attachmentService.upload(claimId, request.toCommand(), SecurityUtils.currentActor());
        return ResponseEntity.status(HttpStatus.CREATED).body(AttachmentResponse.fromEntity(attachment));
    }

    @GetMapping("/claims/{claimId}/attachments")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<AttachmentResponse>> listAttachments(@PathVariable String claimId) {
        List<ClaimAttachment> attachments = attachmentService.listAttachments(claimId, SecurityUtils.currentActor());
        return ResponseEntity.ok(attachments.stream().map(AttachmentResponse::fromEntity).collect(Collectors.toList()));
    }

    @GetMapping("/attachments/{attachmentId}")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<AttachmentResponse> getAttachment(@PathVariable String attachmentId) {
        ClaimAttachment attachment = attachmentService.getAttachment(attachmentId, SecurityUtils.currentActor());
        return ResponseEntity.ok(AttachmentResponse.fromEntity(attachment));
    }

    /**
     * Scanner callback for deployments without the Kafka result topic.
     */
    @PostMapping("/attachments/{attachmentId}/scan-result")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<AttachmentResponse> recordScanResult(
            @PathVariable String attachmentId,
            @Valid @RequestBody ScanResultRequest request
    ) {
        ClaimAttachment attachment = attachmentService.recordScanResult(attachmentId, request.getPassed(),
                request.getDetail());
        return ResponseEntity.ok(AttachmentResponse.fromEntity(attachment));
    }
}
