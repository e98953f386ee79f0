package com.smartseller.warranty.api.controller;

import com.smartseller.warranty.api.exception.GlobalExceptionHandler;
import com.smartseller.warranty.domain.model.ClaimAttachment;
import com.smartseller.warranty.domain.model.ClaimAttachment.AttachmentType;
import com.smartseller.warranty.domain.model.ClaimAttachment.ScanStatus;
import com.smartseller.warranty.exception.PayloadTooLargeException;
import com.smartseller.warranty.exception.ResourceNotFoundException;
import com.smartseller.warranty.service.ClaimAttachmentService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for ClaimAttachmentController using MockMvc.
 */
@WebMvcTest(ClaimAttachmentController.class)
@ContextConfiguration(classes = {ClaimAttachmentController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@WithMockUser(username = "cust-001", roles = "CUSTOMER")
@DisplayName("ClaimAttachmentController Tests")
class ClaimAttachmentControllerTest {

    private static final String UPLOAD_BODY = """
            {
                "filename": "receipt.jpg",
                "storageRef": "s3://claims/claim-1/receipt.jpg",
                "fileSize": 20480,
                "mimeType": "image/jpeg",
                "attachmentType": "receipt"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ClaimAttachmentService attachmentService;

    private ClaimAttachment attachment(ScanStatus scanStatus) {
        return ClaimAttachment.builder()
                .attachmentId("att-1")
                .claimId("claim-1")
                .filename("receipt.jpg")
                .storageRef("s3://claims/claim-1/receipt.jpg")
                .fileSize(20480L)
                .mimeType("image/jpeg")
                .attachmentType(AttachmentType.RECEIPT)
                .scanStatus(scanStatus)
                .uploadedBy("cust-001")
                .uploadedAt(Instant.parse("2024-06-02T10:05:00Z"))
                .build();
    }

    @Test
    @DisplayName("POST /claims/{id}/attachments - Returns 201 with a pending scan")
    void upload_Returns201() throws Exception {
        // Given
        when(attachmentService.upload(eq("claim-1"), any(), any())).thenReturn(attachment(ScanStatus.PENDING));

        // When / Then
        mockMvc.perform(post("/api/v1/claims/claim-1/attachments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(UPLOAD_BODY))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.attachmentId").value("att-1"))
                .andExpect(jsonPath("$.attachmentType").value("receipt"))
                .andExpect(jsonPath("$.scanStatus").value("pending"));
    }

    @Test
    @DisplayName("POST /claims/{id}/attachments - Oversized file returns 413 with limits")
    void upload_TooLarge_Returns413() throws Exception {
        // Given
        when(attachmentService.upload(eq("claim-1"), any(), any()))
                .thenThrow(new PayloadTooLargeException(10485760L, 20971520L));

        // When / Then
        mockMvc.perform(post("/api/v1/claims/claim-1/attachments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(UPLOAD_BODY))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(jsonPath("$.error").value("payload_too_large"))
                .andExpect(jsonPath("$.details.maxBytes").value(10485760));
    }

    @Test
    @DisplayName("POST /claims/{id}/attachments - Missing storage reference returns 400")
    void upload_MissingStorageRef_Returns400() throws Exception {
        // When / Then
        mockMvc.perform(post("/api/v1/claims/claim-1/attachments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\": \"receipt.jpg\", \"fileSize\": 10, \"mimeType\": \"image/jpeg\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors[0].field").value("storageRef"));

        verify(attachmentService, never()).upload(any(), any(), any());
    }

    @Test
    @DisplayName("GET /claims/{id}/attachments - Lists what the service returns")
    void listAttachments_Returns200() throws Exception {
        // Given
        when(attachmentService.listAttachments(eq("claim-1"), any())).thenReturn(List.of(attachment(ScanStatus.PASSED)));

        // When / Then
        mockMvc.perform(get("/api/v1/claims/claim-1/attachments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].scanStatus").value("passed"));
    }

    @Test
    @DisplayName("GET /attachments/{id} - Unscanned file hidden from customers as 404")
    void getAttachment_Hidden_Returns404() throws Exception {
        // Given
        when(attachmentService.getAttachment(eq("att-1"), any()))
                .thenThrow(new ResourceNotFoundException("ClaimAttachment", "att-1"));

        // When / Then
        mockMvc.perform(get("/api/v1/attachments/att-1"))
                .andExpect(status().isNotFound());
    }

    @Test
    @WithMockUser(username = "admin-1", roles = "ADMIN")
    @DisplayName("POST /attachments/{id}/scan-result - Verdict recorded")
    void recordScanResult_Returns200() throws Exception {
        // Given
        ClaimAttachment failed = attachment(ScanStatus.FAILED);
        when(attachmentService.recordScanResult("att-1", false, "Trojan.Generic")).thenReturn(failed);

        // When / Then
        mockMvc.perform(post("/api/v1/attachments/att-1/scan-result")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"passed\": false, \"detail\": \"Trojan.Generic\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.scanStatus").value("failed"));
    }
}
