package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.IssueCategory;
import com.smartseller.warranty.domain.model.Severity;
import com.smartseller.warranty.service.WarrantyClaimService.SubmitClaimCommand;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PastOrPresent;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Request DTO for submitting a warranty claim.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class SubmitClaimRequest {

    @NotBlank(message = "Barcode number is required")
    private String barcodeNumber;

    @NotNull(message = "Issue category is required")
    private IssueCategory issueCategory;

    @NotBlank(message = "Issue description is required")
    @Size(min = 10, max = 2000, message = "Issue description must be 10..2000 characters")
    private String issueDescription;

    @NotNull(message = "Issue date is required")
    @PastOrPresent(message = "Issue date cannot be in the future")
    private LocalDate issueDate;

    @NotNull(message = "Severity is required")
    private Severity severity;

    @Size(max = 255)
    private String customerName;

    @Email(message = "Customer e-mail is malformed")
    private String customerEmail;

    @Size(max = 50)
    private String customerPhone;

    @Size(max = 1000)
    private String pickupAddress;

    @Size(max = 2000)
    private String customerNotes;

    @Size(max = 500)
    private String tags;

    @Valid
    @Size(max = 10, message = "At most 10 attachments per claim submission")
    private List<UploadAttachmentRequest> attachments;

    public SubmitClaimCommand toCommand() {
        return SubmitClaimCommand.builder()
                .barcodeNumber(barcodeNumber)
                .issueCategory(issueCategory)
                .issueDescription(issueDescription)
                .issueDate(issueDate)
                .severity(severity)
                .customerName(customerName)
                .customerEmail(customerEmail)
                .customerPhone(customerPhone)
                .pickupAddress(pickupAddress)
                .customerNotes(customerNotes)
                .tags(tags)
                .attachments(attachments == null ? List.of() : attachments.stream()
                        .map(UploadAttachmentRequest::toCommand)
                        .collect(Collectors.toList()))
                .build();
    }
}
