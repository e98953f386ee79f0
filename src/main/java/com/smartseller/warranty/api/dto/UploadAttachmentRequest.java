package com.smartseller.warranty.api.dto;

import com.smartseller.warranty.domain.model.ClaimAttachment.AttachmentType;
import com.smartseller.warranty.service.ClaimAttachmentService.UploadCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata of a file already placed in external storage.
 * Size and mime-type limits are enforced by the service.
 *
 * @author Warranty Platform Team
 */
@Data
@NoArgsConstructor
public class UploadAttachmentRequest {

    @NotBlank(message = "Filename is required")
    @Size(max = 255)
    private String filename;

    @NotBlank(message = "Storage reference is required")
    private String storageRef;

    @NotNull(message = "File size is required")
    private Long fileSize;

    @NotBlank(message = "Mime type is required")
    private String mimeType;

    private AttachmentType attachmentType;

    @Size(max = 1000)
    private String description;

    public UploadCommand toCommand() {
        return UploadCommand.builder()
                .filename(filename)
                .storageRef(storageRef)
                .fileSize(fileSize)
                .mimeType(mimeType)
                .attachmentType(attachmentType)
                .description(description)
                .build();
    }
}
