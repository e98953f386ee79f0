package com.smartseller.warranty.infrastructure.messaging.events;

/**
 * Request for the scanning service to inspect an uploaded attachment.
 *
 * @author Warranty Platform Team
 */
public class ScanRequestMessage {

    private String attachmentId;
    private String storageRef;
    private String mimeType;

    public ScanRequestMessage() {
    }

    public ScanRequestMessage(String attachmentId, String storageRef, String mimeType) {
        this.attachmentId = attachmentId;
        this.storageRef = storageRef;
        this.mimeType = mimeType;
    }

    public String getAttachmentId() { return attachmentId; }
    public void setAttachmentId(String attachmentId) { this.attachmentId = attachmentId; }

    public String getStorageRef() { return storageRef; }
    public void setStorageRef(String storageRef) { this.storageRef = storageRef; }

    public String getMimeType() { return mimeType; }
    public void setMimeType(String mimeType) { this.mimeType = mimeType; }
}
