package com.smartseller.warranty.infrastructure.messaging.events;

/**
 * Verdict returned by the scanning service.
 *
 * @author Warranty Platform Team
 */
public class ScanResultMessage {

    private String attachmentId;
    private boolean passed;
    private String detail;

    public ScanResultMessage() {
    }

    public ScanResultMessage(String attachmentId, boolean passed, String detail) {
        this.attachmentId = attachmentId;
        this.passed = passed;
        this.detail = detail;
    }

    public String getAttachmentId() { return attachmentId; }
    public void setAttachmentId(String attachmentId) { this.attachmentId = attachmentId; }

    public boolean isPassed() { return passed; }
    public void setPassed(boolean passed) { this.passed = passed; }

    public String getDetail() { return detail; }
    public void setDetail(String detail) { this.detail = detail; }
}
