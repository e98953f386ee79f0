package com.smartseller.warranty.infrastructure.messaging;

/**
 * Asynchronous attachment scanning capability. The verdict arrives later through
 * {@link AttachmentScanResultConsumer}.
 *
 * @author Warranty Platform Team
 */
public interface AttachmentScanner {

    /**
     * Hand an uploaded payload to the scanner.
     *
     * @return true if the request was handed off, false if it could not be sent
     */
    boolean requestScan(String attachmentId, String storageRef, String mimeType);
}
