package com.smartseller.warranty.infrastructure.messaging.events;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Request to the notification service to render a template for a recipient.
 *
 * @author Warranty Platform Team
 */
public class NotificationMessage {

    private String recipient;
    private String templateId;
    private Map<String, Object> payload = new HashMap<>();
    private Instant requestedAt;

    public NotificationMessage() {
    }

    public NotificationMessage(String recipient, String templateId, Map<String, Object> payload) {
        this.recipient = recipient;
        this.templateId = templateId;
        this.payload = new HashMap<>(payload);
        this.requestedAt = Instant.now();
    }

    public String getRecipient() { return recipient; }
    public void setRecipient(String recipient) { this.recipient = recipient; }

    public String getTemplateId() { return templateId; }
    public void setTemplateId(String templateId) { this.templateId = templateId; }

    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload; }

    public Instant getRequestedAt() { return requestedAt; }
    public void setRequestedAt(Instant requestedAt) { this.requestedAt = requestedAt; }
}
