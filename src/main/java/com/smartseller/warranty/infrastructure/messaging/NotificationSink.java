package com.smartseller.warranty.infrastructure.messaging;

import java.util.Map;

/**
 * Fire-and-forget notification capability. Implementations log delivery failures and never throw.
 *
 * @author Warranty Platform Team
 */
public interface NotificationSink {

    void notify(String recipient, String templateId, Map<String, Object> payload);
}
