package com.pricelens.backend.service.audit;

import java.util.Map;

/**
 * Fire-and-forget destination for structured audit events. Implementations must not throw.
 */
public interface AuditSink {

    /** MDC key whose value is copied into every event. */
    String CORRELATION_ID = "correlationId";

    void logEvent(String eventType, Map<String, Object> details);

    default void logEvent(AuditEventType eventType, Map<String, Object> details) {
        logEvent(eventType.name(), details);
    }
}
