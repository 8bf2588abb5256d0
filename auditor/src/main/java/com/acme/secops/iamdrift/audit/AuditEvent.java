package com.acme.secops.iamdrift.audit;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

public record AuditEvent(
    String eventId,
    Instant eventTime,
    AuditEventType type,
    String rawEventType,
    String eventName,
    String principal,
    String resourceId,
    String resourceName,
    String compartmentId
) {
    public static final String UNKNOWN_PRINCIPAL = "UNKNOWN_PRINCIPAL";

    public AuditEvent {
        Objects.requireNonNull(eventTime, "eventTime");
        Objects.requireNonNull(type, "type");
        eventId = eventId == null ? "" : eventId;
        rawEventType = rawEventType == null ? "" : rawEventType;
        eventName = eventName == null ? "" : eventName;
        principal = principal == null || principal.isBlank() ? UNKNOWN_PRINCIPAL : principal;
        resourceId = resourceId == null ? "" : resourceId;
        resourceName = resourceName == null ? "" : resourceName;
        compartmentId = compartmentId == null ? "" : compartmentId;
    }

    /** Events emitted by the identity control plane, whether or not they are classified. */
    public boolean isIdentityEvent() {
        return type != AuditEventType.OTHER || rawEventType.toLowerCase(Locale.ROOT).contains("identity");
    }

    public boolean affects(String resource) {
        if (resource == null || resource.isEmpty()) {
            return false;
        }
        return resource.equals(resourceId) || resource.equals(resourceName);
    }
}
