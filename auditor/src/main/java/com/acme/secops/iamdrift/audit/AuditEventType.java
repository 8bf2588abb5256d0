package com.acme.secops.iamdrift.audit;

import java.util.List;
import java.util.Locale;

/**
 * Identity-change categories relevant to drift detection.
 */
public enum AuditEventType {
    POLICY_CHANGED("policy-changed", List.of("createpolicy", "updatepolicy", "deletepolicy")),
    DYNAMIC_GROUP_CHANGED("dynamic-group-changed", List.of("createdynamicgroup", "updatedynamicgroup", "deletedynamicgroup")),
    GROUP_MEMBERSHIP_CHANGED("group-membership-changed", List.of("addusertogroup", "removeuserfromgroup", "usergroupmembership")),
    GROUP_CHANGED("group-changed", List.of("creategroup", "updategroup", "deletegroup")),
    USER_CHANGED("user-changed", List.of("createuser", "updateuser", "deleteuser")),
    OTHER("other", List.of());

    private final String label;
    private final List<String> terms;

    AuditEventType(String label, List<String> terms) {
        this.label = label;
        this.terms = terms;
    }

    public String label() {
        return label;
    }

    /**
     * Classifies a raw audit event by its type and name. Both are reduced to lower-case
     * alphanumerics, so {@code com.oraclecloud.identityControlPlane.UpdatePolicy} and
     * {@code UpdatePolicy} match alike.
     */
    public static AuditEventType classify(String rawEventType, String eventName) {
        String normalized = normalize((rawEventType == null ? "" : rawEventType) + " " + (eventName == null ? "" : eventName));
        for (AuditEventType type : values()) {
            for (String term : type.terms) {
                if (normalized.contains(term)) {
                    return type;
                }
            }
        }
        return OTHER;
    }

    /** Parses a label such as {@code policy-changed}; unknown labels map to {@link #OTHER}. */
    public static AuditEventType fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return OTHER;
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (AuditEventType type : values()) {
            if (type.label.equals(value)) {
                return type;
            }
        }
        return OTHER;
    }

    private static String normalize(String raw) {
        StringBuilder out = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isLetterOrDigit(c)) {
                out.append(Character.toLowerCase(c));
            }
        }
        return out.toString();
    }
}
