package com.acme.secops.iamdrift.policy;

import java.util.Locale;

/**
 * Permission verbs, ordered from least to most powerful.
 */
public enum Verb {
    INSPECT,
    READ,
    USE,
    MANAGE;

    static Verb fromToken(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        return switch (token.trim().toLowerCase(Locale.ROOT)) {
            case "inspect" -> INSPECT;
            case "read" -> READ;
            case "use" -> USE;
            case "manage" -> MANAGE;
            default -> null;
        };
    }

    public boolean atLeast(Verb other) {
        return ordinal() >= other.ordinal();
    }

    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }
}
