package com.acme.secops.iamdrift.policy;

import java.util.Objects;

/**
 * Why a statement could not be turned into a {@link Grant}. {@code position} is the
 * token index where parsing stopped.
 */
public record ParseError(Kind kind, String message, int position) {
    public enum Kind {
        UNSUPPORTED_VERB,
        MALFORMED_GRAMMAR,
        MISSING_SUBJECT
    }

    public ParseError {
        Objects.requireNonNull(kind, "kind");
        message = message == null ? "" : message;
    }
}
