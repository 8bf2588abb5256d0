package com.acme.secops.iamdrift.directory;

import java.util.Objects;

/** A compartment whose policies the collector could not read. */
public record SkippedCompartment(String compartmentId, String reason) {
    public SkippedCompartment {
        Objects.requireNonNull(compartmentId, "compartmentId");
        reason = reason == null ? "" : reason;
    }
}
