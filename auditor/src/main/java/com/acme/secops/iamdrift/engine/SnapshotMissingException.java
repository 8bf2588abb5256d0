package com.acme.secops.iamdrift.engine;

/**
 * Thrown when mandatory snapshot data (compartments, policies) is absent or could not be
 * collected. The run must abort rather than evaluate a partial picture.
 */
public final class SnapshotMissingException extends RuntimeException {
    private final String reason;

    public SnapshotMissingException(String reason) {
        super("Snapshot unavailable: " + reason);
        this.reason = reason;
    }

    public SnapshotMissingException(String reason, Throwable cause) {
        super("Snapshot unavailable: " + reason, cause);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
