package com.acme.secops.iamdrift.audit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Closed time window {@code [start, end]} of the audit lookback. */
public record AuditWindow(Instant start, Instant end) {
    public AuditWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("window start after end: " + start + " > " + end);
        }
    }

    public static AuditWindow endingNow(Clock clock, int lookbackHours) {
        Objects.requireNonNull(clock, "clock");
        return endingAt(clock.instant(), lookbackHours);
    }

    public static AuditWindow endingAt(Instant end, int lookbackHours) {
        Objects.requireNonNull(end, "end");
        if (lookbackHours < 1) {
            throw new IllegalArgumentException("lookbackHours must be >= 1: " + lookbackHours);
        }
        return new AuditWindow(end.minus(Duration.ofHours(lookbackHours)), end);
    }

    public boolean contains(Instant t) {
        return t != null && !t.isBefore(start) && !t.isAfter(end);
    }
}
