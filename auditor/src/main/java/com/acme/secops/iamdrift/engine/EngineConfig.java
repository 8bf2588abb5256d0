package com.acme.secops.iamdrift.engine;

/**
 * Explicit per-run engine settings.
 *
 * @param lookbackHours          audit correlation window ending at evaluation time
 * @param includeSubcompartments whether the snapshot was collected with subcompartments; recorded in reports
 * @param recentEventLimit       cap on the recent change events carried in the result
 */
public record EngineConfig(int lookbackHours, boolean includeSubcompartments, int recentEventLimit) {
    public static final int DEFAULT_LOOKBACK_HOURS = 24;
    public static final int DEFAULT_RECENT_EVENT_LIMIT = 200;

    public EngineConfig {
        if (lookbackHours < 1) {
            throw new IllegalArgumentException("lookbackHours must be >= 1: " + lookbackHours);
        }
        if (recentEventLimit < 0) {
            throw new IllegalArgumentException("recentEventLimit must be >= 0: " + recentEventLimit);
        }
    }

    public EngineConfig(int lookbackHours, boolean includeSubcompartments) {
        this(lookbackHours, includeSubcompartments, DEFAULT_RECENT_EVENT_LIMIT);
    }

    public static EngineConfig defaults() {
        return new EngineConfig(DEFAULT_LOOKBACK_HOURS, true, DEFAULT_RECENT_EVENT_LIMIT);
    }
}
