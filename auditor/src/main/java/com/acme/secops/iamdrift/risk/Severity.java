package com.acme.secops.iamdrift.risk;

/**
 * Risk severity. Declaration order is the report order, most severe first.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public int rank() {
        return ordinal();
    }

    public boolean isElevated() {
        return this != LOW;
    }
}
