package com.acme.secops.iamdrift.util;

/**
 * Defaults used when the corresponding environment variable is not set.
 */
public final class AuditorDefaults {

    // ---- Audit window ----
    public static final int DEFAULT_LOOKBACK_HOURS = 24;
    public static final int MIN_LOOKBACK_HOURS = 1;
    public static final int MAX_LOOKBACK_HOURS = 90 * 24;

    // ---- Collection ----
    public static final boolean DEFAULT_INCLUDE_SUBCOMPARTMENTS = true;
    public static final String DEFAULT_SNAPSHOT_FILE = "snapshot.json";

    // ---- Reports ----
    public static final String DEFAULT_OUTPUT_DIR = "output";
    public static final String REPORT_BASENAME = "iam_policy_drift_audit";
    public static final int DEFAULT_REPORT_TOP_FINDINGS = 50;
    public static final int DEFAULT_REPORT_TOP_EVENTS = 50;
    public static final int MAX_REPORT_ROWS = 10_000;
    public static final int RECENT_EVENT_LIMIT = 200;

    private AuditorDefaults() {
    }
}
