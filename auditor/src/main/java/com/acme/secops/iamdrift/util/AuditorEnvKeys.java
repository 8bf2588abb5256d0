package com.acme.secops.iamdrift.util;

/**
 * Canonical environment variable names read by the auditor.
 */
public final class AuditorEnvKeys {
    public static final String OCI_AUDIT_LOOKBACK_HOURS = "OCI_AUDIT_LOOKBACK_HOURS";
    public static final String OCI_INCLUDE_SUBCOMPARTMENTS = "OCI_INCLUDE_SUBCOMPARTMENTS";
    public static final String OCI_ROOT_COMPARTMENT_OCID = "OCI_ROOT_COMPARTMENT_OCID";

    public static final String OCI_SNAPSHOT_FILE = "OCI_SNAPSHOT_FILE";
    public static final String OCI_OUTPUT_DIR = "OCI_OUTPUT_DIR";

    public static final String OCI_REPORT_TOP_FINDINGS = "OCI_REPORT_TOP_FINDINGS";
    public static final String OCI_REPORT_TOP_EVENTS = "OCI_REPORT_TOP_EVENTS";

    private AuditorEnvKeys() {
    }
}
