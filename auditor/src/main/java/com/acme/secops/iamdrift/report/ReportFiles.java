package com.acme.secops.iamdrift.report;

import com.acme.secops.iamdrift.util.AuditorDefaults;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

final class ReportFiles {
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'")
        .withZone(ZoneOffset.UTC);

    private ReportFiles() {
    }

    /** {@code iam_policy_drift_audit_20240102T030405Z.json} for extension {@code json}. */
    static String fileName(Instant evaluatedAt, String extension) {
        return AuditorDefaults.REPORT_BASENAME + "_" + STAMP.format(evaluatedAt) + "." + extension;
    }
}
