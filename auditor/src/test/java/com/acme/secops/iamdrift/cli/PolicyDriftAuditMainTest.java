package com.acme.secops.iamdrift.cli;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolicyDriftAuditMainTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldWriteBothReports() throws Exception {
        Path dir = Files.createTempDirectory("audit-main-test");
        try {
            Path snapshot = dir.resolve("snapshot.json");
            Files.writeString(snapshot, """
                {
                  "tenancyId": "ocid1.tenancy.oc1..root",
                  "region": "eu-frankfurt-1",
                  "compartments": [],
                  "policies": [
                    {"id": "p1", "name": "Everyone", "compartmentId": "ocid1.tenancy.oc1..root",
                     "statements": ["Allow any-user to manage all-resources in tenancy"]}
                  ],
                  "users": [{"id": "u1", "name": "alice"}],
                  "auditEvents": []
                }
                """, StandardCharsets.UTF_8);
            Path output = dir.resolve("output");
            AuditorConfig config = AuditorConfig.fromEnvironment(Map.of("OCI_OUTPUT_DIR", output.toString()));

            int code = PolicyDriftAuditMain.run(new String[] {snapshot.toString()}, config, CLOCK);

            assertEquals(PolicyDriftAuditMain.EXIT_OK, code);
            assertTrue(Files.exists(output.resolve("iam_policy_drift_audit_20240501T120000Z.json")));
            assertTrue(Files.exists(output.resolve("iam_policy_drift_audit_20240501T120000Z.md")));
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void shouldExitOneWhenSnapshotMissing() throws Exception {
        Path dir = Files.createTempDirectory("audit-main-missing");
        try {
            AuditorConfig config = AuditorConfig.fromEnvironment(Map.of("OCI_OUTPUT_DIR", dir.toString()));

            int code = PolicyDriftAuditMain.run(new String[] {dir.resolve("absent.json").toString()}, config, CLOCK);

            assertEquals(PolicyDriftAuditMain.EXIT_INPUT_FAILURE, code);
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void shouldExitTwoWhenReportsCannotBeWritten() throws Exception {
        Path dir = Files.createTempDirectory("audit-main-report");
        try {
            Path snapshot = dir.resolve("snapshot.json");
            Files.writeString(snapshot, """
                {"tenancyId": "t", "policies": [
                  {"id": "p1", "compartmentId": "t", "statements": ["Allow group Ops to read buckets in tenancy"]}
                ]}
                """, StandardCharsets.UTF_8);
            Path blocker = dir.resolve("not-a-dir");
            Files.writeString(blocker, "x", StandardCharsets.UTF_8);
            AuditorConfig config = AuditorConfig.fromEnvironment(Map.of("OCI_OUTPUT_DIR", blocker.resolve("out").toString()));

            int code = PolicyDriftAuditMain.run(new String[] {snapshot.toString()}, config, CLOCK);

            assertEquals(PolicyDriftAuditMain.EXIT_REPORT_FAILURE, code);
        } finally {
            deleteRecursively(dir);
        }
    }

    private static void deleteRecursively(Path dir) throws Exception {
        try (var paths = Files.walk(dir)) {
            List<Path> ordered = paths.sorted((a, b) -> b.getNameCount() - a.getNameCount()).toList();
            for (Path p : ordered) {
                Files.deleteIfExists(p);
            }
        }
    }
}
