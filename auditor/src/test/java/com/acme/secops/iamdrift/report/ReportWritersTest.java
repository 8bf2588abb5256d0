package com.acme.secops.iamdrift.report;

import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.audit.AuditEventType;
import com.acme.secops.iamdrift.directory.Compartment;
import com.acme.secops.iamdrift.directory.DirectorySnapshot;
import com.acme.secops.iamdrift.directory.Group;
import com.acme.secops.iamdrift.directory.InMemoryGroupDirectory;
import com.acme.secops.iamdrift.directory.SkippedCompartment;
import com.acme.secops.iamdrift.engine.EngineConfig;
import com.acme.secops.iamdrift.engine.EvaluationResult;
import com.acme.secops.iamdrift.engine.PolicyRiskEngine;
import com.acme.secops.iamdrift.policy.Policy;
import com.acme.secops.iamdrift.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportWritersTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:03:04Z");
    private static final String ROOT = "ocid1.tenancy.oc1..root";

    @Test
    void shouldWriteJsonReportWithFindingsAndSummary() throws Exception {
        Path dir = Files.createTempDirectory("report-json-test");
        try {
            Path file = new JsonReportWriter().write(dir.resolve("out"), result());

            assertEquals("iam_policy_drift_audit_20240501T120304Z.json", file.getFileName().toString());
            JsonNode root = JsonCodec.readTree(Files.readString(file, StandardCharsets.UTF_8));
            assertEquals(ROOT, root.get("tenancyId").asText());
            assertEquals(24, root.get("lookbackHours").asInt());
            assertEquals(1, root.get("summary").get("bySeverity").get("CRITICAL").asInt());
            assertEquals(3, root.get("findings").size());

            JsonNode first = root.get("findings").get(0);
            assertEquals("CRITICAL", first.get("severity").asText());
            assertEquals("any-user", first.get("subjectType").asText());
            assertEquals("counted", first.get("blastRadius").get("status").asText());
            assertEquals(5, first.get("blastRadius").get("principals").asInt());
            assertTrue(first.get("recentlyModified").asBoolean());
            assertEquals("e1", first.get("correlatedEventIds").get(0).asText());

            JsonNode unresolved = root.get("findings").get(1);
            assertEquals("unresolved", unresolved.get("blastRadius").get("status").asText());
            assertEquals("Ghosts", unresolved.get("blastRadius").get("reference").asText());

            assertEquals("policy-changed", root.get("recentChangeEvents").get(0).get("type").asText());
            assertEquals("NotAuthorized", root.get("skippedCompartments").get(0).get("reason").asText());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void shouldRenderMarkdownSections() {
        String md = new MarkdownReportWriter().render(result());

        assertTrue(md.startsWith("# OCI IAM Policy Drift Auditor Report\n"));
        assertTrue(md.contains("- Region: `us-ashburn-1`"));
        assertTrue(md.contains("- Audit Lookback: `24h`"));
        assertTrue(md.contains("| Risky Statements | 2 |"));
        assertTrue(md.contains("| CRITICAL | 1 |"));
        assertTrue(md.contains("## Skipped Compartments"));
        assertTrue(md.contains("## Top Risky Statements (Top 50)"));
        assertTrue(md.contains("| CRITICAL | root | Root\\|Policy | - | 5 | `Allow any-user to manage all-resources in tenancy` |"));
        assertTrue(md.contains("| Ghosts | unresolved |"));
        assertTrue(md.contains("## Recently Modified Grants"));
        assertTrue(md.contains("## Recent IAM Policy Change Events (Top 50)"));
        assertTrue(md.contains("| alice | com.oraclecloud.identityControlPlane.UpdatePolicy | UpdatePolicy | Root\\|Policy |"));
        assertTrue(md.endsWith("See the JSON report generated in the same output directory.\n"));
    }

    @Test
    void shouldCapMarkdownRows() {
        String md = new MarkdownReportWriter(1, 0).render(result());

        assertTrue(md.contains("## Top Risky Statements (Top 1)"));
        assertFalse(md.contains("| Ghosts |"));
        assertFalse(md.contains("| UpdatePolicy |"));
    }

    @Test
    void shouldNoteDisabledCorrelation() {
        EvaluationResult result = engine().evaluate(snapshot(), null, EngineConfig.defaults());

        String md = new MarkdownReportWriter().render(result);

        assertTrue(md.contains("Drift Correlation: `disabled (audit events unavailable)`"));
        assertFalse(md.contains("## Recently Modified Grants"));
    }

    @Test
    void shouldWriteMarkdownFile() throws Exception {
        Path dir = Files.createTempDirectory("report-md-test");
        try {
            Path file = new MarkdownReportWriter().write(dir, result());

            assertEquals("iam_policy_drift_audit_20240501T120304Z.md", file.getFileName().toString());
            assertTrue(Files.readString(file, StandardCharsets.UTF_8).contains("## Full Data"));
        } finally {
            deleteRecursively(dir);
        }
    }

    private static EvaluationResult result() {
        AuditEvent change = new AuditEvent("e1", NOW.minus(Duration.ofHours(1)), AuditEventType.POLICY_CHANGED,
            "com.oraclecloud.identityControlPlane.UpdatePolicy", "UpdatePolicy", "alice", "p1", "Root|Policy", ROOT);
        return engine().evaluate(snapshot(), List.of(change), EngineConfig.defaults());
    }

    private static PolicyRiskEngine engine() {
        return new PolicyRiskEngine(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static DirectorySnapshot snapshot() {
        return new DirectorySnapshot(
            ROOT,
            "us-ashburn-1",
            NOW,
            List.of(new Compartment(ROOT, "root", null)),
            List.of(new SkippedCompartment("ocid1.compartment.oc1..locked", "NotAuthorized")),
            List.of(new Policy("p1", "Root|Policy", "", ROOT, List.of(
                "Allow any-user to manage all-resources in tenancy",
                "Allow group Ghosts to manage users in tenancy",
                "Allow group Readers to read buckets in tenancy"
            ))),
            new InMemoryGroupDirectory(List.of(Group.group("g-readers", "Readers", 4))),
            List.of(),
            5
        );
    }

    private static void deleteRecursively(Path dir) throws Exception {
        try (var paths = Files.walk(dir)) {
            for (Path p : paths.sorted((a, b) -> b.getNameCount() - a.getNameCount()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
