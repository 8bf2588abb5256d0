package com.acme.secops.iamdrift.report;

import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.directory.Group;
import com.acme.secops.iamdrift.directory.SkippedCompartment;
import com.acme.secops.iamdrift.engine.EvaluationResult;
import com.acme.secops.iamdrift.engine.FindingSummary;
import com.acme.secops.iamdrift.finding.Finding;
import com.acme.secops.iamdrift.policy.Grant;
import com.acme.secops.iamdrift.policy.ParseResult;
import com.acme.secops.iamdrift.policy.Scope;
import com.acme.secops.iamdrift.radius.BlastRadius;
import com.acme.secops.iamdrift.risk.Severity;
import com.acme.secops.iamdrift.util.JsonCodec;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Machine-readable report carrying every finding and the full summary.
 */
public final class JsonReportWriter implements ReportWriter {

    @Override
    public Path write(Path outputDir, EvaluationResult result) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(ReportFiles.fileName(result.evaluatedAt(), "json"));
        Files.writeString(file, JsonCodec.writeString(toTree(result)) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    static Map<String, Object> toTree(EvaluationResult result) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("generatedAt", result.evaluatedAt().toString());
        root.put("tenancyId", result.tenancyId());
        root.put("region", result.region());
        root.put("lookbackHours", result.config().lookbackHours());
        root.put("includeSubcompartments", result.config().includeSubcompartments());
        root.put("correlationEnabled", result.correlationEnabled());
        root.put("summary", summary(result.summary()));

        List<Map<String, Object>> findings = new ArrayList<>(result.findings().size());
        for (Finding f : result.findings()) {
            findings.add(finding(f));
        }
        root.put("findings", findings);

        List<Map<String, Object>> events = new ArrayList<>(result.recentChangeEvents().size());
        for (AuditEvent e : result.recentChangeEvents()) {
            events.add(event(e));
        }
        root.put("recentChangeEvents", events);

        List<Map<String, Object>> groups = new ArrayList<>();
        for (Group g : result.groupsByMemberCount()) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", g.id());
            row.put("name", g.name());
            row.put("memberCount", g.memberCount().isPresent() ? g.memberCount().getAsInt() : null);
            groups.add(row);
        }
        root.put("groupsByMemberCount", groups);

        List<Map<String, Object>> skipped = new ArrayList<>();
        for (SkippedCompartment s : result.skippedCompartments()) {
            skipped.add(Map.of("compartmentId", s.compartmentId(), "reason", s.reason()));
        }
        root.put("skippedCompartments", skipped);
        return root;
    }

    private static Map<String, Object> summary(FindingSummary s) {
        Map<String, Object> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.name(), s.count(severity));
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("bySeverity", bySeverity);
        out.put("byCompartment", s.byCompartment());
        out.put("elevatedByCompartment", s.elevatedByCompartment());
        out.put("scannedCompartments", s.scannedCompartments());
        out.put("skippedCompartments", s.skippedCompartments());
        out.put("policiesScanned", s.policiesScanned());
        out.put("statementsScanned", s.statementsScanned());
        out.put("elevatedFindings", s.elevatedFindings());
        out.put("unparsedStatements", s.unparsedStatements());
        out.put("unresolvedGroupReferences", s.unresolvedGroupReferences());
        out.put("recentlyModifiedFindings", s.recentlyModifiedFindings());
        out.put("identityAuditEvents", s.identityAuditEvents());
        out.put("policyChangeEvents", s.policyChangeEvents());
        out.put("groupCount", s.groupCount());
        out.put("dynamicGroupCount", s.dynamicGroupCount());
        out.put("userCount", s.userCount());
        out.put("mfaEnabledUserCount", s.mfaEnabledUserCount());
        out.put("activePrincipalCount", s.activePrincipalCount());
        return out;
    }

    private static Map<String, Object> finding(Finding f) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("severity", f.severity().name());
        out.put("ruleId", f.ruleId());
        out.put("rationale", f.rationale());
        out.put("policyId", f.statement().policyId());
        out.put("policyName", f.statement().policyName());
        out.put("compartmentId", f.statement().compartmentId());
        out.put("compartmentName", f.statement().compartmentName());
        out.put("statement", f.statement().raw());
        if (f.statement().parsed() instanceof ParseResult.Parsed parsed) {
            Grant g = parsed.grant();
            out.put("subjectType", g.subjectType().keyword());
            out.put("subject", g.subjectName());
            out.put("verb", g.verb().token());
            out.put("resourceType", g.resourceType());
            out.put("scope", g.scope().kind() == Scope.Kind.COMPARTMENT
                ? g.scope().target()
                : g.scope().kind().name().toLowerCase(Locale.ROOT));
            out.put("condition", g.condition());
        } else if (f.statement().parsed() instanceof ParseResult.Unparsed unparsed) {
            out.put("parseError", unparsed.error().kind().name());
        }
        out.put("blastRadius", blastRadius(f.blastRadius()));
        out.put("recentlyModified", f.recentlyModified());
        List<String> eventIds = new ArrayList<>();
        for (AuditEvent e : f.correlatedEvents()) {
            eventIds.add(e.eventId());
        }
        out.put("correlatedEventIds", eventIds);
        return out;
    }

    private static Map<String, Object> blastRadius(BlastRadius radius) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (radius instanceof BlastRadius.Counted c) {
            out.put("status", "counted");
            out.put("principals", c.principals());
            out.put("source", c.source().name());
        } else if (radius instanceof BlastRadius.Unresolved u) {
            out.put("status", "unresolved");
            out.put("reference", u.reference());
            out.put("reason", u.reason());
        } else {
            out.put("status", "not-applicable");
        }
        return out;
    }

    private static Map<String, Object> event(AuditEvent e) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("eventId", e.eventId());
        out.put("eventTime", e.eventTime().toString());
        out.put("type", e.type().label());
        out.put("eventType", e.rawEventType());
        out.put("eventName", e.eventName());
        out.put("principal", e.principal());
        out.put("resourceName", e.resourceName());
        out.put("compartmentId", e.compartmentId());
        return out;
    }
}
