package com.acme.secops.iamdrift.engine;

import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.directory.Group;
import com.acme.secops.iamdrift.directory.SkippedCompartment;
import com.acme.secops.iamdrift.finding.Finding;
import com.acme.secops.iamdrift.risk.Severity;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Everything one run produces. Findings are ordered by severity, most severe first,
 * then by statement order in the snapshot.
 */
public record EvaluationResult(
    Instant evaluatedAt,
    String tenancyId,
    String region,
    EngineConfig config,
    boolean correlationEnabled,
    List<Finding> findings,
    FindingSummary summary,
    List<AuditEvent> recentChangeEvents,
    List<Group> groupsByMemberCount,
    List<SkippedCompartment> skippedCompartments
) {
    public EvaluationResult {
        Objects.requireNonNull(evaluatedAt, "evaluatedAt");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(summary, "summary");
        findings = List.copyOf(findings);
        recentChangeEvents = List.copyOf(recentChangeEvents);
        groupsByMemberCount = List.copyOf(groupsByMemberCount);
        skippedCompartments = List.copyOf(skippedCompartments);
    }

    public List<Finding> findings(Severity severity) {
        return findings.stream().filter(f -> f.severity() == severity).toList();
    }

    public List<Finding> recentlyModified() {
        return findings.stream().filter(Finding::recentlyModified).toList();
    }
}
