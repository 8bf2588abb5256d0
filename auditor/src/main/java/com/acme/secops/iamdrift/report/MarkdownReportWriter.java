package com.acme.secops.iamdrift.report;

import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.directory.SkippedCompartment;
import com.acme.secops.iamdrift.engine.EvaluationResult;
import com.acme.secops.iamdrift.engine.FindingSummary;
import com.acme.secops.iamdrift.finding.Finding;
import com.acme.secops.iamdrift.policy.Grant;
import com.acme.secops.iamdrift.radius.BlastRadius;
import com.acme.secops.iamdrift.risk.Severity;
import com.acme.secops.iamdrift.util.AuditorDefaults;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Human-readable report. Tables are capped at the configured row limits; the JSON report
 * remains the complete record.
 */
public final class MarkdownReportWriter implements ReportWriter {
    private final int topFindings;
    private final int topEvents;

    public MarkdownReportWriter(int topFindings, int topEvents) {
        if (topFindings < 0 || topEvents < 0) {
            throw new IllegalArgumentException("row limits must be >= 0");
        }
        this.topFindings = Math.min(topFindings, AuditorDefaults.MAX_REPORT_ROWS);
        this.topEvents = Math.min(topEvents, AuditorDefaults.MAX_REPORT_ROWS);
    }

    public MarkdownReportWriter() {
        this(AuditorDefaults.DEFAULT_REPORT_TOP_FINDINGS, AuditorDefaults.DEFAULT_REPORT_TOP_EVENTS);
    }

    @Override
    public Path write(Path outputDir, EvaluationResult result) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve(ReportFiles.fileName(result.evaluatedAt(), "md"));
        Files.writeString(file, render(result), StandardCharsets.UTF_8);
        return file;
    }

    String render(EvaluationResult result) {
        FindingSummary s = result.summary();
        StringBuilder md = new StringBuilder(4096);
        md.append("# OCI IAM Policy Drift Auditor Report\n\n");
        md.append("- Generated UTC: `").append(result.evaluatedAt()).append("`\n");
        md.append("- Region: `").append(result.region()).append("`\n");
        md.append("- Tenancy: `").append(result.tenancyId()).append("`\n");
        md.append("- Audit Lookback: `").append(result.config().lookbackHours()).append("h`\n");
        md.append("- Include Subcompartments: `").append(result.config().includeSubcompartments()).append("`\n");
        if (!result.correlationEnabled()) {
            md.append("- Drift Correlation: `disabled (audit events unavailable)`\n");
        }
        md.append('\n');

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n|---|---:|\n");
        row(md, "Scanned Compartments", s.scannedCompartments());
        row(md, "Skipped Compartments", s.skippedCompartments());
        row(md, "Policies Scanned", s.policiesScanned());
        row(md, "Statements Scanned", s.statementsScanned());
        row(md, "Risky Statements", s.elevatedFindings());
        row(md, "Unparsed Statements", s.unparsedStatements());
        row(md, "Unresolved Group References", s.unresolvedGroupReferences());
        row(md, "Recently Modified Findings", s.recentlyModifiedFindings());
        row(md, "Identity Audit Events", s.identityAuditEvents());
        row(md, "Policy Change Events", s.policyChangeEvents());
        row(md, "Tenancy Users", s.userCount());
        row(md, "Users with MFA Enabled", s.mfaEnabledUserCount());
        md.append('\n');

        md.append("## Risk Severity\n\n");
        md.append("| Severity | Count |\n|---|---:|\n");
        for (Severity severity : Severity.values()) {
            row(md, severity.name(), s.count(severity));
        }
        md.append('\n');

        if (!s.elevatedByCompartment().isEmpty()) {
            md.append("## Risky Statements by Compartment\n\n");
            md.append("| Compartment | Count |\n|---|---:|\n");
            for (Map.Entry<String, Integer> e : s.elevatedByCompartment().entrySet()) {
                row(md, escape(e.getKey()), e.getValue());
            }
            md.append('\n');
        }

        if (!result.skippedCompartments().isEmpty()) {
            md.append("## Skipped Compartments\n\n");
            md.append("| Compartment | Reason |\n|---|---|\n");
            for (SkippedCompartment skipped : result.skippedCompartments()) {
                md.append("| `").append(escape(skipped.compartmentId())).append("` | ")
                    .append(escape(skipped.reason())).append(" |\n");
            }
            md.append('\n');
        }

        List<Finding> risky = result.findings().stream()
            .filter(f -> f.severity().isElevated())
            .limit(topFindings)
            .toList();
        md.append("## Top Risky Statements (Top ").append(topFindings).append(")\n\n");
        if (risky.isEmpty()) {
            md.append("No risky statements found.\n\n");
        } else {
            md.append("| Severity | Compartment | Policy | Referenced Group | Group Members | Statement |\n");
            md.append("|---|---|---|---|---:|---|\n");
            for (Finding f : risky) {
                md.append("| ").append(f.severity().name())
                    .append(" | ").append(escape(f.statement().compartmentName()))
                    .append(" | ").append(escape(f.statement().policyName()))
                    .append(" | ").append(escape(referencedGroup(f)))
                    .append(" | ").append(members(f.blastRadius()))
                    .append(" | `").append(escape(f.statement().raw())).append("` |\n");
            }
            md.append('\n');
        }

        List<Finding> drifted = result.recentlyModified();
        if (result.correlationEnabled()) {
            md.append("## Recently Modified Grants\n\n");
            if (drifted.isEmpty()) {
                md.append("No findings touched by identity changes inside the lookback window.\n\n");
            } else {
                md.append("| Severity | Policy | Statement | Latest Change | Changed By |\n");
                md.append("|---|---|---|---|---|\n");
                for (Finding f : drifted.subList(0, Math.min(drifted.size(), topFindings))) {
                    AuditEvent latest = f.correlatedEvents().get(0);
                    md.append("| ").append(f.severity().name())
                        .append(" | ").append(escape(f.statement().policyName()))
                        .append(" | `").append(escape(f.statement().raw())).append('`')
                        .append(" | ").append(latest.eventTime())
                        .append(" | ").append(escape(latest.principal())).append(" |\n");
                }
                md.append('\n');
            }
        }

        List<AuditEvent> events = result.recentChangeEvents();
        md.append("## Recent IAM Policy Change Events (Top ").append(topEvents).append(")\n\n");
        if (events.isEmpty()) {
            md.append("No identity change events in the lookback window.\n\n");
        } else {
            md.append("| Event Time | Principal | Event Type | Event Name | Resource |\n");
            md.append("|---|---|---|---|---|\n");
            for (AuditEvent e : events.subList(0, Math.min(events.size(), topEvents))) {
                md.append("| ").append(e.eventTime())
                    .append(" | ").append(escape(e.principal()))
                    .append(" | ").append(escape(e.rawEventType().isEmpty() ? e.type().label() : e.rawEventType()))
                    .append(" | ").append(escape(e.eventName()))
                    .append(" | ").append(escape(e.resourceName().isEmpty() ? e.resourceId() : e.resourceName()))
                    .append(" |\n");
            }
            md.append('\n');
        }

        md.append("## Full Data\n\n");
        md.append("See the JSON report generated in the same output directory.\n");
        return md.toString();
    }

    private static void row(StringBuilder md, String label, int value) {
        md.append("| ").append(label).append(" | ").append(value).append(" |\n");
    }

    private static String referencedGroup(Finding f) {
        return f.statement().grant()
            .map(Grant::subjectName)
            .filter(name -> !name.isEmpty())
            .orElse("-");
    }

    private static String members(BlastRadius radius) {
        if (radius instanceof BlastRadius.Counted c) {
            return Integer.toString(c.principals());
        }
        return radius instanceof BlastRadius.Unresolved ? "unresolved" : "-";
    }

    static String escape(String value) {
        if (value == null) return "";
        return value.replace("|", "\\|").replace("\n", " ");
    }
}
