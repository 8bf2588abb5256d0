package com.acme.secops.iamdrift.finding;

import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.policy.ParseResult;
import com.acme.secops.iamdrift.policy.PolicyStatement;
import com.acme.secops.iamdrift.radius.BlastRadius;
import com.acme.secops.iamdrift.risk.Classification;
import com.acme.secops.iamdrift.risk.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Evaluation outcome for one policy statement. Immutable: correlation produces a new
 * instance through {@link #withCorrelatedEvents(List)}.
 */
public record Finding(
    PolicyStatement statement,
    Severity severity,
    String ruleId,
    String rationale,
    BlastRadius blastRadius,
    List<AuditEvent> correlatedEvents
) {
    public static final String UNPARSED_RULE_ID = "unparsed";
    public static final String UNPARSED_RATIONALE = "could not classify";

    public Finding {
        Objects.requireNonNull(statement, "statement");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(ruleId, "ruleId");
        Objects.requireNonNull(blastRadius, "blastRadius");
        rationale = rationale == null ? "" : rationale;
        correlatedEvents = correlatedEvents == null ? List.of() : List.copyOf(correlatedEvents);
    }

    public static Finding classified(PolicyStatement statement, Classification classification, BlastRadius blastRadius) {
        Objects.requireNonNull(classification, "classification");
        return new Finding(
            statement,
            classification.severity(),
            classification.ruleId(),
            classification.rationale(),
            blastRadius,
            List.of()
        );
    }

    public static Finding unparsed(PolicyStatement statement) {
        String rationale = UNPARSED_RATIONALE;
        if (statement.parsed() instanceof ParseResult.Unparsed u) {
            rationale = rationale + ": " + u.error().kind() + " (" + u.error().message() + ")";
        }
        return new Finding(statement, Severity.LOW, UNPARSED_RULE_ID, rationale, new BlastRadius.NotApplicable(), List.of());
    }

    public Finding withCorrelatedEvents(List<AuditEvent> events) {
        return new Finding(statement, severity, ruleId, rationale, blastRadius, events);
    }

    public boolean recentlyModified() {
        return !correlatedEvents.isEmpty();
    }

    public boolean parsed() {
        return statement.parsed() instanceof ParseResult.Parsed;
    }

    /** @return the principal count, or null when the subject is not a group or could not be resolved */
    public Integer blastRadiusCount() {
        return BlastRadius.countOrNull(blastRadius);
    }

    public boolean blastRadiusUnresolved() {
        return blastRadius instanceof BlastRadius.Unresolved;
    }
}
