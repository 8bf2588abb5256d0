package com.acme.secops.iamdrift.engine;

import com.acme.secops.iamdrift.risk.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate counts over one evaluation. {@code bySeverity} always carries all four
 * severities; the compartment maps are keyed by compartment name and ordered by count,
 * highest first.
 */
public record FindingSummary(
    Map<Severity, Integer> bySeverity,
    Map<String, Integer> byCompartment,
    Map<String, Integer> elevatedByCompartment,
    int scannedCompartments,
    int skippedCompartments,
    int policiesScanned,
    int statementsScanned,
    int unparsedStatements,
    int unresolvedGroupReferences,
    int recentlyModifiedFindings,
    int identityAuditEvents,
    int policyChangeEvents,
    int groupCount,
    int dynamicGroupCount,
    int userCount,
    int mfaEnabledUserCount,
    int activePrincipalCount
) {
    public FindingSummary {
        bySeverity = Map.copyOf(bySeverity);
        byCompartment = Collections.unmodifiableMap(new LinkedHashMap<>(byCompartment));
        elevatedByCompartment = Collections.unmodifiableMap(new LinkedHashMap<>(elevatedByCompartment));
    }

    public int count(Severity severity) {
        return bySeverity.getOrDefault(severity, 0);
    }

    public int elevatedFindings() {
        return count(Severity.CRITICAL) + count(Severity.HIGH) + count(Severity.MEDIUM);
    }
}
