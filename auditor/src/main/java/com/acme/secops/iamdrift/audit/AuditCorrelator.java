package com.acme.secops.iamdrift.audit;

import com.acme.secops.iamdrift.finding.Finding;

import java.util.List;

/**
 * Joins recent identity-change events to findings.
 *
 * <p>Correlation is a pure filter and join: events outside the lookback window are never
 * attached, and an empty event list leaves every finding as it was.
 */
public interface AuditCorrelator {
    /**
     * @param findings      findings in report order; the returned list keeps that order
     * @param events        candidate events, may be empty
     * @param lookbackHours size of the window ending now
     * @return findings with matching events attached
     */
    List<Finding> correlate(List<Finding> findings, List<AuditEvent> events, int lookbackHours);

    /** Same as {@link #correlate(List, List, int)} over an explicit window. */
    List<Finding> correlate(List<Finding> findings, List<AuditEvent> events, AuditWindow window);
}
