package com.acme.secops.iamdrift.snapshot;

import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.directory.DirectorySnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Supplies the fully materialized input of one evaluation run. Collection (paging,
 * retries, compartment fan-out) happens behind this interface and completes before the
 * engine starts.
 */
public interface SnapshotSource {
    /**
     * @throws com.acme.secops.iamdrift.engine.SnapshotMissingException if mandatory data
     *         could not be obtained
     */
    DirectorySnapshot loadSnapshot();

    /**
     * @return recent identity audit events, newest first, or empty when events could not be
     *         collected (correlation is then disabled)
     */
    Optional<List<AuditEvent>> loadAuditEvents();
}
