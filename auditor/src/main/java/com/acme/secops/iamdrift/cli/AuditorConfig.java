package com.acme.secops.iamdrift.cli;

import com.acme.secops.iamdrift.engine.EngineConfig;
import com.acme.secops.iamdrift.util.AuditorDefaults;
import com.acme.secops.iamdrift.util.AuditorEnvKeys;
import com.acme.secops.iamdrift.util.EnvVars;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Run configuration bound once from the environment.
 *
 * @param rootCompartmentId overrides the snapshot's root compartment; null keeps the snapshot's own
 */
public record AuditorConfig(
    int lookbackHours,
    boolean includeSubcompartments,
    String rootCompartmentId,
    Path snapshotFile,
    Path outputDir,
    int reportTopFindings,
    int reportTopEvents
) {
    public AuditorConfig {
        Objects.requireNonNull(snapshotFile, "snapshotFile");
        Objects.requireNonNull(outputDir, "outputDir");
        if (lookbackHours < AuditorDefaults.MIN_LOOKBACK_HOURS) {
            throw new IllegalArgumentException("lookbackHours must be >= 1: " + lookbackHours);
        }
        rootCompartmentId = rootCompartmentId == null || rootCompartmentId.isBlank() ? null : rootCompartmentId;
    }

    public static AuditorConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static AuditorConfig fromEnvironment(Map<String, String> env) {
        return new AuditorConfig(
            EnvVars.getIntClamped(env, AuditorEnvKeys.OCI_AUDIT_LOOKBACK_HOURS,
                AuditorDefaults.DEFAULT_LOOKBACK_HOURS,
                AuditorDefaults.MIN_LOOKBACK_HOURS,
                AuditorDefaults.MAX_LOOKBACK_HOURS),
            EnvVars.getBoolean(env, AuditorEnvKeys.OCI_INCLUDE_SUBCOMPARTMENTS,
                AuditorDefaults.DEFAULT_INCLUDE_SUBCOMPARTMENTS),
            EnvVars.getOrDefault(env, AuditorEnvKeys.OCI_ROOT_COMPARTMENT_OCID, null),
            EnvVars.getPath(env, AuditorEnvKeys.OCI_SNAPSHOT_FILE, AuditorDefaults.DEFAULT_SNAPSHOT_FILE),
            EnvVars.getPath(env, AuditorEnvKeys.OCI_OUTPUT_DIR, AuditorDefaults.DEFAULT_OUTPUT_DIR),
            EnvVars.getIntClamped(env, AuditorEnvKeys.OCI_REPORT_TOP_FINDINGS,
                AuditorDefaults.DEFAULT_REPORT_TOP_FINDINGS, 0, AuditorDefaults.MAX_REPORT_ROWS),
            EnvVars.getIntClamped(env, AuditorEnvKeys.OCI_REPORT_TOP_EVENTS,
                AuditorDefaults.DEFAULT_REPORT_TOP_EVENTS, 0, AuditorDefaults.MAX_REPORT_ROWS)
        );
    }

    public AuditorConfig withSnapshotFile(Path file) {
        return new AuditorConfig(lookbackHours, includeSubcompartments, rootCompartmentId, file, outputDir,
            reportTopFindings, reportTopEvents);
    }

    public EngineConfig toEngineConfig() {
        return new EngineConfig(lookbackHours, includeSubcompartments, AuditorDefaults.RECENT_EVENT_LIMIT);
    }
}
