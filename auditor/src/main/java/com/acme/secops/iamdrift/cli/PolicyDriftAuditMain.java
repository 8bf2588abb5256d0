package com.acme.secops.iamdrift.cli;

import com.acme.secops.iamdrift.audit.AuditEvent;
import com.acme.secops.iamdrift.directory.DirectorySnapshot;
import com.acme.secops.iamdrift.engine.EvaluationResult;
import com.acme.secops.iamdrift.engine.PolicyRiskEngine;
import com.acme.secops.iamdrift.engine.SnapshotMissingException;
import com.acme.secops.iamdrift.report.JsonReportWriter;
import com.acme.secops.iamdrift.report.MarkdownReportWriter;
import com.acme.secops.iamdrift.snapshot.JsonFileSnapshotSource;
import com.acme.secops.iamdrift.snapshot.SnapshotSource;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.logging.Logger;

public final class PolicyDriftAuditMain {
    private static final Logger LOG = Logger.getLogger(PolicyDriftAuditMain.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_FAILURE = 1;
    static final int EXIT_REPORT_FAILURE = 2;

    private PolicyDriftAuditMain() {
    }

    public static void main(String[] args) {
        int code = run(args, AuditorConfig.fromEnvironment(), Clock.systemUTC());
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    /** Runs one audit and returns the process exit code. */
    static int run(String[] args, AuditorConfig config, Clock clock) {
        if (args.length > 0 && !args[0].isBlank()) {
            config = config.withSnapshotFile(Path.of(args[0]));
        }
        LOG.info("Starting IAM policy drift audit"
            + " snapshot=" + config.snapshotFile()
            + " lookbackHours=" + config.lookbackHours()
            + " includeSubcompartments=" + config.includeSubcompartments());

        EvaluationResult result;
        try {
            SnapshotSource source = new JsonFileSnapshotSource(
                config.snapshotFile(), config.includeSubcompartments(), config.rootCompartmentId());
            DirectorySnapshot snapshot = source.loadSnapshot();
            List<AuditEvent> events = source.loadAuditEvents().orElse(null);
            result = new PolicyRiskEngine(clock).evaluate(snapshot, events, config.toEngineConfig());
        } catch (SnapshotMissingException e) {
            LOG.severe("Audit aborted: " + e.getMessage());
            return EXIT_INPUT_FAILURE;
        }

        try {
            Path json = new JsonReportWriter().write(config.outputDir(), result);
            Path markdown = new MarkdownReportWriter(config.reportTopFindings(), config.reportTopEvents())
                .write(config.outputDir(), result);
            LOG.info("Reports written json=" + json + " markdown=" + markdown);
        } catch (IOException e) {
            LOG.severe("Report write failed: " + e.getClass().getSimpleName() + " " + e.getMessage());
            return EXIT_REPORT_FAILURE;
        }
        return EXIT_OK;
    }
}
