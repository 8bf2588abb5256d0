package com.acme.secops.iamdrift.report;

import com.acme.secops.iamdrift.engine.EvaluationResult;

import java.io.IOException;
import java.nio.file.Path;

public interface ReportWriter {
    /**
     * Renders the result into {@code outputDir}, creating it when needed.
     *
     * @return the written file
     */
    Path write(Path outputDir, EvaluationResult result) throws IOException;
}
