package org.mongomigrations.workload.commands;

import java.nio.file.Path;

import org.mongomigrations.workload.unit.RunReport;

import lombok.Builder;
import lombok.Getter;

@Builder
public class WorkloadRunResult {
    @Getter
    private final RunReport report;
    /** Noun phrase for successful units, e.g. "indexes created" */
    private final String unitVerb;
    @Getter
    private final Path outputFile;
    @Getter
    private final String outputLabel;
    @Getter
    private final String errorMessage;
    @Getter
    private final int exitCode;

    public String asCliOutput() {
        var sb = new StringBuilder();
        if (report != null) {
            sb.append(report.asCliOutput(unitVerb));
        }
        if (outputFile != null) {
            sb.append(outputLabel).append(": ").append(outputFile).append(System.lineSeparator());
        }
        if (errorMessage != null) {
            sb.append("Failed:").append(System.lineSeparator()).append(errorMessage).append(System.lineSeparator());
        }
        return sb.toString();
    }
}
