package org.mongomigrations.commands;

import org.mongomigrations.apply.ApplyReport;

import lombok.Builder;
import lombok.Getter;

@Builder
public class ApplyRunResult implements Result {
    @Getter
    private final ApplyReport report;
    @Getter
    private final String errorMessage;
    @Getter
    private final int exitCode;

    @Override
    public String asCliOutput() {
        var sb = new StringBuilder();
        if (report != null) {
            sb.append(report.asCliOutput()).append(System.lineSeparator());
        }
        sb.append("Results:").append(System.lineSeparator());
        if (errorMessage != null) {
            sb.append("   Apply failed").append(System.lineSeparator());
            sb.append(errorMessage).append(System.lineSeparator());
        } else if (report != null && report.getErrorCount() > 0) {
            sb.append("   Completed with ").append(report.getErrorCount()).append(" error(s); see Error Details above")
                .append(System.lineSeparator());
        } else {
            sb.append("   Schema applied successfully").append(System.lineSeparator());
        }
        return sb.toString();
    }
}
