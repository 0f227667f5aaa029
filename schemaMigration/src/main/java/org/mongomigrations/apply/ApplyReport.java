package org.mongomigrations.apply;

import java.util.List;

/**
 * Per-target results of one apply run together with the totals the script reported.
 */
public record ApplyReport(
    List<ApplyResult> results,
    ApplySummary summary,
    List<ApplyError> unmatchedErrors
) {

    public ApplyReport {
        results = List.copyOf(results);
        unmatchedErrors = List.copyOf(unmatchedErrors);
    }

    public long count(ApplyStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public List<ApplyResult> failures() {
        return results.stream().filter(r -> r.status() == ApplyStatus.FAILED).toList();
    }

    public int getErrorCount() {
        return summary.errorCount();
    }

    public String asCliOutput() {
        var sb = new StringBuilder();
        sb.append("Apply Results:").append(System.lineSeparator());
        sb.append("   Databases Created: ").append(summary.databasesCreated()).append(System.lineSeparator());
        sb.append("   Collections Created: ").append(summary.collectionsCreated()).append(System.lineSeparator());
        sb.append("   Indexes Created: ").append(summary.indexesCreated()).append(System.lineSeparator());
        sb.append("   Skipped: ").append(count(ApplyStatus.SKIPPED)).append(System.lineSeparator());
        sb.append("   Errors: ").append(summary.errorCount()).append(System.lineSeparator());
        if (!summary.errors().isEmpty()) {
            sb.append(System.lineSeparator()).append("Error Details:").append(System.lineSeparator());
            summary.errors().forEach(e -> sb.append("   - ").append(e.describe()).append(System.lineSeparator()));
        }
        return sb.toString();
    }
}
