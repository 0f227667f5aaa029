package org.mongomigrations.workload.unit;

import java.util.List;
import java.util.Locale;

/**
 * Totals over the outcomes of one run.
 */
public record RunReport(List<UnitOutcome> outcomes) {

    public RunReport {
        outcomes = List.copyOf(outcomes);
    }

    public int getAttempted() {
        return outcomes.size();
    }

    public int getSucceeded() {
        return (int) outcomes.stream().filter(UnitOutcome::isSuccess).count();
    }

    public int getFailed() {
        return getAttempted() - getSucceeded();
    }

    public double getTotalSeconds() {
        return outcomes.stream().mapToDouble(UnitOutcome::seconds).sum();
    }

    public double getAverageSeconds() {
        return outcomes.isEmpty() ? 0 : getTotalSeconds() / outcomes.size();
    }

    /**
     * @param verb past participle describing a successful unit, e.g. "indexes created"
     */
    public String asCliOutput(String verb) {
        var sb = new StringBuilder();
        for (var outcome : outcomes) {
            sb.append("   ").append(outcome.isSuccess() ? "[OK]    " : "[ERROR] ").append(outcome.name());
            sb.append(String.format(Locale.ROOT, " (%.3fs", outcome.seconds()));
            if (outcome.mode() != null) {
                sb.append(", ").append(outcome.mode());
            }
            sb.append(')');
            if (outcome.message() != null) {
                sb.append(": ").append(outcome.message());
            }
            sb.append(System.lineSeparator());
        }
        sb.append(String.format(Locale.ROOT, "Summary: %d/%d %s", getSucceeded(), getAttempted(), verb))
            .append(System.lineSeparator());
        sb.append(String.format(Locale.ROOT, "Total: %.3fs | Avg: %.3fs", getTotalSeconds(), getAverageSeconds()))
            .append(System.lineSeparator());
        return sb.toString();
    }
}
