package org.mongomigrations.workload.explain;

/**
 * Explain verbosities in the order they are tried.
 */
public enum ExplainVerbosity {
    ALL_PLANS_EXECUTION("allPlansExecution"),
    EXECUTION_STATS("executionStats");

    private final String mode;

    ExplainVerbosity(String mode) {
        this.mode = mode;
    }

    public String getMode() {
        return mode;
    }
}
