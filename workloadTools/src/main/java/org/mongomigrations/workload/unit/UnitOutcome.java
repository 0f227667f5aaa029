package org.mongomigrations.workload.unit;

/**
 * Final state of one logical unit.
 *
 * @param name the index name or query description
 * @param seconds elapsed time; for queries the server-side execution time
 * @param mode the mode the unit finished in, e.g. the explain verbosity; null when not applicable
 * @param message error text for failed units
 */
public record UnitOutcome(
    String name,
    UnitStatus status,
    double seconds,
    String mode,
    String message
) {

    public UnitOutcome {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Outcome of '" + name + "' must be terminal, was " + status);
        }
        if (seconds < 0) {
            throw new IllegalArgumentException("Outcome of '" + name + "' has negative time " + seconds);
        }
    }

    public boolean isSuccess() {
        return status == UnitStatus.SUCCESS;
    }
}
