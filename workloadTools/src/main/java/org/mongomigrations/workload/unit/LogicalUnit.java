package org.mongomigrations.workload.unit;

import java.time.Duration;

/**
 * Lifecycle of one index, query or explain unit:
 * PENDING, then RUNNING, then SUCCESS or ERROR. A running unit may switch to a fallback mode
 * once, which is how explain capture retries with reduced verbosity after a timeout.
 * Every other transition throws {@link IllegalStateException}.
 */
public class LogicalUnit {

    private final String name;
    private UnitStatus status = UnitStatus.PENDING;
    private String mode;
    private boolean fellBack;
    private Duration elapsed = Duration.ZERO;
    private String message;

    public LogicalUnit(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public UnitStatus getStatus() {
        return status;
    }

    public String getMode() {
        return mode;
    }

    public boolean hasFallenBack() {
        return fellBack;
    }

    public void start() {
        start(null);
    }

    public void start(String initialMode) {
        require(UnitStatus.PENDING, "start");
        status = UnitStatus.RUNNING;
        mode = initialMode;
    }

    public void fallBack(String reducedMode) {
        require(UnitStatus.RUNNING, "fall back");
        if (fellBack) {
            throw new IllegalStateException("Unit '" + name + "' has already fallen back to " + mode);
        }
        fellBack = true;
        mode = reducedMode;
    }

    public void succeed(Duration elapsed) {
        require(UnitStatus.RUNNING, "succeed");
        status = UnitStatus.SUCCESS;
        this.elapsed = elapsed;
    }

    public void fail(String message, Duration elapsed) {
        require(UnitStatus.RUNNING, "fail");
        status = UnitStatus.ERROR;
        this.message = message;
        this.elapsed = elapsed;
    }

    public UnitOutcome toOutcome() {
        if (!status.isTerminal()) {
            throw new IllegalStateException("Unit '" + name + "' is still " + status);
        }
        return new UnitOutcome(name, status, elapsed.toNanos() / 1_000_000_000.0, mode, message);
    }

    private void require(UnitStatus expected, String action) {
        if (status != expected) {
            throw new IllegalStateException("Cannot " + action + " unit '" + name + "' in state " + status);
        }
    }
}
