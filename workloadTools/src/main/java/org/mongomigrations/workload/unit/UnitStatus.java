package org.mongomigrations.workload.unit;

public enum UnitStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    ERROR;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR;
    }
}
