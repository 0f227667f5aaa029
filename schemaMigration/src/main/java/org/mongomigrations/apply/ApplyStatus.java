package org.mongomigrations.apply;

public enum ApplyStatus {
    CREATED,
    SKIPPED,
    FAILED
}
