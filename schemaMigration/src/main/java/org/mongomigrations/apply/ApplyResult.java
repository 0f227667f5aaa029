package org.mongomigrations.apply;

/**
 * Outcome of one apply target.
 */
public record ApplyResult(
    ApplyTarget target,
    ApplyStatus status,
    String message
) {

    public static ApplyResult created(ApplyTarget target) {
        return new ApplyResult(target, ApplyStatus.CREATED, null);
    }

    public static ApplyResult skipped(ApplyTarget target, String reason) {
        return new ApplyResult(target, ApplyStatus.SKIPPED, reason);
    }

    public static ApplyResult failed(ApplyTarget target, String error) {
        return new ApplyResult(target, ApplyStatus.FAILED, error);
    }
}
