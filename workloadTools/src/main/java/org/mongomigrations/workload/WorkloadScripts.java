package org.mongomigrations.workload;

import org.mongomigrations.shell.ConnectionString;
import org.mongomigrations.shell.ExecutionResult;
import org.mongomigrations.shell.ShellLiterals;

/**
 * Script fragments and output handling shared by the workload tools.
 */
public final class WorkloadScripts {

    private static final int MAX_MESSAGE_LENGTH = 300;

    private WorkloadScripts() {
        throw new IllegalStateException("Utility class");
    }

    /** Binds {@code targetDb} to the configured database. */
    public static String prelude(String database) {
        return "var targetDb = db.getSiblingDB(" + ShellLiterals.string(database) + ");\n";
    }

    /** Redacted, single-line description of a failed invocation. */
    public static String failureMessage(ConnectionString target, ExecutionResult result) {
        var output = result.stderr().isBlank() ? result.stdout() : result.stderr();
        var firstLine = output.strip().lines().findFirst().orElse("exit status " + result.exitCode());
        var redacted = target.redact(firstLine);
        return redacted.length() <= MAX_MESSAGE_LENGTH ? redacted : redacted.substring(0, MAX_MESSAGE_LENGTH) + "...";
    }
}
