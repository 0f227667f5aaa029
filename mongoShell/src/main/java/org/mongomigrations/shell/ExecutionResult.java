package org.mongomigrations.shell;

import java.time.Duration;

/**
 * Outcome of one external client invocation that ran to completion.
 */
public record ExecutionResult(
    int exitCode,
    String stdout,
    String stderr,
    Duration elapsed
) {

    public ExecutionResult {
        stdout = stdout == null ? "" : stdout;
        stderr = stderr == null ? "" : stderr;
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public static ExecutionResult success(String stdout) {
        return new ExecutionResult(0, stdout, "", Duration.ZERO);
    }

    public static ExecutionResult failure(int exitCode, String stderr) {
        return new ExecutionResult(exitCode, "", stderr, Duration.ZERO);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }
}
