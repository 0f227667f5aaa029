package org.mongomigrations.shell;

import java.io.IOException;
import java.time.Duration;

/**
 * Runs shell scripts against a target server.
 *
 * Implementations perform exactly one invocation per call and never retry. Per-statement
 * failures inside a script are the script's business; this layer only reports how the
 * invocation as a whole ended.
 */
@FunctionalInterface
public interface CommandExecutor {

    /**
     * Execute a script body against the target.
     *
     * @param target the server to connect to
     * @param script script text in the client's dialect
     * @param timeout wall-clock budget for the whole invocation
     * @return exit status and captured output
     * @throws ExecutionTimeoutException if the budget elapsed before the client exited
     * @throws ClientNotFoundException if the client could not be launched
     * @throws IOException on any other I/O failure
     */
    ExecutionResult execute(ConnectionString target, String script, Duration timeout) throws IOException;

    /**
     * Execute a single command expression and print its result as JSON.
     */
    default ExecutionResult executeCommand(ConnectionString target, String command, Duration timeout)
        throws IOException {
        return execute(target, "print(JSON.stringify(" + command + "));\n", timeout);
    }
}
