package org.mongomigrations.shell;

import java.io.IOException;
import java.time.Duration;

/**
 * The external client did not finish within its wall-clock budget and was terminated.
 */
public class ExecutionTimeoutException extends IOException {

    private final Duration timeout;

    public ExecutionTimeoutException(Duration timeout) {
        super("Execution timed out after " + timeout.toSeconds() + " seconds");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
