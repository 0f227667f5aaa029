package org.mongomigrations.cli;

import java.io.IOException;

import org.mongomigrations.arguments.ConfigurationException;
import org.mongomigrations.shell.ClientNotFoundException;
import org.mongomigrations.shell.ConnectivityException;
import org.mongomigrations.shell.ExecutionTimeoutException;
import org.mongomigrations.shell.UnsafeIdentifierException;

import lombok.extern.slf4j.Slf4j;

/**
 * Logs a failure that ends a command and renders the message shown to the user, including the
 * remediation steps the failure carries.
 */
@Slf4j
public final class CliFailures {

    private CliFailures() {
        throw new IllegalStateException("Utility class");
    }

    public static String describe(Exception e) {
        if (e instanceof ConfigurationException) {
            var ce = (ConfigurationException) e;
            log.atError().setCause(ce).setMessage("Invalid configuration").log();
            return withSteps("Configuration error: " + ce.getMessage(), String.join(System.lineSeparator(), ce.getRemediation()));
        } else if (e instanceof ConnectivityException) {
            var ce = (ConnectivityException) e;
            log.atError().setCause(ce).setMessage("Connectivity failure ({})").addArgument(ce.getKind()).log();
            return withSteps("Connection failed: " + ce.getMessage(), ce.getRemediation());
        } else if (e instanceof ExecutionTimeoutException) {
            log.atError().setCause(e).setMessage("Client invocation timed out").log();
            return withSteps(e.getMessage(), "Increase --timeout-seconds, or check the server load");
        } else if (e instanceof ClientNotFoundException) {
            log.atError().setCause(e).setMessage("Database client not found").log();
            return e.getMessage();
        } else if (e instanceof UnsafeIdentifierException) {
            log.atError().setCause(e).setMessage("Unsafe identifiers").log();
            return withSteps(e.getMessage(),
                "Rename the listed objects (or adjust --database-prefix) so no name contains quote, delimiter or control characters");
        } else if (e instanceof IOException) {
            log.atError().setCause(e).setMessage("I/O failure").log();
            return "Failure: " + e.getMessage();
        }
        log.atError().setCause(e).setMessage("Unexpected failure").log();
        return createUnexpectedErrorMessage(e);
    }

    public static String withSteps(String message, String remediation) {
        return message + System.lineSeparator() + "How to fix:" + System.lineSeparator() + remediation;
    }

    private static String createUnexpectedErrorMessage(Exception e) {
        var causeMessage = e.getCause() != null ? ", inner cause: " + e.getCause().getMessage() : "";
        return "Unexpected failure: " + e.getMessage() + causeMessage;
    }
}
