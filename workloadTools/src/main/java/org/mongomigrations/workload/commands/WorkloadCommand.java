package org.mongomigrations.workload.commands;

import java.io.IOException;

import org.mongomigrations.cli.CliFailures;
import org.mongomigrations.schema.io.DeserializationException;
import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.shell.ConnectivityCheck;
import org.mongomigrations.shell.MongoShellExecutor;
import org.mongomigrations.workload.WorkloadConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * Template for the workload commands: convert arguments, check connectivity, run, and map any
 * fatal failure to exit code 1. Per-unit failures never change the exit code.
 */
@Slf4j
public abstract class WorkloadCommand<A extends WorkloadArgs> {

    public static final int SUCCESS_CODE = 0;
    public static final int FAILURE_CODE = 1;

    protected final A arguments;

    protected WorkloadCommand(A arguments) {
        this.arguments = arguments;
    }

    protected CommandExecutor createExecutor(String mongoshPath) {
        return new MongoShellExecutor(mongoshPath);
    }

    public WorkloadRunResult execute() {
        var result = WorkloadRunResult.builder();
        try {
            var config = arguments.toConfig();
            log.info("Target: {}", config.connection());
            log.info("Database: {}", config.database());
            log.info("Collection: {}", config.collection());
            var executor = createExecutor(config.mongoshPath());
            new ConnectivityCheck(executor).verify(config.connection(), config.timeout());
            run(executor, config, result);
            result.exitCode(SUCCESS_CODE);
        } catch (DeserializationException e) {
            log.atError().setCause(e).setMessage("Unreadable input file").log();
            result.exitCode(FAILURE_CODE).errorMessage("Invalid input: " + e.getMessage());
        } catch (Exception e) {
            result.exitCode(FAILURE_CODE).errorMessage(CliFailures.describe(e));
        }
        return result.build();
    }

    protected abstract void run(CommandExecutor executor, WorkloadConfig config, WorkloadRunResult.WorkloadRunResultBuilder result)
        throws IOException;
}
