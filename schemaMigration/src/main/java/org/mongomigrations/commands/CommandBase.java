package org.mongomigrations.commands;

import java.io.IOException;
import java.time.Duration;

import org.mongomigrations.cli.CliFailures;
import org.mongomigrations.schema.io.DeserializationException;
import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.shell.ConnectionString;
import org.mongomigrations.shell.ConnectivityCheck;
import org.mongomigrations.shell.MongoShellExecutor;

import lombok.extern.slf4j.Slf4j;

/** Shared functionality between the extract and apply commands */
@Slf4j
public abstract class CommandBase {

    public static final int SUCCESS_CODE = 0;
    public static final int FAILURE_CODE = 1;

    protected CommandExecutor createExecutor(String mongoshPath) {
        return new MongoShellExecutor(mongoshPath);
    }

    protected void checkConnectivity(CommandExecutor executor, ConnectionString target, Duration timeout)
        throws IOException
    {
        new ConnectivityCheck(executor).verify(target, timeout);
    }

    protected String describeFailure(Exception e) {
        if (e instanceof DeserializationException) {
            log.atError().setCause(e).setMessage("Unreadable schema").log();
            return "Invalid input: " + e.getMessage();
        }
        return CliFailures.describe(e);
    }
}
