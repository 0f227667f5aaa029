package org.mongomigrations.workload.commands;

import java.util.ArrayList;
import java.util.Optional;

import org.mongomigrations.arguments.ArgNameConstants;
import org.mongomigrations.arguments.ArgValidation;
import org.mongomigrations.shell.ConnectionString;
import org.mongomigrations.shell.IdentifierValidator;
import org.mongomigrations.shell.MongoShellExecutor;
import org.mongomigrations.workload.WorkloadConfig;

import com.beust.jcommander.Parameter;

/** Target settings shared by every workload command */
public abstract class WorkloadArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this command")
    public boolean help;

    @Parameter(names = { ArgNameConstants.CONNECTION_STRING_ARG }, description = "Connection string of the server to run against")
    public String connectionString;

    @Parameter(names = { ArgNameConstants.DATABASE_ARG }, description = "Database holding the target collection")
    public String database = "mobile_apps";

    @Parameter(names = { ArgNameConstants.COLLECTION_ARG }, description = "Target collection; substituted for {{collection}} in queries")
    public String collection = "applications";

    @Parameter(names = { ArgNameConstants.TIMEOUT_SECONDS_ARG }, description = "Wall-clock budget for one client invocation")
    public int timeoutSeconds = 60;

    @Parameter(names = { ArgNameConstants.MONGOSH_PATH_ARG }, description = "The mongosh executable to run")
    public String mongoshPath = MongoShellExecutor.DEFAULT_SHELL;

    public abstract WorkloadConfig toConfig();

    protected WorkloadConfig.WorkloadConfigBuilder baseConfig() {
        var connection = new ConnectionString(ArgValidation.requireValue(connectionString, ArgNameConstants.CONNECTION_STRING_ARG));
        ArgValidation.requireValue(database, ArgNameConstants.DATABASE_ARG);
        ArgValidation.requireValue(collection, ArgNameConstants.COLLECTION_ARG);
        var checks = new ArrayList<Optional<String>>();
        checks.add(IdentifierValidator.checkDatabaseName(database));
        checks.add(IdentifierValidator.checkCollectionName(database, collection));
        IdentifierValidator.requireSafe(checks);
        return WorkloadConfig.builder()
            .connection(connection)
            .database(database)
            .collection(collection)
            .timeout(ArgValidation.toTimeout(timeoutSeconds, ArgNameConstants.TIMEOUT_SECONDS_ARG))
            .mongoshPath(mongoshPath);
    }
}
