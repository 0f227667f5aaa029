package org.mongomigrations.commands;

import org.mongomigrations.apply.ApplyConfig;
import org.mongomigrations.arguments.ArgNameConstants;
import org.mongomigrations.arguments.ArgValidation;
import org.mongomigrations.shell.ConnectionString;
import org.mongomigrations.shell.MongoShellExecutor;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "apply", commandDescription = "Recreates the databases, collections, indexes and shard keys of a schema file on a destination")
public class ApplyArgs {
    @Parameter(names = {"--help", "-h"}, help = true, description = "Displays information about how to use this command")
    public boolean help;

    @Parameter(names = { ArgNameConstants.DEST_CONNECTION_STRING_ARG }, description = "Connection string of the destination")
    public String destConnectionString;

    @Parameter(names = { "--schema", "-s" }, description = "Path of the schema file to apply")
    public String schemaFile = "schema.json";

    @Parameter(names = { ArgNameConstants.DATABASE_PREFIX_ARG }, description = "Prefix prepended to every database name on the destination")
    public String databasePrefix = "";

    @Parameter(names = { ArgNameConstants.TIMEOUT_SECONDS_ARG }, description = "Wall-clock budget for one client invocation")
    public int timeoutSeconds = 120;

    @Parameter(names = { ArgNameConstants.MONGOSH_PATH_ARG }, description = "The mongosh executable to run")
    public String mongoshPath = MongoShellExecutor.DEFAULT_SHELL;

    public ApplyConfig toConfig() {
        return ApplyConfig.builder()
            .destination(new ConnectionString(ArgValidation.requireValue(destConnectionString, ArgNameConstants.DEST_CONNECTION_STRING_ARG)))
            .schemaFile(ArgValidation.requireFile(schemaFile, "Schema file", "--schema"))
            .databasePrefix(databasePrefix == null ? "" : databasePrefix)
            .timeout(ArgValidation.toTimeout(timeoutSeconds, ArgNameConstants.TIMEOUT_SECONDS_ARG))
            .mongoshPath(mongoshPath)
            .build();
    }
}
