package org.mongomigrations.workload.commands;

import org.mongomigrations.arguments.ArgNameConstants;
import org.mongomigrations.arguments.ArgValidation;
import org.mongomigrations.workload.WorkloadConfig;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "create-indexes", commandDescription = "Creates the indexes listed in a JSON file on the target collection")
public class CreateIndexesArgs extends WorkloadArgs {
    @Parameter(names = { ArgNameConstants.INDEXES_FILE_ARG }, description = "JSON array of {name, keys} entries")
    public String indexesFile = "data/mongodb_indexes.json";

    @Override
    public WorkloadConfig toConfig() {
        return baseConfig()
            .indexesFile(ArgValidation.requireFile(indexesFile, "Indexes file", ArgNameConstants.INDEXES_FILE_ARG))
            .build();
    }
}
