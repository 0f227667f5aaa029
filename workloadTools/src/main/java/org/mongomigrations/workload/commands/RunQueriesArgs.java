package org.mongomigrations.workload.commands;

import java.nio.file.Path;

import org.mongomigrations.arguments.ArgNameConstants;
import org.mongomigrations.arguments.ArgValidation;
import org.mongomigrations.workload.WorkloadConfig;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "run-queries", commandDescription = "Runs the queries of a JSON file and records their execution times in a CSV table")
public class RunQueriesArgs extends WorkloadArgs {
    @Parameter(names = { ArgNameConstants.QUERIES_FILE_ARG }, description = "JSON array of {description, query} entries")
    public String queriesFile = "data/mongodb_queries.json";

    @Parameter(names = { "--output" }, description = "CSV timing table to merge this run into")
    public String timingFile = "data/Query_Execution_output.csv";

    @Override
    public WorkloadConfig toConfig() {
        return baseConfig()
            .queriesFile(ArgValidation.requireFile(queriesFile, "Queries file", ArgNameConstants.QUERIES_FILE_ARG))
            .timingFile(Path.of(ArgValidation.requireValue(timingFile, "--output")))
            .build();
    }
}
