package org.mongomigrations.workload.commands;

import java.nio.file.Path;

import org.mongomigrations.arguments.ArgNameConstants;
import org.mongomigrations.arguments.ArgValidation;
import org.mongomigrations.workload.WorkloadConfig;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;

@Parameters(commandNames = "explain", commandDescription = "Captures explain output for the queries of a JSON file")
public class ExplainArgs extends WorkloadArgs {
    @Parameter(names = { ArgNameConstants.QUERIES_FILE_ARG }, description = "JSON array of {description, query} entries")
    public String queriesFile = "data/mongodb_queries.json";

    @Parameter(names = { ArgNameConstants.EXPLAIN_TIMEOUT_SECONDS_ARG }, description = "Wall-clock budget for one explain invocation")
    public int explainTimeoutSeconds = 300;

    @Parameter(names = { "--output-dir" }, description = "Directory receiving the explain_out_<epoch>.txt transcript")
    public String outputDir = "data";

    @Override
    public WorkloadConfig toConfig() {
        return baseConfig()
            .queriesFile(ArgValidation.requireFile(queriesFile, "Queries file", ArgNameConstants.QUERIES_FILE_ARG))
            .explainTimeout(ArgValidation.toTimeout(explainTimeoutSeconds, ArgNameConstants.EXPLAIN_TIMEOUT_SECONDS_ARG))
            .outputDir(Path.of(ArgValidation.requireValue(outputDir, "--output-dir")))
            .build();
    }
}
