package org.mongomigrations.workload.commands;

import java.io.IOException;

import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.workload.WorkloadConfig;
import org.mongomigrations.workload.indexes.IndexCreator;
import org.mongomigrations.workload.input.WorkloadInputs;

public class CreateIndexes extends WorkloadCommand<CreateIndexesArgs> {

    public CreateIndexes(CreateIndexesArgs arguments) {
        super(arguments);
    }

    @Override
    protected void run(CommandExecutor executor, WorkloadConfig config, WorkloadRunResult.WorkloadRunResultBuilder result)
        throws IOException
    {
        var indexes = new WorkloadInputs().loadIndexes(config.indexesFile());
        var report = new IndexCreator(executor).createIndexes(indexes, config);
        result.report(report).unitVerb("indexes created");
    }
}
