package org.mongomigrations.workload.commands;

import java.io.IOException;
import java.time.Clock;

import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.workload.WorkloadConfig;
import org.mongomigrations.workload.input.WorkloadInputs;
import org.mongomigrations.workload.queries.QueryRunner;

public class RunQueries extends WorkloadCommand<RunQueriesArgs> {

    private final Clock clock;

    public RunQueries(RunQueriesArgs arguments) {
        this(arguments, Clock.systemUTC());
    }

    public RunQueries(RunQueriesArgs arguments, Clock clock) {
        super(arguments);
        this.clock = clock;
    }

    @Override
    protected void run(CommandExecutor executor, WorkloadConfig config, WorkloadRunResult.WorkloadRunResultBuilder result)
        throws IOException
    {
        var queries = new WorkloadInputs().loadQueries(config.queriesFile(), config.collection());
        var runner = new QueryRunner(executor, clock);
        var report = runner.runQueries(queries, config);
        var column = runner.saveTimings(report, config);
        result.report(report)
            .unitVerb("queries executed")
            .outputFile(config.timingFile())
            .outputLabel("Results saved to (column " + column + ")");
    }
}
