package org.mongomigrations.workload.commands;

import java.io.IOException;
import java.time.Clock;

import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.workload.WorkloadConfig;
import org.mongomigrations.workload.explain.ExplainCapture;
import org.mongomigrations.workload.input.WorkloadInputs;

public class Explain extends WorkloadCommand<ExplainArgs> {

    private final Clock clock;

    public Explain(ExplainArgs arguments) {
        this(arguments, Clock.systemDefaultZone());
    }

    public Explain(ExplainArgs arguments, Clock clock) {
        super(arguments);
        this.clock = clock;
    }

    @Override
    protected void run(CommandExecutor executor, WorkloadConfig config, WorkloadRunResult.WorkloadRunResultBuilder result)
        throws IOException
    {
        var queries = new WorkloadInputs().loadQueries(config.queriesFile(), config.collection());
        var capture = new ExplainCapture(executor, clock).capture(queries, config);
        result.report(capture.report())
            .unitVerb("explains captured")
            .outputFile(capture.transcript())
            .outputLabel("Explain output saved to");
    }
}
