package org.mongomigrations.apply;

import java.io.IOException;
import java.time.Duration;

import org.mongomigrations.schema.model.SchemaSnapshot;
import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.shell.ConnectionString;
import org.mongomigrations.shell.ConnectivityDiagnostics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Recreates the structure of a snapshot on a destination server and reports per-object outcomes.
 */
@Slf4j
@RequiredArgsConstructor
public class SchemaApplier {

    private final CommandExecutor executor;
    private final ApplyScriptGenerator generator;
    private final ApplySummaryParser parser;
    private final ApplyResultAggregator aggregator;

    public SchemaApplier(CommandExecutor executor) {
        this(executor, new ApplyScriptGenerator(), new ApplySummaryParser(), new ApplyResultAggregator());
    }

    public ApplyReport apply(SchemaSnapshot snapshot, String databasePrefix, ConnectionString destination, Duration timeout)
        throws IOException
    {
        var script = generator.generate(snapshot, databasePrefix);
        log.info("Applying {} objects to {}", script.targets().size(), destination);

        var result = executor.execute(destination, script.body(), timeout);
        result.stdout().lines().forEach(line -> log.debug("{}", destination.redact(line)));

        if (!parser.hasSummary(result.stdout())) {
            if (!result.isSuccess()) {
                throw ConnectivityDiagnostics.diagnose(destination, result);
            }
            throw new ScriptOutputException("Apply script finished without printing its summary");
        }
        if (!result.isSuccess()) {
            log.warn("Client exited with status {} after printing the apply summary", result.exitCode());
        }

        var report = aggregator.aggregate(script, parser.parse(result.stdout()));
        report.failures().forEach(f -> log.warn("Failed: {}: {}", f.target().describe(), destination.redact(f.message())));
        return report;
    }
}
