package org.mongomigrations.workload.queries;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalLong;

import org.mongomigrations.shell.ClientNotFoundException;
import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.workload.WorkloadConfig;
import org.mongomigrations.workload.WorkloadScripts;
import org.mongomigrations.workload.input.QueryDefinition;
import org.mongomigrations.workload.unit.LogicalUnit;
import org.mongomigrations.workload.unit.RunReport;
import org.mongomigrations.workload.unit.UnitOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs each query once and records the execution time measured inside the client, so process
 * start-up and connection set-up are not part of the figure.
 */
@Slf4j
public class QueryRunner {

    static final String EXEC_TIME_MARKER = "EXEC_TIME:";

    private final CommandExecutor executor;
    private final Clock clock;

    public QueryRunner(CommandExecutor executor) {
        this(executor, Clock.systemUTC());
    }

    public QueryRunner(CommandExecutor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    public RunReport runQueries(List<QueryDefinition> queries, WorkloadConfig config) throws ClientNotFoundException {
        var outcomes = new ArrayList<UnitOutcome>();
        for (var query : queries) {
            var unit = new LogicalUnit(query.description());
            log.info("{}", query.description());
            unit.start();
            try {
                var result = executor.execute(config.connection(), buildScript(query, config), config.timeout());
                if (result.isSuccess()) {
                    var millis = parseExecutionMillis(result.stdout());
                    if (millis.isEmpty()) {
                        log.warn("   No {} line in client output, recording 0", EXEC_TIME_MARKER);
                    }
                    unit.succeed(Duration.ofMillis(millis.orElse(0)));
                } else {
                    unit.fail(WorkloadScripts.failureMessage(config.connection(), result), Duration.ZERO);
                }
            } catch (ClientNotFoundException e) {
                throw e;
            } catch (IOException e) {
                unit.fail(e.getMessage(), Duration.ZERO);
            }
            var outcome = unit.toOutcome();
            if (outcome.isSuccess()) {
                log.info("   {}s", String.format(Locale.ROOT, "%.3f", outcome.seconds()));
            } else {
                log.warn("   Failed: {}", outcome.message());
            }
            outcomes.add(outcome);
        }
        return new RunReport(outcomes);
    }

    /**
     * Merges the run into the timing table at the configured path.
     *
     * @return the name of the column holding this run
     */
    public String saveTimings(RunReport report, WorkloadConfig config) throws IOException {
        var table = QueryTimingTable.load(config.timingFile());
        var column = table.freeColumnName(config.collection() + "_" + clock.instant().getEpochSecond());
        table.addRun(column, report.outcomes());
        table.write(config.timingFile());
        log.info("Results saved to: {}", config.timingFile());
        log.info("Column: {}", column);
        return column;
    }

    static String buildScript(QueryDefinition query, WorkloadConfig config) {
        return WorkloadScripts.prelude(config.database())
            + "var startMs = Date.now();\n"
            + "var result = " + query.query() + ";\n"
            + "var endMs = Date.now();\n"
            + "print('" + EXEC_TIME_MARKER + "' + (endMs - startMs));\n";
    }

    static OptionalLong parseExecutionMillis(String stdout) {
        return stdout.lines()
            .filter(line -> line.startsWith(EXEC_TIME_MARKER))
            .map(line -> line.substring(EXEC_TIME_MARKER.length()).trim())
            .filter(value -> value.matches("\\d+"))
            .mapToLong(Long::parseLong)
            .findFirst();
    }
}
