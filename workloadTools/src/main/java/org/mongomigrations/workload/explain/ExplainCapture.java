package org.mongomigrations.workload.explain;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.mongomigrations.shell.ClientNotFoundException;
import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.shell.ExecutionResult;
import org.mongomigrations.shell.ExecutionTimeoutException;
import org.mongomigrations.workload.WorkloadConfig;
import org.mongomigrations.workload.WorkloadScripts;
import org.mongomigrations.workload.input.QueryDefinition;
import org.mongomigrations.workload.unit.LogicalUnit;
import org.mongomigrations.workload.unit.RunReport;
import org.mongomigrations.workload.unit.UnitOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Captures explain output for each query into a transcript file.
 *
 * A query is first explained with {@code allPlansExecution}. If that attempt times out it is
 * retried once with {@code executionStats}; any other failure is recorded as an error without a
 * retry. The transcript carries the original query, the mode used and the output or error text.
 */
@Slf4j
public class ExplainCapture {

    static final String RULE = "=".repeat(80);
    static final String SUB_RULE = "-".repeat(80);

    private final CommandExecutor executor;
    private final Clock clock;

    public ExplainCapture(CommandExecutor executor) {
        this(executor, Clock.systemDefaultZone());
    }

    public ExplainCapture(CommandExecutor executor, Clock clock) {
        this.executor = executor;
        this.clock = clock;
    }

    /** Result of a capture run: per-query outcomes and the transcript written. */
    public record CaptureResult(RunReport report, Path transcript) {}

    public CaptureResult capture(List<QueryDefinition> queries, WorkloadConfig config) throws IOException {
        var now = clock.instant();
        var transcript = config.outputDir().resolve("explain_out_" + now.getEpochSecond() + ".txt");
        Files.createDirectories(config.outputDir());

        var outcomes = new ArrayList<UnitOutcome>();
        try (var out = Files.newBufferedWriter(transcript, StandardCharsets.UTF_8)) {
            out.write("MongoDB Explain Output\n");
            out.write("Generated: " + OffsetDateTime.ofInstant(now, clock.getZone()) + "\n");
            out.write("Database: " + config.database() + "\n");
            out.write("Collection: " + config.collection() + "\n");
            out.write(RULE + "\n\n");

            int position = 0;
            for (var query : queries) {
                position++;
                log.info("[{}/{}] {}", position, queries.size(), query.description());
                out.write("Query " + position + ": " + query.description() + "\n");
                out.write(SUB_RULE + "\n");
                out.write("Original Query: " + query.query() + "\n\n");

                var outcome = explain(query, config, out);
                outcomes.add(outcome);
                out.write("\n" + RULE + "\n\n");
            }
        }
        log.info("Explain output saved to: {}", transcript);
        return new CaptureResult(new RunReport(outcomes), transcript);
    }

    private UnitOutcome explain(QueryDefinition query, WorkloadConfig config, BufferedWriter out) throws IOException {
        var unit = new LogicalUnit(query.description());
        unit.start(ExplainVerbosity.ALL_PLANS_EXECUTION.getMode());
        long start = System.nanoTime();
        try {
            var result = run(query, ExplainVerbosity.ALL_PLANS_EXECUTION, config);
            if (result.isSuccess()) {
                record(unit, ExplainVerbosity.ALL_PLANS_EXECUTION, result, out, start);
            } else if (result.stderr().toLowerCase(Locale.ROOT).contains("timeout")) {
                fallBack(unit, query, config, out, start);
            } else {
                recordFailure(unit, WorkloadScripts.failureMessage(config.connection(), result),
                    config.connection().redact(result.stderr()), out, start);
            }
        } catch (ExecutionTimeoutException e) {
            fallBack(unit, query, config, out, start);
        } catch (ClientNotFoundException e) {
            throw e;
        } catch (IOException e) {
            recordFailure(unit, e.getMessage(), e.getMessage(), out, start);
        }
        return unit.toOutcome();
    }

    private void fallBack(LogicalUnit unit, QueryDefinition query, WorkloadConfig config, BufferedWriter out, long start)
        throws IOException
    {
        var reduced = ExplainVerbosity.EXECUTION_STATS;
        log.warn("   Timeout, falling back to {}", reduced.getMode());
        out.write("Note: " + ExplainVerbosity.ALL_PLANS_EXECUTION.getMode() + " timed out, using "
            + reduced.getMode() + "...\n\n");
        unit.fallBack(reduced.getMode());
        try {
            var result = run(query, reduced, config);
            if (result.isSuccess()) {
                record(unit, reduced, result, out, start);
            } else {
                recordFailure(unit, WorkloadScripts.failureMessage(config.connection(), result),
                    config.connection().redact(result.stderr()), out, start);
            }
        } catch (ClientNotFoundException e) {
            throw e;
        } catch (IOException e) {
            recordFailure(unit, e.getMessage(), e.getMessage(), out, start);
        }
    }

    private ExecutionResult run(QueryDefinition query, ExplainVerbosity verbosity, WorkloadConfig config) throws IOException {
        return executor.execute(config.connection(), buildScript(query, verbosity, config), config.explainTimeout());
    }

    private static void record(LogicalUnit unit, ExplainVerbosity verbosity, ExecutionResult result, BufferedWriter out, long start)
        throws IOException
    {
        out.write("Explain Output (mode: " + verbosity.getMode() + "):\n");
        out.write(result.stdout());
        out.write("\n");
        unit.succeed(Duration.ofNanos(System.nanoTime() - start));
        log.info("   Captured ({})", verbosity.getMode());
    }

    private static void recordFailure(LogicalUnit unit, String message, String detail, BufferedWriter out, long start)
        throws IOException
    {
        out.write("ERROR:\n");
        out.write(detail == null ? "" : detail);
        out.write("\n");
        unit.fail(message, Duration.ofNanos(System.nanoTime() - start));
        log.warn("   Failed: {}", message);
    }

    static String buildScript(QueryDefinition query, ExplainVerbosity verbosity, WorkloadConfig config) {
        return WorkloadScripts.prelude(config.database())
            + "var explainResult = " + ExplainQueryTransformer.toExplain(query.query(), verbosity) + ";\n"
            + "print(JSON.stringify(explainResult, null, 2));\n";
    }
}
