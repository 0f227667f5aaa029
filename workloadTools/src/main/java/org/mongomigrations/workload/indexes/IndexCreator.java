package org.mongomigrations.workload.indexes;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

import org.mongomigrations.shell.ClientNotFoundException;
import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.shell.IdentifierValidator;
import org.mongomigrations.shell.ShellLiterals;
import org.mongomigrations.workload.WorkloadConfig;
import org.mongomigrations.workload.WorkloadScripts;
import org.mongomigrations.workload.input.IndexDefinition;
import org.mongomigrations.workload.unit.LogicalUnit;
import org.mongomigrations.workload.unit.RunReport;
import org.mongomigrations.workload.unit.UnitOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Creates the indexes of a flat list on the configured collection, one client invocation per
 * index. A failed index is recorded and the next one is attempted.
 */
@Slf4j
@RequiredArgsConstructor
public class IndexCreator {

    private final CommandExecutor executor;

    public RunReport createIndexes(List<IndexDefinition> indexes, WorkloadConfig config) throws ClientNotFoundException {
        var outcomes = new ArrayList<UnitOutcome>();
        for (var index : indexes) {
            var unit = new LogicalUnit(index.name());
            log.info("Creating: {}", index.name());
            unit.start();
            long start = System.nanoTime();
            try {
                var problem = IdentifierValidator.checkIndexName(config.database() + "." + config.collection(), index.name());
                if (problem.isPresent()) {
                    unit.fail(problem.get(), Duration.ZERO);
                } else {
                    var result = executor.execute(config.connection(), buildScript(index, config), config.timeout());
                    var elapsed = Duration.ofNanos(System.nanoTime() - start);
                    if (result.isSuccess()) {
                        unit.succeed(elapsed);
                    } else {
                        unit.fail(WorkloadScripts.failureMessage(config.connection(), result), elapsed);
                    }
                }
            } catch (ClientNotFoundException e) {
                throw e;
            } catch (IOException e) {
                unit.fail(e.getMessage(), Duration.ofNanos(System.nanoTime() - start));
            }
            var outcome = unit.toOutcome();
            if (outcome.isSuccess()) {
                log.info("   Created ({}s)", String.format(Locale.ROOT, "%.2f", outcome.seconds()));
            } else {
                log.warn("   Failed: {}", outcome.message());
            }
            outcomes.add(outcome);
        }
        return new RunReport(outcomes);
    }

    static String buildScript(IndexDefinition index, WorkloadConfig config) {
        var options = new LinkedHashMap<String, Object>();
        options.put("name", index.name());
        options.put("background", true);
        return WorkloadScripts.prelude(config.database())
            + "var result = targetDb.getCollection(" + ShellLiterals.string(config.collection()) + ").createIndex("
            + ShellLiterals.json(index.keys()) + ", " + ShellLiterals.json(options) + ");\n"
            + "print(JSON.stringify(result));\n";
    }
}
