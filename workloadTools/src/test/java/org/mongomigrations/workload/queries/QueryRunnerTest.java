package org.mongomigrations.workload.queries;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

import org.mongomigrations.shell.CommandExecutor;
import org.mongomigrations.shell.ExecutionResult;
import org.mongomigrations.workload.WorkloadConfig;
import org.mongomigrations.workload.testutils.WorkloadFixtures;
import org.mongomigrations.workload.unit.UnitStatus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryRunnerTest {

    @TempDir
    Path tempDir;

    private static Clock at(long epochSecond) {
        return Clock.fixed(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC);
    }

    @Test
    void recordsTimeReportedByClient() throws Exception {
        var scripts = new ArrayList<String>();
        CommandExecutor executor = (target, script, timeout) -> {
            scripts.add(script);
            return ExecutionResult.success("some output\nEXEC_TIME:1250\n");
        };

        var report = new QueryRunner(executor).runQueries(WorkloadFixtures.queries(), WorkloadFixtures.config(tempDir).build());

        assertEquals(2, report.getSucceeded());
        assertEquals(1.25, report.outcomes().get(0).seconds(), 1e-9);
        assertTrue(scripts.get(0).contains("var result = targetDb.applications.find({email: 'a@example.com'}).toArray();"));
    }

    @Test
    void scriptMeasuresInsideClient() {
        var config = WorkloadFixtures.config(tempDir).build();
        var script = QueryRunner.buildScript(WorkloadFixtures.queries().get(1), config);

        assertEquals("var targetDb = db.getSiblingDB(\"mobile_apps\");\n"
            + "var startMs = Date.now();\n"
            + "var result = targetDb.applications.countDocuments({status: 'active'});\n"
            + "var endMs = Date.now();\n"
            + "print('EXEC_TIME:' + (endMs - startMs));\n", script);
    }

    @Test
    void parsesExecutionTimeLine() {
        assertEquals(OptionalLong.of(42), QueryRunner.parseExecutionMillis("noise\nEXEC_TIME:42\n"));
        assertEquals(OptionalLong.of(7), QueryRunner.parseExecutionMillis("EXEC_TIME: 7"));
        assertEquals(OptionalLong.empty(), QueryRunner.parseExecutionMillis("EXEC_TIME:NaN"));
        assertEquals(OptionalLong.empty(), QueryRunner.parseExecutionMillis(""));
    }

    @Test
    void missingTimeLineCountsAsZero() throws Exception {
        CommandExecutor executor = (target, script, timeout) -> ExecutionResult.success("[]");

        var report = new QueryRunner(executor).runQueries(WorkloadFixtures.queries(), WorkloadFixtures.config(tempDir).build());

        assertEquals(UnitStatus.SUCCESS, report.outcomes().get(0).status());
        assertEquals(0.0, report.outcomes().get(0).seconds());
    }

    @Test
    void failedQueryIsAnError() throws Exception {
        CommandExecutor executor = (target, script, timeout) -> script.contains("countDocuments")
            ? ExecutionResult.failure(1, "MongoServerError: unknown operator: $bogus")
            : ExecutionResult.success("EXEC_TIME:10");

        var report = new QueryRunner(executor).runQueries(WorkloadFixtures.queries(), WorkloadFixtures.config(tempDir).build());

        assertEquals(2, report.getAttempted());
        assertEquals(1, report.getSucceeded());
        assertEquals(UnitStatus.ERROR, report.outcomes().get(1).status());
        assertEquals("MongoServerError: unknown operator: $bogus", report.outcomes().get(1).message());
    }

    @Test
    void twoRunsAddTwoColumns() throws Exception {
        CommandExecutor executor = (target, script, timeout) -> ExecutionResult.success("EXEC_TIME:100");
        WorkloadConfig config = WorkloadFixtures.config(tempDir).build();

        var first = new QueryRunner(executor, at(1_700_000_000L));
        var firstColumn = first.saveTimings(first.runQueries(WorkloadFixtures.queries(), config), config);
        var second = new QueryRunner(executor, at(1_700_000_600L));
        var secondColumn = second.saveTimings(second.runQueries(WorkloadFixtures.queries(), config), config);

        assertEquals("applications_1700000000", firstColumn);
        assertEquals("applications_1700000600", secondColumn);
        var table = QueryTimingTable.load(config.timingFile());
        assertEquals(3, table.getColumns().size());
        assertEquals(2, table.getDescriptions().size());
        assertEquals("0.100", table.getCell("Find by email", firstColumn));
        assertEquals("0.100", table.getCell("Count active", secondColumn));
    }

    @Test
    void runsWithinTheSameSecondGetDistinctColumns() throws Exception {
        CommandExecutor executor = (target, script, timeout) -> ExecutionResult.success("EXEC_TIME:20");
        WorkloadConfig config = WorkloadFixtures.config(tempDir).build();
        var runner = new QueryRunner(executor, at(1_700_000_000L));

        var columns = new ArrayList<String>();
        for (int run = 0; run < 3; run++) {
            columns.add(runner.saveTimings(runner.runQueries(WorkloadFixtures.queries(), config), config));
        }

        assertEquals(List.of("applications_1700000000", "applications_1700000000_2", "applications_1700000000_3"), columns);
        var table = QueryTimingTable.load(config.timingFile());
        assertEquals(4, table.getColumns().size());
        assertEquals(2, table.getDescriptions().size());
        assertEquals("0.020", table.getCell("Count active", "applications_1700000000_3"));
    }
}
