package org.mongomigrations.workload.queries;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.mongomigrations.workload.unit.UnitOutcome;
import org.mongomigrations.workload.unit.UnitStatus;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QueryTimingTableTest {

    @TempDir
    Path tempDir;

    private static UnitOutcome ok(String description, double seconds) {
        return new UnitOutcome(description, UnitStatus.SUCCESS, seconds, null, null);
    }

    private static UnitOutcome error(String description) {
        return new UnitOutcome(description, UnitStatus.ERROR, 0, null, "boom");
    }

    @Test
    void missingFileLoadsEmptyTable() throws Exception {
        var table = QueryTimingTable.load(tempDir.resolve("absent.csv"));
        assertEquals(List.of(QueryTimingTable.DESCRIPTION_COLUMN), table.getColumns());
        assertTrue(table.getDescriptions().isEmpty());
    }

    @Test
    void failedQueryIsMarkedError() {
        var table = new QueryTimingTable();
        table.addRun("applications_1", List.of(ok("Find by email", 0.0123), error("Count active")));

        assertEquals("0.012", table.getCell("Find by email", "applications_1"));
        assertEquals(QueryTimingTable.ERROR_CELL, table.getCell("Count active", "applications_1"));
    }

    @Test
    void mergingKeepsPriorRowsAndColumns() throws Exception {
        var file = tempDir.resolve("nested/timings.csv");
        var first = new QueryTimingTable();
        first.addRun("applications_1", List.of(ok("Find by email", 0.5), ok("Old query", 1.0)));
        first.write(file);

        var second = QueryTimingTable.load(file);
        second.addRun("applications_2", List.of(ok("Find by email", 0.25), ok("New query", 2.0)));
        second.write(file);

        var merged = QueryTimingTable.load(file);
        assertEquals(List.of(QueryTimingTable.DESCRIPTION_COLUMN, "applications_1", "applications_2"), merged.getColumns());
        assertEquals(List.of("Find by email", "Old query", "New query"), merged.getDescriptions());
        assertEquals("0.500", merged.getCell("Find by email", "applications_1"));
        assertEquals("0.250", merged.getCell("Find by email", "applications_2"));
        assertEquals("", merged.getCell("Old query", "applications_2"));
        assertEquals("", merged.getCell("New query", "applications_1"));
        assertNull(merged.getCell("Unknown", "applications_1"));
    }

    @Test
    void descriptionsWithCommasSurviveRoundTrip() throws Exception {
        var file = tempDir.resolve("timings.csv");
        var table = new QueryTimingTable();
        table.addRun("applications_1", List.of(ok("Find by status, sorted by date", 0.1)));
        table.write(file);

        assertEquals(List.of("Find by status, sorted by date"), QueryTimingTable.load(file).getDescriptions());
    }

    @Test
    void duplicateColumnIsRejected() {
        var table = new QueryTimingTable();
        table.addRun("applications_1", List.of(ok("q", 0.1)));
        assertThrows(IllegalArgumentException.class, () -> table.addRun("applications_1", List.of(ok("q", 0.2))));
    }

    @Test
    void foreignCsvIsRejected() throws Exception {
        var file = Files.writeString(tempDir.resolve("other.csv"), "name,value\na,1\n");
        assertThrows(IOException.class, () -> QueryTimingTable.load(file));
    }

    @Test
    void freeColumnNameSkipsTakenNames() {
        var table = new QueryTimingTable();
        assertEquals("applications_1", table.freeColumnName("applications_1"));

        table.addRun("applications_1", List.of(ok("q", 0.1)));
        table.addRun("applications_1_2", List.of(ok("q", 0.2)));

        assertEquals("applications_1_3", table.freeColumnName("applications_1"));
    }
}
